package com.bridge.model.error;

import com.bridge.model.Environment;

/**
 * Operations could not be generated for an environment at all.
 *
 * @param environment The environment being generated.
 * @param cause       The underlying error, usually a {@link DiscoveryError}.
 */
public record GenerationError(Environment environment, CapabilityError cause) implements CapabilityError {

    @Override
    public String message() {
        return "Operation generation failed for " + environment.key() + ": " + cause.message();
    }
}
