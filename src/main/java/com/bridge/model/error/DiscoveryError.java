package com.bridge.model.error;

import com.bridge.model.Environment;

/**
 * Capability listing failed for an environment.
 *
 * @param environment The environment being discovered.
 * @param cause       The transport or breaker error behind the failure.
 */
public record DiscoveryError(Environment environment, CapabilityError cause) implements CapabilityError {

    @Override
    public String message() {
        return "Discovery failed for " + environment.key() + ": " + cause.message();
    }
}
