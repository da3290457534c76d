package com.bridge.exception;

import com.bridge.model.Environment;
import com.bridge.model.error.TransportError;

/**
 * Raised when no provider endpoint is configured for an environment.
 * <p>
 * The message names the property and the environment variable that would configure it. The
 * failure carries reason {@code NOT_CONFIGURED} and is reported like any other transport failure,
 * but it is raised before a connection or circuit breaker exists, so no breaker counts it.
 */
public class ProviderNotConfiguredException extends TransportException {

    /**
     * Constructs a new ProviderNotConfiguredException.
     *
     * @param environment The environment without a {@code bridge.providers.<env>.url}.
     */
    public ProviderNotConfiguredException(Environment environment) {
        super(TransportError.Reason.NOT_CONFIGURED,
                "Missing " + environment.key() + " provider configuration. Set bridge.providers." + environment.key()
                        + ".url (or " + environment.envPrefix() + "_URL) and, if required, its username and password.");
    }
}
