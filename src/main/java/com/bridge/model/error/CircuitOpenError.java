package com.bridge.model.error;

import java.time.Duration;

/**
 * The provider's circuit breaker is open and the call was not attempted.
 *
 * @param provider   Name of the guarded provider.
 * @param retryAfter Time left until the breaker admits calls again.
 */
public record CircuitOpenError(String provider, Duration retryAfter) implements CapabilityError {

    @Override
    public String message() {
        return "Provider '" + provider + "' is unavailable (circuit open, retry in " + retryAfter.toMillis() + " ms)";
    }
}
