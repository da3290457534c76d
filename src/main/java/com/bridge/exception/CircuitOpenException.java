package com.bridge.exception;

import com.bridge.model.error.CircuitOpenError;
import java.time.Duration;

/**
 * Raised by {@link com.bridge.resilience.CircuitBreaker} when a call is rejected without
 * reaching the transport.
 */
public class CircuitOpenException extends BridgeException {

    private final String provider;
    private final Duration retryAfter;

    /**
     * Constructs a new CircuitOpenException.
     *
     * @param provider   Name of the provider whose circuit is open.
     * @param retryAfter Time left until the cool-down ends and calls reach the transport again.
     */
    public CircuitOpenException(String provider, Duration retryAfter) {
        super("Circuit for provider '" + provider + "' is open; retry in " + retryAfter.toMillis() + " ms");
        this.provider = provider;
        this.retryAfter = retryAfter;
    }

    public String getProvider() {
        return provider;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }

    /**
     * @return the error value handed to callers in place of this exception.
     */
    public CircuitOpenError toError() {
        return new CircuitOpenError(provider, retryAfter);
    }
}
