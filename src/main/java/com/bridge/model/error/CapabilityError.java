package com.bridge.model.error;

/**
 * Error values carried by failed {@link com.bridge.model.Result}s.
 */
public sealed interface CapabilityError
        permits ValidationError, TransportError, CircuitOpenError, DiscoveryError, GenerationError {

    /**
     * @return a human-readable description of the failure.
     */
    String message();
}
