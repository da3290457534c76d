package com.bridge.exception;

/**
 * Base runtime exception for the capability bridge.
 * <p>
 * Exceptions of this family travel inside reactive error signals between the transport,
 * the circuit breaker and the services. Public service methods translate them into
 * {@link com.bridge.model.Result} failures before they reach a caller.
 */
public class BridgeException extends RuntimeException {

    /**
     * Constructs a new BridgeException with the specified detail message.
     *
     * @param message The detail message.
     */
    public BridgeException(String message) {
        super(message);
    }

    /**
     * Constructs a new BridgeException with the specified detail message and cause.
     *
     * @param message The detail message.
     * @param cause   The underlying cause, may be {@code null}.
     */
    public BridgeException(String message, Throwable cause) {
        super(message, cause);
    }
}
