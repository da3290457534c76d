package com.bridge.exception;

import com.bridge.model.error.TransportError;

/**
 * Signals a network or provider level failure raised by a {@link com.bridge.service.api.Transport}.
 * These are the failures counted by the circuit breaker.
 */
public class TransportException extends BridgeException {

    private final TransportError.Reason reason;
    private final Integer status;

    /**
     * Constructs a new TransportException without a cause or HTTP status.
     *
     * @param reason  The failure category.
     * @param message The detail message.
     */
    public TransportException(TransportError.Reason reason, String message) {
        this(reason, message, null, null);
    }

    /**
     * Constructs a new TransportException wrapping a lower level failure.
     *
     * @param reason  The failure category.
     * @param message The detail message.
     * @param cause   The underlying cause, may be {@code null}.
     */
    public TransportException(TransportError.Reason reason, String message, Throwable cause) {
        this(reason, message, null, cause);
    }

    /**
     * Constructs a new TransportException.
     *
     * @param reason  The failure category.
     * @param message The detail message.
     * @param status  The HTTP status code the provider answered with, or {@code null}.
     * @param cause   The underlying cause, may be {@code null}.
     */
    public TransportException(TransportError.Reason reason, String message, Integer status, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.status = status;
    }

    public TransportError.Reason getReason() {
        return reason;
    }

    /**
     * @return the HTTP status code reported by the provider, or {@code null} when none was received.
     */
    public Integer getStatus() {
        return status;
    }

    /**
     * @return the error value handed to callers in place of this exception, keeping reason, message and status.
     */
    public TransportError toError() {
        return new TransportError(reason, getMessage(), status);
    }
}
