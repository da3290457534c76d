package com.bridge.model.error;

/**
 * A network or provider level failure.
 *
 * @param reason  The failure category.
 * @param message Human-readable description.
 * @param status  HTTP status, when the provider answered with one; otherwise {@code null}.
 */
public record TransportError(Reason reason, String message, Integer status) implements CapabilityError {

    public enum Reason {
        /** No endpoint configured for the environment. */
        NOT_CONFIGURED,
        /** The provider could not be reached. */
        UNREACHABLE,
        /** The provider answered with a non-success HTTP status. */
        HTTP_STATUS,
        /** The provider answered with something that is not a valid protocol message. */
        PROTOCOL,
        /** The provider processed the call and reported it as failed. */
        REJECTED,
        /** Anything else. */
        UNKNOWN
    }

    public static TransportError rejected(String message) {
        return new TransportError(Reason.REJECTED, message, null);
    }
}
