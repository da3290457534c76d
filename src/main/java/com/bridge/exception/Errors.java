package com.bridge.exception;

import com.bridge.model.error.CapabilityError;
import com.bridge.model.error.TransportError;
import reactor.core.Exceptions;

/**
 * Translates exceptions raised inside the reactive pipeline into {@link CapabilityError} values.
 */
public final class Errors {

    private Errors() {
    }

    /**
     * @param error Any throwable signalled by a transport or breaker.
     * @return the matching error value; unknown exceptions become a {@link TransportError} of reason {@code UNKNOWN}.
     */
    public static CapabilityError toCapabilityError(Throwable error) {
        Throwable unwrapped = Exceptions.unwrap(error);
        if (unwrapped instanceof CircuitOpenException open) {
            return open.toError();
        }
        if (unwrapped instanceof TransportException transport) {
            return transport.toError();
        }
        String message = unwrapped.getMessage() != null ? unwrapped.getMessage() : unwrapped.getClass().getSimpleName();
        return new TransportError(TransportError.Reason.UNKNOWN, message, null);
    }
}
