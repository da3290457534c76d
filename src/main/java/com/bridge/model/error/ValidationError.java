package com.bridge.model.error;

/**
 * Input rejected by a generated validator before any network activity.
 *
 * @param kind    What went wrong.
 * @param path    Location of the offending value, e.g. {@code $.tags[1]}.
 * @param message Human-readable description.
 */
public record ValidationError(Kind kind, String path, String message) implements CapabilityError {

    public enum Kind {
        TYPE_MISMATCH,
        NOT_INTEGER,
        ENUM_MISMATCH,
        MISSING_REQUIRED
    }
}
