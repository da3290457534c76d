package com.bridge.schema;

import com.bridge.model.Result;
import com.bridge.model.error.ValidationError;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Checks a value against a converted schema and returns its normalized form (defaults filled in,
 * integral numbers normalized). Validators are pure and never mutate their input.
 */
@FunctionalInterface
public interface Validator {

    String ROOT_PATH = "$";

    /**
     * Validates a value found at {@code path}.
     *
     * @param value The value, {@code null} or a missing node when absent.
     * @param path  Location used in error reports.
     * @return the normalized value, or the first violation found.
     */
    Result<JsonNode, ValidationError> validate(JsonNode value, String path);

    default Result<JsonNode, ValidationError> validate(JsonNode value) {
        return validate(value, ROOT_PATH);
    }

    static boolean isAbsent(JsonNode value) {
        return value == null || value.isMissingNode();
    }
}
