package com.bridge.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * The result of re-issuing one tracked invocation against another environment.
 *
 * @param record  The replayed record.
 * @param success Whether the target accepted the call.
 * @param result  The target's unwrapped result, {@code null} on failure.
 * @param error   The failure description, {@code null} on success.
 */
public record ReplayOutcome(InvocationRecord record, boolean success, JsonNode result, String error) {

    public static ReplayOutcome applied(InvocationRecord record, JsonNode result) {
        return new ReplayOutcome(record, true, result, null);
    }

    public static ReplayOutcome failed(InvocationRecord record, String error) {
        return new ReplayOutcome(record, false, null, error);
    }
}
