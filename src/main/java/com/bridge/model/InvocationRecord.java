package com.bridge.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;

/**
 * One completed operation call, as kept by a tracking session.
 * <p>
 * The record owns private copies of its JSON trees. Arguments and results are copied when the
 * record is built and again whenever they are read, so neither the caller that made the call nor
 * a later reader can change the tracked history that replay sends to another environment.
 *
 * @param ordinal       Position within the session, starting at 0.
 * @param operationName The invoked capability.
 * @param arguments     The normalized arguments that were sent.
 * @param result        The unwrapped result.
 * @param timestamp     When the call completed.
 */
public record InvocationRecord(long ordinal,
                               String operationName,
                               JsonNode arguments,
                               JsonNode result,
                               Instant timestamp) {

    public InvocationRecord {
        arguments = copy(arguments);
        result = copy(result);
    }

    /**
     * @return a copy of the arguments that were sent.
     */
    @Override
    public JsonNode arguments() {
        return copy(arguments);
    }

    /**
     * @return a copy of the unwrapped result.
     */
    @Override
    public JsonNode result() {
        return copy(result);
    }

    private static JsonNode copy(JsonNode node) {
        return node == null ? null : node.deepCopy();
    }
}
