package com.bridge.service.api;

import com.bridge.model.InvocationRecord;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * Append-only, ordered log of completed operation calls for one environment.
 */
public interface TrackingSession {

    /**
     * Appends a record with the next ordinal and the current time.
     *
     * @return the appended record.
     */
    InvocationRecord record(String operationName, JsonNode arguments, JsonNode result);

    /**
     * @return every record in ordinal order, as an unmodifiable copy; the session keeps them.
     */
    List<InvocationRecord> drain();

    /**
     * Removes every record. Ordinals start again at 0.
     */
    void clear();

    int size();

    default boolean isEmpty() {
        return size() == 0;
    }
}
