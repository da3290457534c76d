package com.bridge.service.impl;

import com.bridge.model.Environment;
import com.bridge.model.InvocationRecord;
import com.bridge.service.api.TrackingSession;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link TrackingSession} kept in memory. Appends are serialized, so ordinals follow completion order.
 */
@Slf4j
public class InMemoryTrackingSession implements TrackingSession {

    private final Environment environment;
    private final Clock clock;
    private final List<InvocationRecord> records = new ArrayList<>();
    private long nextOrdinal;

    public InMemoryTrackingSession(Environment environment, Clock clock) {
        this.environment = environment;
        this.clock = clock;
    }

    @Override
    public synchronized InvocationRecord record(String operationName, JsonNode arguments, JsonNode result) {
        InvocationRecord record = new InvocationRecord(nextOrdinal++, operationName, arguments, result, clock.instant());
        records.add(record);
        log.debug("Tracked {} #{} in {}", operationName, record.ordinal(), environment.key());
        return record;
    }

    @Override
    public synchronized List<InvocationRecord> drain() {
        return List.copyOf(records);
    }

    @Override
    public synchronized void clear() {
        records.clear();
        nextOrdinal = 0;
        log.info("Cleared tracking session of {}", environment.key());
    }

    @Override
    public synchronized int size() {
        return records.size();
    }
}
