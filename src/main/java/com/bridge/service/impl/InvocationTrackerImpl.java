package com.bridge.service.impl;

import com.bridge.model.Environment;
import com.bridge.service.api.InvocationTracker;
import com.bridge.service.api.TrackingSession;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Service;

/**
 * {@link InvocationTracker} holding an {@link InMemoryTrackingSession} per environment.
 * <p>
 * Sessions live as long as the application; nothing is persisted. Records are timestamped with
 * the injected {@link Clock}, which tests replace to control time.
 */
@Service
public class InvocationTrackerImpl implements InvocationTracker {

    private final Clock clock;
    private final Map<Environment, TrackingSession> sessions = new ConcurrentHashMap<>();

    /**
     * Constructs the tracker.
     *
     * @param clock The clock used to timestamp invocation records.
     */
    public InvocationTrackerImpl(Clock clock) {
        this.clock = clock;
    }

    @Override
    public TrackingSession session(Environment environment) {
        return sessions.computeIfAbsent(environment, env -> new InMemoryTrackingSession(env, clock));
    }
}
