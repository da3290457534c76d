package com.bridge.service.api;

import com.bridge.model.Environment;

/**
 * Keeps one {@link TrackingSession} per environment.
 * <p>
 * Generated operations append to the session of the environment they were called in, after the
 * provider answered successfully. The replay service reads a session to re-issue its calls
 * against another environment, and the shell shows and clears sessions on request.
 */
public interface InvocationTracker {

    /**
     * Returns the tracking session of an environment, creating an empty one on first use.
     * Repeated calls for the same environment return the same session.
     *
     * @param environment The environment whose calls are tracked.
     * @return the environment's session, never {@code null}.
     */
    TrackingSession session(Environment environment);
}
