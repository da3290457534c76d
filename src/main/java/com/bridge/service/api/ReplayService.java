package com.bridge.service.api;

import com.bridge.model.Environment;
import com.bridge.model.SyncReport;
import reactor.core.publisher.Mono;

/**
 * Re-issues the tracked calls of one environment against another.
 */
public interface ReplayService {

    /**
     * Replays the source session's records, in ordinal order, against {@code target}. The source
     * session is cleared only when every record was applied.
     *
     * @param source Environment whose tracking session is replayed.
     * @param target Environment receiving the calls.
     * @return the sync report; the {@code Mono} never errors.
     */
    Mono<SyncReport> replay(Environment source, Environment target);
}
