package com.bridge.dto.request;

import com.bridge.model.Environment;

/**
 * A shell request to replay the tracked changes of {@code source} against {@code target}.
 */
public record SyncRequest(Environment source, Environment target) {
}
