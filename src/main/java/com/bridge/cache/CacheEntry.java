package com.bridge.cache;

import java.time.Instant;

/**
 * A cached payload and the instant it stops being served.
 */
public record CacheEntry<V>(V payload, Instant expiresAt) {

    /**
     * An entry is served up to, but not including, its expiry instant.
     *
     * @param now The current time.
     * @return {@code true} once {@code now} has reached {@code expiresAt}.
     */
    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
