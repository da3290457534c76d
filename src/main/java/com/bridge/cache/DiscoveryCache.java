package com.bridge.cache;

import com.bridge.model.Environment;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;

/**
 * In-memory, per-environment cache whose entries expire after a fixed time-to-live.
 * <p>
 * Entries are replaced wholesale, never merged. Nothing is persisted; a restart starts empty.
 *
 * @param <V> The cached payload type.
 */
@Slf4j
public class DiscoveryCache<V> {

    private final String name;
    private final Duration ttl;
    private final Clock clock;
    private final Map<Environment, CacheEntry<V>> entries = new ConcurrentHashMap<>();

    public DiscoveryCache(String name, Duration ttl, Clock clock) {
        if (ttl == null || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be zero or positive");
        }
        this.name = name;
        this.ttl = ttl;
        this.clock = clock;
    }

    /**
     * @return the unexpired payload for {@code environment}, if any. Expired entries are evicted.
     */
    public Optional<V> get(Environment environment) {
        CacheEntry<V> entry = entries.get(environment);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(environment, entry);
            log.debug("{} cache entry for {} expired", name, environment.key());
            return Optional.empty();
        }
        return Optional.of(entry.payload());
    }

    /**
     * Stores {@code payload} for {@code environment}, replacing any previous entry.
     */
    public void put(Environment environment, V payload) {
        Instant expiresAt = clock.instant().plus(ttl);
        entries.put(environment, new CacheEntry<>(payload, expiresAt));
        log.debug("{} cache stored entry for {} until {}", name, environment.key(), expiresAt);
    }

    public void invalidate(Environment environment) {
        if (entries.remove(environment) != null) {
            log.info("Invalidated {} cache for {}", name, environment.key());
        }
    }

    public void invalidateAll() {
        entries.clear();
        log.info("Invalidated {} cache for all environments", name);
    }

    public Duration getTtl() {
        return ttl;
    }
}
