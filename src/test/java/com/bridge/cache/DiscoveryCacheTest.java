package com.bridge.cache;

import static org.assertj.core.api.Assertions.assertThat;

import com.bridge.model.Environment;
import com.bridge.support.MutableClock;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DiscoveryCacheTest {

    private MutableClock clock;
    private DiscoveryCache<String> cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        cache = new DiscoveryCache<>("test", Duration.ofMinutes(5), clock);
    }

    @Test
    void get_returnsPayloadWithinTtl() {
        cache.put(Environment.SANDBOX, "listing");
        clock.advance(Duration.ofMinutes(4));

        assertThat(cache.get(Environment.SANDBOX)).contains("listing");
    }

    @Test
    void get_afterTtl_isEmpty() {
        cache.put(Environment.SANDBOX, "listing");
        clock.advance(Duration.ofMinutes(5));

        assertThat(cache.get(Environment.SANDBOX)).isEmpty();
    }

    @Test
    void environmentsAreIsolated() {
        cache.put(Environment.SANDBOX, "sandbox listing");

        assertThat(cache.get(Environment.PRODUCTION)).isEmpty();
    }

    @Test
    void put_replacesWholesaleAndRestartsTtl() {
        cache.put(Environment.SANDBOX, "old");
        clock.advance(Duration.ofMinutes(3));
        cache.put(Environment.SANDBOX, "new");
        clock.advance(Duration.ofMinutes(3));

        assertThat(cache.get(Environment.SANDBOX)).contains("new");
    }

    @Test
    void invalidate_dropsOneEnvironment_invalidateAll_dropsEvery() {
        cache.put(Environment.SANDBOX, "a");
        cache.put(Environment.PRODUCTION, "b");

        cache.invalidate(Environment.SANDBOX);
        assertThat(cache.get(Environment.SANDBOX)).isEmpty();
        assertThat(cache.get(Environment.PRODUCTION)).contains("b");

        cache.invalidateAll();
        assertThat(cache.get(Environment.PRODUCTION)).isEmpty();
    }
}
