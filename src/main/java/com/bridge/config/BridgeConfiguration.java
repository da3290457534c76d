package com.bridge.config;

import com.bridge.cache.DiscoveryCache;
import com.bridge.model.CapabilityDescriptor;
import com.bridge.model.GeneratedOperations;
import java.time.Clock;
import java.util.List;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the clock and the per-environment caches shared by the services.
 */
@Configuration
@EnableConfigurationProperties(BridgeProperties.class)
public class BridgeConfiguration {

    /**
     * The clock behind cache expiry, breaker cool-downs and record timestamps.
     *
     * @return the system clock in UTC.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Creates the cache of discovered capability descriptors, written only by the discovery service.
     *
     * @param properties The bound settings; {@code bridge.cache.descriptor-ttl} sets the lifetime of an entry.
     * @param clock      The clock that decides when entries expire.
     * @return an empty descriptor cache.
     */
    @Bean
    public DiscoveryCache<List<CapabilityDescriptor>> descriptorCache(BridgeProperties properties, Clock clock) {
        return new DiscoveryCache<>("descriptor", properties.getCache().getDescriptorTtl(), clock);
    }

    /**
     * Creates the cache of generated operations, written only by the operation factory. Its
     * lifetime is independent of the descriptor cache, so the two may expire at different times.
     *
     * @param properties The bound settings; {@code bridge.cache.operation-ttl} sets the lifetime of an entry.
     * @param clock      The clock that decides when entries expire.
     * @return an empty operation cache.
     */
    @Bean
    public DiscoveryCache<GeneratedOperations> operationCache(BridgeProperties properties, Clock clock) {
        return new DiscoveryCache<>("operation", properties.getCache().getOperationTtl(), clock);
    }
}
