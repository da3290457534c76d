package com.bridge.config;

import com.bridge.service.api.DiscoveryService;
import com.bridge.service.api.OperationFactory;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

/**
 * Invalidates every cache at the fixed delay {@code bridge.cache.refresh-interval}. A zero or
 * negative interval registers nothing.
 */
@Configuration
@EnableScheduling
@Slf4j
public class CacheRefreshScheduler implements SchedulingConfigurer {

    private final BridgeProperties properties;
    private final DiscoveryService discoveryService;
    private final OperationFactory operationFactory;

    public CacheRefreshScheduler(BridgeProperties properties, DiscoveryService discoveryService,
                                 OperationFactory operationFactory) {
        this.properties = properties;
        this.discoveryService = discoveryService;
        this.operationFactory = operationFactory;
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar registrar) {
        Duration interval = properties.getCache().getRefreshInterval();
        if (interval == null || interval.isZero() || interval.isNegative()) {
            log.debug("Scheduled cache refresh is disabled");
            return;
        }
        log.info("Invalidating capability caches every {}", interval);
        registrar.addFixedDelayTask(this::refresh, interval);
    }

    void refresh() {
        log.info("Scheduled refresh: invalidating capability caches");
        operationFactory.invalidate(null);
        discoveryService.invalidate(null);
    }
}
