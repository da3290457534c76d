package com.bridge.service.impl;

import com.bridge.cache.DiscoveryCache;
import com.bridge.exception.Errors;
import com.bridge.model.CapabilityDescriptor;
import com.bridge.model.Environment;
import com.bridge.model.RawCapability;
import com.bridge.model.Result;
import com.bridge.model.error.DiscoveryError;
import com.bridge.service.api.DiscoveryService;
import com.bridge.service.api.ProviderConnection;
import com.bridge.service.api.ProviderRegistry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * {@link DiscoveryService} backed by a {@link DiscoveryCache}.
 * <p>
 * A cache miss lists the provider's capabilities through the environment's circuit breaker and
 * caches the complete descriptor list. Concurrent misses for one environment share a single
 * listing. Failures are returned, never cached.
 */
@Service
@Slf4j
public class DiscoveryServiceImpl implements DiscoveryService {

    static final String UNKNOWN_CATEGORY = "unknown";
    private static final String SEPARATORS = "-/_.:";

    private final ProviderRegistry providerRegistry;
    private final DiscoveryCache<List<CapabilityDescriptor>> descriptorCache;
    private final Map<Environment, Mono<Result<List<CapabilityDescriptor>, DiscoveryError>>> inFlight =
            new ConcurrentHashMap<>();

    public DiscoveryServiceImpl(ProviderRegistry providerRegistry,
                                DiscoveryCache<List<CapabilityDescriptor>> descriptorCache) {
        this.providerRegistry = providerRegistry;
        this.descriptorCache = descriptorCache;
    }

    @Override
    public Mono<Result<List<CapabilityDescriptor>, DiscoveryError>> discover(Environment environment) {
        Optional<List<CapabilityDescriptor>> cached = descriptorCache.get(environment);
        if (cached.isPresent()) {
            log.debug("Descriptor cache hit for {}", environment.key());
            return Mono.just(Result.success(cached.get()));
        }
        return inFlight.computeIfAbsent(environment, env -> fetch(env)
                .doFinally(signal -> inFlight.remove(env))
                .cache());
    }

    @Override
    public void invalidate(Environment environment) {
        if (environment == null) {
            descriptorCache.invalidateAll();
        } else {
            descriptorCache.invalidate(environment);
        }
    }

    private Mono<Result<List<CapabilityDescriptor>, DiscoveryError>> fetch(Environment environment) {
        return Mono.defer(() -> {
                    ProviderConnection connection = providerRegistry.connection(environment);
                    log.info("Listing capabilities of {} provider", environment.key());
                    return connection.circuitBreaker().execute(() -> connection.transport().listOperations());
                })
                .map(listing -> toDescriptors(environment, listing))
                .doOnNext(descriptors -> {
                    descriptorCache.put(environment, descriptors);
                    log.info("Discovered {} capabilities in {}", descriptors.size(), environment.key());
                })
                .map(descriptors -> Result.<List<CapabilityDescriptor>, DiscoveryError>success(descriptors))
                .onErrorResume(error -> {
                    log.warn("Discovery failed for {}: {}", environment.key(), error.getMessage());
                    DiscoveryError discoveryError = new DiscoveryError(environment, Errors.toCapabilityError(error));
                    return Mono.just(Result.<List<CapabilityDescriptor>, DiscoveryError>failure(discoveryError));
                });
    }

    private List<CapabilityDescriptor> toDescriptors(Environment environment, List<RawCapability> listing) {
        Map<String, CapabilityDescriptor> byName = new LinkedHashMap<>();
        if (listing != null) {
            for (RawCapability raw : listing) {
                if (raw == null || raw.name() == null || raw.name().isBlank()) {
                    log.warn("Skipping a {} listing entry without a name", environment.key());
                    continue;
                }
                if (byName.containsKey(raw.name())) {
                    log.warn("Capability '{}' is listed twice in {}; keeping the last entry", raw.name(), environment.key());
                    byName.remove(raw.name());
                }
                byName.put(raw.name(), new CapabilityDescriptor(raw.name(), raw.description(),
                        deriveCategory(raw.name()), raw.inputSchema(), environment));
            }
        }
        return List.copyOf(new ArrayList<>(byName.values()));
    }

    /**
     * Returns the name's leading segment up to its first separator, e.g. {@code posts} for
     * {@code posts-list}; {@code unknown} when there is no such segment.
     */
    static String deriveCategory(String name) {
        for (int i = 0; i < name.length(); i++) {
            if (SEPARATORS.indexOf(name.charAt(i)) >= 0) {
                return i == 0 ? UNKNOWN_CATEGORY : name.substring(0, i);
            }
        }
        return UNKNOWN_CATEGORY;
    }
}
