package com.bridge.service.api;

import com.bridge.model.CapabilityDescriptor;
import com.bridge.model.Environment;
import com.bridge.model.Result;
import com.bridge.model.error.DiscoveryError;
import java.util.List;
import reactor.core.publisher.Mono;

/**
 * Lists the capabilities of an environment's provider, with caching.
 */
public interface DiscoveryService {

    /**
     * Returns the environment's capability descriptors, from cache when fresh.
     * Concurrent calls for the same environment share one provider listing, and failures are never cached.
     *
     * @param environment The environment to discover.
     * @return the descriptors in listing order, or the failure.
     */
    Mono<Result<List<CapabilityDescriptor>, DiscoveryError>> discover(Environment environment);

    /**
     * Drops cached descriptors.
     *
     * @param environment The environment to drop, or {@code null} for all environments.
     */
    void invalidate(Environment environment);
}
