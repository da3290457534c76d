package com.bridge.support;

import com.bridge.exception.ProviderNotConfiguredException;
import com.bridge.model.Environment;
import com.bridge.resilience.CircuitBreaker;
import com.bridge.service.api.ProviderConnection;
import com.bridge.service.api.ProviderRegistry;
import com.bridge.service.api.Transport;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * {@link ProviderRegistry} over fixed transports, each guarded by its own breaker.
 */
public class StaticProviderRegistry implements ProviderRegistry {

    private final Map<Environment, ProviderConnection> connections = new EnumMap<>(Environment.class);
    private final Clock clock;

    public StaticProviderRegistry(Clock clock) {
        this.clock = clock;
    }

    public StaticProviderRegistry with(Environment environment, Transport transport) {
        return with(environment, transport, 5, Duration.ofSeconds(30));
    }

    public StaticProviderRegistry with(Environment environment, Transport transport, int threshold, Duration coolDown) {
        connections.put(environment, new ProviderConnection(environment, transport,
                new CircuitBreaker(environment.key(), threshold, coolDown, clock)));
        return this;
    }

    @Override
    public ProviderConnection connection(Environment environment) {
        ProviderConnection connection = connections.get(environment);
        if (connection == null) {
            throw new ProviderNotConfiguredException(environment);
        }
        return connection;
    }

    @Override
    public Set<Environment> configuredEnvironments() {
        return Set.copyOf(connections.keySet());
    }

    @Override
    public void close(Environment environment) {
        if (environment == null) {
            connections.clear();
        } else {
            connections.remove(environment);
        }
    }
}
