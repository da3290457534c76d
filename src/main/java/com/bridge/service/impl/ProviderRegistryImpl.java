package com.bridge.service.impl;

import com.bridge.config.BridgeProperties;
import com.bridge.exception.ProviderNotConfiguredException;
import com.bridge.model.Environment;
import com.bridge.resilience.CircuitBreaker;
import com.bridge.service.api.ProviderConnection;
import com.bridge.service.api.ProviderRegistry;
import com.bridge.service.api.Transport;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Creates provider connections from {@code bridge.providers.*} on first use and keeps them until closed.
 */
@Service
@Slf4j
public class ProviderRegistryImpl implements ProviderRegistry {

    private final BridgeProperties properties;
    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Map<Environment, ProviderConnection> connections = new ConcurrentHashMap<>();

    public ProviderRegistryImpl(BridgeProperties properties, WebClient webClient, ObjectMapper objectMapper, Clock clock) {
        this.properties = properties;
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public ProviderConnection connection(Environment environment) {
        return connections.computeIfAbsent(environment, this::connect);
    }

    @Override
    public Set<Environment> configuredEnvironments() {
        Set<Environment> configured = Arrays.stream(Environment.values())
                .filter(env -> provider(env) != null)
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(Environment.class)));
        return Set.copyOf(configured);
    }

    @Override
    public void close(Environment environment) {
        if (environment == null) {
            connections.keySet().forEach(this::close);
            return;
        }
        ProviderConnection connection = connections.remove(environment);
        if (connection != null) {
            connection.transport().close();
            log.info("Closed {} provider connection", environment.key());
        }
    }

    @PreDestroy
    public void shutdown() {
        close(null);
    }

    private ProviderConnection connect(Environment environment) {
        BridgeProperties.Provider provider = provider(environment);
        if (provider == null) {
            throw new ProviderNotConfiguredException(environment);
        }
        log.info("Creating {} provider connection to {}", environment.key(), provider.getUrl());
        BridgeProperties.Breaker breaker = properties.getBreaker();
        CircuitBreaker circuitBreaker = new CircuitBreaker(environment.key(), breaker.getThreshold(),
                breaker.getCoolDown(), clock);
        return new ProviderConnection(environment, createTransport(environment, provider), circuitBreaker);
    }

    /**
     * Builds the transport for a configured provider. Basic credentials are sent when both a
     * username and a password are configured.
     */
    protected Transport createTransport(Environment environment, BridgeProperties.Provider provider) {
        WebClient providerClient = webClient.mutate()
                .baseUrl(provider.getUrl())
                .defaultHeaders(headers -> {
                    if (provider.hasCredentials()) {
                        headers.setBasicAuth(provider.getUsername(), provider.getPassword());
                    }
                })
                .build();
        return new McpHttpTransport(environment, providerClient, objectMapper, properties.getHttp().getTimeout());
    }

    private BridgeProperties.Provider provider(Environment environment) {
        BridgeProperties.Provider provider = properties.getProviders().get(environment);
        return provider != null && provider.hasUrl() ? provider : null;
    }
}
