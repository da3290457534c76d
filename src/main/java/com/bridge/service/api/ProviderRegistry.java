package com.bridge.service.api;

import com.bridge.model.Environment;
import java.util.Set;

/**
 * Hands out one {@link ProviderConnection} per environment.
 */
public interface ProviderRegistry {

    /**
     * Returns the connection for an environment, creating it on first use.
     *
     * @param environment The target environment.
     * @return the shared connection.
     * @throws com.bridge.exception.ProviderNotConfiguredException if the environment has no endpoint.
     */
    ProviderConnection connection(Environment environment);

    /**
     * @return the environments that have an endpoint configured.
     */
    Set<Environment> configuredEnvironments();

    /**
     * Drops cached connections so the next request creates fresh ones.
     *
     * @param environment The environment to drop, or {@code null} for all.
     */
    void close(Environment environment);
}
