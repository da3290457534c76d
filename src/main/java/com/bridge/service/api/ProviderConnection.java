package com.bridge.service.api;

import com.bridge.model.Environment;
import com.bridge.resilience.CircuitBreaker;

/**
 * A provider's transport paired with the circuit breaker guarding it.
 *
 * @param environment    The environment the provider serves.
 * @param transport      Wire access to the provider.
 * @param circuitBreaker Shared by every call made through {@code transport}.
 */
public record ProviderConnection(Environment environment, Transport transport, CircuitBreaker circuitBreaker) {
}
