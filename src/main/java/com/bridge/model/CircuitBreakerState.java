package com.bridge.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Snapshot of a circuit breaker.
 *
 * @param provider            Name of the guarded provider.
 * @param consecutiveFailures Failures since the last success.
 * @param lastFailureAt       Time of the most recent failure, {@code null} if none.
 * @param threshold           Consecutive failures that open the circuit.
 * @param coolDown            How long the circuit stays open after the last failure.
 * @param open                Whether calls are currently rejected.
 */
public record CircuitBreakerState(String provider,
                                  int consecutiveFailures,
                                  Instant lastFailureAt,
                                  int threshold,
                                  Duration coolDown,
                                  boolean open) {
}
