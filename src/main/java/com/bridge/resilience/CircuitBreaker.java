package com.bridge.resilience;

import com.bridge.exception.CircuitOpenException;
import com.bridge.model.CircuitBreakerState;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Fails fast once a provider has failed {@code threshold} times in a row.
 * <p>
 * The circuit is open while the failure count is at or above the threshold and less than
 * {@code coolDown} has passed since the last failure. Once the cool-down has passed, calls go
 * through again; a failure re-opens the circuit and a success resets the count. There is no
 * half-open state limiting trial calls. A cancelled call counts as neither success nor failure.
 * <p>
 * One instance guards every call made through one provider connection.
 */
@Slf4j
public class CircuitBreaker {

    private final String name;
    private final int threshold;
    private final Duration coolDown;
    private final Clock clock;

    private int consecutiveFailures;
    private Instant lastFailureAt;

    public CircuitBreaker(String name, int threshold, Duration coolDown, Clock clock) {
        if (threshold < 1) {
            throw new IllegalArgumentException("threshold must be at least 1 but was " + threshold);
        }
        if (coolDown == null || coolDown.isNegative()) {
            throw new IllegalArgumentException("coolDown must be zero or positive");
        }
        this.name = name;
        this.threshold = threshold;
        this.coolDown = coolDown;
        this.clock = clock;
    }

    /**
     * Runs {@code call} unless the circuit is open. The supplier is only invoked when the call is
     * admitted, so an open circuit never touches the provider.
     *
     * @param call Produces the guarded call; invoked once per subscription.
     * @param <T>  The call's result type.
     * @return the call's outcome, or a {@link CircuitOpenException} error when rejected.
     */
    public <T> Mono<T> execute(Supplier<Mono<T>> call) {
        return Mono.defer(() -> {
            Duration remaining = remainingOpenTime();
            if (!remaining.isZero()) {
                log.debug("Circuit '{}' is open; rejecting call ({} ms left)", name, remaining.toMillis());
                return Mono.error(new CircuitOpenException(name, remaining));
            }
            Mono<T> guarded;
            try {
                guarded = call.get();
            } catch (RuntimeException e) {
                onFailure(e);
                return Mono.error(e);
            }
            return guarded
                    .doOnSuccess(result -> onSuccess())
                    .doOnError(this::onFailure);
        });
    }

    /**
     * @return whether a call made now would be rejected.
     */
    public boolean isOpen() {
        return !remainingOpenTime().isZero();
    }

    public synchronized CircuitBreakerState state() {
        return new CircuitBreakerState(name, consecutiveFailures, lastFailureAt, threshold, coolDown, isOpen());
    }

    public String getName() {
        return name;
    }

    private synchronized Duration remainingOpenTime() {
        if (consecutiveFailures < threshold || lastFailureAt == null) {
            return Duration.ZERO;
        }
        Duration remaining = Duration.between(clock.instant(), lastFailureAt.plus(coolDown));
        return remaining.isNegative() || remaining.isZero() ? Duration.ZERO : remaining;
    }

    private synchronized void onSuccess() {
        if (consecutiveFailures >= threshold) {
            log.info("Circuit '{}' closed after a successful call", name);
        }
        consecutiveFailures = 0;
    }

    private synchronized void onFailure(Throwable error) {
        consecutiveFailures++;
        lastFailureAt = clock.instant();
        if (consecutiveFailures == threshold) {
            log.warn("Circuit '{}' opened after {} consecutive failures; last error: {}", name, consecutiveFailures,
                    error.getMessage());
        } else if (consecutiveFailures > threshold) {
            log.warn("Circuit '{}' re-opened by a failed call after cool-down: {}", name, error.getMessage());
        } else {
            log.debug("Circuit '{}' recorded failure {}/{}: {}", name, consecutiveFailures, threshold, error.getMessage());
        }
    }
}
