package com.bridge.service.api;

import com.bridge.model.Environment;
import com.bridge.model.GeneratedOperations;
import com.bridge.model.Result;
import com.bridge.model.error.GenerationError;
import reactor.core.publisher.Mono;

/**
 * Builds callable {@link Operation}s from discovered capabilities, with caching.
 */
public interface OperationFactory {

    /**
     * Returns the operations of an environment. Capabilities that cannot be turned into operations
     * are reported in {@link GeneratedOperations#failures()}; only a failed discovery fails the result.
     *
     * @param environment The environment.
     * @return the generated operations, or the failure.
     */
    Mono<Result<GeneratedOperations, GenerationError>> getOperations(Environment environment);

    /**
     * Drops cached operations.
     *
     * @param environment The environment to drop, or {@code null} for all environments.
     */
    void invalidate(Environment environment);
}
