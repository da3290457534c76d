package com.bridge.config;

import com.bridge.model.Environment;
import com.bridge.model.GeneratedOperations;
import com.bridge.model.Result;
import com.bridge.model.error.GenerationError;
import com.bridge.service.api.OperationFactory;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Generates the operations of every environment listed in {@code bridge.warm-up.environments}
 * on startup, so the first shell command is served from cache.
 */
@Component
@Profile("!test") // Ensures this does not run during tests
@Slf4j
public class WarmUpRunner implements CommandLineRunner {

    private final BridgeProperties properties;
    private final OperationFactory operationFactory;

    public WarmUpRunner(BridgeProperties properties, OperationFactory operationFactory) {
        this.properties = properties;
        this.operationFactory = operationFactory;
    }

    @Override
    public void run(String... args) {
        List<Environment> environments = properties.getWarmUp().getEnvironments();
        if (environments.isEmpty()) {
            log.debug("No warm-up environments configured");
            return;
        }
        System.out.println("\n--- Warming up capability caches ---");
        for (Environment environment : environments) {
            Result<GeneratedOperations, GenerationError> result = operationFactory.getOperations(environment).block();
            if (result == null) {
                continue;
            }
            if (result.isSuccess()) {
                GeneratedOperations generated = result.value();
                System.out.println("  [" + environment.key() + "] " + generated.operations().size() + " operations ready"
                        + (generated.isPartial() ? ", " + generated.failures().size() + " skipped" : ""));
                log.info("Warm-up of {} generated {} operations", environment.key(), generated.operations().size());
            } else {
                System.err.println("  [" + environment.key() + "] FAILED: " + result.error().message());
                log.warn("Warm-up of {} failed: {}", environment.key(), result.error().message());
            }
        }
        System.out.println("--- Warm-up complete ---\n");
    }
}
