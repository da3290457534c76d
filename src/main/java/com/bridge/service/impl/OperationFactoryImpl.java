package com.bridge.service.impl;

import com.bridge.cache.DiscoveryCache;
import com.bridge.model.CapabilityDescriptor;
import com.bridge.model.Environment;
import com.bridge.model.GeneratedOperations;
import com.bridge.model.GenerationFailure;
import com.bridge.model.Result;
import com.bridge.model.error.GenerationError;
import com.bridge.schema.SchemaConverter;
import com.bridge.schema.SchemaParser;
import com.bridge.schema.Validator;
import com.bridge.service.api.DiscoveryService;
import com.bridge.service.api.InvocationTracker;
import com.bridge.service.api.Operation;
import com.bridge.service.api.OperationFactory;
import com.bridge.service.api.ProviderRegistry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * {@link OperationFactory} that turns discovered descriptors into {@link GeneratedOperation}s.
 * <p>
 * Descriptors are generated concurrently and collected in listing order. A descriptor that cannot
 * be generated is logged and reported as a {@link GenerationFailure}; the others are unaffected.
 * <p>
 * Concurrent cache misses for one environment share a single discovery and generation, so every
 * caller receives the same {@link GeneratedOperations} and the cache is written once.
 */
@Service
@Slf4j
public class OperationFactoryImpl implements OperationFactory {

    private final DiscoveryService discoveryService;
    private final SchemaParser schemaParser;
    private final SchemaConverter schemaConverter;
    private final ProviderRegistry providerRegistry;
    private final EnvelopeUnwrapper unwrapper;
    private final InvocationTracker tracker;
    private final DiscoveryCache<GeneratedOperations> operationCache;
    private final Map<Environment, Mono<Result<GeneratedOperations, GenerationError>>> inFlight =
            new ConcurrentHashMap<>();

    public OperationFactoryImpl(DiscoveryService discoveryService,
                                SchemaParser schemaParser,
                                SchemaConverter schemaConverter,
                                ProviderRegistry providerRegistry,
                                EnvelopeUnwrapper unwrapper,
                                InvocationTracker tracker,
                                DiscoveryCache<GeneratedOperations> operationCache) {
        this.discoveryService = discoveryService;
        this.schemaParser = schemaParser;
        this.schemaConverter = schemaConverter;
        this.providerRegistry = providerRegistry;
        this.unwrapper = unwrapper;
        this.tracker = tracker;
        this.operationCache = operationCache;
    }

    @Override
    public Mono<Result<GeneratedOperations, GenerationError>> getOperations(Environment environment) {
        Optional<GeneratedOperations> cached = operationCache.get(environment);
        if (cached.isPresent()) {
            log.debug("Operation cache hit for {}", environment.key());
            return Mono.just(Result.success(cached.get()));
        }
        return inFlight.computeIfAbsent(environment, env -> build(env)
                .doFinally(signal -> inFlight.remove(env))
                .cache());
    }

    private Mono<Result<GeneratedOperations, GenerationError>> build(Environment environment) {
        return discoveryService.discover(environment)
                .flatMap(discovered -> {
                    if (discovered.isFailure()) {
                        log.warn("Cannot generate operations for {}: {}", environment.key(), discovered.error().message());
                        return Mono.just(Result.<GeneratedOperations, GenerationError>failure(
                                new GenerationError(environment, discovered.error())));
                    }
                    return generate(environment, discovered.value())
                            .map(generated -> Result.<GeneratedOperations, GenerationError>success(generated));
                });
    }

    @Override
    public void invalidate(Environment environment) {
        if (environment == null) {
            operationCache.invalidateAll();
        } else {
            operationCache.invalidate(environment);
        }
    }

    private Mono<GeneratedOperations> generate(Environment environment, List<CapabilityDescriptor> descriptors) {
        return Flux.fromIterable(descriptors)
                .flatMapSequential(descriptor -> Mono.fromCallable(() -> generateOne(descriptor))
                        .subscribeOn(Schedulers.boundedElastic()))
                .collectList()
                .map(outcomes -> {
                    Map<String, Operation> operations = new LinkedHashMap<>();
                    List<GenerationFailure> failures = new ArrayList<>();
                    for (Outcome outcome : outcomes) {
                        if (outcome.operation() != null) {
                            operations.put(outcome.operation().name(), outcome.operation());
                        } else {
                            failures.add(outcome.failure());
                        }
                    }
                    GeneratedOperations generated = new GeneratedOperations(environment, operations, failures);
                    operationCache.put(environment, generated);
                    if (generated.isPartial()) {
                        log.info("Generated {} operations for {}; {} capabilities skipped", operations.size(),
                                environment.key(), failures.size());
                    } else {
                        log.info("Generated {} operations for {}", operations.size(), environment.key());
                    }
                    return generated;
                });
    }

    private Outcome generateOne(CapabilityDescriptor descriptor) {
        try {
            Validator validator = schemaConverter.convert(schemaParser.parse(descriptor.inputSchema()));
            return new Outcome(new GeneratedOperation(descriptor, validator, providerRegistry, unwrapper, tracker), null);
        } catch (RuntimeException e) {
            log.warn("Skipping capability '{}' in {}: {}", descriptor.name(), descriptor.environment().key(), e.getMessage());
            return new Outcome(null, new GenerationFailure(descriptor.name(), e.getMessage()));
        }
    }

    /** Exactly one of the two is set. */
    private record Outcome(Operation operation, GenerationFailure failure) {
    }
}
