package com.bridge.service.impl;

import com.bridge.exception.Errors;
import com.bridge.model.CapabilityDescriptor;
import com.bridge.model.Environment;
import com.bridge.model.Result;
import com.bridge.model.error.CapabilityError;
import com.bridge.model.error.TransportError;
import com.bridge.model.error.ValidationError;
import com.bridge.schema.Validator;
import com.bridge.service.api.InvocationTracker;
import com.bridge.service.api.Operation;
import com.bridge.service.api.ProviderRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.MissingNode;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * An {@link Operation} closed over one descriptor and its validator.
 * <p>
 * Each call validates, goes through the environment's circuit breaker, unwraps the envelope and,
 * on success, appends to the environment's tracking session.
 */
@Slf4j
class GeneratedOperation implements Operation {

    private final CapabilityDescriptor descriptor;
    private final Validator validator;
    private final ProviderRegistry providerRegistry;
    private final EnvelopeUnwrapper unwrapper;
    private final InvocationTracker tracker;

    GeneratedOperation(CapabilityDescriptor descriptor, Validator validator, ProviderRegistry providerRegistry,
                       EnvelopeUnwrapper unwrapper, InvocationTracker tracker) {
        this.descriptor = descriptor;
        this.validator = validator;
        this.providerRegistry = providerRegistry;
        this.unwrapper = unwrapper;
        this.tracker = tracker;
    }

    @Override
    public String name() {
        return descriptor.name();
    }

    @Override
    public Environment environment() {
        return descriptor.environment();
    }

    @Override
    public CapabilityDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public Validator validator() {
        return validator;
    }

    @Override
    public Mono<Result<JsonNode, CapabilityError>> invoke(JsonNode arguments) {
        Result<JsonNode, ValidationError> validated =
                validator.validate(arguments == null ? MissingNode.getInstance() : arguments);
        if (validated.isFailure()) {
            log.debug("Rejected arguments for {}: {}", name(), validated.error().message());
            return Mono.just(Result.<JsonNode, CapabilityError>failure(validated.error()));
        }
        JsonNode normalized = Validator.isAbsent(validated.value()) || validated.value().isNull()
                ? JsonNodeFactory.instance.objectNode()
                : validated.value();

        return Mono.defer(() -> {
                    var connection = providerRegistry.connection(environment());
                    log.debug("Invoking {} in {} with {}", name(), environment().key(), normalized);
                    return connection.circuitBreaker().execute(() -> connection.transport().invoke(name(), normalized));
                })
                .map(envelope -> {
                    JsonNode payload = unwrapper.unwrap(envelope);
                    if (envelope.isError()) {
                        return Result.<JsonNode, CapabilityError>failure(TransportError.rejected(
                                name() + " was rejected by the provider: " + describe(payload)));
                    }
                    tracker.session(environment()).record(name(), normalized, payload);
                    return Result.<JsonNode, CapabilityError>success(payload);
                })
                .onErrorResume(error -> {
                    log.debug("Call to {} in {} failed: {}", name(), environment().key(), error.getMessage());
                    return Mono.just(Result.<JsonNode, CapabilityError>failure(Errors.toCapabilityError(error)));
                });
    }

    private static String describe(JsonNode payload) {
        return payload.isTextual() ? payload.asText() : payload.toString();
    }

    @Override
    public String toString() {
        return "Operation[" + environment().key() + "/" + name() + "]";
    }
}
