package com.bridge.service.api;

import com.bridge.model.CapabilityDescriptor;
import com.bridge.model.Environment;
import com.bridge.model.Result;
import com.bridge.model.error.CapabilityError;
import com.bridge.schema.Validator;
import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Mono;

/**
 * A runtime-checked caller for one discovered capability.
 */
public interface Operation {

    String name();

    Environment environment();

    CapabilityDescriptor descriptor();

    Validator validator();

    /**
     * Validates {@code arguments}, calls the provider and unwraps its response.
     * Invalid input fails with a {@link com.bridge.model.error.ValidationError} before any network activity.
     *
     * @param arguments The call arguments; {@code null} means none.
     * @return the unwrapped result or the failure; the {@code Mono} itself never errors.
     */
    Mono<Result<JsonNode, CapabilityError>> invoke(JsonNode arguments);
}
