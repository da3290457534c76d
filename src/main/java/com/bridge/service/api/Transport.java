package com.bridge.service.api;

import com.bridge.model.RawCapability;
import com.bridge.model.ResponseEnvelope;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import reactor.core.publisher.Mono;

/**
 * Wire-level access to one remote provider. Authentication, connections and protocol details
 * are the implementation's business.
 * <p>
 * Failures are signalled as {@link com.bridge.exception.TransportException} errors.
 */
public interface Transport {

    /**
     * Lists the capabilities the provider currently exposes.
     *
     * @return the complete listing.
     */
    Mono<List<RawCapability>> listOperations();

    /**
     * Invokes a capability.
     *
     * @param name      The capability name, as listed.
     * @param arguments Validated arguments, always a JSON object.
     * @return the provider's raw response envelope.
     */
    Mono<ResponseEnvelope> invoke(String name, JsonNode arguments);

    /**
     * Releases any session held with the provider. The default does nothing.
     */
    default void close() {
    }
}
