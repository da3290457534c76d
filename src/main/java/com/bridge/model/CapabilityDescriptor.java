package com.bridge.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * Discovered metadata for one remote capability, before it becomes a callable operation.
 * Immutable; a re-discovery replaces the whole descriptor list of an environment.
 *
 * @param name        Capability name, unique within one environment's listing.
 * @param description Provider supplied description, may be {@code null}.
 * @param category    Leading segment of the name, or {@code unknown}.
 * @param inputSchema The raw JSON-Schema input description, or {@code null} when the provider gave none.
 * @param environment The environment the capability was discovered in.
 */
public record CapabilityDescriptor(String name,
                                   String description,
                                   String category,
                                   JsonNode inputSchema,
                                   Environment environment) {

    public CapabilityDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(environment, "environment");
        category = category == null ? "unknown" : category;
    }

    public boolean hasInputSchema() {
        return inputSchema != null && !inputSchema.isNull() && !inputSchema.isMissingNode();
    }
}
