package com.bridge.model.schema;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A node whose kind could not be recognized. Validates anything.
 *
 * @param rawKind The kind as the provider wrote it, or {@code null} when it gave none.
 */
public record UnknownSchema(String rawKind, JsonNode defaultValue, String description) implements SchemaNode {

    public static UnknownSchema of(String rawKind) {
        return new UnknownSchema(rawKind, null, null);
    }

    @Override
    public SchemaKind kind() {
        return SchemaKind.UNKNOWN;
    }
}
