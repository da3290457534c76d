package com.bridge.model.schema;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A string, integer, number or boolean value.
 */
public record PrimitiveSchema(SchemaKind kind, JsonNode defaultValue, String description) implements SchemaNode {

    public PrimitiveSchema {
        if (kind == null || !kind.isPrimitive()) {
            throw new IllegalArgumentException("Not a primitive kind: " + kind);
        }
    }

    public static PrimitiveSchema of(SchemaKind kind) {
        return new PrimitiveSchema(kind, null, null);
    }
}
