package com.bridge.model.schema;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * An array whose elements all match {@code items}. A {@code null} items schema accepts any element.
 */
public record ArraySchema(SchemaNode items, JsonNode defaultValue, String description) implements SchemaNode {

    @Override
    public SchemaKind kind() {
        return SchemaKind.ARRAY;
    }
}
