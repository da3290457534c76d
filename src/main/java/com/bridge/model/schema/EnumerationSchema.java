package com.bridge.model.schema;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * A value restricted to an ordered, non-empty list of allowed values.
 */
public record EnumerationSchema(List<JsonNode> allowedValues, JsonNode defaultValue, String description)
        implements SchemaNode {

    public EnumerationSchema {
        if (allowedValues == null || allowedValues.isEmpty()) {
            throw new IllegalArgumentException("An enumeration needs at least one allowed value");
        }
        allowedValues = List.copyOf(allowedValues);
    }

    @Override
    public SchemaKind kind() {
        return SchemaKind.ENUMERATION;
    }
}
