package com.bridge.model.schema;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One node of a structured input description. The set of variants is closed; anything the
 * parser cannot classify becomes an {@link UnknownSchema}.
 */
public sealed interface SchemaNode
        permits PrimitiveSchema, ObjectSchema, ArraySchema, EnumerationSchema, UnknownSchema {

    SchemaKind kind();

    /**
     * @return the value substituted for missing input, or {@code null} when there is none.
     */
    JsonNode defaultValue();

    String description();

    default boolean hasDefault() {
        return defaultValue() != null && !defaultValue().isMissingNode();
    }
}
