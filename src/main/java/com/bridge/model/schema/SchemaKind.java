package com.bridge.model.schema;

/**
 * The kind tag carried by every {@link SchemaNode}.
 */
public enum SchemaKind {
    STRING,
    INTEGER,
    NUMBER,
    BOOLEAN,
    OBJECT,
    ARRAY,
    ENUMERATION,
    UNKNOWN;

    public boolean isPrimitive() {
        return this == STRING || this == INTEGER || this == NUMBER || this == BOOLEAN;
    }
}
