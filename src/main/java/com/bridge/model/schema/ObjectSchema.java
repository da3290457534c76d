package com.bridge.model.schema;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * An object with named properties. Required names are always a subset of the property names;
 * names without a matching property are dropped on construction.
 */
public record ObjectSchema(Map<String, SchemaNode> properties,
                           Set<String> requiredNames,
                           JsonNode defaultValue,
                           String description) implements SchemaNode {

    public ObjectSchema {
        properties = properties == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        Set<String> required = new LinkedHashSet<>();
        if (requiredNames != null) {
            for (String name : requiredNames) {
                if (properties.containsKey(name)) {
                    required.add(name);
                }
            }
        }
        requiredNames = Collections.unmodifiableSet(required);
    }

    @Override
    public SchemaKind kind() {
        return SchemaKind.OBJECT;
    }

    public boolean isRequired(String name) {
        return requiredNames.contains(name);
    }
}
