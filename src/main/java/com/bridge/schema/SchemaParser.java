package com.bridge.schema;

import com.bridge.exception.MalformedSchemaException;
import com.bridge.model.schema.ArraySchema;
import com.bridge.model.schema.EnumerationSchema;
import com.bridge.model.schema.ObjectSchema;
import com.bridge.model.schema.PrimitiveSchema;
import com.bridge.model.schema.SchemaKind;
import com.bridge.model.schema.SchemaNode;
import com.bridge.model.schema.UnknownSchema;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Reads a provider's JSON-Schema input description into a {@link SchemaNode} tree.
 * <p>
 * Only the root is strict: a document that is not a JSON object is rejected. Everything below
 * the root degrades locally, so an odd property never costs the rest of the document.
 */
@Component
@Slf4j
public class SchemaParser {

    static final int MAX_DEPTH = 64;

    /**
     * Parses a raw schema document.
     *
     * @param document The raw document, may be {@code null} or JSON null.
     * @return the parsed tree, or {@code null} when no document was given.
     * @throws MalformedSchemaException if the document is present but not a JSON object.
     */
    public SchemaNode parse(JsonNode document) {
        if (document == null || document.isNull() || document.isMissingNode()) {
            return null;
        }
        if (!document.isObject()) {
            throw new MalformedSchemaException("Input schema must be a JSON object but was " + document.getNodeType());
        }
        return parseNode(document, "$", 0);
    }

    private SchemaNode parseNode(JsonNode node, String path, int depth) {
        if (depth > MAX_DEPTH) {
            log.warn("Schema nesting at {} exceeds {} levels; accepting any value below it", path, MAX_DEPTH);
            return UnknownSchema.of("too-deep");
        }
        if (node == null || !node.isObject()) {
            log.warn("Schema node at {} is not an object ({}); accepting any value", path,
                    node == null ? "absent" : node.getNodeType());
            return UnknownSchema.of(null);
        }

        JsonNode defaultValue = node.has("default") ? node.get("default") : null;
        String description = node.hasNonNull("description") ? node.get("description").asText() : null;

        if (node.has("enum")) {
            JsonNode values = node.get("enum");
            if (values.isArray() && !values.isEmpty()) {
                List<JsonNode> allowed = new ArrayList<>();
                values.forEach(allowed::add);
                return new EnumerationSchema(allowed, defaultValue, description);
            }
            log.warn("Enumeration at {} lists no values; accepting any value", path);
            return new UnknownSchema("enum", defaultValue, description);
        }

        String rawKind = readKind(node);
        SchemaKind kind = toKind(rawKind);
        if (kind == null) {
            if (rawKind == null && node.has("properties")) {
                kind = SchemaKind.OBJECT;
            } else if (rawKind == null && node.has("items")) {
                kind = SchemaKind.ARRAY;
            } else {
                return new UnknownSchema(rawKind, defaultValue, description);
            }
        }

        switch (kind) {
            case OBJECT:
                return parseObject(node, path, depth, defaultValue, description);
            case ARRAY:
                JsonNode items = node.get("items");
                SchemaNode itemSchema = items == null || items.isNull() || (items.isObject() && items.isEmpty())
                        ? null
                        : parseNode(items, path + "[]", depth + 1);
                return new ArraySchema(itemSchema, defaultValue, description);
            default:
                return new PrimitiveSchema(kind, defaultValue, description);
        }
    }

    private ObjectSchema parseObject(JsonNode node, String path, int depth, JsonNode defaultValue, String description) {
        Map<String, SchemaNode> properties = new LinkedHashMap<>();
        JsonNode rawProperties = node.get("properties");
        if (rawProperties != null && rawProperties.isObject()) {
            for (Map.Entry<String, JsonNode> field : rawProperties.properties()) {
                properties.put(field.getKey(), parseNode(field.getValue(), path + "." + field.getKey(), depth + 1));
            }
        } else if (rawProperties != null) {
            log.warn("Properties at {} are not an object; treating the object as open", path);
        }

        Set<String> required = new LinkedHashSet<>();
        JsonNode rawRequired = node.get("required");
        if (rawRequired != null && rawRequired.isArray()) {
            for (JsonNode name : rawRequired) {
                if (!name.isTextual()) {
                    continue;
                }
                if (properties.containsKey(name.asText())) {
                    required.add(name.asText());
                } else {
                    log.warn("Required name '{}' at {} has no matching property; ignoring it", name.asText(), path);
                }
            }
        }
        return new ObjectSchema(properties, required, defaultValue, description);
    }

    /**
     * Reads {@code type}, using the first non-null entry of a type union.
     */
    private String readKind(JsonNode node) {
        JsonNode type = node.get("type");
        if (type == null || type.isNull()) {
            return null;
        }
        if (type.isArray()) {
            for (JsonNode candidate : type) {
                if (candidate.isTextual() && !"null".equals(candidate.asText())) {
                    return candidate.asText();
                }
            }
            return null;
        }
        return type.asText();
    }

    private SchemaKind toKind(String rawKind) {
        if (rawKind == null) {
            return null;
        }
        switch (rawKind.toLowerCase(Locale.ROOT)) {
            case "string":
                return SchemaKind.STRING;
            case "integer":
                return SchemaKind.INTEGER;
            case "number":
                return SchemaKind.NUMBER;
            case "boolean":
                return SchemaKind.BOOLEAN;
            case "object":
                return SchemaKind.OBJECT;
            case "array":
                return SchemaKind.ARRAY;
            default:
                return null;
        }
    }
}
