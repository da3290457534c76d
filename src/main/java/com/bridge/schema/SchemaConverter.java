package com.bridge.schema;

import com.bridge.model.schema.ArraySchema;
import com.bridge.model.schema.EnumerationSchema;
import com.bridge.model.schema.ObjectSchema;
import com.bridge.model.schema.PrimitiveSchema;
import com.bridge.model.schema.SchemaNode;
import com.bridge.model.schema.UnknownSchema;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns a {@link SchemaNode} tree into a {@link Validator}.
 * <p>
 * Conversion is total. A node that cannot be converted degrades to an any-value validator and
 * a warning is logged; its siblings are converted as usual. Enumerations take precedence over the
 * node's kind, and defaults replace missing input before validation.
 */
@Component
@Slf4j
public class SchemaConverter {

    /**
     * Converts a schema document.
     *
     * @param document The parsed document, or {@code null} when the capability declares none.
     * @return a validator; permissive when {@code document} is {@code null}.
     */
    public Validator convert(SchemaNode document) {
        if (document == null) {
            return Validators.any();
        }
        return convertNode(document, Validator.ROOT_PATH, 0);
    }

    private Validator convertNode(SchemaNode node, String path, int depth) {
        if (depth > SchemaParser.MAX_DEPTH) {
            log.warn("Schema nesting at {} exceeds {} levels; accepting any value below it", path, SchemaParser.MAX_DEPTH);
            return Validators.any();
        }
        try {
            if (node instanceof EnumerationSchema enumeration) {
                return Validators.withDefault(enumeration.defaultValue(), Validators.enumeration(enumeration.allowedValues()));
            }
            if (node instanceof PrimitiveSchema primitive) {
                return Validators.withDefault(primitive.defaultValue(), Validators.primitive(primitive.kind()));
            }
            if (node instanceof ObjectSchema object) {
                return convertObject(object, path, depth);
            }
            if (node instanceof ArraySchema array) {
                Validator items = array.items() == null ? null : convertNode(array.items(), path + "[]", depth + 1);
                return Validators.withDefault(array.defaultValue(), Validators.array(items));
            }
            if (node instanceof UnknownSchema unknown) {
                log.warn("Unrecognized schema kind '{}' at {}; accepting any value", unknown.rawKind(), path);
                return Validators.withDefault(unknown.defaultValue(), Validators.any());
            }
            log.warn("Unsupported schema node {} at {}; accepting any value", node, path);
            return Validators.any();
        } catch (RuntimeException e) {
            log.warn("Could not convert schema at {}; accepting any value. Error: {}", path, e.getMessage());
            return Validators.any();
        }
    }

    private Validator convertObject(ObjectSchema object, String path, int depth) {
        List<Validators.FieldRule> rules = new ArrayList<>();
        for (Map.Entry<String, SchemaNode> property : object.properties().entrySet()) {
            String name = property.getKey();
            SchemaNode child = property.getValue();
            Validator validator = child == null ? Validators.any() : convertNode(child, path + "." + name, depth + 1);
            rules.add(new Validators.FieldRule(name, validator, object.isRequired(name), child != null && child.hasDefault()));
        }
        return Validators.object(rules, object.defaultValue());
    }
}
