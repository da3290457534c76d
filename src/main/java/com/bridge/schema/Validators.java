package com.bridge.schema;

import com.bridge.model.Result;
import com.bridge.model.error.ValidationError;
import com.bridge.model.schema.SchemaKind;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The validator building blocks used by {@link SchemaConverter}.
 */
public final class Validators {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private static final Validator ANY = (value, path) -> Result.success(value);

    private Validators() {
    }

    /**
     * @return a validator that accepts every value, absent ones included, and returns it unchanged.
     */
    public static Validator any() {
        return ANY;
    }

    /**
     * Substitutes {@code defaultValue} for absent input before delegating.
     */
    public static Validator withDefault(JsonNode defaultValue, Validator delegate) {
        if (defaultValue == null || defaultValue.isMissingNode()) {
            return delegate;
        }
        return (value, path) -> delegate.validate(Validator.isAbsent(value) ? defaultValue.deepCopy() : value, path);
    }

    public static Validator primitive(SchemaKind kind) {
        return (value, path) -> {
            if (Validator.isAbsent(value)) {
                return missing(path);
            }
            switch (kind) {
                case STRING:
                    return value.isTextual() ? Result.success(value) : mismatch(path, "string", value);
                case BOOLEAN:
                    return value.isBoolean() ? Result.success(value) : mismatch(path, "boolean", value);
                case NUMBER:
                    return value.isNumber() ? Result.success(value) : mismatch(path, "number", value);
                case INTEGER:
                    return integer(value, path);
                default:
                    throw new IllegalArgumentException("Not a primitive kind: " + kind);
            }
        };
    }

    public static Validator enumeration(List<JsonNode> allowedValues) {
        List<JsonNode> allowed = List.copyOf(allowedValues);
        return (value, path) -> {
            if (Validator.isAbsent(value)) {
                return missing(path);
            }
            for (JsonNode candidate : allowed) {
                if (sameValue(candidate, value)) {
                    return Result.success(value);
                }
            }
            return Result.failure(new ValidationError(ValidationError.Kind.ENUM_MISMATCH, path,
                    "Value " + value + " at " + path + " is not one of " + allowed.stream()
                            .map(JsonNode::toString)
                            .collect(Collectors.joining(", ", "[", "]"))));
        };
    }

    /**
     * Validates an array element by element.
     *
     * @param items Validator for every element; {@code null} accepts any element.
     */
    public static Validator array(Validator items) {
        Validator elementValidator = items == null ? ANY : items;
        return (value, path) -> {
            if (Validator.isAbsent(value)) {
                return missing(path);
            }
            if (!value.isArray()) {
                return mismatch(path, "array", value);
            }
            ArrayNode normalized = NODES.arrayNode(value.size());
            for (int i = 0; i < value.size(); i++) {
                Result<JsonNode, ValidationError> element = elementValidator.validate(value.get(i), path + "[" + i + "]");
                if (element.isFailure()) {
                    return element;
                }
                normalized.add(element.value());
            }
            return Result.success(normalized);
        };
    }

    /**
     * Validates an object field by field, in declared order. Fields without a rule are copied
     * through untouched. Absent input is replaced by {@code defaultValue}, or an empty object.
     *
     * @param fields       Rules for the declared properties.
     * @param defaultValue Object-level default, may be {@code null}.
     */
    public static Validator object(List<FieldRule> fields, JsonNode defaultValue) {
        List<FieldRule> rules = List.copyOf(fields);
        return (value, path) -> {
            JsonNode input = value;
            if (Validator.isAbsent(input)) {
                input = defaultValue != null && !defaultValue.isMissingNode() ? defaultValue : NODES.objectNode();
            }
            if (!input.isObject()) {
                return mismatch(path, "object", input);
            }
            ObjectNode normalized = ((ObjectNode) input).deepCopy();
            for (FieldRule rule : rules) {
                String fieldPath = path + "." + rule.name();
                JsonNode fieldValue = input.get(rule.name());
                if (Validator.isAbsent(fieldValue)) {
                    if (rule.required()) {
                        return Result.failure(new ValidationError(ValidationError.Kind.MISSING_REQUIRED, fieldPath,
                                "Missing required field " + fieldPath));
                    }
                    if (!rule.hasDefault()) {
                        continue;
                    }
                }
                Result<JsonNode, ValidationError> field = rule.validator().validate(fieldValue, fieldPath);
                if (field.isFailure()) {
                    return field;
                }
                if (!Validator.isAbsent(field.value())) {
                    normalized.set(rule.name(), field.value());
                }
            }
            return Result.success(normalized);
        };
    }

    /**
     * Numbers compare by value, so {@code 1} matches {@code 1.0}; everything else by JSON equality.
     */
    static boolean sameValue(JsonNode a, JsonNode b) {
        if (a.isNumber() && b.isNumber()) {
            try {
                return a.decimalValue().compareTo(b.decimalValue()) == 0;
            } catch (NumberFormatException e) {
                return a.asDouble() == b.asDouble();
            }
        }
        return a.equals(b);
    }

    private static Result<JsonNode, ValidationError> integer(JsonNode value, String path) {
        if (value.isIntegralNumber()) {
            return Result.success(value);
        }
        if (!value.isNumber()) {
            return mismatch(path, "integer", value);
        }
        if ((value.isDouble() || value.isFloat()) && !Double.isFinite(value.doubleValue())) {
            return notInteger(path, value);
        }
        BigDecimal decimal = value.decimalValue();
        if (decimal.stripTrailingZeros().scale() > 0) {
            return notInteger(path, value);
        }
        BigInteger integral = decimal.toBigIntegerExact();
        return Result.success(integral.bitLength() < 64 ? NODES.numberNode(integral.longValue()) : NODES.numberNode(integral));
    }

    private static Result<JsonNode, ValidationError> missing(String path) {
        return Result.failure(new ValidationError(ValidationError.Kind.MISSING_REQUIRED, path,
                "A value is required at " + path));
    }

    private static Result<JsonNode, ValidationError> notInteger(String path, JsonNode value) {
        return Result.failure(new ValidationError(ValidationError.Kind.NOT_INTEGER, path,
                "Expected an integer at " + path + " but got " + value));
    }

    private static Result<JsonNode, ValidationError> mismatch(String path, String expected, JsonNode value) {
        return Result.failure(new ValidationError(ValidationError.Kind.TYPE_MISMATCH, path,
                "Expected " + expected + " at " + path + " but got " + value.getNodeType().name().toLowerCase()));
    }

    /**
     * How one declared property of an object is validated.
     *
     * @param name       Property name.
     * @param validator  Validator for the property value.
     * @param required   Whether absence is an error.
     * @param hasDefault Whether the validator fills in a default for absent input.
     */
    public record FieldRule(String name, Validator validator, boolean required, boolean hasDefault) {
    }
}
