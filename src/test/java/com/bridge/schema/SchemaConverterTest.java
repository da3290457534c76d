package com.bridge.schema;

import static com.bridge.support.Json.json;
import static org.assertj.core.api.Assertions.assertThat;

import com.bridge.model.Result;
import com.bridge.model.error.ValidationError;
import com.bridge.model.schema.ObjectSchema;
import com.bridge.model.schema.PrimitiveSchema;
import com.bridge.model.schema.SchemaKind;
import com.bridge.model.schema.SchemaNode;
import com.bridge.model.schema.UnknownSchema;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class SchemaConverterTest {

    private final SchemaParser parser = new SchemaParser();
    private final SchemaConverter converter = new SchemaConverter();

    private Validator validatorFor(String schema) {
        return converter.convert(parser.parse(json(schema)));
    }

    @Test
    void convert_null_acceptsAnything() {
        Validator validator = converter.convert(null);

        assertThat(validator.validate(json("{'anything':[1,2]}")).isSuccess()).isTrue();
        assertThat(validator.validate(MissingNode.getInstance()).isSuccess()).isTrue();
    }

    @Test
    void objectDefaults_areFilledForAbsentFields() {
        Validator validator = validatorFor("{'type':'object','properties':{'perPage':{'type':'integer','default':10}}}");

        Result<JsonNode, ValidationError> result = validator.validate(json("{}"));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.value()).isEqualTo(json("{'perPage':10}"));
    }

    @Test
    void absentObject_isValidatedAsEmptyObject() {
        Validator validator = validatorFor("{'type':'object','properties':{'perPage':{'type':'integer','default':10}}}");

        Result<JsonNode, ValidationError> result = validator.validate(MissingNode.getInstance());

        assertThat(result.value()).isEqualTo(json("{'perPage':10}"));
    }

    @Test
    void missingOptionalField_succeeds_missingRequiredField_fails() {
        Validator validator = validatorFor("{'type':'object','properties':{'title':{'type':'string'},'slug':{'type':'string'}},"
                + "'required':['title']}");

        assertThat(validator.validate(json("{'title':'Hello'}")).isSuccess()).isTrue();

        Result<JsonNode, ValidationError> missing = validator.validate(json("{'slug':'hello'}"));
        assertThat(missing.isFailure()).isTrue();
        assertThat(missing.error().kind()).isEqualTo(ValidationError.Kind.MISSING_REQUIRED);
        assertThat(missing.error().path()).isEqualTo("$.title");
    }

    @Test
    void typeMismatch_reportsNestedPath() {
        Validator validator = validatorFor("{'type':'object','properties':{'post':{'type':'object','properties':"
                + "{'tags':{'type':'array','items':{'type':'string'}}}}}}");

        Result<JsonNode, ValidationError> result = validator.validate(json("{'post':{'tags':['a','b',3]}}"));

        assertThat(result.isFailure()).isTrue();
        assertThat(result.error().kind()).isEqualTo(ValidationError.Kind.TYPE_MISMATCH);
        assertThat(result.error().path()).isEqualTo("$.post.tags[2]");
    }

    @Test
    void integer_acceptsIntegralDecimal_andNormalizesIt() {
        Validator validator = validatorFor("{'type':'object','properties':{'page':{'type':'integer'}}}");

        Result<JsonNode, ValidationError> result = validator.validate(json("{'page':10.0}"));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.value().get("page").isIntegralNumber()).isTrue();
        assertThat(result.value().get("page").asLong()).isEqualTo(10L);
    }

    @Test
    void integer_rejectsFraction() {
        Validator validator = validatorFor("{'type':'object','properties':{'page':{'type':'integer'}}}");

        Result<JsonNode, ValidationError> result = validator.validate(json("{'page':1.5}"));

        assertThat(result.error().kind()).isEqualTo(ValidationError.Kind.NOT_INTEGER);
    }

    @Test
    void enumeration_withDefault_returnsDefaultForAbsentInput() {
        Validator validator = validatorFor("{'type':'object','properties':{'status':{'enum':['draft','publish'],'default':'draft'}}}");

        Result<JsonNode, ValidationError> result = validator.validate(json("{}"));

        assertThat(result.value().get("status").asText()).isEqualTo("draft");
    }

    @Test
    void enumeration_rejectsOtherValues_andComparesNumbersByValue() {
        Validator status = validatorFor("{'type':'object','properties':{'status':{'enum':['draft','publish']}}}");
        Validator level = validatorFor("{'type':'object','properties':{'level':{'enum':[1,2,3]}}}");

        assertThat(status.validate(json("{'status':'trash'}")).error().kind()).isEqualTo(ValidationError.Kind.ENUM_MISMATCH);
        assertThat(level.validate(json("{'level':2.0}")).isSuccess()).isTrue();
    }

    @Test
    void unknownKind_acceptsAnyValue_andSiblingsStillValidate() {
        Validator validator = validatorFor("{'type':'object','properties':{'when':{'type':'date-time'},'count':{'type':'integer'}}}");

        assertThat(validator.validate(json("{'when':{'weird':true},'count':1}")).isSuccess()).isTrue();
        assertThat(validator.validate(json("{'when':'x','count':'one'}")).error().path()).isEqualTo("$.count");
    }

    @Test
    void undeclaredFields_arePassedThrough() {
        Validator validator = validatorFor("{'type':'object','properties':{'title':{'type':'string'}}}");

        Result<JsonNode, ValidationError> result = validator.validate(json("{'title':'a','extra':42}"));

        assertThat(result.value()).isEqualTo(json("{'title':'a','extra':42}"));
    }

    @Test
    void validation_doesNotMutateInput() {
        Validator validator = validatorFor("{'type':'object','properties':{'perPage':{'type':'integer','default':10}}}");
        JsonNode input = json("{}");

        validator.validate(input);

        assertThat(input).isEqualTo(json("{}"));
    }

    @Test
    void convert_handBuiltTree_withUnknownNode() {
        Map<String, SchemaNode> properties = new LinkedHashMap<>();
        properties.put("name", PrimitiveSchema.of(SchemaKind.STRING));
        properties.put("blob", UnknownSchema.of("binary"));
        Validator validator = converter.convert(new ObjectSchema(properties, Set.of("name"), null, null));

        assertThat(validator.validate(json("{'name':'n','blob':[1]}")).isSuccess()).isTrue();
        assertThat(validator.validate(json("{'blob':[1]}")).isFailure()).isTrue();
    }
}
