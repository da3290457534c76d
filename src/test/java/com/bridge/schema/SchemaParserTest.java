package com.bridge.schema;

import static com.bridge.support.Json.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.bridge.exception.MalformedSchemaException;
import com.bridge.model.schema.ArraySchema;
import com.bridge.model.schema.EnumerationSchema;
import com.bridge.model.schema.ObjectSchema;
import com.bridge.model.schema.PrimitiveSchema;
import com.bridge.model.schema.SchemaKind;
import com.bridge.model.schema.SchemaNode;
import com.bridge.model.schema.UnknownSchema;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

class SchemaParserTest {

    private final SchemaParser parser = new SchemaParser();

    @Test
    void parse_whenDocumentAbsent_returnsNull() {
        assertThat(parser.parse(null)).isNull();
        assertThat(parser.parse(NullNode.getInstance())).isNull();
    }

    @Test
    void parse_whenRootIsNotAnObject_throwsMalformedSchema() {
        assertThatThrownBy(() -> parser.parse(json("[1, 2]")))
                .isInstanceOf(MalformedSchemaException.class)
                .hasMessageContaining("ARRAY");
    }

    @Test
    void parse_objectWithPropertiesAndRequired_keepsDeclaredOrder() {
        SchemaNode node = parser.parse(json(
                "{'type':'object','properties':{'title':{'type':'string'},'perPage':{'type':'integer','default':10}},"
                        + "'required':['title','ghost']}"));

        assertThat(node).isInstanceOf(ObjectSchema.class);
        ObjectSchema object = (ObjectSchema) node;
        assertThat(object.properties().keySet()).containsExactly("title", "perPage");
        assertThat(object.requiredNames()).containsExactly("title");
        assertThat(object.properties().get("perPage").defaultValue().asInt()).isEqualTo(10);
    }

    @Test
    void parse_enumTakesPrecedenceOverType() {
        SchemaNode node = parser.parse(json("{'type':'object','properties':{'status':{'type':'string','enum':['draft','publish']}}}"));

        SchemaNode status = ((ObjectSchema) node).properties().get("status");
        assertThat(status).isInstanceOf(EnumerationSchema.class);
        assertThat(((EnumerationSchema) status).allowedValues()).containsExactly(TextNode.valueOf("draft"), TextNode.valueOf("publish"));
    }

    @Test
    void parse_typeUnionUsesFirstNonNullEntry() {
        SchemaNode node = parser.parse(json("{'properties':{'count':{'type':['null','integer']}}}"));

        SchemaNode count = ((ObjectSchema) node).properties().get("count");
        assertThat(count).isInstanceOf(PrimitiveSchema.class);
        assertThat(count.kind()).isEqualTo(SchemaKind.INTEGER);
    }

    @Test
    void parse_inferObjectAndArrayWithoutType() {
        SchemaNode node = parser.parse(json("{'properties':{'tags':{'items':{'type':'string'}}}}"));

        assertThat(node).isInstanceOf(ObjectSchema.class);
        SchemaNode tags = ((ObjectSchema) node).properties().get("tags");
        assertThat(tags).isInstanceOf(ArraySchema.class);
        assertThat(((ArraySchema) tags).items().kind()).isEqualTo(SchemaKind.STRING);
    }

    @Test
    void parse_unrecognizedKind_becomesUnknownWithRawKind() {
        SchemaNode node = parser.parse(json("{'type':'object','properties':{'when':{'type':'date-time','default':'now'}}}"));

        SchemaNode when = ((ObjectSchema) node).properties().get("when");
        assertThat(when).isInstanceOf(UnknownSchema.class);
        assertThat(((UnknownSchema) when).rawKind()).isEqualTo("date-time");
        assertThat(when.defaultValue().asText()).isEqualTo("now");
    }

    @Test
    void parse_emptyEnum_becomesUnknown() {
        SchemaNode node = parser.parse(json("{'type':'object','properties':{'mode':{'enum':[]}}}"));

        assertThat(((ObjectSchema) node).properties().get("mode")).isInstanceOf(UnknownSchema.class);
    }

    @Test
    void parse_deepNesting_terminates() {
        StringBuilder schema = new StringBuilder();
        int depth = 200;
        for (int i = 0; i < depth; i++) {
            schema.append("{\"type\":\"object\",\"properties\":{\"child\":");
        }
        schema.append("{\"type\":\"string\"}");
        for (int i = 0; i < depth; i++) {
            schema.append("}}");
        }

        SchemaNode node = parser.parse(json(schema.toString()));

        assertThat(node).isInstanceOf(ObjectSchema.class);
    }
}
