package com.bridge.cli.ui;

import static com.bridge.cli.ui.Ansi.CYAN;
import static com.bridge.cli.ui.Ansi.GREEN;
import static com.bridge.cli.ui.Ansi.PURPLE;
import static com.bridge.cli.ui.Ansi.RED;
import static com.bridge.cli.ui.Ansi.RESET;
import static com.bridge.cli.ui.Ansi.WHITE;
import static com.bridge.cli.ui.Ansi.YELLOW;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Iterator;
import java.util.Map;

/**
 * Pretty-prints JSON with ANSI colours for the terminal.
 */
public final class JsonPrinter {

    private JsonPrinter() {
    }

    /**
     * @param node The node to format, may be {@code null}.
     * @return an indented, colourized rendering.
     */
    public static String format(JsonNode node) {
        if (node == null) {
            return PURPLE + "null" + RESET;
        }
        StringBuilder sb = new StringBuilder();
        append(node, sb, 0);
        return sb.toString();
    }

    private static void append(JsonNode node, StringBuilder sb, int indentLevel) {
        String indent = "  ".repeat(indentLevel);
        if (node.isObject()) {
            sb.append(WHITE).append("{").append(RESET).append("\n");
            Iterator<Map.Entry<String, JsonNode>> fields = node.properties().iterator();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                sb.append(indent).append("  ").append(CYAN).append("\"").append(field.getKey()).append("\"").append(RESET).append(": ");
                append(field.getValue(), sb, indentLevel + 1);
                if (fields.hasNext()) {
                    sb.append(",");
                }
                sb.append("\n");
            }
            sb.append(indent).append(WHITE).append("}").append(RESET);
        } else if (node.isArray()) {
            sb.append(WHITE).append("[").append(RESET).append("\n");
            Iterator<JsonNode> elements = node.elements();
            while (elements.hasNext()) {
                sb.append(indent).append("  ");
                append(elements.next(), sb, indentLevel + 1);
                if (elements.hasNext()) {
                    sb.append(",");
                }
                sb.append("\n");
            }
            sb.append(indent).append(WHITE).append("]").append(RESET);
        } else if (node.isTextual()) {
            sb.append(GREEN).append("\"").append(node.asText()).append("\"").append(RESET);
        } else if (node.isNumber()) {
            sb.append(YELLOW).append(node.asText()).append(RESET);
        } else if (node.isBoolean()) {
            sb.append(PURPLE).append(node.asBoolean()).append(RESET);
        } else if (node.isNull()) {
            sb.append(RED).append("null").append(RESET);
        } else {
            sb.append(node.asText());
        }
    }
}
