package com.bridge.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * The raw result of invoking a capability. Providers wrap their payload in content items,
 * typically {@code {"type":"text","text":"..."}}.
 *
 * @param content The content items, never {@code null}.
 * @param isError Whether the provider reported the call as failed.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ResponseEnvelope(@JsonProperty("content") List<JsonNode> content,
                               @JsonProperty("isError") boolean isError) {

    public ResponseEnvelope {
        content = content == null ? List.of() : List.copyOf(content);
    }

    public static ResponseEnvelope ofContent(List<JsonNode> content) {
        return new ResponseEnvelope(content, false);
    }
}
