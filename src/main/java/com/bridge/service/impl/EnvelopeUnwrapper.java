package com.bridge.service.impl;

import com.bridge.model.ResponseEnvelope;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Extracts the payload from a provider's {@link ResponseEnvelope}. Never throws.
 * <ul>
 *     <li>The first {@code text} item is parsed as JSON; text that is not JSON is returned as a string.</li>
 *     <li>When there is no text item, or the first one has empty text, the content items are returned
 *     as an array, which is empty for an envelope without content.</li>
 *     <li>A missing envelope yields JSON {@code null}.</li>
 * </ul>
 */
@Component
@Slf4j
public class EnvelopeUnwrapper {

    private final ObjectMapper objectMapper;

    public EnvelopeUnwrapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @param envelope The provider's response, may be {@code null}.
     * @return the payload; never {@code null}.
     */
    public JsonNode unwrap(ResponseEnvelope envelope) {
        if (envelope == null) {
            return NullNode.getInstance();
        }
        Optional<JsonNode> textItem = envelope.content().stream()
                .filter(item -> item != null && "text".equals(item.path("type").asText()))
                .findFirst();
        if (textItem.isPresent() && !textItem.get().path("text").asText().isEmpty()) {
            return parseText(textItem.get().path("text").asText());
        }
        ArrayNode items = objectMapper.createArrayNode();
        envelope.content().forEach(items::add);
        return items;
    }

    private JsonNode parseText(String text) {
        try {
            JsonNode parsed = objectMapper.readTree(text);
            // readTree yields a missing node for blank input
            return parsed == null || parsed.isMissingNode() ? TextNode.valueOf(text) : parsed;
        } catch (JsonProcessingException e) {
            log.debug("Response text is not JSON, returning it verbatim: {}", e.getOriginalMessage());
            return TextNode.valueOf(text);
        }
    }
}
