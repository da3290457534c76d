package com.bridge.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * One entry of a provider's capability listing, as received.
 *
 * @param name        The capability name.
 * @param description Optional description.
 * @param inputSchema Optional JSON-Schema document describing the arguments.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RawCapability(@JsonProperty("name") String name,
                            @JsonProperty("description") String description,
                            @JsonProperty("inputSchema") JsonNode inputSchema) {
}
