package com.bridge.dto.request;

import com.bridge.model.Environment;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * A shell request to call one generated operation.
 *
 * @param environment The environment to call into.
 * @param operation   The capability name.
 * @param arguments   Parsed call arguments; {@code null} when none were given.
 */
public record InvokeOperationRequest(Environment environment, String operation, JsonNode arguments) {
}
