package com.bridge.dto.rpc;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A JSON-RPC 2.0 request, or a notification when {@code id} is {@code null}.
 * <p>
 * Lombok's {@code @Data} generates the accessors Jackson serializes.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JsonRpcRequest {

    private String jsonrpc = "2.0";

    private Long id;

    /**
     * The remote method, e.g. {@code tools/list}.
     */
    private String method;

    private JsonNode params;

    public JsonRpcRequest(Long id, String method, JsonNode params) {
        this.id = id;
        this.method = method;
        this.params = params;
    }

    public static JsonRpcRequest notification(String method) {
        return new JsonRpcRequest(null, method, null);
    }
}
