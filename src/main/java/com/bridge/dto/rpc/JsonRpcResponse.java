package com.bridge.dto.rpc;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class JsonRpcResponse {
    private String jsonrpc;
    private Long id;
    private JsonNode result;
    private JsonRpcError error;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class JsonRpcError {
        private int code;
        private String message;
        private JsonNode data;
    }
}
