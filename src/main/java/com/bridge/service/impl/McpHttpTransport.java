package com.bridge.service.impl;

import com.bridge.dto.rpc.JsonRpcRequest;
import com.bridge.dto.rpc.JsonRpcResponse;
import com.bridge.exception.TransportException;
import com.bridge.model.Environment;
import com.bridge.model.RawCapability;
import com.bridge.model.ResponseEnvelope;
import com.bridge.model.error.TransportError;
import com.bridge.service.api.Transport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/**
 * {@link Transport} speaking MCP JSON-RPC over HTTP POST ("streamable HTTP").
 * <p>
 * The first call performs the {@code initialize} handshake and keeps the session id the
 * provider returns in the {@code Mcp-Session-Id} header. A failed handshake is attempted again on
 * the next call. Responses may be plain JSON or an event stream whose {@code data:} lines carry
 * the JSON-RPC messages.
 */
@Slf4j
public class McpHttpTransport implements Transport {

    static final String SESSION_HEADER = "Mcp-Session-Id";
    static final String PROTOCOL_VERSION = "2025-03-26";
    private static final String CLIENT_NAME = "capability-bridge";
    private static final String CLIENT_VERSION = "0.1.0";

    private final Environment environment;
    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final Duration timeout;
    private final AtomicLong requestIds = new AtomicLong();

    private volatile String sessionId;
    private Mono<Void> handshake;

    /**
     * @param environment The environment this transport serves, used in log and error messages.
     * @param webClient   A client already bound to the provider URL and credentials.
     * @param objectMapper Used to read provider responses.
     * @param timeout     Upper bound for one HTTP exchange.
     */
    public McpHttpTransport(Environment environment, WebClient webClient, ObjectMapper objectMapper, Duration timeout) {
        this.environment = environment;
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.timeout = timeout;
    }

    @Override
    public Mono<List<RawCapability>> listOperations() {
        return session()
                .then(Mono.defer(() -> listPage(null)))
                .expand(page -> page.nextCursor() == null ? Mono.empty() : listPage(page.nextCursor()))
                .concatMapIterable(ToolPage::tools)
                .collectList()
                .doOnNext(tools -> log.debug("{} provider listed {} tools", environment.key(), tools.size()));
    }

    @Override
    public Mono<ResponseEnvelope> invoke(String name, JsonNode arguments) {
        ObjectNode params = objectMapper.createObjectNode();
        params.put("name", name);
        params.set("arguments", arguments == null ? objectMapper.createObjectNode() : arguments);
        return session()
                .then(Mono.defer(() -> call("tools/call", params)))
                .map(result -> read(result, ResponseEnvelope.class, "tools/call result"));
    }

    @Override
    public void close() {
        String current = sessionId;
        forgetSession();
        if (current == null) {
            return;
        }
        log.info("Closing {} provider session", environment.key());
        webClient.delete()
                .header(SESSION_HEADER, current)
                .retrieve()
                .toBodilessEntity()
                .timeout(timeout)
                .subscribe(
                        response -> log.debug("{} provider session closed", environment.key()),
                        error -> log.debug("Could not close {} provider session: {}", environment.key(), error.getMessage()));
    }

    String getSessionId() {
        return sessionId;
    }

    private synchronized Mono<Void> session() {
        if (handshake == null) {
            AtomicReference<Mono<Void>> self = new AtomicReference<>();
            Mono<Void> attempt = initialize()
                    .doOnError(error -> {
                        log.warn("Handshake with {} provider failed: {}", environment.key(), error.getMessage());
                        forgetHandshake(self.get());
                    })
                    .cache();
            self.set(attempt);
            handshake = attempt;
        }
        return handshake;
    }

    private synchronized void forgetHandshake(Mono<Void> failed) {
        if (handshake == failed) {
            handshake = null;
        }
    }

    private synchronized void forgetSession() {
        handshake = null;
        sessionId = null;
    }

    private Mono<Void> initialize() {
        ObjectNode params = objectMapper.createObjectNode();
        params.put("protocolVersion", PROTOCOL_VERSION);
        params.set("capabilities", objectMapper.createObjectNode());
        params.putObject("clientInfo").put("name", CLIENT_NAME).put("version", CLIENT_VERSION);

        return Mono.defer(() -> {
                    log.info("Opening MCP session with {} provider", environment.key());
                    return call("initialize", params);
                })
                .flatMap(result -> {
                    log.debug("{} provider initialized: {}", environment.key(), result.path("serverInfo"));
                    return exchange(JsonRpcRequest.notification("notifications/initialized"));
                })
                .then();
    }

    private Mono<ToolPage> listPage(String cursor) {
        ObjectNode params = objectMapper.createObjectNode();
        if (cursor != null) {
            params.put("cursor", cursor);
        }
        return call("tools/list", params).map(result -> {
            List<RawCapability> tools = new ArrayList<>();
            JsonNode rawTools = result.path("tools");
            if (!rawTools.isArray()) {
                throw new TransportException(TransportError.Reason.PROTOCOL,
                        environment.key() + " provider returned a tools/list result without a tools array");
            }
            for (JsonNode tool : rawTools) {
                tools.add(read(tool, RawCapability.class, "tool entry"));
            }
            JsonNode next = result.get("nextCursor");
            String nextCursor = next == null || next.isNull() || next.asText().isEmpty() ? null : next.asText();
            if (nextCursor != null && nextCursor.equals(cursor)) {
                throw new TransportException(TransportError.Reason.PROTOCOL,
                        environment.key() + " provider repeated pagination cursor " + cursor);
            }
            return new ToolPage(tools, nextCursor);
        });
    }

    /**
     * Sends one JSON-RPC request and returns its {@code result}.
     */
    private Mono<JsonNode> call(String method, JsonNode params) {
        long id = requestIds.incrementAndGet();
        JsonRpcRequest request = new JsonRpcRequest(id, method, params);
        return exchange(request).map(reply -> {
            JsonRpcResponse response = decode(reply, id, method);
            if (response.getError() != null) {
                throw new TransportException(TransportError.Reason.PROTOCOL, environment.key() + " provider rejected "
                        + method + ": " + response.getError().getMessage() + " (code " + response.getError().getCode() + ")");
            }
            if (response.getResult() == null) {
                throw new TransportException(TransportError.Reason.PROTOCOL,
                        environment.key() + " provider sent no result for " + method);
            }
            return response.getResult();
        });
    }

    /**
     * Posts one JSON-RPC message. The session header is read on subscription, after the handshake.
     */
    private Mono<Reply> exchange(JsonRpcRequest request) {
        return Mono.defer(() -> {
                    log.debug("-> {} {} {}", environment.key(), request.getMethod(), request.getParams());
                    String current = sessionId;
                    return webClient.post()
                            .contentType(MediaType.APPLICATION_JSON)
                            .accept(MediaType.APPLICATION_JSON, MediaType.TEXT_EVENT_STREAM)
                            .headers(headers -> {
                                if (current != null) {
                                    headers.set(SESSION_HEADER, current);
                                }
                            })
                            .bodyValue(request)
                            .exchangeToMono(response -> toReply(response, request.getMethod()));
                })
                .timeout(timeout)
                .onErrorMap(error -> toTransportException(error, request.getMethod()));
    }

    private Mono<Reply> toReply(ClientResponse response, String method) {
        int status = response.statusCode().value();
        if (response.statusCode().isError()) {
            if (status == HttpStatus.NOT_FOUND.value() && sessionId != null) {
                log.info("{} provider no longer knows session {}; a new one will be opened", environment.key(), sessionId);
                forgetSession();
            }
            return response.bodyToMono(String.class)
                    .defaultIfEmpty("")
                    .flatMap(body -> Mono.error(new TransportException(TransportError.Reason.HTTP_STATUS,
                            environment.key() + " provider answered " + method + " with HTTP " + status
                                    + (body.isBlank() ? "" : ": " + body), status, null)));
        }
        String session = response.headers().asHttpHeaders().getFirst(SESSION_HEADER);
        if (session != null) {
            sessionId = session;
        }
        boolean eventStream = response.headers().contentType()
                .map(MediaType.TEXT_EVENT_STREAM::isCompatibleWith)
                .orElse(false);
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> new Reply(body, eventStream));
    }

    private JsonRpcResponse decode(Reply reply, long id, String method) {
        List<String> messages = reply.eventStream() ? dataLines(reply.body()) : List.of(reply.body());
        JsonRpcResponse fallback = null;
        for (String message : messages) {
            if (message.isBlank()) {
                continue;
            }
            JsonRpcResponse response;
            try {
                response = objectMapper.readValue(message, JsonRpcResponse.class);
            } catch (JsonProcessingException e) {
                throw new TransportException(TransportError.Reason.PROTOCOL,
                        environment.key() + " provider sent an unreadable " + method + " response: " + e.getOriginalMessage(), e);
            }
            if (response.getId() != null && response.getId() == id) {
                log.debug("<- {} {} {}", environment.key(), method, message);
                return response;
            }
            fallback = response;
        }
        if (fallback == null) {
            throw new TransportException(TransportError.Reason.PROTOCOL,
                    environment.key() + " provider sent an empty " + method + " response");
        }
        return fallback;
    }

    /**
     * Joins the {@code data:} lines of each server-sent event.
     */
    static List<String> dataLines(String body) {
        List<String> events = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String line : body.split("\r?\n", -1)) {
            if (line.isEmpty()) {
                if (current.length() > 0) {
                    events.add(current.toString());
                    current.setLength(0);
                }
            } else if (line.startsWith("data:")) {
                if (current.length() > 0) {
                    current.append('\n');
                }
                current.append(line.substring(5).trim());
            }
        }
        if (current.length() > 0) {
            events.add(current.toString());
        }
        return events;
    }

    private <T> T read(JsonNode node, Class<T> type, String what) {
        try {
            return objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new TransportException(TransportError.Reason.PROTOCOL,
                    environment.key() + " provider sent an unreadable " + what + ": " + e.getMessage(), e);
        }
    }

    private Throwable toTransportException(Throwable error, String method) {
        if (error instanceof TransportException) {
            return error;
        }
        if (error instanceof WebClientResponseException response) {
            int status = response.getStatusCode().value();
            return new TransportException(TransportError.Reason.HTTP_STATUS,
                    environment.key() + " provider answered " + method + " with HTTP " + status, status, error);
        }
        if (error instanceof WebClientRequestException || error instanceof TimeoutException) {
            return new TransportException(TransportError.Reason.UNREACHABLE,
                    environment.key() + " provider is unreachable: " + error.getMessage(), error);
        }
        return new TransportException(TransportError.Reason.PROTOCOL,
                environment.key() + " provider exchange failed: " + error.getMessage(), error);
    }

    private record Reply(String body, boolean eventStream) {
    }

    private record ToolPage(List<RawCapability> tools, String nextCursor) {
    }
}
