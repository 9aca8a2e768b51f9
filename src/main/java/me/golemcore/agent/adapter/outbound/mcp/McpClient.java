package me.golemcore.agent.adapter.outbound.mcp;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agent.adapter.outbound.mcp.transport.McpTransport;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolFailureKind;
import me.golemcore.agent.domain.model.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * JSON-RPC 2.0 client for a single MCP (Model Context Protocol) server.
 *
 * <p>
 * Lifecycle:
 * <ol>
 * <li>Open the transport
 * <li>Send initialize request (JSON-RPC handshake)
 * <li>Send the initialized notification
 * <li>Fetch available tools (tools/list)
 * <li>Call tools (tools/call)
 * <li>Close the transport
 * </ol>
 *
 * <p>
 * Responses are matched to requests by JSON-RPC id. Server notifications are
 * logged and ignored; server requests other than {@code ping} are answered
 * with "method not found".
 *
 * <p>
 * MCP protocol version: 2024-11-05
 *
 * <p>
 * Not a Spring bean; created per server by {@link McpClientManager}.
 */
public class McpClient implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(McpClient.class);
    private static final String JSONRPC_VERSION = "2.0";
    static final String MCP_PROTOCOL_VERSION = "2024-11-05";
    private static final int METHOD_NOT_FOUND = -32601;
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };
    private static final TypeReference<List<Object>> LIST_TYPE_REF = new TypeReference<>() {
    };

    private final String serverName;
    private final McpTransport transport;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    private final AtomicInteger nextId = new AtomicInteger(1);
    private final Map<Integer, CompletableFuture<JsonNode>> pendingRequests = new ConcurrentHashMap<>();

    private volatile boolean connected;
    private List<ToolDefinition> cachedTools = List.of();

    public McpClient(String serverName, McpTransport transport, ObjectMapper objectMapper, Duration requestTimeout) {
        this.serverName = serverName;
        this.transport = transport;
        this.objectMapper = objectMapper;
        this.requestTimeout = requestTimeout;
    }

    /**
     * Opens the transport, performs the handshake and fetches the tool list,
     * each step bounded by {@code startupTimeout}. The client is closed when any
     * step fails.
     */
    public List<ToolDefinition> connect(Duration startupTimeout)
            throws IOException, McpException, TimeoutException, InterruptedException {
        log.info("[MCP:{}] Connecting", serverName);
        long timeoutMs = startupTimeout.toMillis();
        try {
            await(transport.start(new McpTransport.Listener() {
                @Override
                public void onMessage(String message) {
                    handleMessage(message);
                }

                @Override
                public void onClosed(Throwable cause) {
                    handleClosed(cause);
                }
            }), timeoutMs);
            connected = true;

            JsonNode initResult = await(sendRequest("initialize", Map.of(
                    "protocolVersion", MCP_PROTOCOL_VERSION,
                    "capabilities", Map.of(),
                    "clientInfo", Map.of(
                            "name", "golemcore-agent",
                            "version", "1.0.0"))),
                    timeoutMs);
            log.info("[MCP:{}] Initialized: {}", serverName, initResult);

            sendNotification("notifications/initialized", Map.of());

            JsonNode toolsResult = await(sendRequest("tools/list", Map.of()), timeoutMs);
            cachedTools = parseToolDefinitions(toolsResult);
            log.info("[MCP:{}] Available tools: {}", serverName,
                    cachedTools.stream().map(ToolDefinition::getName).toList());
            return cachedTools;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("[MCP:{}] Connection interrupted, cleaning up", serverName);
            close();
            throw e;
        } catch (IOException | McpException | TimeoutException | RuntimeException e) {
            log.error("[MCP:{}] Connection failed, cleaning up: {}", serverName, e.getMessage());
            close();
            throw e;
        }
    }

    /**
     * Calls a tool on the server. The structured {@code content} list becomes
     * the model content, its text items joined by newlines the display text;
     * {@code isError} marks the result as failed. Protocol and transport errors
     * complete the future exceptionally.
     */
    public CompletableFuture<ToolResult> callTool(String name, Map<String, Object> arguments, Duration timeout) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("name", name);
        params.put("arguments", arguments != null ? arguments : Map.of());
        return sendRequest("tools/call", params, timeout)
                .thenApply(result -> parseToolCallResult(name, result));
    }

    CompletableFuture<JsonNode> sendRequest(String method, Map<String, Object> params) {
        return sendRequest(method, params, requestTimeout);
    }

    CompletableFuture<JsonNode> sendRequest(String method, Map<String, Object> params, Duration timeout) {
        int id = nextId.getAndIncrement();
        CompletableFuture<JsonNode> future = new CompletableFuture<>();
        pendingRequests.put(id, future);
        future.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((result, ex) -> pendingRequests.remove(id));

        Map<String, Object> request = new LinkedHashMap<>();
        request.put("jsonrpc", JSONRPC_VERSION);
        request.put("id", id);
        request.put("method", method);
        request.put("params", params);

        try {
            String json = objectMapper.writeValueAsString(request);
            log.debug("[MCP:{}] -> {}", serverName, json);
            transport.send(json).whenComplete((ignored, ex) -> {
                if (ex != null) {
                    future.completeExceptionally(ex);
                }
            });
        } catch (JsonProcessingException e) {
            future.completeExceptionally(e);
        }
        return future;
    }

    /**
     * Sends a JSON-RPC notification (no id, no response expected).
     */
    void sendNotification(String method, Map<String, Object> params) {
        Map<String, Object> notification = new LinkedHashMap<>();
        notification.put("jsonrpc", JSONRPC_VERSION);
        notification.put("method", method);
        if (params != null && !params.isEmpty()) {
            notification.put("params", params);
        }
        sendRaw(notification, "notification");
    }

    private void sendRaw(Map<String, Object> message, String kind) {
        try {
            String json = objectMapper.writeValueAsString(message);
            log.debug("[MCP:{}] -> ({}) {}", serverName, kind, json);
            transport.send(json).whenComplete((ignored, ex) -> {
                if (ex != null) {
                    log.warn("[MCP:{}] Failed to send {}: {}", serverName, kind, ex.getMessage());
                }
            });
        } catch (JsonProcessingException e) {
            log.warn("[MCP:{}] Failed to serialize {}: {}", serverName, kind, e.getMessage());
        }
    }

    void handleMessage(String raw) {
        String line = raw.trim();
        if (line.isEmpty()) {
            return;
        }
        log.debug("[MCP:{}] <- {}", serverName, line);
        JsonNode message;
        try {
            message = objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            log.warn("[MCP:{}] Failed to parse message: {}", serverName, e.getMessage());
            return;
        }
        if (message.isArray()) {
            message.forEach(this::dispatch);
        } else {
            dispatch(message);
        }
    }

    private void dispatch(JsonNode message) {
        JsonNode idNode = message.get("id");
        JsonNode methodNode = message.get("method");

        if (methodNode != null) {
            if (idNode != null && !idNode.isNull()) {
                answerServerRequest(idNode, methodNode.asText());
            } else {
                log.debug("[MCP:{}] Server notification: {}", serverName, methodNode.asText());
            }
            return;
        }

        if (idNode == null || !idNode.canConvertToInt()) {
            log.warn("[MCP:{}] Ignoring message without a usable id", serverName);
            return;
        }
        int id = idNode.asInt();
        CompletableFuture<JsonNode> pending = pendingRequests.remove(id);
        if (pending == null) {
            log.warn("[MCP:{}] Received response for unknown id: {}", serverName, id);
            return;
        }
        JsonNode error = message.get("error");
        if (error != null && !error.isNull()) {
            pending.completeExceptionally(new McpException(
                    error.has("code") ? error.get("code").asInt() : -1,
                    error.has("message") ? error.get("message").asText() : "Unknown MCP error"));
        } else {
            pending.complete(message.get("result"));
        }
    }

    private void answerServerRequest(JsonNode id, String method) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("jsonrpc", JSONRPC_VERSION);
        response.put("id", id);
        if ("ping".equals(method)) {
            response.put("result", Map.of());
        } else {
            log.debug("[MCP:{}] Unsupported server request: {}", serverName, method);
            response.put("error", Map.of("code", METHOD_NOT_FOUND, "message", "Method not found: " + method));
        }
        sendRaw(response, "response");
    }

    private void handleClosed(Throwable cause) {
        if (connected) {
            log.warn("[MCP:{}] Connection lost: {}", serverName, cause != null ? cause.getMessage() : "closed");
        }
        connected = false;
        failPending(cause != null ? cause : new IOException("MCP connection closed"));
    }

    private void failPending(Throwable cause) {
        for (CompletableFuture<JsonNode> future : pendingRequests.values()) {
            future.completeExceptionally(cause);
        }
        pendingRequests.clear();
    }

    private <T> T await(CompletableFuture<T> future, long timeoutMs)
            throws IOException, McpException, TimeoutException, InterruptedException {
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException ioException) {
                throw ioException;
            }
            if (cause instanceof McpException mcpException) {
                throw mcpException;
            }
            if (cause instanceof TimeoutException timeoutException) {
                throw timeoutException;
            }
            throw new IOException(cause != null ? cause.getMessage() : "MCP request failed", cause);
        }
    }

    private List<ToolDefinition> parseToolDefinitions(JsonNode result) {
        if (result == null) {
            return List.of();
        }
        JsonNode toolsNode = result.get("tools");
        if (toolsNode == null || !toolsNode.isArray()) {
            return List.of();
        }

        List<ToolDefinition> tools = new ArrayList<>();
        for (JsonNode toolNode : toolsNode) {
            String name = toolNode.has("name") ? toolNode.get("name").asText() : null;
            String description = toolNode.has("description") ? toolNode.get("description").asText() : "";
            if (name == null || name.isBlank()) {
                continue;
            }

            Map<String, Object> inputSchema = ToolDefinition.emptySchema();
            if (toolNode.has("inputSchema")) {
                try {
                    inputSchema = objectMapper.convertValue(toolNode.get("inputSchema"), MAP_TYPE_REF);
                } catch (IllegalArgumentException e) {
                    log.warn("[MCP:{}] Failed to parse inputSchema for tool '{}': {}", serverName, name,
                            e.getMessage());
                }
            }

            tools.add(ToolDefinition.builder()
                    .name(name)
                    .description(description)
                    .inputSchema(inputSchema)
                    .build());
        }
        return tools;
    }

    private ToolResult parseToolCallResult(String toolName, JsonNode result) {
        if (result == null) {
            return ToolResult.failure("No result from MCP tool: " + toolName);
        }

        boolean isError = result.has("isError") && result.get("isError").asBoolean(false);

        List<Object> content = List.of();
        StringBuilder display = new StringBuilder();
        JsonNode contentNode = result.get("content");
        if (contentNode != null && contentNode.isArray()) {
            content = objectMapper.convertValue(contentNode, LIST_TYPE_REF);
            for (JsonNode item : contentNode) {
                String type = item.has("type") ? item.get("type").asText() : "text";
                if (!display.isEmpty()) {
                    display.append("\n");
                }
                if ("text".equals(type) && item.has("text")) {
                    display.append(item.get("text").asText());
                } else {
                    display.append('[').append(type).append(']');
                }
            }
        }

        if (isError) {
            String error = display.isEmpty() ? "MCP tool error" : display.toString();
            return ToolResult.builder()
                    .llmContent(content)
                    .returnDisplay(error)
                    .error(error)
                    .failureKind(ToolFailureKind.EXECUTION_FAILED)
                    .build();
        }
        return ToolResult.success(content, display.isEmpty() ? "(no output)" : display.toString());
    }

    public List<ToolDefinition> getCachedTools() {
        return cachedTools;
    }

    public boolean isConnected() {
        return connected;
    }

    public String getServerName() {
        return serverName;
    }

    @Override
    public void close() {
        log.info("[MCP:{}] Closing client", serverName);
        connected = false;
        failPending(new IOException("MCP client closing"));
        transport.close();
    }

    /**
     * Exception for MCP JSON-RPC errors.
     */
    public static class McpException extends Exception {
        private static final long serialVersionUID = 1L;
        private final int code;

        public McpException(int code, String message) {
            super(message);
            this.code = code;
        }

        public int getCode() {
            return code;
        }
    }
}
