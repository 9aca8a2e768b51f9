package me.golemcore.agent.adapter.outbound.mcp.transport;

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

import lombok.extern.slf4j.Slf4j;
import okhttp3.Headers;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;

/**
 * One JSON-RPC message per WebSocket text frame.
 */
@Slf4j
public class WebSocketMcpTransport implements McpTransport {

    private final String serverName;
    private final String url;
    private final Headers headers;
    private final OkHttpClient httpClient;

    private WebSocket webSocket;
    private volatile boolean closed;

    public WebSocketMcpTransport(String serverName, String address, Headers headers, OkHttpClient httpClient) {
        this.serverName = serverName;
        this.url = address.startsWith("ws://") || address.startsWith("wss://") ? address : "ws://" + address;
        this.headers = headers;
        this.httpClient = httpClient;
    }

    @Override
    public CompletableFuture<Void> start(Listener listener) {
        CompletableFuture<Void> opened = new CompletableFuture<>();
        Request request = new Request.Builder().url(url).headers(headers).build();
        webSocket = httpClient.newWebSocket(request, new WebSocketListener() {
            @Override
            public void onOpen(WebSocket socket, Response response) {
                log.debug("[MCP:{}] WebSocket open: {}", serverName, url);
                opened.complete(null);
            }

            @Override
            public void onMessage(WebSocket socket, String text) {
                listener.onMessage(text);
            }

            @Override
            public void onClosed(WebSocket socket, int code, String reason) {
                opened.completeExceptionally(new IOException("WebSocket closed: " + code));
                listener.onClosed(new IOException("WebSocket closed: " + code + " " + reason));
            }

            @Override
            public void onFailure(WebSocket socket, Throwable t, Response response) {
                IOException failure = new IOException("WebSocket failure: " + t.getMessage(), t);
                opened.completeExceptionally(failure);
                if (!closed) {
                    listener.onClosed(failure);
                }
            }
        });
        return opened;
    }

    @Override
    public CompletableFuture<Void> send(String message) {
        if (webSocket == null || closed) {
            return CompletableFuture.failedFuture(new IOException("WebSocket not connected"));
        }
        if (!webSocket.send(message)) {
            return CompletableFuture.failedFuture(new IOException("WebSocket send rejected"));
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public void close() {
        closed = true;
        if (webSocket != null) {
            webSocket.close(1000, "client closing");
        }
    }
}
