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
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.Headers;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.sse.EventSource;
import okhttp3.sse.EventSourceListener;
import okhttp3.sse.EventSources;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;

/**
 * Legacy MCP HTTP+SSE transport: a long-lived {@code GET} event stream
 * delivers server messages, and the first {@code endpoint} event names the URL
 * client messages are {@code POST}ed to.
 */
@Slf4j
public class SseMcpTransport implements McpTransport {

    private static final MediaType JSON = MediaType.get("application/json");

    private final String serverName;
    private final HttpUrl url;
    private final Headers headers;
    private final OkHttpClient httpClient;

    private final CompletableFuture<HttpUrl> endpoint = new CompletableFuture<>();
    private EventSource eventSource;
    private volatile boolean closed;

    public SseMcpTransport(String serverName, String url, Headers headers, OkHttpClient httpClient) {
        this.serverName = serverName;
        this.url = HttpUrl.get(url);
        this.headers = headers;
        this.httpClient = httpClient;
    }

    @Override
    public CompletableFuture<Void> start(Listener listener) {
        Request request = new Request.Builder()
                .url(url)
                .headers(headers)
                .header("Accept", "text/event-stream")
                .build();

        eventSource = EventSources.createFactory(httpClient).newEventSource(request, new EventSourceListener() {
            @Override
            public void onEvent(EventSource source, String id, String type, String data) {
                if ("endpoint".equals(type)) {
                    HttpUrl resolved = url.resolve(data.trim());
                    if (resolved == null) {
                        endpoint.completeExceptionally(new IOException("Invalid MCP endpoint: " + data));
                    } else {
                        log.debug("[MCP:{}] Message endpoint: {}", serverName, resolved);
                        endpoint.complete(resolved);
                    }
                } else if (type == null || "message".equals(type)) {
                    listener.onMessage(data);
                }
            }

            @Override
            public void onClosed(EventSource source) {
                endpoint.completeExceptionally(new IOException("SSE stream closed before endpoint event"));
                listener.onClosed(new IOException("SSE stream closed"));
            }

            @Override
            public void onFailure(EventSource source, Throwable t, Response response) {
                IOException failure = new IOException("SSE connection failed"
                        + (response != null ? ": HTTP " + response.code() : "")
                        + (t != null ? ": " + t.getMessage() : ""), t);
                endpoint.completeExceptionally(failure);
                if (!closed) {
                    listener.onClosed(failure);
                }
            }
        });
        return endpoint.thenApply(ignored -> null);
    }

    @Override
    public CompletableFuture<Void> send(String message) {
        HttpUrl target = endpoint.getNow(null);
        if (target == null || closed) {
            return CompletableFuture.failedFuture(new IOException("SSE transport not connected"));
        }
        Request request = new Request.Builder()
                .url(target)
                .headers(headers)
                .post(RequestBody.create(message, JSON))
                .build();

        CompletableFuture<Void> sent = new CompletableFuture<>();
        httpClient.newCall(request).enqueue(new Callback() {
            @Override
            public void onFailure(Call call, IOException e) {
                sent.completeExceptionally(e);
            }

            @Override
            public void onResponse(Call call, Response response) {
                try (response) {
                    if (response.isSuccessful()) {
                        sent.complete(null);
                    } else {
                        sent.completeExceptionally(new IOException("HTTP " + response.code() + " from " + target));
                    }
                }
            }
        });
        return sent;
    }

    @Override
    public void close() {
        closed = true;
        if (eventSource != null) {
            eventSource.cancel();
        }
    }
}
