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
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.util.concurrent.CompletableFuture;

/**
 * MCP streamable HTTP transport: every client message is a {@code POST} whose
 * response carries the server messages, either as a JSON body or as a
 * {@code text/event-stream} of {@code data:} events. The
 * {@code Mcp-Session-Id} issued by the server is echoed on later requests.
 */
@Slf4j
public class StreamableHttpMcpTransport implements McpTransport {

    static final String SESSION_HEADER = "Mcp-Session-Id";
    private static final MediaType JSON = MediaType.get("application/json");

    private final String serverName;
    private final String url;
    private final Headers headers;
    private final OkHttpClient httpClient;

    private volatile Listener listener;
    private volatile String sessionId;
    private volatile boolean closed;

    public StreamableHttpMcpTransport(String serverName, String url, Headers headers, OkHttpClient httpClient) {
        this.serverName = serverName;
        this.url = url;
        this.headers = headers;
        this.httpClient = httpClient;
    }

    @Override
    public CompletableFuture<Void> start(Listener listener) {
        this.listener = listener;
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> send(String message) {
        if (closed || listener == null) {
            return CompletableFuture.failedFuture(new IOException("HTTP transport not started"));
        }
        Request.Builder builder = new Request.Builder()
                .url(url)
                .headers(headers)
                .header("Accept", "application/json, text/event-stream")
                .post(RequestBody.create(message, JSON));
        String session = sessionId;
        if (session != null) {
            builder.header(SESSION_HEADER, session);
        }

        CompletableFuture<Void> sent = new CompletableFuture<>();
        httpClient.newCall(builder.build()).enqueue(new Callback() {
            @Override
            public void onFailure(Call call, IOException e) {
                sent.completeExceptionally(e);
            }

            @Override
            public void onResponse(Call call, Response response) {
                try (response) {
                    handleResponse(response);
                    sent.complete(null);
                } catch (IOException e) {
                    sent.completeExceptionally(e);
                }
            }
        });
        return sent;
    }

    private void handleResponse(Response response) throws IOException {
        String issued = response.header(SESSION_HEADER);
        if (issued != null && !issued.isBlank()) {
            sessionId = issued;
        }
        if (!response.isSuccessful()) {
            throw new IOException("HTTP " + response.code() + " from " + url);
        }
        ResponseBody body = response.body();
        if (body == null || response.code() == 202 || response.code() == 204) {
            return;
        }
        String text = body.string();
        if (text.isBlank()) {
            return;
        }
        MediaType contentType = body.contentType();
        if (contentType != null && "event-stream".equals(contentType.subtype())) {
            dispatchEventStream(text);
        } else {
            listener.onMessage(text);
        }
    }

    private void dispatchEventStream(String text) throws IOException {
        StringBuilder data = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(new StringReader(text))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isEmpty()) {
                    flushEvent(data);
                } else if (line.startsWith("data:")) {
                    if (!data.isEmpty()) {
                        data.append('\n');
                    }
                    data.append(line.substring(5).stripLeading());
                }
            }
        }
        flushEvent(data);
    }

    private void flushEvent(StringBuilder data) {
        if (!data.isEmpty()) {
            listener.onMessage(data.toString());
            data.setLength(0);
        }
    }

    String getSessionId() {
        return sessionId;
    }

    @Override
    public void close() {
        closed = true;
        Listener current = listener;
        if (current != null) {
            current.onClosed(new IOException("HTTP transport closed"));
        }
        log.debug("[MCP:{}] HTTP transport closed", serverName);
    }
}
