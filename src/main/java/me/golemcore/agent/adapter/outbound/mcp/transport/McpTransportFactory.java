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

import lombok.RequiredArgsConstructor;
import me.golemcore.agent.domain.model.McpAuthConfig;
import me.golemcore.agent.domain.model.McpServerConfig;
import me.golemcore.agent.domain.model.McpTransportType;
import okhttp3.Headers;
import okhttp3.OkHttpClient;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;

/**
 * Creates the transport selected by a server's configuration. HTTP transports
 * derive their client from the shared OkHttp bean.
 */
@Component
@RequiredArgsConstructor
public class McpTransportFactory {

    private static final Duration WEBSOCKET_PING_INTERVAL = Duration.ofSeconds(30);

    private final OkHttpClient okHttpClient;

    public McpTransport create(String serverName, McpServerConfig config, Duration requestTimeout) {
        McpTransportType type = config.getTransportType();
        if (type == null) {
            throw new IllegalArgumentException(
                    "MCP server '" + serverName + "' has no command, url, httpUrl or tcp configured");
        }
        return switch (type) {
        case STREAMABLE_HTTP -> new StreamableHttpMcpTransport(serverName, config.getHttpUrl(), buildHeaders(config),
                okHttpClient.newBuilder().readTimeout(requestTimeout).build());
        case SSE -> new SseMcpTransport(serverName, config.getUrl(), buildHeaders(config),
                okHttpClient.newBuilder().readTimeout(Duration.ZERO).build());
        case STDIO -> new StdioMcpTransport(serverName, config.getCommand(), config.getArgs(), config.getEnv(),
                config.getCwd());
        case WEBSOCKET -> new WebSocketMcpTransport(serverName, config.getTcp(), buildHeaders(config),
                okHttpClient.newBuilder().pingInterval(WEBSOCKET_PING_INTERVAL).build());
        };
    }

    static Headers buildHeaders(McpServerConfig config) {
        Headers.Builder builder = new Headers.Builder();
        if (config.getHeaders() != null) {
            for (Map.Entry<String, String> header : config.getHeaders().entrySet()) {
                builder.set(header.getKey(), header.getValue());
            }
        }
        McpAuthConfig auth = config.getAuth();
        if (auth != null && auth.isConfigured()) {
            builder.set(auth.getHeaderName(), auth.headerValue());
        }
        return builder.build();
    }
}
