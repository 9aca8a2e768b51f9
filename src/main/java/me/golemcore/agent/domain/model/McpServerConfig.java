package me.golemcore.agent.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Connection settings of one MCP server. Exactly one transport is used; when
 * several are configured the priority is {@code httpUrl}, {@code url},
 * {@code command}, {@code tcp}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class McpServerConfig {

    // stdio
    private String command;
    @Builder.Default
    private List<String> args = new ArrayList<>();
    @Builder.Default
    private Map<String, String> env = new LinkedHashMap<>();
    private String cwd;

    // SSE
    private String url;

    // streamable HTTP
    private String httpUrl;
    @Builder.Default
    private Map<String, String> headers = new LinkedHashMap<>();

    // websocket
    private String tcp;

    /** Request timeout in milliseconds; null uses the runtime default. */
    private Long timeout;

    /** Skip confirmation for every tool of this server. */
    private boolean trust;

    private String description;

    @Builder.Default
    private List<String> includeTools = new ArrayList<>();
    @Builder.Default
    private List<String> excludeTools = new ArrayList<>();

    private McpAuthConfig auth;

    /**
     * Returns the transport selected by the configured endpoints, or null when
     * none is set.
     */
    public McpTransportType getTransportType() {
        if (hasText(httpUrl)) {
            return McpTransportType.STREAMABLE_HTTP;
        }
        if (hasText(url)) {
            return McpTransportType.SSE;
        }
        if (hasText(command)) {
            return McpTransportType.STDIO;
        }
        if (hasText(tcp)) {
            return McpTransportType.WEBSOCKET;
        }
        return null;
    }

    /**
     * Applies include/exclude filters to a server-side tool name. Exclusion
     * wins over inclusion; an empty include list admits everything.
     */
    public boolean isToolEnabled(String toolName) {
        if (excludeTools != null && excludeTools.contains(toolName)) {
            return false;
        }
        return includeTools == null || includeTools.isEmpty() || includeTools.contains(toolName);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
