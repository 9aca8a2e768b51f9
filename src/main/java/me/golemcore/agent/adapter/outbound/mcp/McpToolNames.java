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

import java.util.regex.Pattern;

/**
 * Registry names for MCP tools. Model APIs accept {@code [a-zA-Z0-9_.-]} names
 * of at most 63 characters.
 */
final class McpToolNames {

    static final int MAX_LENGTH = 63;
    private static final Pattern INVALID_CHARS = Pattern.compile("[^a-zA-Z0-9_.-]");

    private McpToolNames() {
    }

    /**
     * Bare tool name with a single server, {@code server.tool} when several
     * servers are configured; sanitized in both cases.
     */
    static String registryName(String serverName, String toolName, boolean namespaced) {
        return sanitize(namespaced ? serverName + "." + toolName : toolName);
    }

    static String sanitize(String name) {
        String valid = INVALID_CHARS.matcher(name).replaceAll("_");
        if (valid.length() > MAX_LENGTH) {
            valid = valid.substring(0, 28) + "___" + valid.substring(valid.length() - 32);
        }
        return valid;
    }
}
