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

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-lifetime set of trusted MCP server names and {@code server.tool}
 * keys. Owned by the tool registry and passed by reference to every MCP tool;
 * only confirmation continuations add to it.
 */
public class ToolAllowlist {

    private final Set<String> keys = ConcurrentHashMap.newKeySet();

    public static String toolKey(String serverName, String toolName) {
        return serverName + "." + toolName;
    }

    public boolean contains(String key) {
        return keys.contains(key);
    }

    public void add(String key) {
        keys.add(key);
    }

    public boolean allowsServer(String serverName) {
        return keys.contains(serverName);
    }

    public boolean allowsTool(String serverName, String toolName) {
        return keys.contains(toolKey(serverName, toolName));
    }

    public Set<String> snapshot() {
        return Set.copyOf(keys);
    }
}
