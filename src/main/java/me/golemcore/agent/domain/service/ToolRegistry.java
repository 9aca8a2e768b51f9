package me.golemcore.agent.domain.service;

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
import me.golemcore.agent.domain.component.ToolComponent;
import me.golemcore.agent.domain.model.ToolAllowlist;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolSource;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.McpPort;
import me.golemcore.agent.port.outbound.ToolDiscoveryPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Owns the name to tool mapping. Built-in tools are registered at construction
 * time; subprocess and MCP tools are added by discovery.
 *
 * <p>
 * Registration is last-write-wins. The registry also owns the process-lifetime
 * {@link ToolAllowlist} handed to every MCP tool.
 */
@Component
@Slf4j
public class ToolRegistry {

    private final Map<String, ToolComponent> tools = new ConcurrentHashMap<>();
    private final ToolAllowlist allowlist = new ToolAllowlist();
    private final ToolDiscoveryPort toolDiscoveryPort;
    private final McpPort mcpPort;
    private final AgentProperties properties;

    public ToolRegistry(List<ToolComponent> builtinTools,
            ToolDiscoveryPort toolDiscoveryPort,
            McpPort mcpPort,
            AgentProperties properties) {
        this.toolDiscoveryPort = toolDiscoveryPort;
        this.mcpPort = mcpPort;
        this.properties = properties;
        AgentProperties.ToolsProperties config = properties.getTools();
        for (ToolComponent tool : builtinTools) {
            if (!tool.isEnabled()) {
                log.debug("[Registry] Skipping disabled tool: {}", tool.getToolName());
            } else if (!isCoreToolEnabled(tool.getToolName(), tool.getClass().getSimpleName(),
                    config.getCoreTools(), config.getExcludeTools())) {
                log.info("[Registry] Built-in tool '{}' not enabled by core-tools/exclude-tools",
                        tool.getToolName());
            } else {
                registerTool(tool);
            }
        }
    }

    /**
     * Applies the allow and block lists to a built-in tool. Allow entries match
     * the tool name or class name, bare or with an argument suffix such as
     * {@code ShellTool(git)}; block entries match either name exactly.
     *
     * @param coreTools
     *            allow list; null admits every tool
     */
    static boolean isCoreToolEnabled(String toolName, String className, List<String> coreTools,
            List<String> excludeTools) {
        boolean enabled = coreTools == null || coreTools.stream().anyMatch(entry -> entry.equals(toolName)
                || entry.equals(className)
                || entry.startsWith(toolName + "(")
                || entry.startsWith(className + "("));
        if (excludeTools != null && (excludeTools.contains(toolName) || excludeTools.contains(className))) {
            enabled = false;
        }
        return enabled;
    }

    /**
     * Registers a tool under its name, replacing any previous tool with the same
     * name.
     */
    public void registerTool(ToolComponent tool) {
        String name = tool.getToolName();
        ToolComponent previous = tools.put(name, tool);
        if (previous != null && previous != tool) {
            log.warn("[Registry] Tool '{}' ({}) replaced by a {} tool with the same name",
                    name, previous.getSource(), tool.getSource());
        }
    }

    public ToolComponent getTool(String name) {
        if (name == null) {
            return null;
        }
        return tools.get(name);
    }

    public List<ToolComponent> getAllTools() {
        return new ArrayList<>(tools.values());
    }

    public List<String> getToolNames() {
        return tools.keySet().stream().sorted().collect(Collectors.toList());
    }

    /**
     * Returns the schemas of all registered tools, for the model request.
     */
    public List<ToolDefinition> getFunctionDeclarations() {
        return tools.values().stream()
                .map(ToolComponent::getDefinition)
                .collect(Collectors.toList());
    }

    public List<ToolComponent> getToolsByServer(String serverName) {
        return tools.values().stream()
                .filter(tool -> Objects.equals(serverName, tool.getServerName()))
                .sorted((a, b) -> a.getToolName().compareTo(b.getToolName()))
                .collect(Collectors.toList());
    }

    /**
     * Removes every tool of the given source.
     *
     * @return names of the removed tools
     */
    public List<String> unregisterTools(ToolSource source) {
        List<String> removed = new ArrayList<>();
        tools.entrySet().removeIf(entry -> {
            if (entry.getValue().getSource() == source) {
                removed.add(entry.getKey());
                return true;
            }
            return false;
        });
        if (!removed.isEmpty()) {
            log.debug("[Registry] Unregistered {} {} tools: {}", removed.size(), source, removed);
        }
        return removed;
    }

    public ToolAllowlist getAllowlist() {
        return allowlist;
    }

    /**
     * Refreshes subprocess and MCP tools. Built-in tools are left untouched.
     */
    public void discoverTools() {
        discoverSubprocessTools();
        discoverRemoteTools();
        log.info("[Registry] {} tools registered: {}", tools.size(), getToolNames());
    }

    /**
     * Replaces the subprocess-discovered tools with the output of the discovery
     * command. Blocks the calling thread until the command exits; a failure is
     * logged and leaves no subprocess tools registered.
     */
    public void discoverSubprocessTools() {
        unregisterTools(ToolSource.SUBPROCESS);
        try {
            List<ToolComponent> discovered = toolDiscoveryPort.discoverTools();
            discovered.forEach(this::registerTool);
            if (!discovered.isEmpty()) {
                log.info("[Registry] Discovered {} subprocess tools", discovered.size());
            }
        } catch (RuntimeException e) {
            log.error("[Registry] Subprocess tool discovery failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Replaces MCP tools with the tools advertised by the configured servers.
     */
    public void discoverRemoteTools() {
        unregisterTools(ToolSource.MCP);
        if (!properties.getMcp().isEnabled()) {
            log.debug("[Registry] MCP disabled, skipping remote discovery");
            return;
        }
        try {
            List<ToolComponent> discovered = mcpPort.discoverTools(allowlist);
            discovered.forEach(this::registerTool);
        } catch (RuntimeException e) {
            log.error("[Registry] MCP tool discovery failed: {}", e.getMessage(), e);
        }
    }
}
