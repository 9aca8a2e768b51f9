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

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.adapter.outbound.mcp.transport.McpTransport;
import me.golemcore.agent.adapter.outbound.mcp.transport.McpTransportFactory;
import me.golemcore.agent.domain.component.ToolComponent;
import me.golemcore.agent.domain.model.McpServerConfig;
import me.golemcore.agent.domain.model.ToolAllowlist;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.McpPort;
import me.golemcore.agent.security.ShellCommandParser;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Manages MCP client lifecycles: one {@link McpClient} per configured server.
 *
 * <p>
 * Discovery connects to all servers concurrently. A server that fails to
 * connect or list its tools is logged and contributes no tools; a server whose
 * tools are all filtered out is disconnected. With one configured server tools
 * keep their bare names, with several every tool is registered as
 * {@code server.tool}.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code agent.mcp.enabled} - Enable/disable MCP feature
 * <li>{@code agent.mcp.servers.<name>.*} - Server definitions
 * <li>{@code agent.mcp.server-command} - Extra stdio server named {@code mcp}
 * <li>{@code agent.mcp.default-timeout} - Request timeout when a server sets
 * none
 * <li>{@code agent.mcp.startup-timeout} - Bound on connect and tool listing
 * </ul>
 *
 * @see McpClient
 * @see McpToolAdapter
 */
@Component
@Slf4j
public class McpClientManager implements McpPort {

    static final String COMMAND_SERVER_NAME = "mcp";

    private final AgentProperties properties;
    private final McpTransportFactory transportFactory;
    private final ObjectMapper objectMapper;

    private final Map<String, McpClient> clients = new ConcurrentHashMap<>();
    private final ExecutorService connectExecutor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "mcp-connect");
        t.setDaemon(true);
        return t;
    });

    public McpClientManager(AgentProperties properties, McpTransportFactory transportFactory,
            ObjectMapper objectMapper) {
        this.properties = properties;
        this.transportFactory = transportFactory;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<ToolComponent> discoverTools(ToolAllowlist allowlist) {
        Map<String, McpServerConfig> servers = resolveServers();
        closeAll();
        if (servers.isEmpty()) {
            return List.of();
        }

        Map<String, CompletableFuture<McpClient>> connections = new LinkedHashMap<>();
        for (Map.Entry<String, McpServerConfig> entry : servers.entrySet()) {
            connections.put(entry.getKey(), CompletableFuture.supplyAsync(
                    () -> connect(entry.getKey(), entry.getValue()), connectExecutor));
        }

        boolean namespaced = servers.size() > 1;
        List<ToolComponent> tools = new ArrayList<>();
        for (Map.Entry<String, CompletableFuture<McpClient>> entry : connections.entrySet()) {
            String serverName = entry.getKey();
            Optional<McpClient> client = await(serverName, entry.getValue());
            if (client.isEmpty()) {
                continue;
            }
            List<ToolComponent> serverTools = createAdapters(serverName, servers.get(serverName), client.get(),
                    namespaced, allowlist);
            if (serverTools.isEmpty()) {
                log.info("[MCP:{}] No tools enabled, disconnecting", serverName);
                client.get().close();
                continue;
            }
            clients.put(serverName, client.get());
            tools.addAll(serverTools);
            log.info("[MCP:{}] Registered {} tools", serverName, serverTools.size());
        }
        return tools;
    }

    private McpClient connect(String serverName, McpServerConfig config) {
        Duration requestTimeout = requestTimeout(config);
        McpTransport transport = transportFactory.create(serverName, config, requestTimeout);
        McpClient client = new McpClient(serverName, transport, objectMapper, requestTimeout);
        try {
            client.connect(properties.getMcp().getStartupTimeout());
            return client;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CompletionException(e);
        } catch (Exception e) {
            throw new CompletionException(e);
        }
    }

    private Optional<McpClient> await(String serverName, CompletableFuture<McpClient> connection) {
        try {
            return Optional.of(connection.join());
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("[MCP:{}] Discovery failed: {}", serverName, cause.getMessage());
            return Optional.empty();
        }
    }

    private List<ToolComponent> createAdapters(String serverName, McpServerConfig config, McpClient client,
            boolean namespaced, ToolAllowlist allowlist) {
        List<ToolComponent> adapters = new ArrayList<>();
        for (ToolDefinition serverTool : client.getCachedTools()) {
            if (!config.isToolEnabled(serverTool.getName())) {
                log.debug("[MCP:{}] Tool '{}' filtered out", serverName, serverTool.getName());
                continue;
            }
            ToolDefinition definition = ToolDefinition.builder()
                    .name(McpToolNames.registryName(serverName, serverTool.getName(), namespaced))
                    .description(serverTool.getDescription())
                    .inputSchema(serverTool.getInputSchema())
                    .build();
            adapters.add(new McpToolAdapter(client, serverName, serverTool.getName(), definition,
                    config.isTrust(), requestTimeout(config), allowlist));
        }
        return adapters;
    }

    /**
     * Configured servers plus the {@code mcp} server described by
     * {@code agent.mcp.server-command}.
     */
    Map<String, McpServerConfig> resolveServers() {
        AgentProperties.McpProperties mcp = properties.getMcp();
        Map<String, McpServerConfig> servers = new LinkedHashMap<>();
        if (mcp.getServers() != null) {
            servers.putAll(mcp.getServers());
        }
        String serverCommand = mcp.getServerCommand();
        if (serverCommand != null && !serverCommand.isBlank()) {
            List<String> argv = ShellCommandParser.splitArguments(serverCommand);
            if (!argv.isEmpty()) {
                servers.put(COMMAND_SERVER_NAME, McpServerConfig.builder()
                        .command(argv.get(0))
                        .args(new ArrayList<>(argv.subList(1, argv.size())))
                        .build());
            }
        }
        return servers;
    }

    private Duration requestTimeout(McpServerConfig config) {
        Long timeout = config.getTimeout();
        return timeout != null && timeout > 0 ? Duration.ofMillis(timeout) : properties.getMcp().getDefaultTimeout();
    }

    public Optional<McpClient> getClient(String serverName) {
        return Optional.ofNullable(clients.get(serverName));
    }

    private void closeAll() {
        for (Map.Entry<String, McpClient> entry : clients.entrySet()) {
            try {
                entry.getValue().close();
            } catch (RuntimeException e) {
                log.warn("[MCP:{}] Error closing client: {}", entry.getKey(), e.getMessage());
            }
        }
        clients.clear();
    }

    @Override
    @PreDestroy
    public void shutdown() {
        log.info("[MCP] Shutting down all MCP clients");
        closeAll();
        connectExecutor.shutdownNow();
        try {
            connectExecutor.awaitTermination(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
