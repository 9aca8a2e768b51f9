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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.component.ToolComponent;
import me.golemcore.agent.domain.model.CancellationToken;
import me.golemcore.agent.domain.model.ConfirmationRequest;
import me.golemcore.agent.domain.model.ConfirmationType;
import me.golemcore.agent.domain.model.ToolAllowlist;
import me.golemcore.agent.domain.model.ToolConfirmationOutcome;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolFailureKind;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.domain.model.ToolSource;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;

/**
 * Wraps a single MCP tool as a ToolComponent.
 *
 * <p>
 * Created by {@link McpClientManager} for every advertised tool; NOT a Spring
 * bean. Holds the client of its server and the shared
 * {@link ToolAllowlist}. Confirmation is skipped for trusted servers and for
 * servers or tools the user allowed earlier in the process.
 */
@Slf4j
public class McpToolAdapter implements ToolComponent {

    private final McpClient client;
    private final String serverName;
    private final String serverToolName;
    private final ToolDefinition definition;
    private final boolean trust;
    private final Duration timeout;
    private final ToolAllowlist allowlist;

    public McpToolAdapter(McpClient client, String serverName, String serverToolName, ToolDefinition definition,
            boolean trust, Duration timeout, ToolAllowlist allowlist) {
        this.client = client;
        this.serverName = serverName;
        this.serverToolName = serverToolName;
        this.definition = definition;
        this.trust = trust;
        this.timeout = timeout;
        this.allowlist = allowlist;
    }

    @Override
    public ToolDefinition getDefinition() {
        return definition;
    }

    @Override
    public ToolSource getSource() {
        return ToolSource.MCP;
    }

    @Override
    public String getServerName() {
        return serverName;
    }

    @Override
    public String getDisplayName() {
        return serverToolName + " (" + serverName + " MCP Server)";
    }

    public String getServerToolName() {
        return serverToolName;
    }

    @Override
    public CompletableFuture<Optional<ConfirmationRequest>> shouldConfirmExecute(Map<String, Object> parameters) {
        if (trust || allowlist.allowsServer(serverName) || allowlist.allowsTool(serverName, serverToolName)) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        ConfirmationRequest request = ConfirmationRequest.builder()
                .type(ConfirmationType.MCP)
                .title("Confirm MCP Tool Execution")
                .target(ToolAllowlist.toolKey(serverName, serverToolName))
                .serverName(serverName)
                .toolName(serverToolName)
                .toolDisplayName(getToolName())
                .onConfirm(this::onConfirm)
                .build();
        return CompletableFuture.completedFuture(Optional.of(request));
    }

    private void onConfirm(ToolConfirmationOutcome outcome) {
        if (outcome == ToolConfirmationOutcome.PROCEED_ALWAYS_SERVER) {
            allowlist.add(serverName);
            log.info("[MCP:{}] Server allowed for this session", serverName);
        } else if (outcome == ToolConfirmationOutcome.PROCEED_ALWAYS_TOOL) {
            allowlist.add(ToolAllowlist.toolKey(serverName, serverToolName));
            log.info("[MCP:{}] Tool '{}' allowed for this session", serverName, serverToolName);
        }
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters, CancellationToken cancellationToken) {
        if (cancellationToken.isCancelled()) {
            return CompletableFuture.completedFuture(
                    ToolResult.failure(ToolFailureKind.CANCELLED, "Cancelled before execution"));
        }
        if (!client.isConnected()) {
            return CompletableFuture.completedFuture(
                    ToolResult.failure("MCP server not connected: " + serverName));
        }

        CompletableFuture<ToolResult> result = client.callTool(serverToolName, parameters, timeout)
                .handle((toolResult, error) -> {
                    if (error == null) {
                        return toolResult;
                    }
                    Throwable cause = error instanceof CompletionException && error.getCause() != null
                            ? error.getCause()
                            : error;
                    if (cause instanceof TimeoutException) {
                        throw new CompletionException(new TimeoutException("MCP tool '" + serverToolName
                                + "' on server '" + serverName + "' timed out after " + timeout.toMillis() + " ms"));
                    }
                    throw new CompletionException(cause);
                });
        Runnable unregister = cancellationToken.onCancel(() -> result.complete(
                ToolResult.failure(ToolFailureKind.CANCELLED, "MCP tool call cancelled")));
        result.whenComplete((ignored, error) -> unregister.run());
        return result;
    }
}
