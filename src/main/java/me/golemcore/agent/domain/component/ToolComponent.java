package me.golemcore.agent.domain.component;

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

import me.golemcore.agent.domain.model.CancellationToken;
import me.golemcore.agent.domain.model.ConfirmationRequest;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.domain.model.ToolSource;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Component representing an executable tool that can be invoked by the model.
 * Tools expose their JSON Schema definition via function calling, may ask for
 * human approval before running, and implement the execution logic. The set of
 * variants is closed and tagged by {@link ToolSource}: built-in Spring beans,
 * subprocess-discovered tools and MCP server tools.
 */
public interface ToolComponent extends Component {

    @Override
    default String getComponentType() {
        return "tool";
    }

    /**
     * Returns the tool definition with JSON Schema for function calling. The
     * definition includes the tool name, description, and parameter schema.
     *
     * @return the tool definition
     */
    ToolDefinition getDefinition();

    /**
     * Returns where this tool came from. Discovery refreshes use it to replace
     * only the tools of one source.
     */
    default ToolSource getSource() {
        return ToolSource.BUILTIN;
    }

    /**
     * Returns the MCP server this tool belongs to, or null for tools that do not
     * come from a remote server.
     */
    default String getServerName() {
        return null;
    }

    /**
     * Decides whether a human must approve this call before it runs.
     *
     * @param parameters
     *            the call arguments
     * @return a future with the confirmation request, or empty when the call is
     *         pre-approved
     */
    default CompletableFuture<Optional<ConfirmationRequest>> shouldConfirmExecute(Map<String, Object> parameters) {
        return CompletableFuture.completedFuture(Optional.empty());
    }

    /**
     * Executes the tool with the specified parameters. Expected failures are
     * reported through {@link ToolResult#getError()}; unexpected ones complete
     * the future exceptionally.
     *
     * @param parameters
     *            the execution parameters as a map
     * @param cancellationToken
     *            token the tool should observe during its own I/O
     * @return a future containing the tool execution result
     */
    CompletableFuture<ToolResult> execute(Map<String, Object> parameters, CancellationToken cancellationToken);

    /**
     * Returns the unique name of this tool.
     *
     * @return the tool name
     */
    default String getToolName() {
        return getDefinition().getName();
    }

    /**
     * Returns the human-facing name of this tool.
     */
    default String getDisplayName() {
        return getToolName();
    }

    default String getDescription() {
        return getDefinition().getDescription();
    }
}
