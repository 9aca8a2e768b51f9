package me.golemcore.agent.port.outbound;

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

import me.golemcore.agent.domain.component.ToolComponent;
import me.golemcore.agent.domain.model.ToolAllowlist;

import java.util.List;

/**
 * Port for managing MCP (Model Context Protocol) server clients. Abstracts the
 * connection lifecycle of remote tool servers from the domain layer.
 */
public interface McpPort {

    /**
     * Connects to every configured server and returns the tools they advertise,
     * wrapped as components. A server that fails to connect contributes no
     * tools. Clients from a previous call are closed first.
     */
    List<ToolComponent> discoverTools(ToolAllowlist allowlist);

    /**
     * Closes all open clients.
     */
    void shutdown();
}
