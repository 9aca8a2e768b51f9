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

import java.util.List;

/**
 * Port for discovering project tools through an external command.
 */
public interface ToolDiscoveryPort {

    /**
     * Runs discovery and returns the declared tools; empty when no discovery
     * command is configured.
     *
     * @throws me.golemcore.agent.domain.exception.ToolDiscoveryException
     *             when the command fails or its output is not a tool list
     */
    List<ToolComponent> discoverTools();
}
