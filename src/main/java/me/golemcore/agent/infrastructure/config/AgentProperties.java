package me.golemcore.agent.infrastructure.config;

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

import lombok.Data;
import me.golemcore.agent.domain.model.McpServerConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the agent runtime, bound from
 * application.yml.
 *
 * <p>
 * All configuration is organized under the {@code agent.*} prefix:
 * <ul>
 * <li>{@link ToolsProperties} - allow/block lists, discovery and built-in
 * tools</li>
 * <li>{@link McpProperties} - remote tool servers</li>
 * <li>{@link TurnProperties} - turn loop limit</li>
 * <li>{@link HttpProperties} - shared OkHttp client</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "agent")
@Data
public class AgentProperties {

    private ToolsProperties tools = new ToolsProperties();
    private McpProperties mcp = new McpProperties();
    private TurnProperties turn = new TurnProperties();
    private HttpProperties http = new HttpProperties();

    // ==================== TOOLS ====================

    @Data
    public static class ToolsProperties {
        /**
         * Allow list. Null when unset, which admits every shell command; an empty
         * list admits none.
         */
        private List<String> coreTools;

        /** Block list; entries win over allow entries. */
        private List<String> excludeTools = new ArrayList<>();

        /** Command printing the JSON tool declarations of the project. */
        private String discoveryCommand;

        /** Command invoked as {@code <call-command> <toolName>} for discovered tools. */
        private String callCommand;

        /** Bound on the discovery command. */
        private Duration discoveryTimeout = Duration.ofSeconds(60);

        /** Bound on one call of a discovered tool. */
        private Duration callTimeout = Duration.ofMinutes(5);

        /** Per-call execution timeout; null disables it. */
        private Duration executionTimeout;

        /** Skip confirmation for file edits. */
        private boolean autoApproveEdits = false;

        private String workspace = "${user.home}/.golemcore/workspace";

        private ShellToolProperties shell = new ShellToolProperties();
        private WebFetchToolProperties webFetch = new WebFetchToolProperties();

        /**
         * Returns the workspace as an absolute normalized path, expanding
         * {@code ${user.home}}.
         */
        public Path resolveWorkspace() {
            return Paths.get(workspace.replace("${user.home}", System.getProperty("user.home")))
                    .toAbsolutePath()
                    .normalize();
        }
    }

    @Data
    public static class ShellToolProperties {
        /** Seconds. */
        private int defaultTimeout = 30;
        private int maxOutputChars = 100000;
        /** Comma-separated environment variables passed through to commands. */
        private String allowedEnvVars = "";
    }

    @Data
    public static class WebFetchToolProperties {
        private int maxContentChars = 100000;
    }

    // ==================== MCP ====================

    @Data
    public static class McpProperties {
        private boolean enabled = true;

        /** Single stdio server given as one command line, registered as {@code mcp}. */
        private String serverCommand;

        /** Default request timeout when a server does not set its own. */
        private Duration defaultTimeout = Duration.ofMinutes(10);

        /** Time allowed for connecting and listing tools. */
        private Duration startupTimeout = Duration.ofSeconds(30);

        private Map<String, McpServerConfig> servers = new LinkedHashMap<>();
    }

    // ==================== TURN ====================

    @Data
    public static class TurnProperties {
        /** Max number of chained model turns per user message. */
        private int maxTurns = 100;
    }

    // ==================== HTTP ====================

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
