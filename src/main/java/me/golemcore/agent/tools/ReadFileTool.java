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

package me.golemcore.agent.tools;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.component.ToolComponent;
import me.golemcore.agent.domain.model.CancellationToken;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Reads a text file from the workspace, optionally a window of lines.
 */
@Component
@Slf4j
public class ReadFileTool implements ToolComponent {

    public static final String TOOL_NAME = "read_file";

    private static final long MAX_FILE_SIZE = 10 * 1024 * 1024; // 10 MB
    private static final int DEFAULT_LINE_LIMIT = 2000;

    private final Path workspaceRoot;

    public ReadFileTool(AgentProperties properties) {
        this.workspaceRoot = properties.getTools().resolveWorkspace();
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(TOOL_NAME)
                .description("""
                        Read a text file from the workspace. Use offset and limit to page \
                        through large files; lines are counted from 0.
                        """)
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "path", Map.of(
                                        "type", "string",
                                        "description", "File path relative to the workspace"),
                                "offset", Map.of(
                                        "type", "integer",
                                        "description", "First line to read (default 0)"),
                                "limit", Map.of(
                                        "type", "integer",
                                        "description", "Max number of lines (default " + DEFAULT_LINE_LIMIT + ")")),
                        "required", List.of("path")))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters,
            CancellationToken cancellationToken) {
        return CompletableFuture.supplyAsync(() -> {
            Object pathParam = parameters.get("path");
            Path path = WorkspacePaths.resolveSafePath(workspaceRoot, pathParam != null ? pathParam.toString() : null);
            if (path == null) {
                return ToolResult.failure("Invalid path: must be within workspace");
            }
            if (!Files.isRegularFile(path)) {
                return ToolResult.failure("File not found: " + pathParam);
            }

            int offset = intParam(parameters.get("offset"), 0);
            int limit = intParam(parameters.get("limit"), DEFAULT_LINE_LIMIT);
            if (offset < 0 || limit <= 0) {
                return ToolResult.failure("offset must be >= 0 and limit must be > 0");
            }

            try {
                if (Files.size(path) > MAX_FILE_SIZE) {
                    return ToolResult.failure("File too large (max " + (MAX_FILE_SIZE / 1024 / 1024) + " MB)");
                }
                List<String> lines = Files.readAllLines(path, StandardCharsets.UTF_8);
                int from = Math.min(offset, lines.size());
                int to = Math.min(lines.size(), from + limit);
                String content = String.join("\n", lines.subList(from, to));
                String relative = WorkspacePaths.relativePath(workspaceRoot, path);

                if (from == 0 && to == lines.size()) {
                    return ToolResult.success(content, "Read " + relative);
                }
                String header = "[Showing lines " + (from + 1) + "-" + to + " of " + lines.size() + "]\n";
                return ToolResult.success(header + content,
                        "Read lines " + (from + 1) + "-" + to + " of " + relative);
            } catch (IOException e) {
                log.warn("[ReadFile] Failed to read {}: {}", path, e.getMessage());
                return ToolResult.failure("Failed to read file: " + e.getMessage());
            }
        });
    }

    private static int intParam(Object value, int fallback) {
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Integer.parseInt(text.trim());
            } catch (NumberFormatException e) {
                return -1;
            }
        }
        return fallback;
    }
}
