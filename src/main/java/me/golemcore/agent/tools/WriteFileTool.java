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
import me.golemcore.agent.domain.model.ConfirmationRequest;
import me.golemcore.agent.domain.model.ConfirmationType;
import me.golemcore.agent.domain.model.ToolConfirmationOutcome;
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
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Writes a text file in the workspace. Edits are confirmed with a preview of
 * the new content unless auto-approval is configured or the user chose
 * {@link ToolConfirmationOutcome#PROCEED_ALWAYS}.
 */
@Component
@Slf4j
public class WriteFileTool implements ToolComponent {

    public static final String TOOL_NAME = "write_file";

    private static final int PREVIEW_CHARS = 2000;

    private final Path workspaceRoot;
    private final AtomicBoolean approveAll;

    public WriteFileTool(AgentProperties properties) {
        this.workspaceRoot = properties.getTools().resolveWorkspace();
        this.approveAll = new AtomicBoolean(properties.getTools().isAutoApproveEdits());
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(TOOL_NAME)
                .description("Write text content to a file in the workspace, creating parent directories.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "file_path", Map.of(
                                        "type", "string",
                                        "description", "File path relative to the workspace"),
                                "content", Map.of(
                                        "type", "string",
                                        "description", "Full content to write")),
                        "required", List.of("file_path", "content")))
                .build();
    }

    @Override
    public CompletableFuture<Optional<ConfirmationRequest>> shouldConfirmExecute(Map<String, Object> parameters) {
        if (approveAll.get()) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        String filePath = String.valueOf(parameters.get("file_path"));
        String content = parameters.get("content") != null ? parameters.get("content").toString() : "";
        String preview = content.length() > PREVIEW_CHARS
                ? content.substring(0, PREVIEW_CHARS) + "\n[...]"
                : content;

        ConfirmationRequest request = ConfirmationRequest.builder()
                .type(ConfirmationType.EDIT)
                .title("Confirm Write: " + filePath)
                .target(filePath)
                .fileName(filePath)
                .filePreview(preview)
                .onConfirm(outcome -> {
                    if (outcome == ToolConfirmationOutcome.PROCEED_ALWAYS) {
                        approveAll.set(true);
                    }
                })
                .build();
        return CompletableFuture.completedFuture(Optional.of(request));
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters,
            CancellationToken cancellationToken) {
        return CompletableFuture.supplyAsync(() -> {
            Object pathParam = parameters.get("file_path");
            Object content = parameters.get("content");
            if (pathParam == null || content == null) {
                return ToolResult.failure("Missing required parameters: file_path and content");
            }
            Path path = WorkspacePaths.resolveSafePath(workspaceRoot, pathParam.toString());
            if (path == null) {
                return ToolResult.failure("Invalid path: must be within workspace");
            }
            if (Files.isDirectory(path)) {
                return ToolResult.failure("Path is a directory: " + pathParam);
            }

            try {
                Path parent = path.getParent();
                if (parent != null && !Files.exists(parent)) {
                    Files.createDirectories(parent);
                }
                boolean existed = Files.exists(path);
                Files.writeString(path, content.toString(), StandardCharsets.UTF_8);
                String relative = WorkspacePaths.relativePath(workspaceRoot, path);
                log.info("[WriteFile] {} {}", existed ? "Overwrote" : "Created", relative);
                return ToolResult.success((existed ? "Successfully overwrote file: " : "Successfully created file: ")
                        + relative);
            } catch (IOException e) {
                log.warn("[WriteFile] Failed to write {}: {}", path, e.getMessage());
                return ToolResult.failure("Failed to write file: " + e.getMessage());
            }
        });
    }
}
