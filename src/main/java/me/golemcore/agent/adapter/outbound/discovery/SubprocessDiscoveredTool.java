package me.golemcore.agent.adapter.outbound.discovery;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.component.ToolComponent;
import me.golemcore.agent.domain.model.CancellationToken;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolFailureKind;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.domain.model.ToolSource;
import me.golemcore.agent.infrastructure.process.ProcessOutput;
import me.golemcore.agent.infrastructure.process.ProcessRunner;
import me.golemcore.agent.security.ShellCommandParser;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Tool declared by the project's discovery command. A call spawns
 * {@code <call-command> <toolName>}, writes the JSON arguments to its stdin and
 * returns stdout. Any failure, non-zero exit or stderr output is reported as a
 * domain error carrying both streams; this tool never completes exceptionally.
 */
@Slf4j
public class SubprocessDiscoveredTool implements ToolComponent {

    private static final String EMPTY = "(empty)";
    private static final String NONE = "(none)";

    private final ToolDefinition definition;
    private final String callCommand;
    private final Path workingDirectory;
    private final Duration timeout;
    private final int maxOutputChars;
    private final ProcessRunner processRunner;
    private final ObjectMapper objectMapper;

    public SubprocessDiscoveredTool(ToolDefinition definition, String callCommand, Path workingDirectory,
            Duration timeout, int maxOutputChars, ProcessRunner processRunner, ObjectMapper objectMapper) {
        this.definition = definition;
        this.callCommand = callCommand;
        this.workingDirectory = workingDirectory;
        this.timeout = timeout;
        this.maxOutputChars = maxOutputChars;
        this.processRunner = processRunner;
        this.objectMapper = objectMapper;
    }

    @Override
    public ToolDefinition getDefinition() {
        return definition;
    }

    @Override
    public ToolSource getSource() {
        return ToolSource.SUBPROCESS;
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters,
            CancellationToken cancellationToken) {
        if (callCommand == null || callCommand.isBlank()) {
            return CompletableFuture.completedFuture(ToolResult.failure("No tool call command configured"));
        }
        String input;
        try {
            input = objectMapper.writeValueAsString(parameters != null ? parameters : Map.of());
        } catch (JsonProcessingException e) {
            return CompletableFuture.completedFuture(
                    ToolResult.failure("Failed to serialize arguments: " + e.getOriginalMessage()));
        }

        List<String> argv = new ArrayList<>(ShellCommandParser.splitArguments(callCommand));
        argv.add(definition.getName());
        ProcessBuilder builder = new ProcessBuilder(argv);
        if (workingDirectory != null && Files.isDirectory(workingDirectory)) {
            builder.directory(workingDirectory.toFile());
        }

        log.debug("[Discovery] Calling {} via {}", definition.getName(), callCommand);
        return processRunner.runAsync(builder, input, timeout, cancellationToken, maxOutputChars)
                .thenApply(this::toResult);
    }

    ToolResult toResult(ProcessOutput output) {
        if (output.isCleanExit() && output.stderr().isEmpty()) {
            return ToolResult.success(output.stdout());
        }
        String error = describeError(output);
        String content = String.join("\n",
                "Stdout: " + orDefault(output.stdout(), EMPTY),
                "Stderr: " + orDefault(output.stderr(), EMPTY),
                "Error: " + orDefault(error, NONE),
                "Exit Code: " + (output.exitCode() != null ? output.exitCode() : NONE));
        return ToolResult.builder()
                .llmContent(content)
                .returnDisplay(content)
                .error(error != null ? error : "Tool call produced error output")
                .failureKind(output.cancelled() ? ToolFailureKind.CANCELLED : ToolFailureKind.EXECUTION_FAILED)
                .build();
    }

    private String describeError(ProcessOutput output) {
        if (output.error() != null) {
            return output.error();
        }
        if (output.cancelled()) {
            return "Tool call cancelled";
        }
        if (output.timedOut()) {
            return "Tool call timed out after " + timeout.toMillis() + " ms";
        }
        if (output.exitCode() != null && output.exitCode() != 0) {
            return "Tool call command exited with code " + output.exitCode();
        }
        return null;
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isEmpty() ? fallback : value;
    }
}
