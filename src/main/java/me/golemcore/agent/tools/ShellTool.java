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
import me.golemcore.agent.domain.model.ToolFailureKind;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.infrastructure.process.ProcessOutput;
import me.golemcore.agent.infrastructure.process.ProcessRunner;
import me.golemcore.agent.security.ShellCommandParser;
import me.golemcore.agent.security.ShellCommandPolicy;
import me.golemcore.agent.security.ShellCommandVerdict;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Tool for executing shell commands in the sandboxed workspace.
 *
 * <p>
 * Commands are checked by {@link ShellCommandPolicy} before anything runs.
 * Allowed commands ask for confirmation unless every root command was already
 * approved with {@link ToolConfirmationOutcome#PROCEED_ALWAYS} in this
 * session. Rejected commands skip confirmation and fail with
 * {@link ToolFailureKind#POLICY_DENIED} on execution.
 *
 * <p>
 * Processes see a filtered environment, are killed on timeout or
 * cancellation, and have their output truncated.
 */
@Component
@Slf4j
public class ShellTool implements ToolComponent {

    public static final String TOOL_NAME = "run_shell_command";

    private static final String PARAM_COMMAND = "command";
    private static final String PARAM_DESCRIPTION = "description";
    private static final String PARAM_DIRECTORY = "directory";
    private static final String TYPE_STRING = "string";
    private static final String NONE = "(none)";
    private static final String EMPTY = "(empty)";

    private static final Set<String> DEFAULT_ALLOWED_ENV_VARS = Set.of(
            "PATH", "LANG", "LC_ALL", "LC_CTYPE", "TERM", "TMPDIR", "TZ", "SHELL", "USER", "LOGNAME");

    private final Path workspaceRoot;
    private final Duration defaultTimeout;
    private final int maxOutputChars;
    private final Set<String> allowedEnvVars;
    private final ShellCommandPolicy policy;
    private final ProcessRunner processRunner;
    private final Set<String> approvedRoots = ConcurrentHashMap.newKeySet();

    public ShellTool(AgentProperties properties, ShellCommandPolicy policy, ProcessRunner processRunner) {
        var config = properties.getTools().getShell();
        this.workspaceRoot = properties.getTools().resolveWorkspace();
        this.defaultTimeout = Duration.ofSeconds(config.getDefaultTimeout());
        this.maxOutputChars = config.getMaxOutputChars();
        this.allowedEnvVars = buildAllowedEnvVars(config.getAllowedEnvVars());
        this.policy = policy;
        this.processRunner = processRunner;

        try {
            Files.createDirectories(workspaceRoot);
            log.info("[Shell] Workspace: {}", workspaceRoot);
        } catch (IOException e) {
            log.error("[Shell] Failed to create workspace directory: {}", workspaceRoot, e);
        }
    }

    static Set<String> buildAllowedEnvVars(String configured) {
        Set<String> allowed = new HashSet<>(DEFAULT_ALLOWED_ENV_VARS);
        if (configured != null && !configured.isBlank()) {
            Arrays.stream(configured.split(","))
                    .map(String::trim)
                    .filter(name -> !name.isEmpty())
                    .forEach(allowed::add);
        }
        return Set.copyOf(allowed);
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(TOOL_NAME)
                .description("""
                        Execute a shell command in the workspace directory with `bash -c <command>`.
                        Returns Command, Directory, Stdout, Stderr, Error and Exit Code.
                        Command substitution using $(), <() or >() is rejected.
                        """)
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_COMMAND, Map.of(
                                        "type", TYPE_STRING,
                                        PARAM_DESCRIPTION, "Exact bash command to execute"),
                                PARAM_DESCRIPTION, Map.of(
                                        "type", TYPE_STRING,
                                        PARAM_DESCRIPTION, "Brief description of the command for the user"),
                                PARAM_DIRECTORY, Map.of(
                                        "type", TYPE_STRING,
                                        PARAM_DESCRIPTION, "Working directory relative to the workspace")),
                        "required", List.of(PARAM_COMMAND)))
                .build();
    }

    @Override
    public CompletableFuture<Optional<ConfirmationRequest>> shouldConfirmExecute(Map<String, Object> parameters) {
        String command = stringParam(parameters, PARAM_COMMAND);
        if (command == null || command.isBlank() || !policy.isCommandAllowed(command).allowed()) {
            return CompletableFuture.completedFuture(Optional.empty());
        }

        List<String> roots = ShellCommandParser.getCommandRoots(command);
        if (!roots.isEmpty() && approvedRoots.containsAll(roots)) {
            log.debug("[Shell] Roots already approved: {}", roots);
            return CompletableFuture.completedFuture(Optional.empty());
        }

        ConfirmationRequest request = ConfirmationRequest.builder()
                .type(ConfirmationType.EXEC)
                .title("Confirm Shell Command")
                .target(command)
                .command(command)
                .rootCommand(String.join(", ", roots))
                .onConfirm(outcome -> {
                    if (outcome == ToolConfirmationOutcome.PROCEED_ALWAYS) {
                        approvedRoots.addAll(roots);
                    }
                })
                .build();
        return CompletableFuture.completedFuture(Optional.of(request));
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters,
            CancellationToken cancellationToken) {
        String command = stringParam(parameters, PARAM_COMMAND);
        if (command == null || command.isBlank()) {
            return CompletableFuture.completedFuture(ToolResult.failure("Command is required"));
        }

        ShellCommandVerdict verdict = policy.isCommandAllowed(command);
        if (!verdict.allowed()) {
            return CompletableFuture.completedFuture(
                    ToolResult.failure(ToolFailureKind.POLICY_DENIED, verdict.reason()));
        }

        String directory = stringParam(parameters, PARAM_DIRECTORY);
        Path workDir = resolveWorkDir(directory);
        if (workDir == null) {
            return CompletableFuture.completedFuture(
                    ToolResult.failure("Invalid directory: must be an existing directory within workspace"));
        }

        if (cancellationToken.isCancelled()) {
            return CompletableFuture.completedFuture(
                    ToolResult.failure(ToolFailureKind.CANCELLED, "Cancelled before execution"));
        }

        ProcessBuilder builder = new ProcessBuilder(ProcessRunner.shellCommand(command));
        builder.directory(workDir.toFile());
        Map<String, String> env = builder.environment();
        env.keySet().retainAll(allowedEnvVars);
        env.put("HOME", workspaceRoot.toString());
        env.put("PWD", workDir.toString());

        log.info("[Shell] Executing: {} (in {})", command, workDir);
        String displayDirectory = directory == null || directory.isBlank() ? "(root)" : directory;
        return processRunner.runAsync(builder, null, defaultTimeout, cancellationToken, maxOutputChars)
                .thenApply(output -> toResult(command, displayDirectory, output));
    }

    private ToolResult toResult(String command, String directory, ProcessOutput output) {
        String error = output.error();
        if (error == null && output.timedOut()) {
            error = "Command timed out after " + defaultTimeout.toSeconds() + " seconds";
        } else if (error == null && output.cancelled()) {
            error = "Command cancelled";
        }

        String content = String.join("\n",
                "Command: " + command,
                "Directory: " + directory,
                "Stdout: " + orDefault(output.stdout(), EMPTY),
                "Stderr: " + orDefault(output.stderr(), EMPTY),
                "Error: " + orDefault(error, NONE),
                "Exit Code: " + (output.exitCode() != null ? output.exitCode() : NONE));

        if (error == null) {
            log.debug("[Shell] Exit code {}", output.exitCode());
            return ToolResult.success(content, display(output));
        }
        log.warn("[Shell] {}: {}", command, error);
        ToolFailureKind kind = output.cancelled() ? ToolFailureKind.CANCELLED : ToolFailureKind.EXECUTION_FAILED;
        return ToolResult.builder()
                .llmContent(content)
                .returnDisplay("Error: " + error)
                .error(error)
                .failureKind(kind)
                .build();
    }

    private static String display(ProcessOutput output) {
        if (!output.stdout().isEmpty()) {
            return output.stdout();
        }
        if (!output.stderr().isEmpty()) {
            return output.stderr();
        }
        return "Command exited with code " + output.exitCode();
    }

    private Path resolveWorkDir(String directory) {
        if (directory == null || directory.isBlank()) {
            return workspaceRoot;
        }
        try {
            Path resolved = workspaceRoot.resolve(directory).normalize();
            if (!resolved.startsWith(workspaceRoot) || !Files.isDirectory(resolved)) {
                return null;
            }
            Path real = resolved.toRealPath();
            if (!real.startsWith(workspaceRoot.toRealPath())) {
                log.warn("[Shell] Symlink escape blocked: {} -> {}", resolved, real);
                return null;
            }
            return resolved;
        } catch (IOException | RuntimeException e) {
            log.warn("[Shell] Failed to resolve directory {}: {}", directory, e.getMessage());
            return null;
        }
    }

    /** Root commands approved for the rest of this session. */
    public Set<String> getApprovedRoots() {
        return approvedRoots.stream().collect(Collectors.toUnmodifiableSet());
    }

    private static String stringParam(Map<String, Object> parameters, String name) {
        Object value = parameters != null ? parameters.get(name) : null;
        return value != null ? value.toString() : null;
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isEmpty() ? fallback : value;
    }
}
