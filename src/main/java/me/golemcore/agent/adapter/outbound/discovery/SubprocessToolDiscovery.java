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
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.component.ToolComponent;
import me.golemcore.agent.domain.exception.ToolDiscoveryException;
import me.golemcore.agent.domain.model.CancellationToken;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.infrastructure.process.ProcessOutput;
import me.golemcore.agent.infrastructure.process.ProcessRunner;
import me.golemcore.agent.port.outbound.ToolDiscoveryPort;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Discovers project tools by running the configured discovery command and
 * parsing the JSON array it prints. Each element is either a declaration
 * ({@code name}, {@code description}, {@code parameters}) or a group holding
 * {@code function_declarations} / {@code functionDeclarations}.
 */
@Component
@Slf4j
public class SubprocessToolDiscovery implements ToolDiscoveryPort {

    private static final int MAX_DISCOVERY_OUTPUT = 10_000_000;
    private static final TypeReference<Map<String, Object>> SCHEMA_TYPE = new TypeReference<>() {
    };

    private final AgentProperties properties;
    private final ProcessRunner processRunner;
    private final ObjectMapper objectMapper;

    public SubprocessToolDiscovery(AgentProperties properties, ProcessRunner processRunner,
            ObjectMapper objectMapper) {
        this.properties = properties;
        this.processRunner = processRunner;
        this.objectMapper = objectMapper;
    }

    /**
     * Runs the discovery command on the calling thread and blocks until it
     * exits.
     *
     * @return discovered tools, empty when no discovery command is configured
     * @throws ToolDiscoveryException
     *             if the command fails or prints malformed output
     */
    @Override
    public List<ToolComponent> discoverTools() {
        AgentProperties.ToolsProperties tools = properties.getTools();
        String command = tools.getDiscoveryCommand();
        if (command == null || command.isBlank()) {
            return List.of();
        }

        Path workspace = tools.resolveWorkspace();
        ProcessBuilder builder = new ProcessBuilder(ProcessRunner.shellCommand(command));
        if (Files.isDirectory(workspace)) {
            builder.directory(workspace.toFile());
        }

        log.info("[Discovery] Running discovery command: {}", command);
        ProcessOutput output = processRunner.run(builder, null, tools.getDiscoveryTimeout(),
                CancellationToken.create(), MAX_DISCOVERY_OUTPUT);
        if (!output.isCleanExit()) {
            throw new ToolDiscoveryException(describeFailure(command, output));
        }

        List<ToolDefinition> definitions = parseDeclarations(output.stdout());
        List<ToolComponent> discovered = new ArrayList<>();
        for (ToolDefinition declaration : definitions) {
            ToolDefinition definition = ToolDefinition.builder()
                    .name(declaration.getName())
                    .description(describe(declaration, command, tools.getCallCommand()))
                    .inputSchema(declaration.getInputSchema())
                    .build();
            discovered.add(new SubprocessDiscoveredTool(definition, tools.getCallCommand(), workspace,
                    tools.getCallTimeout(), tools.getShell().getMaxOutputChars(), processRunner, objectMapper));
        }
        log.info("[Discovery] Discovered {} tools", discovered.size());
        return discovered;
    }

    List<ToolDefinition> parseDeclarations(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ToolDiscoveryException("Discovery output is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isArray()) {
            throw new ToolDiscoveryException("Discovery output must be a JSON array");
        }

        List<ToolDefinition> definitions = new ArrayList<>();
        for (JsonNode element : root) {
            JsonNode group = element.has("function_declarations")
                    ? element.get("function_declarations")
                    : element.get("functionDeclarations");
            if (group != null && group.isArray()) {
                for (JsonNode declaration : group) {
                    addDeclaration(definitions, declaration);
                }
            } else if (element.hasNonNull("name")) {
                addDeclaration(definitions, element);
            } else {
                log.warn("[Discovery] Skipping unrecognized discovery entry: {}", element);
            }
        }
        return definitions;
    }

    private void addDeclaration(List<ToolDefinition> definitions, JsonNode declaration) {
        String name = declaration.path("name").asText("");
        if (name.isBlank()) {
            log.warn("[Discovery] Skipping declaration without a name");
            return;
        }
        JsonNode parameters = declaration.get("parameters");
        Map<String, Object> schema = parameters != null && parameters.isObject()
                ? objectMapper.convertValue(parameters, SCHEMA_TYPE)
                : ToolDefinition.emptySchema();
        definitions.add(ToolDefinition.builder()
                .name(name)
                .description(declaration.path("description").asText(""))
                .inputSchema(schema)
                .build());
    }

    private static String describe(ToolDefinition declaration, String discoveryCommand, String callCommand) {
        return declaration.getDescription() + """


                This tool was discovered by running `%s` in the project workspace. \
                Calling it runs `%s %s` with the JSON arguments on stdin.
                On success the tool's stdout is returned. Otherwise the result lists \
                Stdout, Stderr, Error and Exit Code, where a stream may be (empty) \
                and a field may be (none).
                """.formatted(discoveryCommand, callCommand, declaration.getName());
    }

    private static String describeFailure(String command, ProcessOutput output) {
        StringBuilder message = new StringBuilder("Discovery command failed: ").append(command);
        if (output.error() != null) {
            message.append(" (").append(output.error()).append(')');
        } else if (output.timedOut()) {
            message.append(" (timed out)");
        } else if (output.exitCode() != null) {
            message.append(" (exit code ").append(output.exitCode()).append(')');
        }
        if (!output.stderr().isBlank()) {
            message.append(": ").append(output.stderr().strip());
        }
        return message.toString();
    }
}
