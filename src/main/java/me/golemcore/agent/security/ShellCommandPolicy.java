package me.golemcore.agent.security;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Decides whether a shell command may run, before any process is spawned.
 *
 * <p>
 * Allow and block entries have two shapes: a bare shell tool name
 * ({@code run_shell_command} or {@code ShellTool}) meaning every command, and
 * {@code ShellTool(prefix)} meaning commands that start with {@code prefix} as
 * whole words. Evaluation order:
 * <ol>
 * <li>command substitution is rejected regardless of configuration</li>
 * <li>a bare shell tool name in the block list disables the tool</li>
 * <li>per chained segment, block entries win over allow entries</li>
 * <li>a configured allow list without a bare shell tool name is strict</li>
 * </ol>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ShellCommandPolicy {

    public static final Set<String> SHELL_TOOL_NAMES = Set.of("run_shell_command", "ShellTool");

    private final AgentProperties properties;

    /**
     * Evaluates a command against the configured allow and block lists.
     */
    public ShellCommandVerdict isCommandAllowed(String command) {
        AgentProperties.ToolsProperties tools = properties.getTools();
        ShellCommandVerdict verdict = evaluate(command, tools.getCoreTools(), tools.getExcludeTools());
        if (!verdict.allowed()) {
            log.warn("[Policy] Rejected shell command ({}): {}", verdict.kind(), verdict.reason());
        }
        return verdict;
    }

    /**
     * Pure evaluation.
     *
     * @param command
     *            raw command line, possibly wrapped in {@code bash -c}
     * @param allowList
     *            tool allow list; null when not configured
     * @param blockList
     *            tool block list; null is treated as empty
     */
    public static ShellCommandVerdict evaluate(String command, List<String> allowList, List<String> blockList) {
        String unwrapped = ShellCommandParser.stripShellWrapper(command);
        if (ShellCommandParser.detectCommandSubstitution(unwrapped)) {
            return ShellCommandVerdict.reject(ShellRejectionKind.COMMAND_SUBSTITUTION,
                    "Command substitution using $(), <(), or >() is not allowed for security reasons");
        }

        List<String> blocked = blockList != null ? blockList : List.of();
        if (blocked.stream().anyMatch(SHELL_TOOL_NAMES::contains)) {
            return ShellCommandVerdict.reject(ShellRejectionKind.GLOBALLY_DISABLED,
                    "Shell tool is globally disabled in configuration");
        }

        List<String> blockedPrefixes = extractCommands(blocked);
        boolean strict = allowList != null && allowList.stream().noneMatch(SHELL_TOOL_NAMES::contains);
        List<String> allowedPrefixes = allowList != null ? extractCommands(allowList) : List.of();

        for (String segment : ShellCommandParser.splitCommands(unwrapped)) {
            String normalized = ShellCommandParser.normalize(segment);
            String rooted = ShellCommandParser.withCommandRoot(normalized);

            if (matchesAny(normalized, rooted, blockedPrefixes)) {
                return ShellCommandVerdict.reject(ShellRejectionKind.BLOCKED,
                        "Command '" + normalized + "' is blocked by configuration");
            }
            if (strict && !matchesAny(normalized, rooted, allowedPrefixes)) {
                return ShellCommandVerdict.reject(ShellRejectionKind.NOT_ALLOWED,
                        "Command '" + normalized + "' is not in the allowed commands list");
            }
        }
        return ShellCommandVerdict.allow();
    }

    private static boolean matchesAny(String normalized, String rooted, List<String> prefixes) {
        for (String prefix : prefixes) {
            if (isPrefixedBy(normalized, prefix) || isPrefixedBy(rooted, prefix)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Whole-word prefix match: {@code npm install} is prefixed by {@code npm},
     * {@code npminstall} is not.
     */
    static boolean isPrefixedBy(String command, String prefix) {
        if (!command.startsWith(prefix)) {
            return false;
        }
        return command.length() == prefix.length() || command.charAt(prefix.length()) == ' ';
    }

    /**
     * Extracts the normalized prefixes of {@code ShellTool(prefix)} entries.
     */
    static List<String> extractCommands(List<String> entries) {
        List<String> commands = new ArrayList<>();
        for (String entry : entries) {
            if (entry == null) {
                continue;
            }
            for (String toolName : SHELL_TOOL_NAMES) {
                if (entry.startsWith(toolName + "(") && entry.endsWith(")")) {
                    String prefix = ShellCommandParser.normalize(
                            entry.substring(toolName.length() + 1, entry.length() - 1));
                    if (!prefix.isEmpty()) {
                        commands.add(prefix);
                    }
                    break;
                }
            }
        }
        return commands;
    }
}
