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

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Narrow, quote-aware parser for shell command lines. It understands single
 * and double quotes, backslash escapes and the chaining operators
 * {@code && || ; | &}; it is not a shell grammar.
 *
 * <p>
 * The class is stateless and thread-safe.
 */
public final class ShellCommandParser {

    private static final Pattern SHELL_WRAPPER = Pattern.compile("^\\s*(?:sh|bash|zsh|cmd\\.exe)\\s+(?:/c|-c)\\s+");
    private static final Pattern FIRST_WORD = Pattern.compile("^\"([^\"]+)\"|^'([^']+)'|^(\\S+)");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private ShellCommandParser() {
    }

    /**
     * Removes a leading {@code sh|bash|zsh -c} or {@code cmd.exe /c} wrapper and
     * the quotes around the wrapped command. Other commands are only trimmed.
     */
    public static String stripShellWrapper(String command) {
        Matcher matcher = SHELL_WRAPPER.matcher(command);
        if (!matcher.find()) {
            return command.trim();
        }
        String inner = command.substring(matcher.end()).trim();
        if (inner.length() >= 2 && ((inner.startsWith("\"") && inner.endsWith("\""))
                || (inner.startsWith("'") && inner.endsWith("'")))) {
            inner = inner.substring(1, inner.length() - 1);
        }
        return inner;
    }

    /**
     * Splits a command line on {@code &&}, {@code ||}, {@code ;}, {@code |} and
     * {@code &}. Quoted spans and escaped characters are never split. Empty
     * segments are dropped.
     */
    public static List<String> splitCommands(String command) {
        List<String> commands = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inSingle = false;
        boolean inDouble = false;
        int i = 0;
        while (i < command.length()) {
            char c = command.charAt(i);
            char next = i + 1 < command.length() ? command.charAt(i + 1) : '\0';

            if (c == '\\' && i < command.length() - 1) {
                current.append(c).append(next);
                i += 2;
                continue;
            }

            if (c == '\'' && !inDouble) {
                inSingle = !inSingle;
            } else if (c == '"' && !inSingle) {
                inDouble = !inDouble;
            }

            if (!inSingle && !inDouble) {
                if ((c == '&' && next == '&') || (c == '|' && next == '|')) {
                    addSegment(commands, current);
                    i++;
                } else if (c == ';' || c == '&' || c == '|') {
                    addSegment(commands, current);
                } else {
                    current.append(c);
                }
            } else {
                current.append(c);
            }
            i++;
        }
        addSegment(commands, current);
        return commands;
    }

    private static void addSegment(List<String> commands, StringBuilder current) {
        String segment = current.toString().trim();
        if (!segment.isEmpty()) {
            commands.add(segment);
        }
        current.setLength(0);
    }

    /**
     * Returns the base executable name of a single command: its first word,
     * unquoted, with any leading path stripped. Null for a blank command.
     */
    public static String getCommandRoot(String command) {
        String trimmed = command == null ? "" : command.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        Matcher matcher = FIRST_WORD.matcher(trimmed);
        if (!matcher.find()) {
            return null;
        }
        String root = matcher.group(1) != null ? matcher.group(1)
                : matcher.group(2) != null ? matcher.group(2) : matcher.group(3);
        String[] parts = root.split("[\\\\/]");
        String base = parts.length == 0 ? "" : parts[parts.length - 1];
        return base.isEmpty() ? null : base;
    }

    /**
     * Rewrites a single command so its first word is the bare command root, for
     * example {@code /usr/bin/git status} becomes {@code git status}.
     */
    public static String withCommandRoot(String command) {
        String trimmed = command.trim();
        Matcher matcher = FIRST_WORD.matcher(trimmed);
        String root = getCommandRoot(trimmed);
        if (root == null || !matcher.find()) {
            return trimmed;
        }
        return root + trimmed.substring(matcher.end());
    }

    /**
     * Returns the command roots of every chained segment, after stripping a
     * shell wrapper.
     */
    public static List<String> getCommandRoots(String command) {
        List<String> roots = new ArrayList<>();
        if (command == null || command.isBlank()) {
            return roots;
        }
        for (String segment : splitCommands(stripShellWrapper(command))) {
            String root = getCommandRoot(segment);
            if (root != null) {
                roots.add(root);
            }
        }
        return roots;
    }

    /**
     * Detects command or process substitution that bash would execute:
     * {@code $(} and backticks unquoted or inside double quotes, {@code <(} and
     * {@code >(} unquoted. Single-quoted text and backslash-escaped characters
     * are literal.
     */
    public static boolean detectCommandSubstitution(String command) {
        boolean inSingle = false;
        boolean inDouble = false;
        int i = 0;
        while (i < command.length()) {
            char c = command.charAt(i);
            char next = i + 1 < command.length() ? command.charAt(i + 1) : '\0';

            if (c == '\\' && !inSingle) {
                i += 2;
                continue;
            }

            if (c == '\'' && !inDouble) {
                inSingle = !inSingle;
            } else if (c == '"' && !inSingle) {
                inDouble = !inDouble;
            } else if (!inSingle) {
                if (c == '$' && next == '(') {
                    return true;
                }
                if (c == '`') {
                    return true;
                }
                if ((c == '<' || c == '>') && next == '(' && !inDouble) {
                    return true;
                }
            }
            i++;
        }
        return false;
    }

    /**
     * Splits a single command line into argv, honouring quotes and backslash
     * escapes outside single quotes.
     */
    public static List<String> splitArguments(String commandLine) {
        List<String> args = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inSingle = false;
        boolean inDouble = false;
        boolean hasToken = false;
        int i = 0;
        while (i < commandLine.length()) {
            char c = commandLine.charAt(i);
            if (c == '\\' && !inSingle && i + 1 < commandLine.length()) {
                current.append(commandLine.charAt(i + 1));
                hasToken = true;
                i += 2;
                continue;
            }
            if (c == '\'' && !inDouble) {
                inSingle = !inSingle;
                hasToken = true;
            } else if (c == '"' && !inSingle) {
                inDouble = !inDouble;
                hasToken = true;
            } else if (Character.isWhitespace(c) && !inSingle && !inDouble) {
                if (hasToken) {
                    args.add(current.toString());
                    current.setLength(0);
                    hasToken = false;
                }
            } else {
                current.append(c);
                hasToken = true;
            }
            i++;
        }
        if (hasToken) {
            args.add(current.toString());
        }
        return args;
    }

    /**
     * Trims and collapses runs of whitespace to single spaces.
     */
    public static String normalize(String command) {
        return WHITESPACE.matcher(command.trim()).replaceAll(" ");
    }
}
