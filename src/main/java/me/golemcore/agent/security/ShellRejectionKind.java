package me.golemcore.agent.security;

/**
 * Why the shell command policy rejected a command.
 */
public enum ShellRejectionKind {
    COMMAND_SUBSTITUTION, GLOBALLY_DISABLED, BLOCKED, NOT_ALLOWED
}
