package me.golemcore.agent.infrastructure.process;

/**
 * Captured outcome of a child process.
 *
 * @param stdout
 *            standard output, possibly truncated
 * @param stderr
 *            standard error, possibly truncated
 * @param exitCode
 *            exit code, or null when the process did not exit on its own
 * @param error
 *            failure to start or wait for the process; null otherwise
 * @param timedOut
 *            the process was killed after its timeout
 * @param cancelled
 *            the process was killed by a cancellation token
 */
public record ProcessOutput(String stdout, String stderr, Integer exitCode, String error, boolean timedOut,
        boolean cancelled) {

    public static ProcessOutput failedToStart(String error) {
        return new ProcessOutput("", "", null, error, false, false);
    }

    public boolean isCleanExit() {
        return error == null && !timedOut && !cancelled && exitCode != null && exitCode == 0;
    }
}
