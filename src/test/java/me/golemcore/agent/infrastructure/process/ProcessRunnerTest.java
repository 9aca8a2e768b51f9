package me.golemcore.agent.infrastructure.process;

import me.golemcore.agent.domain.model.CancellationToken;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisabledOnOs(OS.WINDOWS)
class ProcessRunnerTest {

    private final ProcessRunner runner = new ProcessRunner();

    @AfterEach
    void tearDown() {
        runner.shutdown();
    }

    private static ProcessBuilder shell(String command) {
        return new ProcessBuilder(ProcessRunner.shellCommand(command));
    }

    @Test
    void shouldCaptureStreamsSeparately() {
        ProcessOutput output = runner.run(shell("echo out; echo err >&2; exit 4"), null,
                Duration.ofSeconds(10), CancellationToken.create(), 1000);

        assertEquals("out\n", output.stdout());
        assertEquals("err\n", output.stderr());
        assertEquals(4, output.exitCode());
        assertFalse(output.isCleanExit());
    }

    @Test
    void shouldFeedStdin() {
        ProcessOutput output = runner.run(shell("cat"), "hello", Duration.ofSeconds(10),
                CancellationToken.create(), 1000);

        assertEquals("hello", output.stdout());
        assertTrue(output.isCleanExit());
    }

    @Test
    void shouldTruncateLongOutput() {
        ProcessOutput output = runner.run(shell("printf 'abcdefghij'"), null, Duration.ofSeconds(10),
                CancellationToken.create(), 4);

        assertEquals("abcd\n[Output truncated...]", output.stdout());
    }

    @Test
    void shouldKillOnTimeout() {
        ProcessOutput output = runner.run(shell("sleep 30"), null, Duration.ofMillis(200),
                CancellationToken.create(), 1000);

        assertTrue(output.timedOut());
        assertNull(output.exitCode());
    }

    @Test
    void shouldApplyTimeoutWhileInputIsUnread() {
        long start = System.nanoTime();

        ProcessOutput output = runner.run(shell("sleep 6"), "x".repeat(1_000_000), Duration.ofMillis(500),
                CancellationToken.create(), 1000);

        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        assertTrue(output.timedOut());
        assertNull(output.error());
        assertTrue(elapsedMs < 5000, "took " + elapsedMs + " ms");
    }

    @Test
    void shouldIgnoreInputNotReadByCompletedProcess() {
        ProcessOutput output = runner.run(shell("echo done"), "x".repeat(1_000_000), Duration.ofSeconds(10),
                CancellationToken.create(), 1000);

        assertEquals("done\n", output.stdout());
        assertTrue(output.isCleanExit());
    }

    @Test
    void shouldKillOnCancellation() throws Exception {
        CancellationToken token = CancellationToken.create();
        CompletableFuture<ProcessOutput> future = runner.runAsync(shell("sleep 30"), null,
                Duration.ofSeconds(30), token, 1000);

        Thread.sleep(200);
        token.cancel();
        ProcessOutput output = future.get(10, TimeUnit.SECONDS);

        assertTrue(output.cancelled());
        assertNull(output.exitCode());
    }

    @Test
    void shouldReportStartFailure() {
        ProcessOutput output = runner.run(new ProcessBuilder("/nonexistent/binary-xyz"), null,
                Duration.ofSeconds(5), CancellationToken.create(), 1000);

        assertNotNull(output.error());
        assertFalse(output.isCleanExit());
    }
}
