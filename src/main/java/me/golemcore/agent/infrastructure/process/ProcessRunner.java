package me.golemcore.agent.infrastructure.process;

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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.model.CancellationToken;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs child processes with separate stdout/stderr capture, optional stdin,
 * a timeout and cooperative cancellation (the process is destroyed when the
 * token is cancelled).
 */
@Component
@Slf4j
public class ProcessRunner {

    private static final String TRUNCATED = "\n[Output truncated...]";

    private final ExecutorService executor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "process-io");
        t.setDaemon(true);
        return t;
    });

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[Process] Executor did not terminate within timeout");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Returns the argv prefix running a command line through the platform shell.
     */
    public static String[] shellCommand(String commandLine) {
        if (isWindows()) {
            return new String[] { "cmd.exe", "/c", commandLine };
        }
        return new String[] { "bash", "-c", commandLine };
    }

    public static boolean isWindows() {
        return System.getProperty("os.name").toLowerCase(Locale.ROOT).contains("win");
    }

    public CompletableFuture<ProcessOutput> runAsync(ProcessBuilder builder, String stdin, Duration timeout,
            CancellationToken cancellationToken, int maxOutputChars) {
        return CompletableFuture.supplyAsync(
                () -> run(builder, stdin, timeout, cancellationToken, maxOutputChars), executor);
    }

    /**
     * Runs the process on the calling thread until it exits, times out or is
     * cancelled.
     *
     * @param timeout
     *            null waits without bound
     */
    public ProcessOutput run(ProcessBuilder builder, String stdin, Duration timeout,
            CancellationToken cancellationToken, int maxOutputChars) {
        builder.redirectErrorStream(false);
        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            return ProcessOutput.failedToStart(e.getMessage());
        }

        Runnable unregister = cancellationToken.onCancel(process::destroyForcibly);
        try {
            Future<String> stdout = executor.submit(() -> readAll(process.getInputStream(), maxOutputChars));
            Future<String> stderr = executor.submit(() -> readAll(process.getErrorStream(), maxOutputChars));

            Future<?> input = executor.submit(() -> writeStdin(process, stdin));

            boolean completed;
            if (timeout == null) {
                process.waitFor();
                completed = true;
            } else {
                completed = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            }
            if (!completed) {
                process.destroyForcibly();
            }

            boolean cancelled = cancellationToken.isCancelled();
            Integer exitCode = completed && !cancelled ? process.exitValue() : null;
            input.cancel(true);
            return new ProcessOutput(collect(stdout), collect(stderr), exitCode, null, !completed, cancelled);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return new ProcessOutput("", "", null, "Process execution interrupted", false, false);
        } finally {
            unregister.run();
        }
    }

    /**
     * Writes the input and closes stdin. Runs off the waiting thread so an
     * unread input cannot hold back the timeout; a process that exits or is
     * killed without reading it breaks the pipe, which only ends the write.
     */
    private static void writeStdin(Process process, String stdin) {
        try (OutputStream os = process.getOutputStream()) {
            if (stdin != null) {
                os.write(stdin.getBytes(StandardCharsets.UTF_8));
            }
        } catch (IOException e) {
            log.debug("[Process] Stdin closed before input was written: {}", e.getMessage());
        }
    }

    private static String collect(Future<String> future) throws InterruptedException {
        try {
            return future.get(1, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            return "[Output read timeout]";
        } catch (ExecutionException e) {
            return "[Output read failed: " + e.getCause().getMessage() + "]";
        }
    }

    private static String readAll(InputStream stream, int maxChars) throws IOException {
        StringBuilder output = new StringBuilder();
        boolean truncated = false;
        char[] buffer = new char[8192];
        try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
            int read;
            while ((read = reader.read(buffer)) != -1) {
                int room = maxChars - output.length();
                if (room > 0) {
                    output.append(buffer, 0, Math.min(room, read));
                }
                if (read > room) {
                    truncated = true;
                }
            }
        }
        return truncated ? output + TRUNCATED : output.toString();
    }
}
