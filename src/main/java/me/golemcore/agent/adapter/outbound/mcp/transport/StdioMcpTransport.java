package me.golemcore.agent.adapter.outbound.mcp.transport;

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

import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Newline-delimited JSON-RPC over the stdin/stdout of a child process.
 *
 * <p>
 * stdout is read on a reader thread; stderr is drained to the DEBUG log on a
 * separate thread. The process is destroyed on close.
 */
@Slf4j
public class StdioMcpTransport implements McpTransport {

    private final String serverName;
    private final List<String> command;
    private final Map<String, String> env;
    private final String cwd;

    private Process process;
    private BufferedWriter writer;
    private volatile boolean running;

    public StdioMcpTransport(String serverName, String command, List<String> args, Map<String, String> env,
            String cwd) {
        this.serverName = serverName;
        this.command = new ArrayList<>();
        this.command.add(command);
        if (args != null) {
            this.command.addAll(args);
        }
        this.env = env != null ? env : Map.of();
        this.cwd = cwd;
    }

    @Override
    public CompletableFuture<Void> start(Listener listener) {
        log.info("[MCP:{}] Starting server: {}", serverName, String.join(" ", command));
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectErrorStream(false);
        pb.environment().putAll(env);
        if (cwd != null && !cwd.isBlank()) {
            pb.directory(new File(cwd));
        }

        try {
            process = pb.start();
        } catch (IOException e) {
            return CompletableFuture.failedFuture(e);
        }
        running = true;
        writer = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));

        Thread readerThread = new Thread(() -> readLoop(process, listener), "mcp-reader-" + serverName);
        readerThread.setDaemon(true);
        readerThread.start();

        Thread stderrThread = new Thread(() -> stderrDrain(process), "mcp-stderr-" + serverName);
        stderrThread.setDaemon(true);
        stderrThread.start();

        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> send(String message) {
        if (writer == null || !running) {
            return CompletableFuture.failedFuture(new IOException("MCP process not running"));
        }
        try {
            synchronized (writer) {
                writer.write(message);
                writer.newLine();
                writer.flush();
            }
            return CompletableFuture.completedFuture(null);
        } catch (IOException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private void readLoop(Process p, Listener listener) {
        IOException failure = null;
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(p.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while (running && (line = reader.readLine()) != null) {
                listener.onMessage(line);
            }
        } catch (IOException e) {
            failure = e;
            if (running) {
                log.warn("[MCP:{}] Reader thread error: {}", serverName, e.getMessage());
            }
        } finally {
            listener.onClosed(failure != null ? failure : new IOException("MCP process exited"));
        }
    }

    private void stderrDrain(Process p) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(p.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                log.debug("[MCP:{}] stderr: {}", serverName, line);
            }
        } catch (IOException e) {
            if (running) {
                log.debug("[MCP:{}] Stderr drain ended: {}", serverName, e.getMessage());
            }
        }
    }

    public boolean isRunning() {
        return running && process != null && process.isAlive();
    }

    @Override
    public void close() {
        running = false;
        if (writer != null) {
            try {
                writer.close();
            } catch (IOException e) {
                log.debug("[MCP:{}] Error closing writer: {}", serverName, e.getMessage());
            }
        }

        if (process != null && process.isAlive()) {
            process.destroy();
            try {
                if (!process.waitFor(5, TimeUnit.SECONDS)) {
                    process.destroyForcibly();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
            }
        }
    }
}
