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

import java.io.Closeable;
import java.util.concurrent.CompletableFuture;

/**
 * Moves JSON-RPC messages between an {@link me.golemcore.agent.adapter.outbound.mcp.McpClient}
 * and one MCP server. Implementations frame messages; they never interpret
 * them.
 */
public interface McpTransport extends Closeable {

    /**
     * Opens the connection.
     *
     * @return a future completed once messages can be sent
     */
    CompletableFuture<Void> start(Listener listener);

    /**
     * Sends one serialized JSON-RPC message.
     *
     * @return a future completed when the message was handed to the server, or
     *         failed when it could not be delivered
     */
    CompletableFuture<Void> send(String message);

    @Override
    void close();

    /**
     * Receiver of inbound messages and connection loss.
     */
    interface Listener {

        void onMessage(String message);

        void onClosed(Throwable cause);
    }
}
