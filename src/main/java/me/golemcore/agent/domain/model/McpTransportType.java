package me.golemcore.agent.domain.model;

/**
 * Wire transport used to reach an MCP server.
 */
public enum McpTransportType {
    STDIO, SSE, STREAMABLE_HTTP, WEBSOCKET
}
