package me.golemcore.agent.domain.service;

import me.golemcore.agent.domain.component.ToolComponent;
import me.golemcore.agent.domain.exception.ToolDiscoveryException;
import me.golemcore.agent.domain.model.ToolAllowlist;
import me.golemcore.agent.domain.model.ToolSource;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.McpPort;
import me.golemcore.agent.port.outbound.ToolDiscoveryPort;
import me.golemcore.agent.testsupport.tools.StubTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ToolRegistryTest {

    private static final String READ_FILE = "read_file";

    private ToolDiscoveryPort discoveryPort;
    private McpPort mcpPort;
    private AgentProperties properties;
    private ToolRegistry registry;

    @BeforeEach
    void setUp() {
        discoveryPort = mock(ToolDiscoveryPort.class);
        mcpPort = mock(McpPort.class);
        properties = new AgentProperties();
        registry = new ToolRegistry(List.of(StubTool.returning(READ_FILE, "content")), discoveryPort, mcpPort,
                properties);
    }

    @Test
    void shouldRegisterBuiltinToolsAtConstruction() {
        assertEquals(List.of(READ_FILE), registry.getToolNames());
        assertEquals(READ_FILE, registry.getFunctionDeclarations().get(0).getName());
    }

    @Test
    void shouldKeepOnlyLastRegistrationForSameName() {
        StubTool first = StubTool.returning("dup", "first");
        StubTool second = StubTool.returning("dup", "second");

        registry.registerTool(first);
        registry.registerTool(second);

        assertSame(second, registry.getTool("dup"));
        assertEquals(1, registry.getAllTools().stream().filter(t -> "dup".equals(t.getToolName())).count());
        assertEquals(List.of("dup", READ_FILE), registry.getToolNames());
    }

    @Test
    void shouldSkipBuiltinToolOnBlockList() {
        properties.getTools().setExcludeTools(List.of("web_fetch"));

        ToolRegistry filtered = new ToolRegistry(
                List.of(StubTool.returning("web_fetch", "page"), StubTool.returning(READ_FILE, "content")),
                discoveryPort, mcpPort, properties);

        assertNull(filtered.getTool("web_fetch"));
        assertEquals(List.of(READ_FILE), filtered.getToolNames());
    }

    @Test
    void shouldRegisterOnlyBuiltinToolsOnAllowList() {
        properties.getTools().setCoreTools(List.of(READ_FILE, "run_shell_command(git status)"));

        ToolRegistry filtered = new ToolRegistry(List.of(StubTool.returning(READ_FILE, "content"),
                StubTool.returning("run_shell_command", "ok"), StubTool.returning("write_file", "ok")),
                discoveryPort, mcpPort, properties);

        assertEquals(List.of(READ_FILE, "run_shell_command"), filtered.getToolNames());
    }

    @Test
    void shouldRegisterNoBuiltinToolsWithEmptyAllowList() {
        properties.getTools().setCoreTools(List.of());

        ToolRegistry filtered = new ToolRegistry(List.of(StubTool.returning(READ_FILE, "content")),
                discoveryPort, mcpPort, properties);

        assertTrue(filtered.getToolNames().isEmpty());
    }

    @Test
    void shouldMatchAllowAndBlockEntriesByClassName() {
        assertTrue(ToolRegistry.isCoreToolEnabled("run_shell_command", "ShellTool",
                List.of("ShellTool(echo)"), null));
        assertFalse(ToolRegistry.isCoreToolEnabled("run_shell_command", "ShellTool",
                null, List.of("ShellTool")));
        assertTrue(ToolRegistry.isCoreToolEnabled("run_shell_command", "ShellTool",
                null, List.of("ShellTool(rm -rf /)")));
        assertFalse(ToolRegistry.isCoreToolEnabled("read_file", "ReadFileTool",
                List.of("read_file_extra"), null));
    }

    @Test
    void shouldReturnNullForUnknownOrNullName() {
        assertNull(registry.getTool("missing"));
        assertNull(registry.getTool(null));
    }

    @Test
    void shouldReplaceOnlySubprocessToolsOnRediscovery() {
        ToolComponent v1 = StubTool.returning("lint", "v1").withSource(ToolSource.SUBPROCESS, null);
        ToolComponent v2 = StubTool.returning("format", "v2").withSource(ToolSource.SUBPROCESS, null);
        when(discoveryPort.discoverTools()).thenReturn(List.of(v1), List.of(v2));

        registry.discoverSubprocessTools();
        registry.discoverSubprocessTools();

        assertEquals(List.of("format", READ_FILE), registry.getToolNames());
    }

    @Test
    void shouldContributeNoToolsWhenDiscoveryCommandFails() {
        registry.registerTool(StubTool.returning("old", "x").withSource(ToolSource.SUBPROCESS, null));
        when(discoveryPort.discoverTools()).thenThrow(new ToolDiscoveryException("exit code 2"));

        registry.discoverSubprocessTools();

        assertEquals(List.of(READ_FILE), registry.getToolNames());
    }

    @Test
    void shouldPassOwnAllowlistToRemoteDiscovery() {
        ToolComponent remote = StubTool.returning("github.search", "ok").withSource(ToolSource.MCP, "github");
        when(mcpPort.discoverTools(any(ToolAllowlist.class))).thenReturn(List.of(remote));

        registry.discoverTools();

        verify(mcpPort).discoverTools(registry.getAllowlist());
        assertEquals(List.of(remote), registry.getToolsByServer("github"));
        assertTrue(registry.getToolsByServer("other").isEmpty());
    }

    @Test
    void shouldSkipRemoteDiscoveryWhenDisabled() {
        properties.getMcp().setEnabled(false);
        registry.registerTool(StubTool.returning("stale", "x").withSource(ToolSource.MCP, "s"));

        registry.discoverRemoteTools();

        verify(mcpPort, never()).discoverTools(any());
        assertEquals(List.of(READ_FILE), registry.getToolNames());
    }

    @Test
    void shouldSurviveRemoteDiscoveryFailure() {
        when(mcpPort.discoverTools(any())).thenThrow(new IllegalStateException("boom"));

        registry.discoverRemoteTools();

        assertEquals(List.of(READ_FILE), registry.getToolNames());
    }

    @Test
    void shouldReturnRemovedNamesWhenUnregistering() {
        registry.registerTool(StubTool.returning("a", "x").withSource(ToolSource.MCP, "s"));

        assertEquals(List.of("a"), registry.unregisterTools(ToolSource.MCP));
        assertTrue(registry.unregisterTools(ToolSource.MCP).isEmpty());
    }
}
