package me.golemcore.agent.adapter.outbound.discovery;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agent.domain.model.CancellationToken;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolFailureKind;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.infrastructure.process.ProcessOutput;
import me.golemcore.agent.infrastructure.process.ProcessRunner;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

class SubprocessDiscoveredToolTest {

    private final ProcessRunner processRunner = mock(ProcessRunner.class);

    private SubprocessDiscoveredTool tool(String callCommand) {
        return new SubprocessDiscoveredTool(ToolDefinition.simple("lint", "Run linter"), callCommand, null,
                Duration.ofSeconds(5), 1000, processRunner, new ObjectMapper());
    }

    @Test
    void shouldReturnStdoutOnCleanExit() {
        ToolResult result = tool("run").toResult(new ProcessOutput("ok", "", 0, null, false, false));

        assertTrue(result.isSuccess());
        assertEquals("ok", result.getLlmContent());
    }

    @Test
    void shouldTreatStderrOutputAsFailure() {
        ToolResult result = tool("run").toResult(new ProcessOutput("partial", "warning", 0, null, false, false));

        assertFalse(result.isSuccess());
        assertEquals("""
                Stdout: partial
                Stderr: warning
                Error: (none)
                Exit Code: 0""", result.getLlmContent());
    }

    @Test
    void shouldDescribeTimeout() {
        ToolResult result = tool("run").toResult(new ProcessOutput("", "", null, null, true, false));

        assertEquals("Tool call timed out after 5000 ms", result.getError());
        assertTrue(((String) result.getLlmContent()).endsWith("Exit Code: (none)"));
    }

    @Test
    void shouldMarkCancellation() {
        ToolResult result = tool("run").toResult(new ProcessOutput("", "", null, null, false, true));

        assertEquals(ToolFailureKind.CANCELLED, result.getFailureKind());
        assertEquals("Tool call cancelled", result.getError());
    }

    @Test
    void shouldFailWithoutCallCommand() {
        ToolResult result = tool(" ").execute(Map.of(), CancellationToken.create()).join();

        assertEquals("No tool call command configured", result.getError());
        verifyNoInteractions(processRunner);
    }
}
