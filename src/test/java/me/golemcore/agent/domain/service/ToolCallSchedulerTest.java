package me.golemcore.agent.domain.service;

import me.golemcore.agent.domain.exception.ToolNotFoundException;
import me.golemcore.agent.domain.model.CancellationToken;
import me.golemcore.agent.domain.model.ConfirmationRequest;
import me.golemcore.agent.domain.model.ConfirmationType;
import me.golemcore.agent.domain.model.ToolCallRequest;
import me.golemcore.agent.domain.model.ToolConfirmationOutcome;
import me.golemcore.agent.domain.model.ToolExecutionOutcome;
import me.golemcore.agent.domain.model.ToolFailureKind;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.McpPort;
import me.golemcore.agent.port.outbound.ToolDiscoveryPort;
import me.golemcore.agent.testsupport.tools.StubTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

class ToolCallSchedulerTest {

    private static final String ECHO = "echo";

    private AgentProperties properties;
    private ToolRegistry registry;
    private ToolCallScheduler scheduler;
    private CancellationToken token;

    @BeforeEach
    void setUp() {
        properties = new AgentProperties();
        registry = new ToolRegistry(List.of(), mock(ToolDiscoveryPort.class), mock(McpPort.class), properties);
        scheduler = new ToolCallScheduler(registry, properties);
        token = CancellationToken.create();
    }

    private static ToolCallRequest call(String id, String name) {
        return new ToolCallRequest(id, name, Map.of("k", "v"));
    }

    @Test
    void shouldReportUnknownToolAsNotFound() {
        List<ToolExecutionOutcome> outcomes = scheduler.schedule(List.of(call("1", "read_file")), token).join();

        ToolExecutionOutcome outcome = outcomes.get(0);
        assertInstanceOf(ToolNotFoundException.class, outcome.error());
        assertEquals("Tool \"read_file\" not found or is not registered.", outcome.errorMessage());
        assertNull(outcome.result());
    }

    @Test
    void shouldExecutePreApprovedTool() {
        StubTool tool = StubTool.returning(ECHO, "hi");
        registry.registerTool(tool);

        ToolExecutionOutcome outcome = scheduler.schedule(List.of(call("1", ECHO)), token).join().get(0);

        assertEquals("hi", outcome.result().getLlmContent());
        assertEquals("1", outcome.callId());
        assertEquals(1, tool.getExecutions());
    }

    @Test
    void shouldAttachConfirmationWithoutExecuting() {
        ConfirmationRequest request = ConfirmationRequest.builder().type(ConfirmationType.EXEC).build();
        StubTool tool = StubTool.confirming("risky", request, "done");
        registry.registerTool(tool);

        ToolExecutionOutcome outcome = scheduler.schedule(List.of(call("1", "risky")), token).join().get(0);

        assertSame(request, outcome.confirmationDetails());
        assertNull(outcome.result());
        assertEquals(0, tool.getExecutions());
    }

    @Test
    void shouldCaptureSynchronousAndAsynchronousFailures() {
        registry.registerTool(StubTool.throwing("sync", new IllegalStateException("sync boom")));
        registry.registerTool(StubTool.executing("async",
                args -> CompletableFuture.failedFuture(new IllegalArgumentException("async boom"))));

        List<ToolExecutionOutcome> outcomes = scheduler
                .schedule(List.of(call("1", "sync"), call("2", "async")), token).join();

        assertEquals("sync boom", outcomes.get(0).errorMessage());
        assertInstanceOf(IllegalArgumentException.class, outcomes.get(1).error());
    }

    @Test
    void shouldStartAllCallsTogetherAndKeepInputOrder() throws Exception {
        CountDownLatch bothStarted = new CountDownLatch(2);
        registry.registerTool(StubTool.executing("slow", args -> {
            bothStarted.countDown();
            return CompletableFuture.supplyAsync(() -> {
                await(bothStarted);
                sleep(100);
                return ToolResult.success("slow");
            });
        }));
        registry.registerTool(StubTool.executing("fast", args -> {
            bothStarted.countDown();
            return CompletableFuture.completedFuture(ToolResult.success("fast"));
        }));

        List<ToolExecutionOutcome> outcomes = scheduler
                .schedule(List.of(call("1", "slow"), call("2", "fast")), token)
                .get(5, TimeUnit.SECONDS);

        assertTrue(bothStarted.await(0, TimeUnit.SECONDS));
        List<Object> contents = new ArrayList<>();
        outcomes.forEach(o -> contents.add(o.result().getLlmContent()));
        assertEquals(List.of("slow", "fast"), contents);
    }

    @Test
    void shouldKeepOneOutcomePerRequestWhenOneThrows() {
        registry.registerTool(StubTool.returning("ok", "fine"));
        registry.registerTool(StubTool.throwing("bad", new RuntimeException("broken")));

        List<ToolExecutionOutcome> outcomes = scheduler
                .schedule(List.of(call("1", "ok"), call("2", "bad"), call("3", "ok")), token).join();

        assertEquals(3, outcomes.size());
        assertEquals(List.of("1", "2", "3"), outcomes.stream().map(ToolExecutionOutcome::callId).toList());
        assertTrue(outcomes.get(1).hasError());
        assertTrue(outcomes.get(0).result().isSuccess());
        assertTrue(outcomes.get(2).result().isSuccess());
    }

    @Test
    void shouldTurnHungToolIntoTimeoutError() {
        properties.getTools().setExecutionTimeout(Duration.ofMillis(50));
        registry.registerTool(StubTool.executing("hang", args -> new CompletableFuture<>()));

        ToolExecutionOutcome outcome = scheduler.schedule(List.of(call("1", "hang")), token).join().get(0);

        assertInstanceOf(TimeoutException.class, outcome.error());
        assertEquals("Tool hang timed out after 50 ms", outcome.errorMessage());
    }

    @Test
    void shouldKeepDomainErrorsOnResult() {
        registry.registerTool(StubTool.executing("denied", args -> CompletableFuture.completedFuture(
                ToolResult.failure(ToolFailureKind.POLICY_DENIED, "not allowed"))));

        ToolExecutionOutcome outcome = scheduler.schedule(List.of(call("1", "denied")), token).join().get(0);

        assertTrue(outcome.hasDomainError());
        assertNull(outcome.error());
        assertEquals(ToolFailureKind.POLICY_DENIED, outcome.result().getFailureKind());
    }

    @Test
    void shouldRunToolAfterConfirmationAndNotifyContinuation() {
        List<ToolConfirmationOutcome> decisions = new ArrayList<>();
        ConfirmationRequest request = ConfirmationRequest.builder()
                .type(ConfirmationType.EXEC)
                .onConfirm(decisions::add)
                .build();
        StubTool tool = StubTool.confirming("risky", request, "done");
        registry.registerTool(tool);
        ToolExecutionOutcome pending = scheduler.schedule(List.of(call("1", "risky")), token).join().get(0);

        ToolExecutionOutcome resumed = scheduler
                .resumeAfterConfirmation(pending, ToolConfirmationOutcome.PROCEED_ONCE, token).join();

        assertEquals(List.of(ToolConfirmationOutcome.PROCEED_ONCE), decisions);
        assertEquals("done", resumed.result().getLlmContent());
        assertEquals(1, tool.getExecutions());
    }

    @Test
    void shouldNotRunToolWhenConfirmationCancelled() {
        ConfirmationRequest request = ConfirmationRequest.builder().type(ConfirmationType.EDIT).build();
        StubTool tool = StubTool.confirming("edit", request, "written");
        registry.registerTool(tool);
        ToolExecutionOutcome pending = scheduler.schedule(List.of(call("1", "edit")), token).join().get(0);

        ToolExecutionOutcome resumed = scheduler
                .resumeAfterConfirmation(pending, ToolConfirmationOutcome.CANCEL, token).join();

        assertEquals(ToolFailureKind.CONFIRMATION_DENIED, resumed.result().getFailureKind());
        assertEquals("Cancelled by user", resumed.result().getError());
        assertEquals(0, tool.getExecutions());
    }

    @Test
    void shouldRejectResumeOfExecutedOutcome() {
        ToolExecutionOutcome executed = ToolExecutionOutcome.executed(call("1", ECHO), ToolResult.success("x"));

        assertThrows(IllegalArgumentException.class,
                () -> scheduler.resumeAfterConfirmation(executed, ToolConfirmationOutcome.PROCEED_ONCE, token));
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
