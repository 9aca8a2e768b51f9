package me.golemcore.agent.domain.loop;

import me.golemcore.agent.domain.exception.TurnCancelledException;
import me.golemcore.agent.domain.model.CancellationToken;
import me.golemcore.agent.domain.model.ConfirmationRequest;
import me.golemcore.agent.domain.model.ConfirmationType;
import me.golemcore.agent.domain.model.FunctionCall;
import me.golemcore.agent.domain.model.FunctionResponse;
import me.golemcore.agent.domain.model.ModelChunk;
import me.golemcore.agent.domain.model.ModelMessage;
import me.golemcore.agent.domain.model.ToolCallStatus;
import me.golemcore.agent.domain.model.ToolFailureKind;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.domain.model.TurnEvent;
import me.golemcore.agent.domain.model.TurnEventType;
import me.golemcore.agent.domain.service.ToolCallScheduler;
import me.golemcore.agent.domain.service.ToolRegistry;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.ConversationPort;
import me.golemcore.agent.port.outbound.McpPort;
import me.golemcore.agent.port.outbound.ToolDiscoveryPort;
import me.golemcore.agent.testsupport.tools.StubTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TurnTest {

    private ConversationPort conversationPort;
    private ToolRegistry registry;
    private Turn turn;
    private CancellationToken token;

    @BeforeEach
    void setUp() {
        AgentProperties properties = new AgentProperties();
        conversationPort = mock(ConversationPort.class);
        registry = new ToolRegistry(List.of(), mock(ToolDiscoveryPort.class), mock(McpPort.class), properties);
        turn = new Turn(conversationPort, new ToolCallScheduler(registry, properties));
        token = CancellationToken.create();
    }

    private void stream(ModelChunk... chunks) {
        when(conversationPort.sendMessageStream(any())).thenReturn(Flux.just(chunks));
    }

    private static FunctionCall fc(String id, String name) {
        return new FunctionCall(id, name, Map.of("path", "a.txt"));
    }

    @Test
    void shouldEmitContentForTextChunks() {
        stream(ModelChunk.text("Hello"), ModelChunk.text(" world"));

        StepVerifier.create(turn.run(ModelMessage.ofText("hi"), token))
                .expectNext(TurnEvent.content("Hello"))
                .expectNext(TurnEvent.content(" world"))
                .verifyComplete();

        assertFalse(turn.hasFunctionResponses());
        assertEquals(2, turn.getDebugResponses().size());
    }

    @Test
    void shouldReportMissingToolAsErrorContentAndErrorResponse() {
        stream(ModelChunk.calls(fc("c1", "read_file")));

        StepVerifier.create(turn.run(ModelMessage.ofText("read it"), token))
                .assertNext(event -> assertEquals(ToolCallStatus.PENDING, event.toolCall().status()))
                .assertNext(event -> {
                    assertEquals(TurnEventType.CONTENT, event.type());
                    assertEquals("[Error invoking tool read_file: Tool \"read_file\" not found or is not registered.]",
                            event.text());
                })
                .verifyComplete();

        List<FunctionResponse> responses = turn.getFunctionResponses();
        assertEquals(1, responses.size());
        assertTrue(responses.get(0).isError());
        String error = (String) responses.get(0).response().get(FunctionResponse.ERROR_KEY);
        assertTrue(error.contains("Tool \"read_file\" not found or is not registered."));
        assertEquals("c1", responses.get(0).id());
    }

    @Test
    void shouldEmitInvokedEventWithDisplay() {
        registry.registerTool(StubTool.executing("read_file",
                args -> CompletableFuture.completedFuture(ToolResult.success("file body", "Read a.txt"))));
        stream(ModelChunk.calls(fc("c1", "read_file")));

        StepVerifier.create(turn.run(ModelMessage.ofText("read"), token))
                .assertNext(event -> assertEquals(ToolCallStatus.PENDING, event.toolCall().status()))
                .assertNext(event -> {
                    assertEquals(ToolCallStatus.INVOKED, event.toolCall().status());
                    assertEquals("Read a.txt", event.toolCall().resultDisplay());
                })
                .verifyComplete();

        assertEquals("file body", turn.getFunctionResponses().get(0).response().get(FunctionResponse.OUTPUT_KEY));
    }

    /**
     * The first failing call of a batch ends that batch's events; later calls
     * still produce function responses.
     */
    @Test
    void shouldStopEmittingBatchEventsAfterFirstErrorButAnswerEveryCall() {
        registry.registerTool(StubTool.returning("ok", "fine"));
        registry.registerTool(StubTool.throwing("bad", new IllegalStateException("kaboom")));
        stream(ModelChunk.calls(fc("1", "ok"), fc("2", "bad"), fc("3", "ok")));

        StepVerifier.create(turn.run(ModelMessage.ofText("go"), token))
                .expectNextCount(3)
                .assertNext(event -> assertEquals(ToolCallStatus.INVOKED, event.toolCall().status()))
                .expectNext(TurnEvent.content("[Error invoking tool bad: kaboom]"))
                .verifyComplete();

        List<FunctionResponse> responses = turn.getFunctionResponses();
        assertEquals(3, responses.size());
        assertFalse(responses.get(0).isError());
        assertTrue(responses.get(1).isError());
        assertEquals("Invocation failed: kaboom", responses.get(1).response().get(FunctionResponse.ERROR_KEY));
        assertFalse(responses.get(2).isError());
        assertEquals("fine", responses.get(2).response().get(FunctionResponse.OUTPUT_KEY));
    }

    @Test
    void shouldReportDomainErrorAsContentButOutputToModel() {
        registry.registerTool(StubTool.executing("shell", args -> CompletableFuture.completedFuture(
                ToolResult.failure(ToolFailureKind.POLICY_DENIED, "blocked"))));
        stream(ModelChunk.calls(fc("1", "shell")));

        StepVerifier.create(turn.run(ModelMessage.ofText("go"), token))
                .expectNextCount(1)
                .expectNext(TurnEvent.content("[Error executing tool shell: blocked]"))
                .verifyComplete();

        FunctionResponse response = turn.getFunctionResponses().get(0);
        assertFalse(response.isError());
        assertEquals("Error: blocked", response.response().get(FunctionResponse.OUTPUT_KEY));
    }

    @Test
    void shouldEmitConfirmingEventWithNullOutput() {
        ConfirmationRequest request = ConfirmationRequest.builder().type(ConfirmationType.EXEC).build();
        registry.registerTool(StubTool.confirming("run", request, "done"));
        stream(ModelChunk.calls(fc("1", "run")));

        StepVerifier.create(turn.run(ModelMessage.ofText("go"), token))
                .expectNextCount(1)
                .assertNext(event -> {
                    assertEquals(ToolCallStatus.CONFIRMING, event.toolCall().status());
                    assertEquals(request, event.toolCall().confirmationDetails());
                })
                .verifyComplete();

        assertTrue(turn.hasPendingConfirmations());
        Map<String, Object> payload = turn.getFunctionResponses().get(0).response();
        assertTrue(payload.containsKey(FunctionResponse.OUTPUT_KEY));
        assertNull(payload.get(FunctionResponse.OUTPUT_KEY));
    }

    @Test
    void shouldSynthesizeCallIdWhenModelOmitsIt() {
        registry.registerTool(StubTool.returning("ok", "fine"));
        stream(ModelChunk.calls(new FunctionCall(null, "ok", null)));

        StepVerifier.create(turn.run(ModelMessage.ofText("go"), token))
                .assertNext(event -> assertTrue(event.toolCall().callId().startsWith("ok-")))
                .expectNextCount(1)
                .verifyComplete();
    }

    @Test
    void shouldAccumulateResponsesAcrossBatches() {
        registry.registerTool(StubTool.returning("ok", "fine"));
        stream(ModelChunk.calls(fc("1", "ok")), ModelChunk.text("thinking"), ModelChunk.calls(fc("2", "ok")));

        StepVerifier.create(turn.run(ModelMessage.ofText("go"), token))
                .expectNextCount(5)
                .verifyComplete();

        ModelMessage next = turn.nextMessage();
        assertEquals(List.of("1", "2"), next.getFunctionResponses().stream().map(FunctionResponse::id).toList());
    }

    @Test
    void shouldFailWithCancellationWhenTokenCancelledMidStream() {
        registry.registerTool(StubTool.executing("stop", args -> {
            token.cancel();
            return CompletableFuture.completedFuture(ToolResult.success("stopping"));
        }));
        stream(ModelChunk.calls(fc("1", "stop")), ModelChunk.text("never shown"));

        StepVerifier.create(turn.run(ModelMessage.ofText("go"), token))
                .assertNext(event -> assertEquals(ToolCallStatus.PENDING, event.toolCall().status()))
                .assertNext(event -> assertEquals(ToolCallStatus.INVOKED, event.toolCall().status()))
                .expectErrorSatisfies(error -> {
                    assertTrue(error instanceof TurnCancelledException);
                    assertEquals("Request cancelled by user during stream.", error.getMessage());
                })
                .verify();
    }

    @Test
    void shouldRejectSecondSubscription() {
        stream(ModelChunk.text("once"));
        Flux<TurnEvent> events = turn.run(ModelMessage.ofText("go"), token);

        StepVerifier.create(events).expectNextCount(1).verifyComplete();
        StepVerifier.create(events).expectError(IllegalStateException.class).verify();
    }
}
