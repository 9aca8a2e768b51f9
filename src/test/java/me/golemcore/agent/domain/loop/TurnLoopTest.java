package me.golemcore.agent.domain.loop;

import me.golemcore.agent.domain.model.CancellationToken;
import me.golemcore.agent.domain.model.ConfirmationRequest;
import me.golemcore.agent.domain.model.ConfirmationType;
import me.golemcore.agent.domain.model.FunctionCall;
import me.golemcore.agent.domain.model.ModelChunk;
import me.golemcore.agent.domain.model.ModelMessage;
import me.golemcore.agent.domain.model.ToolCallStatus;
import me.golemcore.agent.domain.model.TurnEvent;
import me.golemcore.agent.domain.service.ToolCallScheduler;
import me.golemcore.agent.domain.service.ToolRegistry;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.ConversationPort;
import me.golemcore.agent.port.outbound.McpPort;
import me.golemcore.agent.port.outbound.ToolDiscoveryPort;
import me.golemcore.agent.testsupport.tools.StubTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TurnLoopTest {

    private ConversationPort conversationPort;
    private ToolRegistry registry;
    private AgentProperties properties;
    private TurnLoop loop;

    @BeforeEach
    void setUp() {
        properties = new AgentProperties();
        conversationPort = mock(ConversationPort.class);
        registry = new ToolRegistry(List.of(), mock(ToolDiscoveryPort.class), mock(McpPort.class), properties);
        TurnFactory factory = new TurnFactory(conversationPort, new ToolCallScheduler(registry, properties));
        loop = new TurnLoop(factory, properties);
    }

    private static ModelChunk call(String id, String name) {
        return ModelChunk.calls(new FunctionCall(id, name, Map.of()));
    }

    @Test
    void shouldFeedFunctionResponsesBackUntilModelAnswersWithText() {
        registry.registerTool(StubTool.returning("ls", "a.txt"));
        when(conversationPort.sendMessageStream(any()))
                .thenReturn(Flux.just(call("1", "ls")))
                .thenReturn(Flux.just(ModelChunk.text("There is a.txt")));

        StepVerifier.create(loop.run(ModelMessage.ofText("list"), CancellationToken.create()))
                .assertNext(event -> assertEquals(ToolCallStatus.PENDING, event.toolCall().status()))
                .assertNext(event -> assertEquals(ToolCallStatus.INVOKED, event.toolCall().status()))
                .expectNext(TurnEvent.content("There is a.txt"))
                .verifyComplete();

        ArgumentCaptor<ModelMessage> inputs = ArgumentCaptor.forClass(ModelMessage.class);
        verify(conversationPort, times(2)).sendMessageStream(inputs.capture());
        ModelMessage second = inputs.getAllValues().get(1);
        assertTrue(second.isFunctionResponse());
        assertEquals("a.txt", second.getFunctionResponses().get(0).response().get("output"));
    }

    @Test
    void shouldStopAtTurnLimit() {
        properties.getTurn().setMaxTurns(2);
        registry.registerTool(StubTool.returning("ls", "a.txt"));
        when(conversationPort.sendMessageStream(any()))
                .thenAnswer(invocation -> Flux.just(call("x", "ls")));

        StepVerifier.create(loop.run(ModelMessage.ofText("loop"), CancellationToken.create()))
                .expectNextCount(4)
                .expectNext(TurnEvent.content("[Turn limit reached (2)]"))
                .verifyComplete();

        verify(conversationPort, times(2)).sendMessageStream(any());
    }

    @Test
    void shouldStopWhileConfirmationIsPending() {
        registry.registerTool(StubTool.confirming("rm",
                ConfirmationRequest.builder().type(ConfirmationType.EXEC).build(), "removed"));
        when(conversationPort.sendMessageStream(any())).thenReturn(Flux.just(call("1", "rm")));

        StepVerifier.create(loop.run(ModelMessage.ofText("clean"), CancellationToken.create()))
                .expectNextCount(1)
                .assertNext(event -> assertEquals(ToolCallStatus.CONFIRMING, event.toolCall().status()))
                .verifyComplete();

        verify(conversationPort, times(1)).sendMessageStream(any());
    }

    @Test
    void shouldRunSingleTurnWithoutToolCalls() {
        when(conversationPort.sendMessageStream(any())).thenReturn(Flux.just(ModelChunk.text("hello")));

        StepVerifier.create(loop.run(ModelMessage.ofText("hi"), CancellationToken.create()))
                .expectNext(TurnEvent.content("hello"))
                .verifyComplete();

        verify(conversationPort, times(1)).sendMessageStream(any());
    }
}
