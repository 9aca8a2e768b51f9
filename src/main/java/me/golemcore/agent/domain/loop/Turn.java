package me.golemcore.agent.domain.loop;

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
import me.golemcore.agent.domain.exception.TurnCancelledException;
import me.golemcore.agent.domain.model.CancellationToken;
import me.golemcore.agent.domain.model.FunctionCall;
import me.golemcore.agent.domain.model.FunctionResponse;
import me.golemcore.agent.domain.model.ModelChunk;
import me.golemcore.agent.domain.model.ModelMessage;
import me.golemcore.agent.domain.model.ToolCallEvent;
import me.golemcore.agent.domain.model.ToolCallRequest;
import me.golemcore.agent.domain.model.ToolExecutionOutcome;
import me.golemcore.agent.domain.model.TurnEvent;
import me.golemcore.agent.domain.service.ToolCallScheduler;
import me.golemcore.agent.port.outbound.ConversationPort;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One request/response exchange with the model.
 *
 * <p>
 * {@link #run} streams the model reply and translates it into
 * {@link TurnEvent}s. Chunks are handled strictly one at a time: a chunk with
 * function calls is fully resolved through the {@link ToolCallScheduler}
 * before the next chunk is looked at. The function responses of every
 * resolved call are buffered and become the next model input
 * ({@link #nextMessage()}).
 *
 * <p>
 * A turn is single use. Create one per exchange with {@link TurnFactory}.
 */
@Slf4j
public class Turn {

    private final ConversationPort conversationPort;
    private final ToolCallScheduler scheduler;
    private final AtomicBoolean started = new AtomicBoolean();

    private final List<ToolCallRequest> pendingToolCalls = new ArrayList<>();
    private final List<FunctionResponse> fnResponses = Collections.synchronizedList(new ArrayList<>());
    private final List<ToolExecutionOutcome> outcomes = Collections.synchronizedList(new ArrayList<>());
    private final List<ModelChunk> debugResponses = Collections.synchronizedList(new ArrayList<>());

    public Turn(ConversationPort conversationPort, ToolCallScheduler scheduler) {
        this.conversationPort = conversationPort;
        this.scheduler = scheduler;
    }

    /**
     * Sends {@code input} and returns the lazy event sequence of the reply.
     * Cancellation is checked once per chunk and fails the sequence with
     * {@link TurnCancelledException}; tool failures never fail it.
     *
     * @throws IllegalStateException
     *             (as a stream error) when subscribed to more than once
     */
    public Flux<TurnEvent> run(ModelMessage input, CancellationToken cancellationToken) {
        return Flux.defer(() -> {
            if (!started.compareAndSet(false, true)) {
                return Flux.error(new IllegalStateException("Turn has already been run"));
            }
            return conversationPort.sendMessageStream(input)
                    .concatMap(chunk -> handleChunk(chunk, cancellationToken));
        });
    }

    private Flux<TurnEvent> handleChunk(ModelChunk chunk, CancellationToken cancellationToken) {
        if (cancellationToken.isCancelled()) {
            log.info("[Turn] Cancelled during stream");
            return Flux.error(new TurnCancelledException());
        }
        debugResponses.add(chunk);

        if (chunk.hasText()) {
            return Flux.just(TurnEvent.content(chunk.getText()));
        }
        if (!chunk.hasFunctionCalls()) {
            return Flux.empty();
        }

        List<TurnEvent> pendingEvents = new ArrayList<>();
        for (FunctionCall functionCall : chunk.getFunctionCalls()) {
            ToolCallRequest request = ToolCallRequest.fromFunctionCall(functionCall);
            pendingToolCalls.add(request);
            pendingEvents.add(TurnEvent.toolCallInfo(ToolCallEvent.pending(request)));
        }
        List<ToolCallRequest> batch = List.copyOf(pendingToolCalls);
        log.debug("[Turn] Resolving {} tool calls", batch.size());

        Flux<TurnEvent> outcomeEvents = Mono.fromFuture(() -> scheduler.schedule(batch, cancellationToken))
                .flatMapMany(resolved -> {
                    List<TurnEvent> events = handleToolOutcomes(resolved);
                    recordFunctionResponses(resolved);
                    pendingToolCalls.clear();
                    return Flux.fromIterable(events);
                });
        return Flux.concat(Flux.fromIterable(pendingEvents), outcomeEvents);
    }

    /**
     * Emits one event per outcome in batch order. The first outcome carrying an
     * error produces a single content line and ends the events of the batch;
     * the outcomes after it are still answered to the model.
     */
    private List<TurnEvent> handleToolOutcomes(List<ToolExecutionOutcome> resolved) {
        List<TurnEvent> events = new ArrayList<>();
        for (ToolExecutionOutcome outcome : resolved) {
            if (outcome.hasError()) {
                events.add(TurnEvent.content(
                        "[Error invoking tool " + outcome.name() + ": " + outcome.errorMessage() + "]"));
                break;
            }
            if (outcome.hasDomainError()) {
                events.add(TurnEvent.content(
                        "[Error executing tool " + outcome.name() + ": " + outcome.result().getError() + "]"));
                break;
            }
            ToolCallEvent event = outcome.isAwaitingConfirmation()
                    ? ToolCallEvent.confirming(outcome)
                    : ToolCallEvent.invoked(outcome);
            events.add(TurnEvent.toolCallInfo(event));
        }
        return events;
    }

    private void recordFunctionResponses(List<ToolExecutionOutcome> resolved) {
        for (ToolExecutionOutcome outcome : resolved) {
            if (outcome.hasError()) {
                log.error("[Turn] Critical error invoking tool {}: {}", outcome.name(), outcome.errorMessage());
            } else if (outcome.hasDomainError()) {
                log.warn("[Turn] Tool {} returned an error: {}", outcome.name(), outcome.result().getError());
            }
            outcomes.add(outcome);
            fnResponses.add(toFunctionResponse(outcome));
        }
    }

    /**
     * Maps an outcome to the function response sent back to the model: an
     * {@code error} payload when the call threw, an {@code output} payload
     * otherwise (null output while a confirmation is pending).
     */
    public static FunctionResponse toFunctionResponse(ToolExecutionOutcome outcome) {
        if (outcome.hasError()) {
            return FunctionResponse.error(outcome.callId(), outcome.name(),
                    "Invocation failed: " + outcome.errorMessage());
        }
        Object output = outcome.result() != null ? outcome.result().getLlmContent() : null;
        return FunctionResponse.output(outcome.callId(), outcome.name(), output);
    }

    /**
     * Returns the responses of every batch scheduled in this turn, in order;
     * a later batch adds to them rather than replacing earlier ones.
     */
    public List<FunctionResponse> getFunctionResponses() {
        synchronized (fnResponses) {
            return List.copyOf(fnResponses);
        }
    }

    public List<ToolExecutionOutcome> getOutcomes() {
        synchronized (outcomes) {
            return List.copyOf(outcomes);
        }
    }

    public List<ModelChunk> getDebugResponses() {
        synchronized (debugResponses) {
            return List.copyOf(debugResponses);
        }
    }

    public boolean hasFunctionResponses() {
        return !fnResponses.isEmpty();
    }

    public boolean hasPendingConfirmations() {
        return getOutcomes().stream().anyMatch(ToolExecutionOutcome::isAwaitingConfirmation);
    }

    /**
     * Returns the model input for the next exchange, built from all buffered
     * function responses.
     */
    public ModelMessage nextMessage() {
        return ModelMessage.ofFunctionResponses(getFunctionResponses());
    }
}
