package me.golemcore.agent.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.component.ToolComponent;
import me.golemcore.agent.domain.exception.ToolNotFoundException;
import me.golemcore.agent.domain.model.CancellationToken;
import me.golemcore.agent.domain.model.ConfirmationRequest;
import me.golemcore.agent.domain.model.ToolCallRequest;
import me.golemcore.agent.domain.model.ToolConfirmationOutcome;
import me.golemcore.agent.domain.model.ToolExecutionOutcome;
import me.golemcore.agent.domain.model.ToolFailureKind;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Resolves a batch of tool calls into outcomes: an executed result, a pending
 * confirmation, or an error. No tool runs before its confirmation check says
 * it is pre-approved.
 *
 * <p>
 * All requests of a batch are evaluated concurrently; the returned list is in
 * input order. The returned future never completes exceptionally, since
 * per-call failures are captured on the outcome.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ToolCallScheduler {

    private final ToolRegistry toolRegistry;
    private final AgentProperties properties;

    public CompletableFuture<List<ToolExecutionOutcome>> schedule(List<ToolCallRequest> requests,
            CancellationToken cancellationToken) {
        List<CompletableFuture<ToolExecutionOutcome>> futures = new ArrayList<>(requests.size());
        for (ToolCallRequest request : requests) {
            futures.add(resolve(request, cancellationToken));
        }
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> {
                    List<ToolExecutionOutcome> outcomes = new ArrayList<>(futures.size());
                    for (CompletableFuture<ToolExecutionOutcome> future : futures) {
                        outcomes.add(future.join());
                    }
                    return outcomes;
                });
    }

    /**
     * Re-drives a call that was waiting for a human decision. The decision is
     * reported to the confirmation continuation first; {@code CANCEL} yields a
     * {@link ToolFailureKind#CONFIRMATION_DENIED} result without running the
     * tool.
     */
    public CompletableFuture<ToolExecutionOutcome> resumeAfterConfirmation(ToolExecutionOutcome outcome,
            ToolConfirmationOutcome decision, CancellationToken cancellationToken) {
        if (!outcome.isAwaitingConfirmation()) {
            throw new IllegalArgumentException("Tool call " + outcome.callId() + " is not awaiting confirmation");
        }
        ToolCallRequest request = outcome.toRequest();
        try {
            outcome.confirmationDetails().confirm(decision);
        } catch (RuntimeException e) {
            log.error("[Scheduler] Confirmation handler failed for '{}'", request.name(), e);
            return CompletableFuture.completedFuture(ToolExecutionOutcome.failed(request, e));
        }

        if (decision == ToolConfirmationOutcome.CANCEL) {
            log.info("[Scheduler] Tool '{}' cancelled by user", request.name());
            return CompletableFuture.completedFuture(ToolExecutionOutcome.executed(request,
                    ToolResult.failure(ToolFailureKind.CONFIRMATION_DENIED, "Cancelled by user")));
        }

        ToolComponent tool = toolRegistry.getTool(request.name());
        if (tool == null) {
            return CompletableFuture.completedFuture(
                    ToolExecutionOutcome.failed(request, new ToolNotFoundException(request.name())));
        }
        return execute(tool, request, cancellationToken)
                .exceptionally(error -> failure(request, error));
    }

    private CompletableFuture<ToolExecutionOutcome> resolve(ToolCallRequest request,
            CancellationToken cancellationToken) {
        ToolComponent tool = toolRegistry.getTool(request.name());
        if (tool == null) {
            log.warn("[Scheduler] Unknown tool requested: {}", request.name());
            return CompletableFuture.completedFuture(
                    ToolExecutionOutcome.failed(request, new ToolNotFoundException(request.name())));
        }

        CompletableFuture<Optional<ConfirmationRequest>> confirmation;
        try {
            confirmation = Optional.ofNullable(tool.shouldConfirmExecute(request.args()))
                    .orElseThrow(() -> new IllegalStateException(
                            "Tool " + request.name() + " returned no confirmation decision"));
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(failure(request, e));
        }

        return confirmation
                .thenCompose(details -> {
                    if (details != null && details.isPresent()) {
                        log.debug("[Scheduler] Tool '{}' ({}) awaits confirmation", request.name(),
                                request.callId());
                        return CompletableFuture.completedFuture(
                                ToolExecutionOutcome.awaitingConfirmation(request, details.get()));
                    }
                    return execute(tool, request, cancellationToken);
                })
                .exceptionally(error -> failure(request, error));
    }

    private CompletableFuture<ToolExecutionOutcome> execute(ToolComponent tool, ToolCallRequest request,
            CancellationToken cancellationToken) {
        log.debug("[Scheduler] Executing '{}' ({})", request.name(), request.callId());
        CompletableFuture<ToolResult> future;
        try {
            future = tool.execute(request.args(), cancellationToken);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        if (future == null) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("Tool " + request.name() + " returned no result"));
        }

        Duration timeout = properties.getTools().getExecutionTimeout();
        if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
            future = future.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }

        return future.thenApply(result -> {
            if (result == null) {
                throw new IllegalStateException("Tool " + request.name() + " returned no result");
            }
            if (!result.isSuccess()) {
                log.warn("[Scheduler] Tool '{}' reported an error: {}", request.name(), result.getError());
            }
            return ToolExecutionOutcome.executed(request, result);
        });
    }

    private ToolExecutionOutcome failure(ToolCallRequest request, Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof TimeoutException && cause.getMessage() == null) {
            Duration timeout = properties.getTools().getExecutionTimeout();
            cause = new TimeoutException("Tool " + request.name() + " timed out"
                    + (timeout != null ? " after " + timeout.toMillis() + " ms" : ""));
        }
        log.error("[Scheduler] Tool '{}' failed: {}", request.name(), cause.getMessage(), cause);
        return ToolExecutionOutcome.failed(request, cause);
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
