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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.model.CancellationToken;
import me.golemcore.agent.domain.model.ModelMessage;
import me.golemcore.agent.domain.model.TurnEvent;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

/**
 * Chains turns until the model answers without tool calls.
 *
 * <p>
 * After each turn the buffered function responses become the next input. The
 * loop stops early when a call awaits confirmation (the UI resumes it) or
 * when {@code agent.turn.max-turns} is reached.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TurnLoop {

    private final TurnFactory turnFactory;
    private final AgentProperties properties;

    public Flux<TurnEvent> run(ModelMessage input, CancellationToken cancellationToken) {
        return runTurn(input, cancellationToken, 1);
    }

    private Flux<TurnEvent> runTurn(ModelMessage input, CancellationToken cancellationToken, int turnNumber) {
        Turn turn = turnFactory.create();
        return turn.run(input, cancellationToken)
                .concatWith(Flux.defer(() -> next(turn, cancellationToken, turnNumber)));
    }

    private Flux<TurnEvent> next(Turn turn, CancellationToken cancellationToken, int turnNumber) {
        if (!turn.hasFunctionResponses()) {
            log.debug("[Turn] Completed after {} turn(s)", turnNumber);
            return Flux.empty();
        }
        if (turn.hasPendingConfirmations()) {
            log.info("[Turn] Waiting for confirmation after turn {}", turnNumber);
            return Flux.empty();
        }
        int maxTurns = properties.getTurn().getMaxTurns();
        if (turnNumber >= maxTurns) {
            log.warn("[Turn] Reached max turns ({})", maxTurns);
            return Flux.just(TurnEvent.content("[Turn limit reached (" + maxTurns + ")]"));
        }
        return runTurn(turn.nextMessage(), cancellationToken, turnNumber + 1);
    }
}
