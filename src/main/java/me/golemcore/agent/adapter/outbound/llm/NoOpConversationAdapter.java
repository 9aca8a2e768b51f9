package me.golemcore.agent.adapter.outbound.llm;

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
import me.golemcore.agent.domain.model.ModelChunk;
import me.golemcore.agent.domain.model.ModelMessage;
import me.golemcore.agent.port.outbound.ConversationPort;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

/**
 * Placeholder conversation used when no model client is wired in. Answers
 * every message with a single text chunk and no function calls, so a turn
 * ends immediately.
 */
@Component
@Slf4j
public class NoOpConversationAdapter implements ConversationPort {

    static final String REPLY = "[No model configured]";

    @Override
    public Flux<ModelChunk> sendMessageStream(ModelMessage message) {
        log.warn("[Conversation] No model configured, ignoring message");
        return Flux.just(ModelChunk.text(REPLY));
    }
}
