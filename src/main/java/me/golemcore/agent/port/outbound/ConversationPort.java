package me.golemcore.agent.port.outbound;

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

import me.golemcore.agent.domain.model.ModelChunk;
import me.golemcore.agent.domain.model.ModelMessage;
import reactor.core.publisher.Flux;

/**
 * Port for the model conversation a turn talks to. Implementations own the
 * chat history and the provider client; a turn only sends one message and
 * consumes the streamed reply.
 */
public interface ConversationPort {

    /**
     * Sends a message and streams the model's reply chunk by chunk. Transport
     * failures are delivered as stream errors.
     */
    Flux<ModelChunk> sendMessageStream(ModelMessage message);
}
