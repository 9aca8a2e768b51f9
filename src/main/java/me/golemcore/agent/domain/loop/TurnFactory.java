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
import me.golemcore.agent.domain.service.ToolCallScheduler;
import me.golemcore.agent.port.outbound.ConversationPort;
import org.springframework.stereotype.Component;

/**
 * Creates single-use {@link Turn}s wired to the conversation and scheduler.
 */
@Component
@RequiredArgsConstructor
public class TurnFactory {

    private final ConversationPort conversationPort;
    private final ToolCallScheduler scheduler;

    public Turn create() {
        return new Turn(conversationPort, scheduler);
    }
}
