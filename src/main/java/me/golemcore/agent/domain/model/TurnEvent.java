package me.golemcore.agent.domain.model;

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

/**
 * Event emitted by a turn: streamed text, or tool call progress. Errors are
 * delivered as CONTENT events with bracketed text.
 */
public record TurnEvent(TurnEventType type, String text, ToolCallEvent toolCall) {

    public static TurnEvent content(String text) {
        return new TurnEvent(TurnEventType.CONTENT, text, null);
    }

    public static TurnEvent toolCallInfo(ToolCallEvent toolCall) {
        return new TurnEvent(TurnEventType.TOOL_CALL_INFO, null, toolCall);
    }

    public boolean isContent() {
        return type == TurnEventType.CONTENT;
    }
}
