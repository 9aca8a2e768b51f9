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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * A model-requested invocation of a named tool. Created when the model stream
 * yields a function call and immutable thereafter.
 *
 * @param callId
 *            id supplied by the model, or synthesized to be unique within a turn
 * @param name
 *            registry name of the requested tool
 * @param args
 *            call arguments (never null)
 */
public record ToolCallRequest(String callId, String name, Map<String, Object> args) {

    public static final String UNDEFINED_TOOL_NAME = "undefined_tool_name";

    public ToolCallRequest {
        args = args == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(args));
    }

    /**
     * Builds a request from a streamed function call, filling in a synthetic id
     * and defaults for missing fields.
     */
    public static ToolCallRequest fromFunctionCall(FunctionCall functionCall) {
        String name = functionCall.getName() != null && !functionCall.getName().isBlank()
                ? functionCall.getName()
                : UNDEFINED_TOOL_NAME;
        String callId = functionCall.getId() != null && !functionCall.getId().isBlank()
                ? functionCall.getId()
                : synthesizeCallId(name);
        return new ToolCallRequest(callId, name, functionCall.getArgs());
    }

    static String synthesizeCallId(String name) {
        String suffix = Long.toHexString(ThreadLocalRandom.current().nextLong() & Long.MAX_VALUE);
        return name + "-" + System.currentTimeMillis() + "-" + suffix;
    }
}
