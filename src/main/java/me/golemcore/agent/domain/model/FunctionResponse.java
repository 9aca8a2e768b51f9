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

/**
 * Function response sent back to the model on the next turn. The payload holds
 * either {@code output} or {@code error}.
 *
 * @param id
 *            call id the response answers
 * @param name
 *            tool name as requested
 * @param response
 *            response payload; values may be null
 */
public record FunctionResponse(String id, String name, Map<String, Object> response) {

    public static final String OUTPUT_KEY = "output";
    public static final String ERROR_KEY = "error";

    public static FunctionResponse output(String id, String name, Object output) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(OUTPUT_KEY, output);
        return new FunctionResponse(id, name, Collections.unmodifiableMap(payload));
    }

    public static FunctionResponse error(String id, String name, String error) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(ERROR_KEY, error);
        return new FunctionResponse(id, name, Collections.unmodifiableMap(payload));
    }

    public boolean isError() {
        return response != null && response.containsKey(ERROR_KEY);
    }
}
