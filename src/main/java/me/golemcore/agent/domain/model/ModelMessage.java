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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Input to one model turn: either user text or the function responses
 * collected by the previous turn.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelMessage {

    private String text;

    @Builder.Default
    private List<FunctionResponse> functionResponses = new ArrayList<>();

    public static ModelMessage ofText(String text) {
        return ModelMessage.builder().text(text).build();
    }

    public static ModelMessage ofFunctionResponses(List<FunctionResponse> responses) {
        return ModelMessage.builder().functionResponses(new ArrayList<>(responses)).build();
    }

    public boolean isFunctionResponse() {
        return functionResponses != null && !functionResponses.isEmpty();
    }
}
