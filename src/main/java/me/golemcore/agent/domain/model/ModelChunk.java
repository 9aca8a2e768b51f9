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
 * One chunk of a streamed model response: optional text and zero or more
 * function calls.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelChunk {

    private String text;

    @Builder.Default
    private List<FunctionCall> functionCalls = new ArrayList<>();

    public static ModelChunk text(String text) {
        return ModelChunk.builder().text(text).build();
    }

    public static ModelChunk calls(FunctionCall... calls) {
        return ModelChunk.builder().functionCalls(new ArrayList<>(List.of(calls))).build();
    }

    public boolean hasText() {
        return text != null && !text.isEmpty();
    }

    public boolean hasFunctionCalls() {
        return functionCalls != null && !functionCalls.isEmpty();
    }
}
