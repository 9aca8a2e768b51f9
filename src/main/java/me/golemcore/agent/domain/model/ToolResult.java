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

import lombok.Builder;
import lombok.Data;

/**
 * Result of tool execution. {@code llmContent} is fed back to the model as the
 * function response output, {@code returnDisplay} is shown to the user. A
 * non-null {@code error} means the tool completed but reports a domain failure,
 * which is distinct from an exception thrown during execution.
 */
@Data
@Builder
public class ToolResult {

    private Object llmContent;
    private String returnDisplay;
    private String error;
    private ToolFailureKind failureKind;

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * Creates a successful tool result whose model content and display text are
     * the same string.
     */
    public static ToolResult success(String output) {
        return success(output, output);
    }

    /**
     * Creates a successful tool result with separate model content and display
     * text.
     */
    public static ToolResult success(Object llmContent, String returnDisplay) {
        return ToolResult.builder()
                .llmContent(llmContent)
                .returnDisplay(returnDisplay)
                .build();
    }

    /**
     * Creates a failed tool result with an error message.
     */
    public static ToolResult failure(String error) {
        return failure(ToolFailureKind.EXECUTION_FAILED, error);
    }

    /**
     * Creates a failed tool result with a machine-readable failure kind.
     */
    public static ToolResult failure(ToolFailureKind kind, String error) {
        return ToolResult.builder()
                .llmContent("Error: " + error)
                .returnDisplay("Error: " + error)
                .error(error)
                .failureKind(kind)
                .build();
    }
}
