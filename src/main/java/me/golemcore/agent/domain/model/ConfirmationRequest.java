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
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.List;
import java.util.function.Consumer;

/**
 * Describes an action that needs human approval before a tool runs. The UI
 * layer presents it and reports the decision through {@link #confirm}, which
 * runs the tool-specific continuation (for example, allow-listing an MCP
 * server).
 */
@Data
@Builder
public class ConfirmationRequest {

    private ConfirmationType type;
    private String title;

    /** Human-readable target of the action (command, file, server tool, URL). */
    private String target;

    // EXEC
    private String command;
    private String rootCommand;

    // MCP
    private String serverName;
    private String toolName;
    private String toolDisplayName;

    // EDIT
    private String fileName;
    private String filePreview;

    // INFO
    private String prompt;
    private List<String> urls;

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Consumer<ToolConfirmationOutcome> onConfirm;

    /**
     * Reports the user's decision to the tool that requested the confirmation.
     */
    public void confirm(ToolConfirmationOutcome outcome) {
        if (onConfirm != null) {
            onConfirm.accept(outcome);
        }
    }
}
