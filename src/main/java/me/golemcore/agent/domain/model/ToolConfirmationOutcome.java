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
 * Decision taken by the user on a {@link ConfirmationRequest}.
 */
public enum ToolConfirmationOutcome {

    PROCEED_ONCE,

    /** Proceed and remember the approval for this tool (or shell command roots). */
    PROCEED_ALWAYS,

    /** Proceed and trust every tool of the same MCP server. */
    PROCEED_ALWAYS_SERVER,

    /** Proceed and trust this MCP tool. */
    PROCEED_ALWAYS_TOOL,

    CANCEL;

    public boolean isProceed() {
        return this != CANCEL;
    }
}
