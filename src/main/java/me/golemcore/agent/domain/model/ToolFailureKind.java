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
 * Machine-readable classification of tool results that carry an error.
 *
 * <p>
 * This exists to avoid relying on string matching in tool error messages.
 */
public enum ToolFailureKind {

    /**
     * Tool execution was skipped because the user declined the confirmation.
     */
    CONFIRMATION_DENIED,

    /**
     * Tool execution was denied by policy (shell allow/block lists, workspace
     * boundaries, disabled tool).
     */
    POLICY_DENIED,

    /**
     * Tool completed but reports a failure (non-zero exit, remote isError,
     * unreadable file, etc.).
     */
    EXECUTION_FAILED,

    /**
     * Tool observed the cancellation token and stopped early.
     */
    CANCELLED
}
