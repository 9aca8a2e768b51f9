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

import java.util.Map;

/**
 * The scheduler's resolution of one {@link ToolCallRequest}. Exactly one of
 * {@code result}, {@code error} and {@code confirmationDetails} is populated.
 *
 * @param callId
 *            call id as provided by the model (or synthesized)
 * @param name
 *            tool name as requested
 * @param args
 *            call arguments
 * @param result
 *            tool result when the tool was executed
 * @param error
 *            failure when the tool was unknown or threw during execution
 * @param confirmationDetails
 *            pending approval when the tool was not executed
 */
public record ToolExecutionOutcome(String callId, String name, Map<String, Object> args, ToolResult result,
        Throwable error, ConfirmationRequest confirmationDetails) {

    public static ToolExecutionOutcome executed(ToolCallRequest request, ToolResult result) {
        return new ToolExecutionOutcome(request.callId(), request.name(), request.args(), result, null, null);
    }

    public static ToolExecutionOutcome failed(ToolCallRequest request, Throwable error) {
        return new ToolExecutionOutcome(request.callId(), request.name(), request.args(), null, error, null);
    }

    public static ToolExecutionOutcome awaitingConfirmation(ToolCallRequest request,
            ConfirmationRequest confirmationDetails) {
        return new ToolExecutionOutcome(request.callId(), request.name(), request.args(), null, null,
                confirmationDetails);
    }

    public ToolCallRequest toRequest() {
        return new ToolCallRequest(callId, name, args);
    }

    public boolean hasError() {
        return error != null;
    }

    public boolean hasDomainError() {
        return result != null && result.getError() != null;
    }

    public boolean isAwaitingConfirmation() {
        return confirmationDetails != null;
    }

    /**
     * Returns the error message in the form shown to users and the model.
     */
    public String errorMessage() {
        if (error == null) {
            return null;
        }
        String message = error.getMessage();
        return message != null && !message.isBlank() ? message : error.toString();
    }
}
