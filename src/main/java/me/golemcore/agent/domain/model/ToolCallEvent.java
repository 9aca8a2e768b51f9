package me.golemcore.agent.domain.model;

import java.util.Map;

/**
 * Progress report for one tool call.
 *
 * @param status
 *            PENDING when registered, then CONFIRMING or INVOKED
 * @param callId
 *            call id
 * @param name
 *            tool name
 * @param args
 *            call arguments
 * @param resultDisplay
 *            user-facing result text (INVOKED only)
 * @param confirmationDetails
 *            pending approval (CONFIRMING only)
 */
public record ToolCallEvent(ToolCallStatus status, String callId, String name, Map<String, Object> args,
        String resultDisplay, ConfirmationRequest confirmationDetails) {

    public static ToolCallEvent pending(ToolCallRequest request) {
        return new ToolCallEvent(ToolCallStatus.PENDING, request.callId(), request.name(), request.args(), null,
                null);
    }

    public static ToolCallEvent confirming(ToolExecutionOutcome outcome) {
        return new ToolCallEvent(ToolCallStatus.CONFIRMING, outcome.callId(), outcome.name(), outcome.args(), null,
                outcome.confirmationDetails());
    }

    public static ToolCallEvent invoked(ToolExecutionOutcome outcome) {
        String display = outcome.result() != null ? outcome.result().getReturnDisplay() : null;
        return new ToolCallEvent(ToolCallStatus.INVOKED, outcome.callId(), outcome.name(), outcome.args(), display,
                null);
    }
}
