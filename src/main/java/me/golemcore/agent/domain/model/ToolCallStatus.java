package me.golemcore.agent.domain.model;

/**
 * Status of a tool call as observed on emitted {@link ToolCallEvent}s. It is
 * not stored on the request itself.
 */
public enum ToolCallStatus {

    /** Registered from the stream, not yet evaluated. */
    PENDING,

    /** A confirmation request was produced; the call did not run. */
    CONFIRMING,

    /** The tool was executed; success or failure lives in the result. */
    INVOKED
}
