package me.golemcore.agent.domain.model;

public enum TurnEventType {
    CONTENT, TOOL_CALL_INFO
}
