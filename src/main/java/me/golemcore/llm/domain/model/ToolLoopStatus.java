package me.golemcore.llm.domain.model;

public enum ToolLoopStatus {
    COMPLETED, BLOCKED
}
