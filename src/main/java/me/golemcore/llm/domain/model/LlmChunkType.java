package me.golemcore.llm.domain.model;

/**
 * Kinds of events emitted by an event source during one step.
 */
public enum LlmChunkType {
    TEXT_DELTA, THINKING_DELTA, TOOL_CALL_DELTA, COMPLETION, ERROR
}
