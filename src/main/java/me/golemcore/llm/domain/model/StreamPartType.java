package me.golemcore.llm.domain.model;

/**
 * Kinds of parts in the normalized output stream of a tool loop.
 */
public enum StreamPartType {
    TEXT_START, TEXT_DELTA, TEXT_END, REASONING_START, REASONING_DELTA, REASONING_END, TOOL_CALL_START, TOOL_CALL_DELTA, TOOL_CALL_END, TOOL_RESULT, PROVIDER_METADATA, FINISH, ERROR;

    public boolean isTerminal() {
        return this == FINISH || this == ERROR;
    }
}
