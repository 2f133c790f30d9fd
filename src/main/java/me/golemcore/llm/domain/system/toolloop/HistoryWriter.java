package me.golemcore.llm.domain.system.toolloop;

import me.golemcore.llm.domain.model.LlmResponse;
import me.golemcore.llm.domain.model.Message;
import me.golemcore.llm.domain.model.ToolCall;
import me.golemcore.llm.domain.model.ToolResult;

import java.util.List;

/**
 * Single point of conversation history mutation for the tool loop.
 */
public interface HistoryWriter {

    void appendAssistantToolCalls(List<Message> messages, LlmResponse response, List<ToolCall> toolCalls);

    void appendToolResults(List<Message> messages, List<ToolResult> results);

    void appendFinalAssistantAnswer(List<Message> messages, LlmResponse response, String finalText);
}
