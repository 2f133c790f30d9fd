package me.golemcore.llm.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One executed step: the model response, the calls it requested and their
 * results.
 */
@Value
@Builder
public class ToolLoopStep {

    int index;
    LlmResponse response;
    List<ToolCall> toolCalls;
    List<ToolResult> toolResults;
}
