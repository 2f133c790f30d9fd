package me.golemcore.llm.domain.model;

import me.golemcore.llm.domain.cancellation.CancellationToken;

import java.util.Map;

/**
 * What a tool handler receives. {@code arguments} is populated only for
 * handlers that ask for parsed input; otherwise the raw JSON is available
 * through the call.
 */
public record ToolInvocation(ToolCall call, Map<String, Object> arguments, CancellationToken cancellationToken) {

    public String rawArguments() {
        return call.getArguments();
    }
}
