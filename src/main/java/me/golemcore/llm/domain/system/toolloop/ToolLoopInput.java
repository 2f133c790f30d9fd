package me.golemcore.llm.domain.system.toolloop;

import me.golemcore.llm.domain.cancellation.CancellationToken;
import me.golemcore.llm.domain.component.ToolApprovalCheck;
import me.golemcore.llm.domain.component.ToolHandler;
import me.golemcore.llm.domain.model.Message;
import me.golemcore.llm.domain.model.ToolDefinition;

import java.util.List;
import java.util.Map;

/**
 * Validated, null-free view of a loop request.
 */
record ToolLoopInput(List<Message> messages, List<ToolDefinition> tools, Map<String, ToolHandler> toolHandlers,
        Map<String, ToolApprovalCheck> toolApprovalChecks, ToolApprovalCheck needsApproval, int maxSteps,
        CancellationToken cancellationToken) {
}
