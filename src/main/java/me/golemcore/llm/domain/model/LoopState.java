package me.golemcore.llm.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Snapshot of a loop that stopped waiting for approval. {@code messages}
 * already ends with the assistant tool-use message and contains no results
 * for the pending calls.
 */
@Value
@Builder
public class LoopState {

    List<Message> messages;
    List<ToolCall> pendingToolCalls;
    List<ToolCall> toolCallsNeedingApproval;
    int stepIndex;
    LlmResponse stepResponse;
    List<ToolLoopStep> steps;

    public boolean needsApproval(ToolCall call) {
        return toolCallsNeedingApproval.stream().anyMatch(c -> c.getId().equals(call.getId()));
    }

    /**
     * Builds the history to resume with: the blocked messages followed by one
     * tool-result message.
     */
    public List<Message> messagesWithToolResults(List<ToolResult> results) {
        List<Message> resumed = new ArrayList<>(messages);
        resumed.add(Message.toolResults(results));
        return resumed;
    }

    public String describeCallsNeedingApproval() {
        return toolCallsNeedingApproval.stream()
                .map(c -> c.getName() + "#" + c.getId())
                .collect(Collectors.joining(", "));
    }
}
