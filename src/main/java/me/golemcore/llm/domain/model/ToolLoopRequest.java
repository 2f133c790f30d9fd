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
import me.golemcore.llm.domain.cancellation.CancellationToken;
import me.golemcore.llm.domain.component.ToolApprovalCheck;
import me.golemcore.llm.domain.component.ToolHandler;

import java.util.List;
import java.util.Map;

/**
 * Input of one tool loop invocation. {@code needsApproval} is a global gate
 * consulted for every call in addition to the per-tool checks. A null
 * {@code maxSteps} falls back to the configured default.
 */
@Value
@Builder(toBuilder = true)
public class ToolLoopRequest {

    List<Message> messages;
    List<ToolDefinition> tools;
    Map<String, ToolHandler> toolHandlers;
    Map<String, ToolApprovalCheck> toolApprovalChecks;
    ToolApprovalCheck needsApproval;
    Integer maxSteps;
    CancellationToken cancellationToken;

    public List<ToolDefinition> getToolsOrEmpty() {
        return tools != null ? tools : List.of();
    }

    public Map<String, ToolHandler> getToolHandlersOrEmpty() {
        return toolHandlers != null ? toolHandlers : Map.of();
    }

    public Map<String, ToolApprovalCheck> getToolApprovalChecksOrEmpty() {
        return toolApprovalChecks != null ? toolApprovalChecks : Map.of();
    }

    public CancellationToken getCancellationTokenOrNone() {
        return cancellationToken != null ? cancellationToken : CancellationToken.NONE;
    }

    public static class ToolLoopRequestBuilder {

        /**
         * Sets tools, handlers and approval checks from one registry.
         */
        public ToolLoopRequestBuilder toolSet(ToolSet toolSet) {
            return tools(toolSet.getDefinitions())
                    .toolHandlers(toolSet.getHandlers())
                    .toolApprovalChecks(toolSet.getApprovalChecks());
        }
    }
}
