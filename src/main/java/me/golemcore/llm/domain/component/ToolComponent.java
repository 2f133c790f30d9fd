package me.golemcore.llm.domain.component;

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

import me.golemcore.llm.domain.model.ToolDefinition;

/**
 * A self-describing tool: its catalog entry plus the handler that executes it.
 * Implementations may also gate themselves behind approval.
 */
public interface ToolComponent extends ToolHandler {

    /**
     * Returns the tool definition with JSON Schema for function calling.
     */
    ToolDefinition getDefinition();

    /**
     * Approval check for this tool, or null when it never needs approval.
     */
    default ToolApprovalCheck getApprovalCheck() {
        return null;
    }

    default String getToolName() {
        return getDefinition().getName();
    }
}
