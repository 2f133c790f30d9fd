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

/**
 * Outcome of executing one tool call. Content is always a JSON string; error
 * results carry an {@code {"error": "..."}} object.
 */
@Value
@Builder
public class ToolResult {

    String toolCallId;
    String toolName;
    String content;
    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isError()
    boolean error;
    ToolFailureKind failureKind;

    public static ToolResult success(ToolCall call, String content) {
        return ToolResult.builder()
                .toolCallId(call.getId())
                .toolName(call.getName())
                .content(content)
                .build();
    }

    public static ToolResult failure(ToolCall call, ToolFailureKind kind, String content) {
        return ToolResult.builder()
                .toolCallId(call.getId())
                .toolName(call.getName())
                .content(content)
                .error(true)
                .failureKind(kind)
                .build();
    }
}
