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

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Final response of one model step. When the event source supplies
 * {@code assistantMessage}, the engine persists it verbatim instead of
 * synthesizing one from text and tool calls.
 */
@Value
@Builder(toBuilder = true)
public class LlmResponse {

    String text;
    String thinking;
    @Builder.Default
    List<ToolCall> toolCalls = List.of();
    LlmUsage usage;
    Map<String, JsonNode> providerMetadata;
    String finishReason;
    String model;
    Message assistantMessage;

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    public boolean hasAssistantMessage() {
        return assistantMessage != null;
    }

    public boolean hasProviderMetadata() {
        return providerMetadata != null && !providerMetadata.isEmpty();
    }

    public static LlmResponse text(String text) {
        return LlmResponse.builder().text(text).finishReason("stop").build();
    }

    public static LlmResponse toolCalls(List<ToolCall> toolCalls) {
        return LlmResponse.builder().toolCalls(List.copyOf(toolCalls)).finishReason("tool_calls").build();
    }
}
