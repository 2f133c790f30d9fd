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
import lombok.Data;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A single conversation message. Carries text, tool-use parts (assistant) or
 * tool-result parts (user), plus an ordered map of provider extensions that
 * the engine copies verbatim and never interprets.
 */
@Data
@Builder(toBuilder = true)
public class Message {

    public static final String ROLE_SYSTEM = "system";
    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";

    private String id;
    private String role; // system, user, assistant
    private String content;

    private List<ToolCall> toolCalls;
    private List<ToolResult> toolResults;

    @Builder.Default
    private Map<String, JsonNode> providerExtensions = new LinkedHashMap<>();
    private Instant timestamp;

    public static Message system(String content) {
        return Message.builder().role(ROLE_SYSTEM).content(content).build();
    }

    public static Message user(String content) {
        return Message.builder().role(ROLE_USER).content(content).build();
    }

    public static Message assistant(String content) {
        return Message.builder().role(ROLE_ASSISTANT).content(content).build();
    }

    /**
     * Assistant message requesting the given tool calls.
     */
    public static Message toolUse(List<ToolCall> toolCalls) {
        return Message.builder()
                .role(ROLE_ASSISTANT)
                .toolCalls(List.copyOf(toolCalls))
                .build();
    }

    /**
     * User message answering every tool call of the preceding assistant message.
     */
    public static Message toolResults(List<ToolResult> results) {
        return Message.builder()
                .role(ROLE_USER)
                .toolResults(List.copyOf(results))
                .build();
    }

    public boolean isUserMessage() {
        return ROLE_USER.equals(role);
    }

    public boolean isAssistantMessage() {
        return ROLE_ASSISTANT.equals(role);
    }

    public boolean isSystemMessage() {
        return ROLE_SYSTEM.equals(role);
    }

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    public boolean hasToolResults() {
        return toolResults != null && !toolResults.isEmpty();
    }
}
