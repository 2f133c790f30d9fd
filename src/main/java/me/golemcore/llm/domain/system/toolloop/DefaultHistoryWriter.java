package me.golemcore.llm.domain.system.toolloop;

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

import me.golemcore.llm.domain.model.LlmResponse;
import me.golemcore.llm.domain.model.Message;
import me.golemcore.llm.domain.model.ToolCall;
import me.golemcore.llm.domain.model.ToolResult;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Appends loop messages to the working history. An assistant message supplied
 * by the event source is stored verbatim, provider extensions included;
 * otherwise one is synthesized from the response.
 */
public class DefaultHistoryWriter implements HistoryWriter {

    private final Clock clock;

    public DefaultHistoryWriter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void appendAssistantToolCalls(List<Message> messages, LlmResponse response, List<ToolCall> toolCalls) {
        if (response != null && response.hasAssistantMessage()) {
            messages.add(response.getAssistantMessage());
            return;
        }
        messages.add(Message.toolUse(toolCalls).toBuilder()
                .id(UUID.randomUUID().toString())
                .content(response != null ? response.getText() : null)
                .timestamp(now())
                .build());
    }

    @Override
    public void appendToolResults(List<Message> messages, List<ToolResult> results) {
        messages.add(Message.toolResults(results).toBuilder()
                .id(UUID.randomUUID().toString())
                .timestamp(now())
                .build());
    }

    @Override
    public void appendFinalAssistantAnswer(List<Message> messages, LlmResponse response, String finalText) {
        if (response != null && response.hasAssistantMessage()) {
            messages.add(response.getAssistantMessage());
            return;
        }
        if (finalText == null || finalText.isEmpty()) {
            return;
        }
        messages.add(Message.assistant(finalText).toBuilder()
                .id(UUID.randomUUID().toString())
                .timestamp(now())
                .build());
    }

    private Instant now() {
        return clock != null ? clock.instant() : Instant.now();
    }
}
