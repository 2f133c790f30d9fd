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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One element of the normalized part stream. Blocks are well-nested: every
 * {@code *_START} is closed by its {@code *_END} before metadata, and
 * {@code FINISH} or {@code ERROR} is always the last part.
 *
 * @param type
 *            part kind
 * @param text
 *            delta for {@code *_DELTA}, accumulated text for {@code TEXT_END}
 *            and {@code REASONING_END}
 * @param toolCallId
 *            call id for {@code TOOL_CALL_END}
 */
public record StreamPart(StreamPartType type, String text, ToolCall toolCall, String toolCallId,
        ToolResult toolResult, Map<String, JsonNode> providerMetadata, LlmResponse response, Throwable error) {

    public static StreamPart textStart() {
        return of(StreamPartType.TEXT_START, null);
    }

    public static StreamPart textDelta(String delta) {
        return of(StreamPartType.TEXT_DELTA, delta);
    }

    public static StreamPart textEnd(String text) {
        return of(StreamPartType.TEXT_END, text);
    }

    public static StreamPart reasoningStart() {
        return of(StreamPartType.REASONING_START, null);
    }

    public static StreamPart reasoningDelta(String delta) {
        return of(StreamPartType.REASONING_DELTA, delta);
    }

    public static StreamPart reasoningEnd(String text) {
        return of(StreamPartType.REASONING_END, text);
    }

    public static StreamPart toolCallStart(ToolCall call) {
        return new StreamPart(StreamPartType.TOOL_CALL_START, null, call, call.getId(), null, null, null, null);
    }

    public static StreamPart toolCallDelta(ToolCall call) {
        return new StreamPart(StreamPartType.TOOL_CALL_DELTA, null, call, call.getId(), null, null, null, null);
    }

    public static StreamPart toolCallEnd(String toolCallId) {
        return new StreamPart(StreamPartType.TOOL_CALL_END, null, null, toolCallId, null, null, null, null);
    }

    public static StreamPart toolResult(ToolResult result) {
        return new StreamPart(StreamPartType.TOOL_RESULT, null, null, result.getToolCallId(), result, null, null,
                null);
    }

    public static StreamPart providerMetadata(Map<String, JsonNode> metadata) {
        return new StreamPart(StreamPartType.PROVIDER_METADATA, null, null, null, null, Collections.unmodifiableMap(new LinkedHashMap<>(metadata)), null,
                null);
    }

    public static StreamPart finish(LlmResponse response) {
        return new StreamPart(StreamPartType.FINISH, null, null, null, null, null, response, null);
    }

    public static StreamPart error(Throwable error) {
        return new StreamPart(StreamPartType.ERROR, null, null, null, null, null, null, error);
    }

    private static StreamPart of(StreamPartType type, String text) {
        return new StreamPart(type, text, null, null, null, null, null, null);
    }
}
