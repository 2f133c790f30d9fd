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

/**
 * A single event from a streaming event source. Exactly one payload field is
 * set, matching {@link #type()}.
 */
public record LlmChunk(LlmChunkType type, String delta, ToolCall toolCall, LlmResponse response,
        Throwable error) {

    public static LlmChunk textDelta(String delta) {
        return new LlmChunk(LlmChunkType.TEXT_DELTA, delta, null, null, null);
    }

    public static LlmChunk thinkingDelta(String delta) {
        return new LlmChunk(LlmChunkType.THINKING_DELTA, delta, null, null, null);
    }

    public static LlmChunk toolCallDelta(ToolCall toolCall) {
        return new LlmChunk(LlmChunkType.TOOL_CALL_DELTA, null, toolCall, null, null);
    }

    public static LlmChunk completion(LlmResponse response) {
        return new LlmChunk(LlmChunkType.COMPLETION, null, null, response, null);
    }

    public static LlmChunk error(Throwable error) {
        return new LlmChunk(LlmChunkType.ERROR, null, null, null, error);
    }
}
