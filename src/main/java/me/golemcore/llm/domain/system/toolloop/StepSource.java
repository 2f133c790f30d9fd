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

import me.golemcore.llm.domain.exception.ProviderException;
import me.golemcore.llm.domain.model.LlmChunk;
import me.golemcore.llm.domain.model.LlmRequest;
import me.golemcore.llm.domain.model.LlmResponse;
import me.golemcore.llm.domain.model.ToolCall;
import me.golemcore.llm.port.outbound.LlmPort;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Produces the chunk sequence of one model step. Chosen once per
 * {@link LlmPort} so the loop never branches on provider capabilities.
 */
interface StepSource {

    Flux<LlmChunk> open(LlmRequest request);

    static StepSource forPort(LlmPort llmPort) {
        if (llmPort.supportsStreaming()) {
            return request -> Flux.defer(() -> llmPort.chatStream(request));
        }
        return request -> Mono.defer(() -> Mono.fromFuture(llmPort.chat(request)))
                .switchIfEmpty(Mono.error(() -> new ProviderException(
                        "Provider " + llmPort.getProviderId() + " returned no response")))
                .flatMapMany(response -> Flux.fromIterable(replay(response)));
    }

    /**
     * Chunks equivalent to a finished response: reasoning, text, one fragment
     * per tool call, then the completion.
     */
    static List<LlmChunk> replay(LlmResponse response) {
        List<LlmChunk> chunks = new ArrayList<>();
        if (response.getThinking() != null && !response.getThinking().isEmpty()) {
            chunks.add(LlmChunk.thinkingDelta(response.getThinking()));
        }
        if (response.getText() != null && !response.getText().isEmpty()) {
            chunks.add(LlmChunk.textDelta(response.getText()));
        }
        if (response.getToolCalls() != null) {
            for (ToolCall call : response.getToolCalls()) {
                chunks.add(LlmChunk.toolCallDelta(call));
            }
        }
        chunks.add(LlmChunk.completion(response));
        return chunks;
    }
}
