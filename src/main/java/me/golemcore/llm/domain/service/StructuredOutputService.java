package me.golemcore.llm.domain.service;

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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.llm.domain.exception.ProviderException;
import me.golemcore.llm.domain.model.GenerateObjectResult;
import me.golemcore.llm.domain.model.LlmChunk;
import me.golemcore.llm.domain.model.LlmRequest;
import me.golemcore.llm.domain.model.LlmResponse;
import me.golemcore.llm.domain.model.OutputSpec;
import me.golemcore.llm.domain.model.StreamObjectResult;
import me.golemcore.llm.domain.model.ToolCall;
import me.golemcore.llm.domain.model.ToolDefinition;
import me.golemcore.llm.port.outbound.LlmPort;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Asks the model for structured output and decodes it with
 * {@link StructuredOutputParser}.
 */
@Slf4j
public class StructuredOutputService {

    private final LlmPort llmPort;
    private final StructuredOutputParser parser;

    public StructuredOutputService(LlmPort llmPort, StructuredOutputParser parser) {
        this.llmPort = llmPort;
        this.parser = parser;
    }

    /**
     * One non-streaming call. The output is offered to the model as a tool named
     * after it; if the model calls that tool, its arguments are the JSON source,
     * otherwise the response text is.
     */
    public <T> CompletableFuture<GenerateObjectResult<T>> generateObject(LlmRequest request, OutputSpec<T> spec) {
        LlmRequest withReturnTool = withReturnTool(request, spec);
        return llmPort.chat(withReturnTool).thenApply(response -> {
            if (response == null) {
                throw new ProviderException("Provider " + llmPort.getProviderId() + " returned no response");
            }
            return new GenerateObjectResult<>(decode(response, spec), response);
        });
    }

    /**
     * Streams the request and decodes the buffered text once the stream ends.
     * The request starts immediately; {@code chunks} replays every event to each
     * subscriber.
     */
    public <T> StreamObjectResult<T> streamObject(LlmRequest request, OutputSpec<T> spec) {
        StructuredOutputCollector<T> collector = new StructuredOutputCollector<>(parser, spec);
        CompletableFuture<T> object = new CompletableFuture<>();

        Flux<LlmChunk> source = openStream(request)
                .takeUntilOther(request.getCancellationTokenOrNone().whenCancelled());
        Flux<LlmChunk> chunks = source
                .doOnNext(collector::accept)
                .doOnComplete(() -> complete(collector, object, request))
                .doOnError(object::completeExceptionally)
                .cache();

        chunks.subscribe(chunk -> log.trace("[StructuredOutput] chunk {}", chunk.type()),
                error -> log.debug("[StructuredOutput] Stream failed: {}", error.getMessage()));
        return new StreamObjectResult<>(chunks, object);
    }

    private <T> void complete(StructuredOutputCollector<T> collector, CompletableFuture<T> object,
            LlmRequest request) {
        try {
            request.getCancellationTokenOrNone().throwIfCancellationRequested();
            object.complete(collector.finish());
        } catch (RuntimeException e) {
            object.completeExceptionally(e);
        }
    }

    private Flux<LlmChunk> openStream(LlmRequest request) {
        if (llmPort.supportsStreaming()) {
            return Flux.defer(() -> llmPort.chatStream(request));
        }
        return Mono.defer(() -> Mono.fromFuture(llmPort.chat(request)))
                .switchIfEmpty(Mono.error(() -> new ProviderException(
                        "Provider " + llmPort.getProviderId() + " returned no response")))
                .map(LlmChunk::completion)
                .flux();
    }

    private <T> T decode(LlmResponse response, OutputSpec<T> spec) {
        for (ToolCall call : response.getToolCalls()) {
            if (spec.getName().equals(call.getName())) {
                log.debug("[StructuredOutput] Using arguments of '{}' tool call", spec.getName());
                JsonNode arguments = parser.parseObject(call.getArguments());
                return parser.decode(arguments, spec, call.getArguments());
            }
        }
        return parser.extract(response.getText(), spec);
    }

    private static LlmRequest withReturnTool(LlmRequest request, OutputSpec<?> spec) {
        List<ToolDefinition> tools = request.getTools() != null ? new ArrayList<>(request.getTools())
                : new ArrayList<>();
        boolean present = tools.stream().anyMatch(tool -> spec.getName().equals(tool.getName()));
        if (!present) {
            tools.add(spec.toToolDefinition());
        }
        return LlmRequest.builder()
                .messages(request.getMessages())
                .tools(tools)
                .cancellationToken(request.getCancellationTokenOrNone())
                .build();
    }
}
