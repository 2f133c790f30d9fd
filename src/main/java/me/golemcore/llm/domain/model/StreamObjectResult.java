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

import reactor.core.publisher.Flux;

import java.util.concurrent.CompletableFuture;

/**
 * Streaming structured output. {@code chunks} replays the upstream events
 * (subscribing to it drives the request); {@code object} completes once the
 * stream ends and the buffered text has been extracted and validated.
 */
public record StreamObjectResult<T>(Flux<LlmChunk> chunks, CompletableFuture<T> object) {
}
