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

import me.golemcore.llm.domain.exception.ProviderException;
import me.golemcore.llm.domain.model.LlmChunk;
import me.golemcore.llm.domain.model.LlmResponse;
import me.golemcore.llm.domain.model.OutputSpec;

/**
 * Buffers streamed text for structured output. Extraction runs only once the
 * stream is over; when no text deltas arrived, the completion text is used
 * instead.
 */
public class StructuredOutputCollector<T> {

    private final StructuredOutputParser parser;
    private final OutputSpec<T> spec;
    private final StringBuilder buffer = new StringBuilder();
    private LlmResponse completion;
    private Throwable error;

    public StructuredOutputCollector(StructuredOutputParser parser, OutputSpec<T> spec) {
        this.parser = parser;
        this.spec = spec;
    }

    public void accept(LlmChunk chunk) {
        switch (chunk.type()) {
        case TEXT_DELTA -> {
            if (chunk.delta() != null) {
                buffer.append(chunk.delta());
            }
        }
        case COMPLETION -> completion = chunk.response();
        case ERROR -> error = chunk.error();
        default -> {
            // reasoning and tool-call deltas carry no output text
        }
        }
    }

    /**
     * Text the object is extracted from.
     */
    public String getText() {
        if (buffer.length() > 0) {
            return buffer.toString();
        }
        return completion != null ? completion.getText() : null;
    }

    public LlmResponse getCompletion() {
        return completion;
    }

    /**
     * Extracts the object from everything collected so far.
     */
    public T finish() {
        if (error != null) {
            throw new ProviderException("Stream failed before structured output completed: " + error.getMessage(),
                    error);
        }
        return parser.extract(getText(), spec);
    }
}
