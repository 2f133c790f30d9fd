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

import me.golemcore.llm.domain.model.StreamPart;
import me.golemcore.llm.domain.model.ToolCall;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Turns one step's deltas into well-nested stream parts.
 *
 * <p>
 * Text and reasoning blocks are mutually exclusive: a delta of one kind closes
 * an open block of the other. Tool-call blocks are keyed by call id and stay
 * open until {@link #closeBlocks()}, which must run before metadata and before
 * any terminal part.
 */
public class StreamPartEmitter {

    private final Consumer<StreamPart> sink;

    private final StringBuilder fullText = new StringBuilder();
    private final StringBuilder fullReasoning = new StringBuilder();
    private final StringBuilder blockText = new StringBuilder();
    private final StringBuilder blockReasoning = new StringBuilder();
    private final Set<String> startedToolCalls = new LinkedHashSet<>();
    private boolean inText;
    private boolean inReasoning;

    public StreamPartEmitter(Consumer<StreamPart> sink) {
        this.sink = sink;
    }

    public void onTextDelta(String delta) {
        if (delta == null || delta.isEmpty()) {
            return;
        }
        closeReasoning();
        if (!inText) {
            inText = true;
            sink.accept(StreamPart.textStart());
        }
        blockText.append(delta);
        fullText.append(delta);
        sink.accept(StreamPart.textDelta(delta));
    }

    public void onReasoningDelta(String delta) {
        if (delta == null || delta.isEmpty()) {
            return;
        }
        closeText();
        if (!inReasoning) {
            inReasoning = true;
            sink.accept(StreamPart.reasoningStart());
        }
        blockReasoning.append(delta);
        fullReasoning.append(delta);
        sink.accept(StreamPart.reasoningDelta(delta));
    }

    /**
     * Emits a fragment whose id is already resolved by the aggregator.
     */
    public void onToolCallDelta(ToolCall fragment) {
        if (startedToolCalls.add(fragment.getId())) {
            sink.accept(StreamPart.toolCallStart(fragment));
        } else {
            sink.accept(StreamPart.toolCallDelta(fragment));
        }
    }

    /**
     * Closes every open block exactly once. Safe to call repeatedly.
     */
    public void closeBlocks() {
        closeText();
        closeReasoning();
        for (String id : startedToolCalls) {
            sink.accept(StreamPart.toolCallEnd(id));
        }
        startedToolCalls.clear();
    }

    public String getText() {
        return fullText.toString();
    }

    public String getReasoning() {
        return fullReasoning.toString();
    }

    private void closeText() {
        if (inText) {
            inText = false;
            sink.accept(StreamPart.textEnd(blockText.toString()));
            blockText.setLength(0);
        }
    }

    private void closeReasoning() {
        if (inReasoning) {
            inReasoning = false;
            sink.accept(StreamPart.reasoningEnd(blockReasoning.toString()));
            blockReasoning.setLength(0);
        }
    }
}
