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

import me.golemcore.llm.domain.model.ToolCall;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges streamed tool-call fragments into complete calls.
 *
 * <p>
 * Fragments are grouped by id in first-seen order. The first non-empty name
 * wins and later names never replace it. Argument fragments are concatenated
 * as strings in arrival order without any JSON validation. A fragment without
 * an id continues the most recent call.
 */
public class ToolCallAggregator {

    private final Map<String, Accumulator> accumulators = new LinkedHashMap<>();
    private String lastId;

    /**
     * Merges one fragment and returns it with its resolved call id.
     */
    public ToolCall addDelta(ToolCall fragment) {
        String id = fragment.getId();
        if (id == null || id.isEmpty()) {
            id = lastId != null ? lastId : "call_" + accumulators.size();
        }
        lastId = id;

        Accumulator accumulator = accumulators.computeIfAbsent(id, Accumulator::new);
        accumulator.merge(fragment);

        return id.equals(fragment.getId()) ? fragment : fragment.toBuilder().id(id).build();
    }

    public boolean isEmpty() {
        return accumulators.isEmpty();
    }

    /**
     * Calls aggregated so far, in first-seen order.
     */
    public List<ToolCall> completed() {
        List<ToolCall> calls = new ArrayList<>(accumulators.size());
        for (Accumulator accumulator : accumulators.values()) {
            calls.add(accumulator.toToolCall());
        }
        return calls;
    }

    /**
     * Aggregates a finished batch of fragments.
     */
    public static List<ToolCall> aggregate(List<ToolCall> fragments) {
        ToolCallAggregator aggregator = new ToolCallAggregator();
        for (ToolCall fragment : fragments) {
            aggregator.addDelta(fragment);
        }
        return aggregator.completed();
    }

    private static final class Accumulator {

        private final String id;
        private String type;
        private String name;
        private final StringBuilder arguments = new StringBuilder();

        private Accumulator(String id) {
            this.id = id;
        }

        private void merge(ToolCall fragment) {
            if (type == null && fragment.getType() != null && !fragment.getType().isEmpty()) {
                type = fragment.getType();
            }
            String fragmentName = fragment.getName();
            if ((name == null || name.isEmpty()) && fragmentName != null && !fragmentName.isEmpty()) {
                name = fragmentName;
            }
            if (fragment.getArguments() != null) {
                arguments.append(fragment.getArguments());
            }
        }

        private ToolCall toToolCall() {
            return ToolCall.builder()
                    .id(id)
                    .type(type != null ? type : ToolCall.FUNCTION_TYPE)
                    .function(new ToolCall.FunctionCall(name != null ? name : "", arguments.toString()))
                    .build();
        }
    }
}
