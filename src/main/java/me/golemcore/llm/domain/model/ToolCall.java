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

import lombok.Builder;
import lombok.Value;

/**
 * A function invocation requested by the model. Arguments are kept as the raw
 * JSON string the model produced; they may be partial while a stream is still
 * being aggregated.
 */
@Value
@Builder(toBuilder = true)
public class ToolCall {

    public static final String FUNCTION_TYPE = "function";

    String id;
    @Builder.Default
    String type = FUNCTION_TYPE;
    FunctionCall function;

    public static ToolCall of(String id, String name, String arguments) {
        return ToolCall.builder()
                .id(id)
                .function(new FunctionCall(name, arguments))
                .build();
    }

    public String getName() {
        return function != null ? function.name() : null;
    }

    public String getArguments() {
        return function != null ? function.arguments() : null;
    }

    /**
     * Name and raw JSON arguments of the invoked function.
     */
    public record FunctionCall(String name, String arguments) {
    }
}
