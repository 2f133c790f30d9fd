package me.golemcore.llm.domain.component;

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

import me.golemcore.llm.domain.cancellation.CancellationToken;
import me.golemcore.llm.domain.model.ToolInvocation;

import java.util.Map;

/**
 * Executes one tool call. The returned value is encoded as the tool result
 * content: strings pass through, numbers and booleans become JSON literals,
 * anything else is serialized with Jackson. A returned
 * {@link java.util.concurrent.CompletionStage} is awaited. Thrown exceptions
 * become error results and never abort the loop.
 */
@FunctionalInterface
public interface ToolHandler {

    Object handle(ToolInvocation invocation) throws Exception;

    /**
     * Whether the executor must parse the call arguments into a JSON object
     * before invoking this handler.
     */
    default boolean expectsArguments() {
        return false;
    }

    /**
     * Wraps a handler that works on parsed arguments.
     */
    static ToolHandler withArguments(ArgumentsHandler handler) {
        return new ToolHandler() {
            @Override
            public Object handle(ToolInvocation invocation) throws Exception {
                return handler.handle(invocation.arguments(), invocation.cancellationToken());
            }

            @Override
            public boolean expectsArguments() {
                return true;
            }
        };
    }

    @FunctionalInterface
    interface ArgumentsHandler {
        Object handle(Map<String, Object> arguments, CancellationToken cancellationToken) throws Exception;
    }
}
