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

import me.golemcore.llm.domain.model.Message;
import me.golemcore.llm.domain.model.ToolCall;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Decides whether a tool call must be approved by a human before it runs. The
 * check sees the conversation so far and the zero-based step index.
 */
@FunctionalInterface
public interface ToolApprovalCheck {

    CompletableFuture<Boolean> needsApproval(ToolCall call, List<Message> messages, int stepIndex);

    static ToolApprovalCheck of(Predicate predicate) {
        return (call, messages, stepIndex) -> CompletableFuture
                .completedFuture(predicate.test(call, messages, stepIndex));
    }

    static ToolApprovalCheck always() {
        return of((call, messages, stepIndex) -> true);
    }

    /**
     * Synchronous form of the check.
     */
    @FunctionalInterface
    interface Predicate {
        boolean test(ToolCall call, List<Message> messages, int stepIndex);
    }
}
