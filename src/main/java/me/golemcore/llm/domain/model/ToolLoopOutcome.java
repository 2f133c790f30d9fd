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
 * Result of a loop run that may stop for approval: either a finished result or
 * a blocked state.
 */
public record ToolLoopOutcome(ToolLoopStatus status, ToolLoopResult result, LoopState state) {

    public static ToolLoopOutcome completed(ToolLoopResult result) {
        return new ToolLoopOutcome(ToolLoopStatus.COMPLETED, result, null);
    }

    public static ToolLoopOutcome blocked(LoopState state) {
        return new ToolLoopOutcome(ToolLoopStatus.BLOCKED, null, state);
    }

    public boolean isBlocked() {
        return status == ToolLoopStatus.BLOCKED;
    }
}
