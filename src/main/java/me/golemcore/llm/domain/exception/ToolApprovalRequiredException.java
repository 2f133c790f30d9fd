package me.golemcore.llm.domain.exception;

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

import me.golemcore.llm.domain.model.LoopState;

/**
 * The loop stopped because at least one requested tool call needs human
 * approval. The blocked state holds everything needed to resume.
 */
public class ToolApprovalRequiredException extends LlmException {

    private static final long serialVersionUID = 1L;

    private final transient LoopState state;

    public ToolApprovalRequiredException(LoopState state) {
        super("Tool approval required for: " + state.describeCallsNeedingApproval());
        this.state = state;
    }

    public LoopState getState() {
        return state;
    }
}
