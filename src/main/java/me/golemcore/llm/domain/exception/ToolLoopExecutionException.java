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

import me.golemcore.llm.domain.model.Message;

import java.util.List;

/**
 * Provider failure raised from a blocking entry point. The cause is the
 * original failure; the history built before it is kept for diagnostics.
 */
public class ToolLoopExecutionException extends LlmException {

    private static final long serialVersionUID = 1L;

    private final int stepIndex;
    private final transient List<Message> messages;

    public ToolLoopExecutionException(int stepIndex, List<Message> messages, Throwable cause) {
        super("Tool loop failed at step " + stepIndex + ": " + cause.getMessage(), cause);
        this.stepIndex = stepIndex;
        this.messages = messages != null ? List.copyOf(messages) : List.of();
    }

    public int getStepIndex() {
        return stepIndex;
    }

    public List<Message> getMessages() {
        return messages;
    }
}
