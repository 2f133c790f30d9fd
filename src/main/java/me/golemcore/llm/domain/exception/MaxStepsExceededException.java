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
 * The model kept requesting tools until the step budget ran out. Carries the
 * history accumulated up to the last executed step.
 */
public class MaxStepsExceededException extends InvalidRequestException {

    private static final long serialVersionUID = 1L;

    private final int maxSteps;
    private final transient List<Message> messages;

    public MaxStepsExceededException(int maxSteps, List<Message> messages) {
        super("Tool loop exceeded maxSteps (" + maxSteps + "). "
                + "The model kept requesting tools and did not produce a final response.");
        this.maxSteps = maxSteps;
        this.messages = messages != null ? List.copyOf(messages) : List.of();
    }

    public int getMaxSteps() {
        return maxSteps;
    }

    public List<Message> getMessages() {
        return messages;
    }
}
