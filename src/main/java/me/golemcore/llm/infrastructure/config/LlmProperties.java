package me.golemcore.llm.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the LLM client core. All settings are prefixed
 * with "golemcore.llm".
 */
@ConfigurationProperties(prefix = "golemcore.llm")
@Data
public class LlmProperties {

    private ToolLoopProperties toolLoop = new ToolLoopProperties();

    // ==================== TOOL LOOP ====================

    @Data
    public static class ToolLoopProperties {

        /**
         * Maximum number of model calls per loop invocation.
         */
        private int maxSteps = 10;

        /**
         * Run the tool calls of one step concurrently.
         */
        private boolean parallelToolExecution = true;

        /**
         * How long to wait for an asynchronous tool handler.
         */
        private long toolTimeoutMs = 30_000L;

        /**
         * Size of the tool execution thread pool.
         */
        private int toolExecutorThreads = 4;

        private ApprovalProperties approval = new ApprovalProperties();
    }

    @Data
    public static class ApprovalProperties {

        /**
         * Tool names that always require human approval.
         */
        private List<String> requiredTools = new ArrayList<>();
    }
}
