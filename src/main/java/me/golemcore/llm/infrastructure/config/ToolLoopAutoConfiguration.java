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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import me.golemcore.llm.domain.service.StructuredOutputParser;
import me.golemcore.llm.domain.service.StructuredOutputService;
import me.golemcore.llm.domain.service.ToolApprovalPolicy;
import me.golemcore.llm.domain.service.ToolCallExecutionService;
import me.golemcore.llm.domain.system.toolloop.DefaultHistoryWriter;
import me.golemcore.llm.domain.system.toolloop.DefaultToolLoopSystem;
import me.golemcore.llm.domain.system.toolloop.HistoryWriter;
import me.golemcore.llm.domain.system.toolloop.ToolLoopSystem;
import me.golemcore.llm.port.outbound.LlmPort;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the tool loop. Beans depending on a model backend are only created
 * when an {@link LlmPort} bean is present.
 */
@AutoConfiguration(after = JacksonAutoConfiguration.class)
@EnableConfigurationProperties(LlmProperties.class)
public class ToolLoopAutoConfiguration {

    public static final String TOOL_EXECUTOR_BEAN = "toolLoopExecutor";

    @Bean
    @ConditionalOnMissingBean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = TOOL_EXECUTOR_BEAN, destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = TOOL_EXECUTOR_BEAN)
    public ExecutorService toolLoopExecutor(LlmProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "tool-exec-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(Math.max(1, properties.getToolLoop().getToolExecutorThreads()),
                threadFactory);
    }

    @Bean
    @ConditionalOnMissingBean
    public ToolCallExecutionService toolCallExecutionService(ObjectMapper objectMapper, LlmProperties properties,
            @Qualifier(TOOL_EXECUTOR_BEAN) ExecutorService toolLoopExecutor) {
        return new ToolCallExecutionService(objectMapper, properties.getToolLoop(), toolLoopExecutor);
    }

    @Bean
    @ConditionalOnMissingBean
    public ToolApprovalPolicy toolApprovalPolicy(LlmProperties properties) {
        return new ToolApprovalPolicy(properties.getToolLoop());
    }

    @Bean
    @ConditionalOnMissingBean
    public HistoryWriter toolLoopHistoryWriter(Clock clock) {
        return new DefaultHistoryWriter(clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public StructuredOutputParser structuredOutputParser(ObjectMapper objectMapper) {
        return new StructuredOutputParser(objectMapper);
    }

    @Bean
    @ConditionalOnBean(LlmPort.class)
    @ConditionalOnMissingBean
    public ToolLoopSystem toolLoopSystem(LlmPort llmPort, ToolCallExecutionService toolCallExecutionService,
            ToolApprovalPolicy toolApprovalPolicy, HistoryWriter historyWriter, LlmProperties properties) {
        return new DefaultToolLoopSystem(llmPort, toolCallExecutionService, toolApprovalPolicy, historyWriter,
                properties.getToolLoop());
    }

    @Bean
    @ConditionalOnBean(LlmPort.class)
    @ConditionalOnMissingBean
    public StructuredOutputService structuredOutputService(LlmPort llmPort, StructuredOutputParser parser) {
        return new StructuredOutputService(llmPort, parser);
    }
}
