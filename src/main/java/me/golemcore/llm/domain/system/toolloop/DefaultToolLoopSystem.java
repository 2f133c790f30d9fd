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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.llm.domain.exception.CancelledException;
import me.golemcore.llm.domain.exception.InvalidRequestException;
import me.golemcore.llm.domain.exception.LlmException;
import me.golemcore.llm.domain.exception.MaxStepsExceededException;
import me.golemcore.llm.domain.exception.ToolApprovalRequiredException;
import me.golemcore.llm.domain.exception.ToolLoopExecutionException;
import me.golemcore.llm.domain.model.StreamPart;
import me.golemcore.llm.domain.model.ToolLoopOutcome;
import me.golemcore.llm.domain.model.ToolLoopRequest;
import me.golemcore.llm.domain.model.ToolLoopResult;
import me.golemcore.llm.domain.service.ToolApprovalPolicy;
import me.golemcore.llm.domain.service.ToolCallExecutionService;
import me.golemcore.llm.infrastructure.config.LlmProperties;
import me.golemcore.llm.port.outbound.LlmPort;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Tool loop orchestrator.
 *
 * <p>
 * Contract per step: 1) the model is called with the history so far, 2) if it
 * requests no tools the loop finishes, 3) if any call needs approval the loop
 * blocks with the assistant tool-use message appended, 4) otherwise all calls
 * run, the assistant message and one tool-result message are appended and the
 * next step starts. All three entry points share one state machine, so a
 * blocking run and a streamed run of the same script behave identically.
 */
@Slf4j
public class DefaultToolLoopSystem implements ToolLoopSystem {

    private final StepSource stepSource;
    private final ToolCallExecutionService executionService;
    private final ToolApprovalPolicy approvalPolicy;
    private final HistoryWriter historyWriter;
    private final LlmProperties.ToolLoopProperties settings;
    private final Scheduler streamScheduler;

    public DefaultToolLoopSystem(LlmPort llmPort, ToolCallExecutionService executionService,
            ToolApprovalPolicy approvalPolicy, HistoryWriter historyWriter,
            LlmProperties.ToolLoopProperties settings) {
        this(llmPort, executionService, approvalPolicy, historyWriter, settings, Schedulers.boundedElastic());
    }

    // Visible for testing
    public DefaultToolLoopSystem(LlmPort llmPort, ToolCallExecutionService executionService,
            ToolApprovalPolicy approvalPolicy, HistoryWriter historyWriter,
            LlmProperties.ToolLoopProperties settings, Scheduler streamScheduler) {
        this.stepSource = StepSource.forPort(llmPort);
        this.executionService = executionService;
        this.approvalPolicy = approvalPolicy;
        this.historyWriter = historyWriter;
        this.settings = settings;
        this.streamScheduler = streamScheduler;
        log.debug("[ToolLoop] Using {} step source for provider {}",
                llmPort.supportsStreaming() ? "streaming" : "chat", llmPort.getProviderId());
    }

    @Override
    public ToolLoopResult run(ToolLoopRequest request) {
        ToolLoopOutcome outcome = runUntilBlocked(request);
        if (outcome.isBlocked()) {
            throw new ToolApprovalRequiredException(outcome.state());
        }
        return outcome.result();
    }

    @Override
    public ToolLoopOutcome runUntilBlocked(ToolLoopRequest request) {
        ToolLoopPartIterator iterator = newIterator(request);
        try {
            iterator.drain();
        } finally {
            iterator.close();
        }

        LlmException failure = iterator.getFailure();
        if (failure == null) {
            return iterator.getOutcome();
        }
        if (failure instanceof MaxStepsExceededException || failure instanceof CancelledException) {
            throw failure;
        }
        throw new ToolLoopExecutionException(iterator.getStepIndex(), iterator.getMessages(), failure);
    }

    @Override
    public Flux<StreamPart> streamParts(ToolLoopRequest request) {
        ToolLoopInput input = resolve(request);
        return Flux.<StreamPart, ToolLoopPartIterator>using(
                () -> new ToolLoopPartIterator(stepSource, executionService, approvalPolicy, historyWriter, input),
                iterator -> Flux.<StreamPart>fromIterable(() -> iterator),
                ToolLoopPartIterator::close)
                .subscribeOn(streamScheduler);
    }

    private ToolLoopPartIterator newIterator(ToolLoopRequest request) {
        return new ToolLoopPartIterator(stepSource, executionService, approvalPolicy, historyWriter,
                resolve(request));
    }

    private ToolLoopInput resolve(ToolLoopRequest request) {
        if (request == null || request.getMessages() == null) {
            throw new InvalidRequestException("Tool loop request must contain messages");
        }
        int maxSteps = request.getMaxSteps() != null ? request.getMaxSteps() : settings.getMaxSteps();
        if (maxSteps < 1) {
            throw new InvalidRequestException("maxSteps must be >= 1, got " + maxSteps);
        }
        return new ToolLoopInput(
                List.copyOf(request.getMessages()),
                List.copyOf(request.getToolsOrEmpty()),
                request.getToolHandlersOrEmpty(),
                request.getToolApprovalChecksOrEmpty(),
                request.getNeedsApproval(),
                maxSteps,
                request.getCancellationTokenOrNone());
    }
}
