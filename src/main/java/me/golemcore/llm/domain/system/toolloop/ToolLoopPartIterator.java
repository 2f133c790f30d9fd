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
import me.golemcore.llm.domain.cancellation.CancellationToken;
import me.golemcore.llm.domain.component.ToolApprovalCheck;
import me.golemcore.llm.domain.component.ToolHandler;
import me.golemcore.llm.domain.exception.LlmException;
import me.golemcore.llm.domain.exception.MaxStepsExceededException;
import me.golemcore.llm.domain.exception.ProviderException;
import me.golemcore.llm.domain.exception.ToolApprovalRequiredException;
import me.golemcore.llm.domain.model.LlmChunk;
import me.golemcore.llm.domain.model.LlmRequest;
import me.golemcore.llm.domain.model.LlmResponse;
import me.golemcore.llm.domain.model.LoopState;
import me.golemcore.llm.domain.model.Message;
import me.golemcore.llm.domain.model.StreamPart;
import me.golemcore.llm.domain.model.ToolCall;
import me.golemcore.llm.domain.model.ToolDefinition;
import me.golemcore.llm.domain.model.ToolLoopOutcome;
import me.golemcore.llm.domain.model.ToolLoopResult;
import me.golemcore.llm.domain.model.ToolLoopStep;
import me.golemcore.llm.domain.model.ToolResult;
import me.golemcore.llm.domain.service.ToolApprovalPolicy;
import me.golemcore.llm.domain.service.ToolCallExecutionService;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.stream.Stream;

/**
 * Pull-driven state machine running one tool loop invocation.
 *
 * <p>
 * Each {@link #hasNext()} advances the loop just far enough to produce the
 * next part: open a step, pull one upstream chunk, or finish a step (approval,
 * tool execution, history update). The last part is always {@code FINISH} or
 * {@code ERROR}; afterwards {@link #getOutcome()} or {@link #getFailure()}
 * tells how the loop ended.
 *
 * <p>
 * Not thread-safe. Owned by a single consumer for its whole life.
 */
@Slf4j
public class ToolLoopPartIterator implements Iterator<StreamPart>, AutoCloseable {

    private enum Phase {
        START_STEP, STREAMING, DONE
    }

    private final StepSource stepSource;
    private final ToolCallExecutionService executionService;
    private final ToolApprovalPolicy approvalPolicy;
    private final HistoryWriter historyWriter;

    private final List<ToolDefinition> tools;
    private final Map<String, ToolHandler> toolHandlers;
    private final Map<String, ToolApprovalCheck> toolApprovalChecks;
    private final ToolApprovalCheck needsApproval;
    private final int maxSteps;
    private final CancellationToken cancellationToken;

    private final List<Message> messages;
    private final List<ToolLoopStep> steps = new ArrayList<>();
    private final Deque<StreamPart> pending = new ArrayDeque<>();

    private Phase phase = Phase.START_STEP;
    private int stepIndex;

    // per-step state
    private Stream<LlmChunk> upstream;
    private Iterator<LlmChunk> upstreamIterator;
    private StreamPartEmitter emitter;
    private ToolCallAggregator aggregator;
    private LlmResponse completion;

    private ToolLoopOutcome outcome;
    private LlmException failure;

    ToolLoopPartIterator(StepSource stepSource, ToolCallExecutionService executionService,
            ToolApprovalPolicy approvalPolicy, HistoryWriter historyWriter, ToolLoopInput input) {
        this.stepSource = stepSource;
        this.executionService = executionService;
        this.approvalPolicy = approvalPolicy;
        this.historyWriter = historyWriter;
        this.tools = input.tools();
        this.toolHandlers = input.toolHandlers();
        this.toolApprovalChecks = input.toolApprovalChecks();
        this.needsApproval = input.needsApproval();
        this.maxSteps = input.maxSteps();
        this.cancellationToken = input.cancellationToken();
        this.messages = new ArrayList<>(input.messages());
    }

    @Override
    public boolean hasNext() {
        while (pending.isEmpty() && phase != Phase.DONE) {
            advance();
        }
        return !pending.isEmpty();
    }

    @Override
    public StreamPart next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Tool loop has finished");
        }
        return pending.poll();
    }

    /**
     * Runs the loop to its end, discarding parts.
     */
    public void drain() {
        while (hasNext()) {
            pending.clear();
        }
    }

    public ToolLoopOutcome getOutcome() {
        return outcome;
    }

    public LlmException getFailure() {
        return failure;
    }

    public List<Message> getMessages() {
        return Collections.unmodifiableList(messages);
    }

    public int getStepIndex() {
        return stepIndex;
    }

    @Override
    public void close() {
        closeUpstream();
        if (phase != Phase.DONE) {
            log.debug("[ToolLoop] Closed before completion at step {}", stepIndex);
            phase = Phase.DONE;
        }
    }

    private void advance() {
        try {
            if (phase == Phase.START_STEP) {
                startStep();
            } else {
                pullChunk();
            }
        } catch (RuntimeException e) {
            fail(e);
        }
    }

    private void startStep() {
        cancellationToken.throwIfCancellationRequested();
        log.debug("[ToolLoop] Step {} of {}", stepIndex + 1, maxSteps);

        LlmRequest request = LlmRequest.builder()
                .messages(List.copyOf(messages))
                .tools(tools)
                .cancellationToken(cancellationToken)
                .build();
        emitter = new StreamPartEmitter(pending::add);
        aggregator = new ToolCallAggregator();
        completion = null;
        upstream = stepSource.open(request)
                .takeUntilOther(cancellationToken.whenCancelled())
                .toStream();
        upstreamIterator = upstream.iterator();
        phase = Phase.STREAMING;
    }

    private void pullChunk() {
        cancellationToken.throwIfCancellationRequested();
        if (!upstreamIterator.hasNext()) {
            closeUpstream();
            cancellationToken.throwIfCancellationRequested();
            finishStep();
            return;
        }
        LlmChunk chunk = upstreamIterator.next();
        switch (chunk.type()) {
        case TEXT_DELTA -> emitter.onTextDelta(chunk.delta());
        case THINKING_DELTA -> emitter.onReasoningDelta(chunk.delta());
        case TOOL_CALL_DELTA -> emitter.onToolCallDelta(aggregator.addDelta(chunk.toolCall()));
        case COMPLETION -> completion = chunk.response();
        case ERROR -> throw new ProviderException("Event source failed: " + describe(chunk.error()), chunk.error());
        default -> throw new IllegalStateException("Unknown chunk type: " + chunk.type());
        }
    }

    private void finishStep() {
        // some sources only report tool calls on the completion
        if (aggregator.isEmpty() && completion != null && completion.hasToolCalls()) {
            for (ToolCall call : completion.getToolCalls()) {
                emitter.onToolCallDelta(aggregator.addDelta(call));
            }
        }
        emitter.closeBlocks();

        List<ToolCall> toolCalls = aggregator.completed();
        LlmResponse response = mergeResponse(toolCalls);
        if (response.hasProviderMetadata()) {
            pending.add(StreamPart.providerMetadata(response.getProviderMetadata()));
        }

        if (toolCalls.isEmpty()) {
            historyWriter.appendFinalAssistantAnswer(messages, response, response.getText());
            steps.add(step(response, List.of(), List.of()));
            log.debug("[ToolLoop] Finished after {} step(s)", steps.size());
            outcome = ToolLoopOutcome.completed(ToolLoopResult.builder()
                    .finalResponse(response)
                    .steps(List.copyOf(steps))
                    .messages(List.copyOf(messages))
                    .build());
            pending.add(StreamPart.finish(response));
            phase = Phase.DONE;
            return;
        }

        List<ToolCall> needingApproval = approvalPolicy.findCallsNeedingApproval(toolCalls, toolApprovalChecks,
                needsApproval, messages, stepIndex, cancellationToken);
        if (!needingApproval.isEmpty()) {
            historyWriter.appendAssistantToolCalls(messages, response, toolCalls);
            LoopState state = LoopState.builder()
                    .messages(List.copyOf(messages))
                    .pendingToolCalls(List.copyOf(toolCalls))
                    .toolCallsNeedingApproval(List.copyOf(needingApproval))
                    .stepIndex(stepIndex)
                    .stepResponse(response)
                    .steps(List.copyOf(steps))
                    .build();
            log.info("[ToolLoop] Blocked at step {}: approval required for {}", stepIndex,
                    state.describeCallsNeedingApproval());
            outcome = ToolLoopOutcome.blocked(state);
            pending.add(StreamPart.error(new ToolApprovalRequiredException(state)));
            phase = Phase.DONE;
            return;
        }

        List<ToolResult> results = executionService.executeAll(toolCalls, toolHandlers, cancellationToken);
        for (ToolResult result : results) {
            pending.add(StreamPart.toolResult(result));
        }
        historyWriter.appendAssistantToolCalls(messages, response, toolCalls);
        historyWriter.appendToolResults(messages, results);
        steps.add(step(response, toolCalls, results));

        stepIndex++;
        if (stepIndex >= maxSteps) {
            log.warn("[ToolLoop] Exceeded max steps ({})", maxSteps);
            fail(new MaxStepsExceededException(maxSteps, messages));
            return;
        }
        phase = Phase.START_STEP;
    }

    private LlmResponse mergeResponse(List<ToolCall> toolCalls) {
        LlmResponse base = completion != null ? completion : LlmResponse.builder().build();
        String text = emitter.getText();
        String reasoning = emitter.getReasoning();
        return base.toBuilder()
                .text(!text.isEmpty() ? text : base.getText())
                .thinking(!reasoning.isEmpty() ? reasoning : base.getThinking())
                .toolCalls(List.copyOf(toolCalls))
                .build();
    }

    private ToolLoopStep step(LlmResponse response, List<ToolCall> toolCalls, List<ToolResult> results) {
        return ToolLoopStep.builder()
                .index(stepIndex)
                .response(response)
                .toolCalls(List.copyOf(toolCalls))
                .toolResults(List.copyOf(results))
                .build();
    }

    private void fail(RuntimeException error) {
        closeUpstream();
        if (emitter != null) {
            emitter.closeBlocks();
        }
        LlmException llmError = error instanceof LlmException known
                ? known
                : new ProviderException("Tool loop step failed: " + describe(error), error);
        log.warn("[ToolLoop] Step {} failed: {}", stepIndex, llmError.getMessage());
        failure = llmError;
        pending.add(StreamPart.error(llmError));
        phase = Phase.DONE;
    }

    private void closeUpstream() {
        if (upstream != null) {
            upstream.close();
            upstream = null;
            upstreamIterator = null;
        }
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        String message = error.getMessage();
        return message != null && !message.isBlank() ? message : error.getClass().getSimpleName();
    }
}
