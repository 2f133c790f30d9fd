package me.golemcore.llm.domain.service;

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
import me.golemcore.llm.domain.model.Message;
import me.golemcore.llm.domain.model.ToolCall;
import me.golemcore.llm.infrastructure.config.LlmProperties;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Policy engine determining which tool calls require human approval before
 * execution. A call needs approval when its per-tool check, the global check,
 * or the configured list of always-gated tools says so. Without any gate every
 * call is approved.
 */
@Slf4j
public class ToolApprovalPolicy {

    private static final int ARGUMENTS_PREVIEW_LENGTH = 80;

    private final Set<String> requiredTools;

    public ToolApprovalPolicy() {
        this.requiredTools = Set.of();
    }

    public ToolApprovalPolicy(LlmProperties.ToolLoopProperties settings) {
        List<String> configured = settings.getApproval().getRequiredTools();
        this.requiredTools = configured != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(configured))
                : Set.of();
        if (!requiredTools.isEmpty()) {
            log.info("[Approval] Tools always requiring approval: {}", requiredTools);
        }
    }

    /**
     * Returns the calls that need approval, in call order. Checks are evaluated
     * one call at a time against the same message snapshot.
     */
    public List<ToolCall> findCallsNeedingApproval(List<ToolCall> calls, Map<String, ToolApprovalCheck> toolChecks,
            ToolApprovalCheck globalCheck, List<Message> messages, int stepIndex,
            CancellationToken cancellationToken) {
        List<ToolCall> needing = new ArrayList<>();
        List<Message> snapshot = Collections.unmodifiableList(new ArrayList<>(messages));
        for (ToolCall call : calls) {
            cancellationToken.throwIfCancellationRequested();
            if (requiresApproval(call, toolChecks, globalCheck, snapshot, stepIndex)) {
                log.debug("[Approval] '{}' needs approval: {}", call.getName(), describeAction(call));
                needing.add(call);
            }
        }
        return needing;
    }

    public boolean requiresApproval(ToolCall call, Map<String, ToolApprovalCheck> toolChecks,
            ToolApprovalCheck globalCheck, List<Message> messages, int stepIndex) {
        if (requiredTools.contains(call.getName())) {
            return true;
        }
        ToolApprovalCheck toolCheck = toolChecks != null ? toolChecks.get(call.getName()) : null;
        if (toolCheck != null && evaluate(toolCheck, call, messages, stepIndex)) {
            return true;
        }
        return globalCheck != null && evaluate(globalCheck, call, messages, stepIndex);
    }

    /**
     * Human-readable summary of a call for approval prompts.
     */
    public String describeAction(ToolCall call) {
        String arguments = call.getArguments();
        if (arguments == null || arguments.isBlank()) {
            return call.getName() + "()";
        }
        if (arguments.length() > ARGUMENTS_PREVIEW_LENGTH) {
            arguments = arguments.substring(0, ARGUMENTS_PREVIEW_LENGTH) + "...";
        }
        return call.getName() + "(" + arguments + ")";
    }

    public Set<String> getRequiredTools() {
        return requiredTools;
    }

    private static boolean evaluate(ToolApprovalCheck check, ToolCall call, List<Message> messages, int stepIndex) {
        CompletableFuture<Boolean> decision = check.needsApproval(call, messages, stepIndex);
        if (decision == null) {
            return false;
        }
        try {
            return Boolean.TRUE.equals(decision.join());
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        }
    }
}
