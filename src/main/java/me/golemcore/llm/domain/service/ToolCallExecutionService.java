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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.llm.domain.cancellation.CancellationToken;
import me.golemcore.llm.domain.component.ToolHandler;
import me.golemcore.llm.domain.exception.CancelledException;
import me.golemcore.llm.domain.model.ToolCall;
import me.golemcore.llm.domain.model.ToolFailureKind;
import me.golemcore.llm.domain.model.ToolInvocation;
import me.golemcore.llm.domain.model.ToolResult;
import me.golemcore.llm.infrastructure.config.LlmProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Pure tool-call execution service: resolves handlers, parses arguments,
 * invokes them and encodes their output as JSON result content.
 *
 * <p>
 * Does NOT mutate conversation history and does NOT decide approval. Handler
 * failures become error results; only cancellation propagates.
 */
@Slf4j
public class ToolCallExecutionService {

    private static final TypeReference<Map<String, Object>> ARGUMENTS_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final LlmProperties.ToolLoopProperties settings;
    private final Executor executor;

    public ToolCallExecutionService(ObjectMapper objectMapper) {
        this(objectMapper, new LlmProperties.ToolLoopProperties(), ForkJoinPool.commonPool());
    }

    public ToolCallExecutionService(ObjectMapper objectMapper, LlmProperties.ToolLoopProperties settings,
            Executor executor) {
        this.objectMapper = objectMapper;
        this.settings = settings;
        this.executor = executor;
    }

    /**
     * Executes all calls of one step and returns their results in call order.
     * Calls run concurrently when parallel execution is enabled.
     */
    public List<ToolResult> executeAll(List<ToolCall> calls, Map<String, ToolHandler> handlers,
            CancellationToken cancellationToken) {
        if (calls.isEmpty()) {
            return List.of();
        }
        if (!settings.isParallelToolExecution() || calls.size() == 1 || executor == null) {
            List<ToolResult> results = new ArrayList<>(calls.size());
            for (ToolCall call : calls) {
                results.add(execute(call, handlers, cancellationToken));
            }
            return results;
        }

        List<CompletableFuture<ToolResult>> futures = new ArrayList<>(calls.size());
        for (ToolCall call : calls) {
            futures.add(CompletableFuture.supplyAsync(() -> execute(call, handlers, cancellationToken), executor));
        }
        List<ToolResult> results = new ArrayList<>(calls.size());
        for (CompletableFuture<ToolResult> future : futures) {
            try {
                results.add(future.join());
            } catch (CompletionException e) {
                awaitSettled(futures);
                if (e.getCause() instanceof RuntimeException runtime) {
                    throw runtime;
                }
                throw e;
            }
        }
        return results;
    }

    // Handlers still running observe the cancelled token; none may outlive the step.
    private static void awaitSettled(List<CompletableFuture<ToolResult>> futures) {
        long running = futures.stream().filter(future -> !future.isDone()).count();
        if (running > 0) {
            log.debug("[Tools] Waiting for {} sibling tool call(s) to settle", running);
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
                .handle((ignored, error) -> null)
                .join();
    }

    /**
     * Executes one call. Never throws for handler problems; throws
     * {@link CancelledException} if the token is cancelled before the handler
     * starts.
     */
    public ToolResult execute(ToolCall call, Map<String, ToolHandler> handlers, CancellationToken cancellationToken) {
        CancellationToken token = cancellationToken != null ? cancellationToken : CancellationToken.NONE;
        token.throwIfCancellationRequested();

        ToolHandler handler = resolveHandler(call.getName(), handlers);
        if (handler == null) {
            log.warn("[Tools] Unknown function requested: {}", call.getName());
            return ToolResult.failure(call, ToolFailureKind.UNKNOWN_TOOL,
                    errorContent("Unknown function: " + call.getName()));
        }

        Map<String, Object> arguments = null;
        if (handler.expectsArguments()) {
            try {
                arguments = parseArguments(call.getArguments());
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.warn("[Tools] Invalid arguments for '{}': {}", call.getName(), e.getMessage());
                return ToolResult.failure(call, ToolFailureKind.INVALID_ARGUMENTS,
                        errorContent("Invalid arguments for " + call.getName() + ": " + safeCauseMessage(e)));
            }
        }

        log.debug("[Tools] Executing '{}' (id={})", call.getName(), call.getId());
        try {
            Object output = handler.handle(new ToolInvocation(call, arguments, token));
            if (output instanceof CompletionStage<?> stage) {
                output = await(stage);
            }
            return ToolResult.success(call, encodeOutput(output));
        } catch (CancelledException e) {
            throw e;
        } catch (TimeoutException e) {
            log.warn("[Tools] Tool '{}' timed out after {} ms", call.getName(), settings.getToolTimeoutMs());
            return ToolResult.failure(call, ToolFailureKind.TIMEOUT,
                    errorContent("Tool timed out after " + settings.getToolTimeoutMs() + " ms"));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolResult.failure(call, ToolFailureKind.EXECUTION_FAILED,
                    errorContent("Tool execution interrupted"));
        } catch (Exception e) {
            log.warn("[Tools] Tool execution failed: {}", call.getName(), e);
            return ToolResult.failure(call, ToolFailureKind.EXECUTION_FAILED, errorContent(safeCauseMessage(e)));
        }
    }

    /**
     * Result for a call a human refused to run.
     */
    public ToolResult deny(ToolCall call, String reason) {
        String message = reason != null && !reason.isBlank() ? reason : "Tool call was not approved";
        return ToolResult.failure(call, ToolFailureKind.APPROVAL_DENIED, errorContent(message));
    }

    /**
     * Encodes handler output as result content: strings pass through, null,
     * numbers and booleans become JSON literals, anything else is serialized.
     */
    public String encodeOutput(Object output) {
        if (output == null) {
            return "null";
        }
        if (output instanceof String text) {
            return text;
        }
        if (output instanceof Number || output instanceof Boolean) {
            return output.toString();
        }
        try {
            return objectMapper.writeValueAsString(output);
        } catch (JsonProcessingException e) {
            log.debug("[Tools] Output of type {} is not serializable, using toString", output.getClass().getName());
            return output.toString();
        }
    }

    public String errorContent(String message) {
        return objectMapper.createObjectNode().put("error", message).toString();
    }

    private Object await(CompletionStage<?> stage)
            throws ExecutionException, InterruptedException, TimeoutException {
        try {
            return stage.toCompletableFuture().get(settings.getToolTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof CancelledException cancelled) {
                throw cancelled;
            }
            throw e;
        }
    }

    private Map<String, Object> parseArguments(String raw) throws JsonProcessingException {
        if (raw == null || raw.isBlank()) {
            return Map.of();
        }
        JsonNode node = objectMapper.readTree(raw);
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("arguments must be a JSON object");
        }
        return objectMapper.convertValue(node, ARGUMENTS_TYPE);
    }

    private ToolHandler resolveHandler(String name, Map<String, ToolHandler> handlers) {
        if (name == null || handlers == null) {
            return null;
        }
        ToolHandler handler = handlers.get(name);
        if (handler != null) {
            return handler;
        }
        String sanitized = sanitizeToolName(name);
        return sanitized.equals(name) ? null : handlers.get(sanitized);
    }

    /**
     * Strip special tokens and garbage from tool names. Some models leak special
     * tokens like {@code <|channel|>} into tool call names.
     */
    private String sanitizeToolName(String name) {
        String sanitized = name.replaceAll("[^a-zA-Z0-9_-].*", "");
        if (!sanitized.equals(name)) {
            log.warn("[Tools] Sanitized tool name: '{}' -> '{}'", name, sanitized);
        }
        return sanitized;
    }

    static String safeCauseMessage(Throwable error) {
        if (error == null) {
            return "unknown";
        }

        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null) {
            if (cause.equals(cursor)) {
                break;
            }
            cursor = cause;
            cause = cursor.getCause();
        }

        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }
}
