package me.golemcore.llm.domain.system.toolloop;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import me.golemcore.llm.domain.cancellation.CancellationTokenSource;
import me.golemcore.llm.domain.component.ToolApprovalCheck;
import me.golemcore.llm.domain.component.ToolHandler;
import me.golemcore.llm.domain.exception.CancelledException;
import me.golemcore.llm.domain.exception.InvalidRequestException;
import me.golemcore.llm.domain.exception.MaxStepsExceededException;
import me.golemcore.llm.domain.exception.ProviderException;
import me.golemcore.llm.domain.exception.ToolApprovalRequiredException;
import me.golemcore.llm.domain.exception.ToolLoopExecutionException;
import me.golemcore.llm.domain.model.LlmResponse;
import me.golemcore.llm.domain.model.Message;
import me.golemcore.llm.domain.model.ToolCall;
import me.golemcore.llm.domain.model.ToolFailureKind;
import me.golemcore.llm.domain.model.ToolLoopOutcome;
import me.golemcore.llm.domain.model.ToolLoopRequest;
import me.golemcore.llm.domain.model.ToolLoopResult;
import me.golemcore.llm.domain.model.ToolResult;
import me.golemcore.llm.domain.service.ToolApprovalPolicy;
import me.golemcore.llm.domain.service.ToolCallExecutionService;
import me.golemcore.llm.infrastructure.config.LlmProperties;
import me.golemcore.llm.port.outbound.LlmPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DefaultToolLoopSystemTest {

    private static final String TOOL_CALL_ID = "tc-1";
    private static final String TOOL_NAME = "get_weather";
    private static final String CONTENT_DONE = "Done";
    private static final String USER_PROMPT = "What's the weather in Paris?";

    @Mock
    private LlmPort llmPort;

    private LlmProperties.ToolLoopProperties settings;
    private ToolCallExecutionService executionService;
    private ToolApprovalPolicy approvalPolicy;
    private HistoryWriter historyWriter;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        settings = new LlmProperties.ToolLoopProperties();
        settings.setParallelToolExecution(false);
        executionService = new ToolCallExecutionService(new ObjectMapper(), settings, Runnable::run);
        approvalPolicy = new ToolApprovalPolicy(settings);
        historyWriter = new DefaultHistoryWriter(Clock.fixed(Instant.parse("2026-02-14T00:00:00Z"), ZoneId.of("UTC")));
    }

    private DefaultToolLoopSystem system(LlmPort port) {
        return new DefaultToolLoopSystem(port, executionService, approvalPolicy, historyWriter, settings,
                Schedulers.immediate());
    }

    private static ToolCall weatherCall(String id) {
        return ToolCall.of(id, TOOL_NAME, "{\"city\":\"Paris\"}");
    }

    private static ToolLoopRequest.ToolLoopRequestBuilder request(Map<String, ToolHandler> handlers) {
        return ToolLoopRequest.builder()
                .messages(List.of(Message.user(USER_PROMPT)))
                .toolHandlers(handlers);
    }

    // ==================== Final answer (no tool calls) ====================

    @Test
    void shouldFinishInOneStepWhenModelRequestsNoTools() {
        ScriptedLlmPort port = ScriptedLlmPort.chat(LlmResponse.text("Hello"));

        ToolLoopResult result = system(port).run(request(Map.of()).build());

        assertEquals("Hello", result.getText());
        assertEquals(1, result.getSteps().size());
        assertEquals(1, port.getCallCount());
        assertEquals(2, result.getMessages().size());
        assertEquals("Hello", result.getMessages().get(1).getContent());
    }

    @Test
    void shouldNotAppendAssistantMessageForEmptyFinalText() {
        ScriptedLlmPort port = ScriptedLlmPort.chat(LlmResponse.builder().finishReason("stop").build());

        ToolLoopResult result = system(port).run(request(Map.of()).build());

        assertEquals(1, result.getMessages().size());
    }

    // ==================== Tool execution ====================

    @Test
    void shouldExecuteToolAndFeedResultBackToModel() throws Exception {
        ScriptedLlmPort port = ScriptedLlmPort.chat(
                LlmResponse.toolCalls(List.of(weatherCall(TOOL_CALL_ID))),
                LlmResponse.text("Sunny, 21C"));
        ToolHandler weather = ToolHandler.withArguments((args, token) -> Map.of("city", args.get("city"), "temp", 21));

        ToolLoopResult result = system(port).run(request(Map.of(TOOL_NAME, weather)).build());

        assertEquals("Sunny, 21C", result.getText());
        assertEquals(2, result.getSteps().size());
        List<Message> messages = result.getMessages();
        assertEquals(4, messages.size());
        assertTrue(messages.get(1).hasToolCalls());
        assertTrue(messages.get(2).hasToolResults());
        ObjectMapper mapper = new ObjectMapper();
        assertEquals(mapper.readTree("{\"city\":\"Paris\",\"temp\":21}"),
                mapper.readTree(messages.get(2).getToolResults().get(0).getContent()));
        assertEquals(3, port.getRequests().get(1).getMessages().size());
    }

    @Test
    void shouldTurnHandlerExceptionIntoErrorResultAndAdvance() {
        ScriptedLlmPort port = ScriptedLlmPort.chat(
                LlmResponse.toolCalls(List.of(ToolCall.of("1", "explode", "{}"))),
                LlmResponse.text(CONTENT_DONE));
        ToolHandler failing = invocation -> {
            throw new IllegalStateException("boom");
        };

        ToolLoopResult result = system(port).run(request(Map.of("explode", failing)).build());

        List<ToolResult> results = result.getSteps().get(0).getToolResults();
        assertEquals(1, results.size());
        assertEquals("1", results.get(0).getToolCallId());
        assertTrue(results.get(0).isError());
        assertEquals("{\"error\":\"boom\"}", results.get(0).getContent());
        assertEquals(CONTENT_DONE, result.getText());
    }

    @Test
    void shouldReportUnknownFunctionWithoutAbortingSiblingCalls() {
        ScriptedLlmPort port = ScriptedLlmPort.chat(
                LlmResponse.toolCalls(List.of(ToolCall.of("a", "missing", "{}"), weatherCall("b"))),
                LlmResponse.text(CONTENT_DONE));

        ToolLoopResult result = system(port).run(request(Map.of(TOOL_NAME, invocation -> "ok")).build());

        List<ToolResult> results = result.getSteps().get(0).getToolResults();
        assertEquals(ToolFailureKind.UNKNOWN_TOOL, results.get(0).getFailureKind());
        assertEquals("{\"error\":\"Unknown function: missing\"}", results.get(0).getContent());
        assertFalse(results.get(1).isError());
        assertEquals("ok", results.get(1).getContent());
    }

    // ==================== Max steps ====================

    @Test
    void shouldFailWhenModelKeepsRequestingToolsPastMaxSteps() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(
                LlmResponse.toolCalls(List.of(weatherCall(TOOL_CALL_ID)))));
        DefaultToolLoopSystem system = system(llmPort);

        MaxStepsExceededException error = assertThrows(MaxStepsExceededException.class,
                () -> system.run(request(Map.of(TOOL_NAME, invocation -> "ok")).maxSteps(2).build()));

        verify(llmPort, times(2)).chat(any());
        assertEquals(2, error.getMaxSteps());
        assertTrue(error.getMessage().contains("Tool loop exceeded maxSteps (2)"));
        assertEquals(5, error.getMessages().size());
    }

    @Test
    void shouldUseConfiguredMaxStepsWhenRequestLeavesItUnset() {
        settings.setMaxSteps(1);
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(
                LlmResponse.toolCalls(List.of(weatherCall(TOOL_CALL_ID)))));
        DefaultToolLoopSystem system = system(llmPort);

        assertThrows(MaxStepsExceededException.class,
                () -> system.run(request(Map.of(TOOL_NAME, invocation -> "ok")).build()));
        verify(llmPort, times(1)).chat(any());
    }

    @Test
    void shouldRejectMaxStepsBelowOne() {
        DefaultToolLoopSystem system = system(llmPort);

        assertThrows(InvalidRequestException.class, () -> system.run(request(Map.of()).maxSteps(0).build()));
        verify(llmPort, never()).chat(any());
    }

    // ==================== Approval ====================

    @Test
    void shouldThrowApprovalRequiredFromRun() {
        ScriptedLlmPort port = ScriptedLlmPort.chat(LlmResponse.toolCalls(List.of(weatherCall(TOOL_CALL_ID))));
        ToolLoopRequest loopRequest = request(Map.of(TOOL_NAME, invocation -> "ok"))
                .needsApproval(ToolApprovalCheck.always())
                .build();

        ToolApprovalRequiredException error = assertThrows(ToolApprovalRequiredException.class,
                () -> system(port).run(loopRequest));

        assertEquals(TOOL_CALL_ID, error.getState().getToolCallsNeedingApproval().get(0).getId());
        assertEquals(0, error.getState().getStepIndex());
    }

    @Test
    void shouldBlockOnlyWhenPerToolCheckMatches() {
        ScriptedLlmPort port = ScriptedLlmPort.chat(
                LlmResponse.toolCalls(List.of(weatherCall("a"), ToolCall.of("b", "delete_file", "{}"))));
        ToolLoopRequest loopRequest = request(Map.of(TOOL_NAME, invocation -> "ok", "delete_file", invocation -> "ok"))
                .toolApprovalChecks(Map.of("delete_file", ToolApprovalCheck.always()))
                .build();

        ToolLoopOutcome outcome = system(port).runUntilBlocked(loopRequest);

        assertTrue(outcome.isBlocked());
        assertEquals(2, outcome.state().getPendingToolCalls().size());
        assertEquals(List.of("b"),
                outcome.state().getToolCallsNeedingApproval().stream().map(ToolCall::getId).toList());
        List<Message> messages = outcome.state().getMessages();
        assertEquals(2, messages.size());
        assertTrue(messages.get(1).hasToolCalls());
    }

    // ==================== Provider messages ====================

    @Test
    void shouldPersistProviderAssistantMessageVerbatim() {
        Message providerMessage = Message.toolUse(List.of(weatherCall(TOOL_CALL_ID)));
        providerMessage.getProviderExtensions().put("thinking.signature", TextNode.valueOf("abc"));
        ScriptedLlmPort port = ScriptedLlmPort.chat(
                LlmResponse.toolCalls(List.of(weatherCall(TOOL_CALL_ID))).toBuilder()
                        .assistantMessage(providerMessage)
                        .build(),
                LlmResponse.text(CONTENT_DONE));

        ToolLoopResult result = system(port).run(request(Map.of(TOOL_NAME, invocation -> "ok")).build());

        assertSame(providerMessage, result.getMessages().get(1));
    }

    // ==================== Failures ====================

    @Test
    void shouldWrapProviderFailureAndKeepHistory() {
        when(llmPort.chat(any())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("503")));
        DefaultToolLoopSystem system = system(llmPort);

        ToolLoopExecutionException error = assertThrows(ToolLoopExecutionException.class,
                () -> system.run(request(Map.of()).build()));

        assertInstanceOf(ProviderException.class, error.getCause());
        assertTrue(error.getCause().getMessage().contains("503"));
        assertEquals(1, error.getMessages().size());
    }

    @Test
    void shouldNotCallModelWhenCancelledBeforeStart() {
        CancellationTokenSource source = new CancellationTokenSource();
        source.cancel("user left");
        DefaultToolLoopSystem system = system(llmPort);

        CancelledException error = assertThrows(CancelledException.class,
                () -> system.run(request(Map.of()).cancellationToken(source.getToken()).build()));

        assertEquals("user left", error.getReason());
        verify(llmPort, never()).chat(any());
    }
}
