package me.golemcore.llm.domain.system.toolloop;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.llm.domain.cancellation.CancellationToken;
import me.golemcore.llm.domain.component.ToolApprovalCheck;
import me.golemcore.llm.domain.component.ToolHandler;
import me.golemcore.llm.domain.model.LlmResponse;
import me.golemcore.llm.domain.model.LoopState;
import me.golemcore.llm.domain.model.Message;
import me.golemcore.llm.domain.model.ToolCall;
import me.golemcore.llm.domain.model.ToolDefinition;
import me.golemcore.llm.domain.model.ToolFailureKind;
import me.golemcore.llm.domain.model.ToolLoopOutcome;
import me.golemcore.llm.domain.model.ToolLoopRequest;
import me.golemcore.llm.domain.model.ToolLoopResult;
import me.golemcore.llm.domain.model.ToolResult;
import me.golemcore.llm.domain.model.ToolSet;
import me.golemcore.llm.domain.service.ToolApprovalPolicy;
import me.golemcore.llm.domain.service.ToolCallExecutionService;
import me.golemcore.llm.infrastructure.config.LlmProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Approval scenario: the loop blocks on a gated tool, the caller executes the
 * pending calls itself and resumes with a fresh invocation.
 */
class ToolLoopSystemBddTest {

    private static final String DELETE_TOOL = "delete_file";
    private static final String FINAL_TEXT = "Deleted notes.txt";

    private LlmProperties.ToolLoopProperties settings;
    private ToolCallExecutionService executionService;
    private List<String> deletedPaths;
    private ToolSet toolSet;

    @BeforeEach
    void setUp() {
        settings = new LlmProperties.ToolLoopProperties();
        executionService = new ToolCallExecutionService(new ObjectMapper(), settings, Runnable::run);
        deletedPaths = new ArrayList<>();
        ToolHandler delete = ToolHandler.withArguments((args, token) -> {
            deletedPaths.add((String) args.get("path"));
            return "ok";
        });
        toolSet = ToolSet.builder()
                .tool(ToolDefinition.withStringParams(DELETE_TOOL, "Delete a file", List.of("path")), delete,
                        ToolApprovalCheck.always())
                .build();
    }

    private DefaultToolLoopSystem system(ScriptedLlmPort port) {
        return new DefaultToolLoopSystem(port, executionService, new ToolApprovalPolicy(settings),
                new DefaultHistoryWriter(Clock.systemUTC()), settings, Schedulers.immediate());
    }

    private static ScriptedLlmPort deleteThenConfirm() {
        return ScriptedLlmPort.chat(
                LlmResponse.toolCalls(List.of(ToolCall.of("c1", DELETE_TOOL, "{\"path\":\"notes.txt\"}"))),
                LlmResponse.text(FINAL_TEXT));
    }

    @Test
    void shouldBlockThenResumeManuallyWithSameOutcomeAsUngatedRun() {
        // GIVEN: a model that asks to delete a file, then confirms
        List<Message> prompt = List.of(Message.user("Delete notes.txt"));
        ScriptedLlmPort gatedPort = deleteThenConfirm();
        DefaultToolLoopSystem gated = system(gatedPort);

        // WHEN: the gated loop runs
        ToolLoopOutcome outcome = gated.runUntilBlocked(ToolLoopRequest.builder()
                .messages(prompt)
                .toolSet(toolSet)
                .build());

        // THEN: it blocks with the tool-use message appended and nothing executed
        assertTrue(outcome.isBlocked());
        LoopState state = outcome.state();
        assertEquals(2, state.getMessages().size());
        assertTrue(state.getMessages().get(1).hasToolCalls());
        assertFalse(state.getMessages().get(1).hasToolResults());
        assertTrue(deletedPaths.isEmpty());
        assertEquals(1, gatedPort.getCallCount());

        // WHEN: the caller approves, executes the pending calls and resumes without gating
        List<ToolResult> results = executionService.executeAll(state.getPendingToolCalls(), toolSet.getHandlers(),
                CancellationToken.NONE);
        ToolLoopResult resumed = gated.run(ToolLoopRequest.builder()
                .messages(state.messagesWithToolResults(results))
                .toolHandlers(toolSet.getHandlers())
                .build());

        // THEN: the resumed loop reaches the same answer as a loop that never blocked
        ToolLoopResult ungated = system(deleteThenConfirm()).run(ToolLoopRequest.builder()
                .messages(prompt)
                .toolHandlers(toolSet.getHandlers())
                .build());

        assertEquals(FINAL_TEXT, resumed.getText());
        assertEquals(ungated.getText(), resumed.getText());
        assertEquals(roles(ungated.getMessages()), roles(resumed.getMessages()));
        assertEquals(List.of("notes.txt", "notes.txt"), deletedPaths);
    }

    @Test
    void shouldLetCallerDenyPendingCallAndContinue() {
        // GIVEN
        ScriptedLlmPort port = ScriptedLlmPort.chat(
                LlmResponse.toolCalls(List.of(ToolCall.of("c1", DELETE_TOOL, "{\"path\":\"notes.txt\"}"))),
                LlmResponse.text("Okay, I left the file alone."));
        DefaultToolLoopSystem system = system(port);
        LoopState state = system.runUntilBlocked(ToolLoopRequest.builder()
                .messages(List.of(Message.user("Delete notes.txt")))
                .toolSet(toolSet)
                .build()).state();

        // WHEN: the human rejects the call
        ToolResult denied = executionService.deny(state.getToolCallsNeedingApproval().get(0), "User rejected");
        ToolLoopResult result = system.run(ToolLoopRequest.builder()
                .messages(state.messagesWithToolResults(List.of(denied)))
                .toolHandlers(toolSet.getHandlers())
                .build());

        // THEN
        assertEquals("Okay, I left the file alone.", result.getText());
        assertEquals(ToolFailureKind.APPROVAL_DENIED, denied.getFailureKind());
        assertEquals("{\"error\":\"User rejected\"}", denied.getContent());
        assertTrue(deletedPaths.isEmpty());
    }

    @Test
    void shouldRunUngatedSiblingsAndDenyGatedCallOnResume() {
        // GIVEN: one step asking for an ungated listing and a gated delete
        ToolSet mixed = ToolSet.builder()
                .tool(ToolDefinition.simple("list_files", "List files"), invocation -> "[\"notes.txt\"]")
                .tool(ToolDefinition.withStringParams(DELETE_TOOL, "Delete a file", List.of("path")),
                        toolSet.getHandlers().get(DELETE_TOOL), ToolApprovalCheck.always())
                .build();
        ScriptedLlmPort port = ScriptedLlmPort.chat(
                LlmResponse.toolCalls(List.of(
                        ToolCall.of("c1", "list_files", "{}"),
                        ToolCall.of("c2", DELETE_TOOL, "{\"path\":\"notes.txt\"}"))),
                LlmResponse.text("Listed, nothing deleted."));
        DefaultToolLoopSystem system = system(port);
        LoopState state = system.runUntilBlocked(ToolLoopRequest.builder()
                .messages(List.of(Message.user("Tidy up")))
                .toolSet(mixed)
                .build()).state();

        // WHEN: the caller runs what needs no approval and denies the rest
        List<ToolResult> results = new ArrayList<>();
        for (ToolCall call : state.getPendingToolCalls()) {
            results.add(state.needsApproval(call)
                    ? executionService.deny(call, null)
                    : executionService.execute(call, mixed.getHandlers(), CancellationToken.NONE));
        }
        ToolLoopResult result = system.run(ToolLoopRequest.builder()
                .messages(state.messagesWithToolResults(results))
                .toolHandlers(mixed.getHandlers())
                .build());

        // THEN
        assertFalse(state.needsApproval(state.getPendingToolCalls().get(0)));
        assertTrue(state.needsApproval(state.getPendingToolCalls().get(1)));
        assertEquals("[\"notes.txt\"]", results.get(0).getContent());
        assertEquals(ToolFailureKind.APPROVAL_DENIED, results.get(1).getFailureKind());
        assertEquals("Listed, nothing deleted.", result.getText());
        assertTrue(deletedPaths.isEmpty());
    }

    private static List<String> roles(List<Message> messages) {
        return messages.stream().map(Message::getRole).toList();
    }
}
