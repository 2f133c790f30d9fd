package me.golemcore.llm.domain.system.toolloop;

import com.fasterxml.jackson.databind.node.TextNode;
import me.golemcore.llm.domain.model.LlmResponse;
import me.golemcore.llm.domain.model.Message;
import me.golemcore.llm.domain.model.ToolCall;
import me.golemcore.llm.domain.model.ToolResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefaultHistoryWriterTest {

    private static final String TC_ID = "tc-1";
    private static final Instant FIXED_INSTANT = Instant.parse("2026-02-14T00:00:00Z");

    private DefaultHistoryWriter writer;
    private List<Message> messages;

    @BeforeEach
    void setUp() {
        writer = new DefaultHistoryWriter(Clock.fixed(FIXED_INSTANT, ZoneId.of("UTC")));
        messages = new ArrayList<>();
    }

    // ==================== appendAssistantToolCalls ====================

    @Test
    void shouldSynthesizeToolUseMessageWhenResponseHasNoAssistantMessage() {
        List<ToolCall> calls = List.of(ToolCall.of(TC_ID, "test", "{}"));

        writer.appendAssistantToolCalls(messages, LlmResponse.builder().text("checking").build(), calls);

        Message message = messages.get(0);
        assertEquals(Message.ROLE_ASSISTANT, message.getRole());
        assertEquals("checking", message.getContent());
        assertEquals(calls, message.getToolCalls());
        assertEquals(FIXED_INSTANT, message.getTimestamp());
        assertNotNull(message.getId());
    }

    @Test
    void shouldStoreProviderAssistantMessageVerbatim() {
        Message provided = Message.toolUse(List.of(ToolCall.of(TC_ID, "test", "{}")));
        provided.getProviderExtensions().put("anthropic.signature", TextNode.valueOf("sig-123"));
        LlmResponse response = LlmResponse.builder().assistantMessage(provided).build();

        writer.appendAssistantToolCalls(messages, response, provided.getToolCalls());

        assertSame(provided, messages.get(0));
        assertEquals("sig-123", messages.get(0).getProviderExtensions().get("anthropic.signature").asText());
    }

    // ==================== appendToolResults ====================

    @Test
    void shouldAppendAllResultsInOneUserMessage() {
        ToolCall first = ToolCall.of("a", "t", "{}");
        ToolCall second = ToolCall.of("b", "t", "{}");

        writer.appendToolResults(messages, List.of(ToolResult.success(first, "1"), ToolResult.success(second, "2")));

        assertEquals(1, messages.size());
        assertEquals(Message.ROLE_USER, messages.get(0).getRole());
        assertEquals(List.of("a", "b"),
                messages.get(0).getToolResults().stream().map(ToolResult::getToolCallId).toList());
    }

    // ==================== appendFinalAssistantAnswer ====================

    @Test
    void shouldAppendFinalTextAsAssistantMessage() {
        writer.appendFinalAssistantAnswer(messages, LlmResponse.text("Done"), "Done");

        assertEquals("Done", messages.get(0).getContent());
        assertTrue(messages.get(0).isAssistantMessage());
    }

    @Test
    void shouldSkipEmptyFinalText() {
        writer.appendFinalAssistantAnswer(messages, LlmResponse.builder().build(), "");

        assertTrue(messages.isEmpty());
    }
}
