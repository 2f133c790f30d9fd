package me.golemcore.llm.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.llm.domain.exception.ResponseFormatException;
import me.golemcore.llm.domain.exception.StructuredOutputException;
import me.golemcore.llm.domain.model.OutputSpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StructuredOutputParserTest {

    private StructuredOutputParser parser;

    @BeforeEach
    void setUp() {
        parser = new StructuredOutputParser(new ObjectMapper());
    }

    // ==================== Extraction stages ====================

    @Test
    void shouldParseBareJsonObject() {
        assertEquals(42, parser.extract("{\"value\":42}", OutputSpec.intValue()));
    }

    @Test
    void shouldParseFencedJsonBlock() {
        assertEquals(99, parser.extract("```json\n{\"value\":99}\n```", OutputSpec.intValue()));
    }

    @Test
    void shouldParseUnlabelledFencedBlock() {
        assertEquals("ok", parser.extract("Here you go:\n```\n{\"value\":\"ok\"}\n```\nBye",
                OutputSpec.stringValue()));
    }

    @Test
    void shouldFindObjectEmbeddedInProse() {
        assertEquals(7, parser.extract("intro {\"value\":7} outro", OutputSpec.intValue()));
    }

    @Test
    void shouldIgnoreBracesInsideStringLiterals() {
        String text = "Result: {\"value\":\"a } tricky { string\"} done";

        assertEquals("a } tricky { string", parser.extract(text, OutputSpec.stringValue()));
    }

    @Test
    void shouldSkipUnbalancedPrefixBeforeRealObject() {
        String text = "set notation {a, b and then {\"value\":true}";

        assertEquals(Boolean.TRUE, parser.extract(text, OutputSpec.boolValue()));
    }

    // ==================== Failures ====================

    @Test
    void shouldRejectTextWithoutJson() {
        ResponseFormatException error = assertThrows(ResponseFormatException.class,
                () -> parser.extract("not json", OutputSpec.intValue()));

        assertEquals("Failed to parse structured JSON output", error.getMessage());
        assertEquals("not json", error.getRawText());
    }

    @Test
    void shouldRejectEmptyText() {
        ResponseFormatException error = assertThrows(ResponseFormatException.class,
                () -> parser.extract("   ", OutputSpec.intValue()));

        assertEquals("Structured output is empty or missing JSON content", error.getMessage());
    }

    @Test
    void shouldRejectTopLevelArray() {
        assertThrows(ResponseFormatException.class, () -> parser.extract("[1, 2, 3]", OutputSpec.intValue()));
    }

    @Test
    void shouldReportSchemaViolationBeforeDecoding() {
        StructuredOutputException error = assertThrows(StructuredOutputException.class,
                () -> parser.extract("{\"value\":\"x\"}", OutputSpec.intValue()));

        assertEquals("IntValue", error.getSchemaName());
        assertEquals(List.of("Expected integer at $.value, got string"), error.getViolations());
        assertEquals("{\"value\":\"x\"}", error.getRawText());
    }

    @Test
    void shouldWrapDecoderFailure() {
        OutputSpec<String> failing = OutputSpec.object("Broken", null, Map.of("type", "object"), node -> {
            throw new IllegalStateException("decoder exploded");
        });

        StructuredOutputException error = assertThrows(StructuredOutputException.class,
                () -> parser.extract("{}", failing));

        assertTrue(error.getMessage().contains("decoder exploded"));
        assertTrue(error.getCause() instanceof IllegalStateException);
    }

    @Test
    void shouldRejectIntegerOutsideIntRange() {
        StructuredOutputException error = assertThrows(StructuredOutputException.class,
                () -> parser.extract("{\"value\":4294967338}", OutputSpec.intValue()));

        assertEquals("IntValue", error.getSchemaName());
        assertTrue(error.getMessage().contains("4294967338"));
        assertThrows(StructuredOutputException.class,
                () -> parser.extract("{\"value\":99999999999999999999}", OutputSpec.intValue()));
    }

    @Test
    void shouldScanLongUnbalancedPrefixInLinearTime() {
        String text = "{".repeat(200_000) + "{\"value\":7}";

        Integer value = assertTimeoutPreemptively(Duration.ofSeconds(2),
                () -> parser.extract(text, OutputSpec.intValue()));

        assertEquals(7, value);
    }

    @Test
    void shouldToleratePromptQuotesOutsideObject() {
        assertEquals(3, parser.extract("The 5\" screen fits \"3\" items: {\"value\":3}", OutputSpec.intValue()));
    }

    // ==================== Specs ====================

    @Test
    void shouldDecodePojoSpec() {
        Map<String, Object> schema = Map.of(
                "type", "object",
                "properties", Map.of("city", Map.of("type", "string"), "population", Map.of("type", "integer")),
                "required", List.of("city"));
        OutputSpec<City> spec = OutputSpec.object("City", "A city", schema, City.class, new ObjectMapper());

        City city = parser.extract("{\"city\":\"Lisbon\",\"population\":545000}", spec);

        assertEquals("Lisbon", city.city);
        assertEquals(545000, city.population);
    }

    @Test
    void shouldDecodeListOfItems() {
        List<Integer> values = parser.extract("{\"items\":[{\"value\":1},{\"value\":2}]}",
                OutputSpec.listOf(OutputSpec.intValue()));

        assertEquals(List.of(1, 2), values);
    }

    @Test
    void shouldPointAtOffendingListElement() {
        StructuredOutputException error = assertThrows(StructuredOutputException.class,
                () -> parser.extract("{\"items\":[{\"value\":1},{\"value\":null}]}",
                        OutputSpec.listOf(OutputSpec.intValue())));

        assertEquals(List.of("Expected integer at $.items[1].value, got null"), error.getViolations());
    }

    @Test
    void shouldReturnNullFieldWhenSchemaAllowsIt() {
        OutputSpec<String> spec = OutputSpec.object("Note", null, Map.of("type", "object"),
                node -> node.path("text").textValue());

        assertNull(parser.extract("{\"other\":1}", spec));
    }

    static class City {
        public String city;
        public int population;
    }
}
