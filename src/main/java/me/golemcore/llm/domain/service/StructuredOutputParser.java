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
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.llm.domain.exception.ResponseFormatException;
import me.golemcore.llm.domain.exception.StructuredOutputException;
import me.golemcore.llm.domain.model.OutputSpec;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recovers a schema-conformant object from free-form model text.
 *
 * <p>
 * Extraction stages, first success wins:
 * <ol>
 * <li>the whole text parsed as JSON</li>
 * <li>the content of a fenced {@code json} code block</li>
 * <li>the first balanced {@code {...}} object that parses, found with a single
 * pass over the text that skips braces inside string literals</li>
 * </ol>
 * The recovered value must be a JSON object. It is then validated against the
 * output schema before the decoder ever sees it.
 */
@Slf4j
public class StructuredOutputParser {

    private static final Pattern FENCED_BLOCK = Pattern.compile("```(?:json)?\\s*(.*?)\\s*```", Pattern.DOTALL);

    private final ObjectReader reader;
    private final JsonSchemaValidator validator;

    public StructuredOutputParser(ObjectMapper objectMapper) {
        this(objectMapper, new JsonSchemaValidator());
    }

    public StructuredOutputParser(ObjectMapper objectMapper, JsonSchemaValidator validator) {
        this.reader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.validator = validator;
    }

    /**
     * Extracts, validates and decodes structured output from model text.
     *
     * @throws ResponseFormatException
     *             if no JSON object can be recovered
     * @throws StructuredOutputException
     *             if the object does not satisfy the schema or cannot be decoded
     */
    public <T> T extract(String rawText, OutputSpec<T> spec) {
        return decode(parseObject(rawText), spec, rawText);
    }

    /**
     * Runs the extraction stages and returns the first JSON object found.
     */
    public ObjectNode parseObject(String rawText) {
        if (rawText == null || rawText.isBlank()) {
            throw new ResponseFormatException("Structured output is empty or missing JSON content", rawText);
        }

        Optional<ObjectNode> direct = tryParseObject(rawText.strip());
        if (direct.isPresent()) {
            return direct.get();
        }

        Matcher fenced = FENCED_BLOCK.matcher(rawText);
        while (fenced.find()) {
            Optional<ObjectNode> parsed = tryParseObject(fenced.group(1));
            if (parsed.isPresent()) {
                log.debug("[StructuredOutput] Recovered JSON from fenced block");
                return parsed.get();
            }
        }

        Optional<ObjectNode> embedded = findBalancedObject(rawText);
        if (embedded.isPresent()) {
            log.debug("[StructuredOutput] Recovered JSON object embedded in text");
            return embedded.get();
        }

        throw new ResponseFormatException("Failed to parse structured JSON output", rawText);
    }

    /**
     * Validates an already parsed value and decodes it.
     */
    public <T> T decode(JsonNode value, OutputSpec<T> spec, String rawText) {
        List<String> violations = validator.validate(value, spec.getJsonSchema());
        if (!violations.isEmpty()) {
            log.debug("[StructuredOutput] {} violation(s) for {}", violations.size(), spec.getName());
            throw new StructuredOutputException(spec.getName(), violations, rawText);
        }
        try {
            return spec.fromJson(value);
        } catch (RuntimeException e) {
            throw new StructuredOutputException(spec.getName(),
                    "Cannot decode structured output as " + spec.getName() + ": " + e.getMessage(), rawText, e);
        }
    }

    private Optional<ObjectNode> findBalancedObject(String text) {
        int[] closing = matchBraces(text);
        for (int start = text.indexOf('{'); start >= 0; start = text.indexOf('{', start + 1)) {
            if (closing[start] < 0) {
                continue;
            }
            Optional<ObjectNode> parsed = tryParseObject(text.substring(start, closing[start] + 1));
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        return Optional.empty();
    }

    /**
     * One left-to-right pass pairing braces. Returns, for every index holding
     * an opening brace, the index of its closing brace or -1. Quotes only open
     * string literals inside an object, so prose around the JSON can contain
     * stray quotes.
     */
    private static int[] matchBraces(String text) {
        int[] closing = new int[text.length()];
        Arrays.fill(closing, -1);
        Deque<Integer> open = new ArrayDeque<>();
        boolean inString = false;
        boolean escaped = false;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (ch == '\\') {
                    escaped = true;
                } else if (ch == '"') {
                    inString = false;
                }
                continue;
            }
            if (ch == '"' && !open.isEmpty()) {
                inString = true;
            } else if (ch == '{') {
                open.push(i);
            } else if (ch == '}' && !open.isEmpty()) {
                closing[open.pop()] = i;
            }
        }
        return closing;
    }

    private Optional<ObjectNode> tryParseObject(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode node = reader.readTree(candidate);
            if (node instanceof ObjectNode object) {
                return Optional.of(object);
            }
            return Optional.empty();
        } catch (JsonProcessingException e) {
            log.trace("[StructuredOutput] Candidate is not valid JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
