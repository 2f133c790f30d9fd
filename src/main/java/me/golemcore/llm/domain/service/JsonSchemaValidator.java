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

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Field-by-field check of a JSON value against the schema subset used by
 * output specs: {@code string}, {@code number}, {@code integer},
 * {@code boolean}, {@code null}, {@code array} with {@code items} and
 * {@code object} with {@code properties} and {@code required}. Unknown
 * keywords are ignored.
 */
public class JsonSchemaValidator {

    public static final String ROOT_PATH = "$";

    /**
     * Returns every violation found, each naming its JSON path. Empty when the
     * value conforms.
     */
    public List<String> validate(JsonNode value, Map<String, Object> schema) {
        List<String> errors = new ArrayList<>();
        validate(value, schema, ROOT_PATH, errors);
        return errors;
    }

    @SuppressWarnings("unchecked")
    private void validate(JsonNode value, Map<String, Object> schema, String path, List<String> errors) {
        Object type = schema.get("type");
        if (!(type instanceof String typeName)) {
            return;
        }

        switch (typeName) {
        case "string" -> expect(value != null && value.isTextual(), "string", value, path, errors);
        case "number" -> expect(value != null && value.isNumber(), "number", value, path, errors);
        case "integer" -> expect(value != null && value.isIntegralNumber(), "integer", value, path, errors);
        case "boolean" -> expect(value != null && value.isBoolean(), "boolean", value, path, errors);
        case "null" -> expect(value == null || value.isNull(), "null", value, path, errors);
        case "array" -> {
            if (!expect(value != null && value.isArray(), "array", value, path, errors)) {
                return;
            }
            if (schema.get("items") instanceof Map<?, ?> itemSchema) {
                for (int i = 0; i < value.size(); i++) {
                    validate(value.get(i), (Map<String, Object>) itemSchema, path + "[" + i + "]", errors);
                }
            }
        }
        case "object" -> {
            if (!expect(value != null && value.isObject(), "object", value, path, errors)) {
                return;
            }
            if (schema.get("required") instanceof List<?> required) {
                for (Object property : required) {
                    if (!value.has(String.valueOf(property))) {
                        errors.add("Missing required property \"" + property + "\" at " + path);
                    }
                }
            }
            if (schema.get("properties") instanceof Map<?, ?> properties) {
                for (Map.Entry<?, ?> entry : properties.entrySet()) {
                    String name = String.valueOf(entry.getKey());
                    if (entry.getValue() instanceof Map<?, ?> propertySchema && value.has(name)) {
                        validate(value.get(name), (Map<String, Object>) propertySchema, path + "." + name, errors);
                    }
                }
            }
        }
        default -> {
            // unsupported type keyword, accepted as-is
        }
        }
    }

    private static boolean expect(boolean matches, String expected, JsonNode value, String path,
            List<String> errors) {
        if (!matches) {
            errors.add("Expected " + expected + " at " + path + ", got " + describe(value));
        }
        return matches;
    }

    private static String describe(JsonNode value) {
        if (value == null || value.isMissingNode()) {
            return "nothing";
        }
        return switch (value.getNodeType()) {
        case STRING -> "string";
        case NUMBER -> value.isIntegralNumber() ? "integer" : "number";
        case BOOLEAN -> "boolean";
        case ARRAY -> "array";
        case OBJECT -> "object";
        case NULL -> "null";
        default -> value.getNodeType().name().toLowerCase(Locale.ROOT);
        };
    }
}
