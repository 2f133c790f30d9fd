package me.golemcore.llm.domain.model;

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
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Describes the structured output expected from the model: a JSON Schema for
 * a top-level object and a decoder that is only called on values satisfying
 * the schema.
 *
 * <p>
 * Primitive outputs are wrapped in an object with a single {@code value}
 * property, lists in an object with an {@code items} property, because the
 * extractor only accepts JSON objects.
 */
public final class OutputSpec<T> {

    public static final String VALUE_FIELD = "value";
    public static final String ITEMS_FIELD = "items";

    private final String name;
    private final String description;
    private final Map<String, Object> jsonSchema;
    private final Function<JsonNode, T> fromJson;

    private OutputSpec(String name, String description, Map<String, Object> jsonSchema,
            Function<JsonNode, T> fromJson) {
        this.name = name;
        this.description = description;
        this.jsonSchema = Collections.unmodifiableMap(new LinkedHashMap<>(jsonSchema));
        this.fromJson = fromJson;
    }

    public static <T> OutputSpec<T> object(String name, String description, Map<String, Object> jsonSchema,
            Function<JsonNode, T> fromJson) {
        return new OutputSpec<>(name, description, jsonSchema, fromJson);
    }

    /**
     * Object output decoded into a POJO with Jackson.
     */
    public static <T> OutputSpec<T> object(String name, String description, Map<String, Object> jsonSchema,
            Class<T> type, ObjectMapper objectMapper) {
        return new OutputSpec<>(name, description, jsonSchema, node -> {
            try {
                return objectMapper.treeToValue(node, type);
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("Cannot map structured output to " + type.getSimpleName(), e);
            }
        });
    }

    public static OutputSpec<Integer> intValue() {
        return primitive("IntValue", "integer", node -> {
            JsonNode value = node.get(VALUE_FIELD);
            if (!value.canConvertToInt()) {
                throw new IllegalArgumentException("Integer out of 32-bit range: " + value.asText());
            }
            return value.intValue();
        });
    }

    public static OutputSpec<Double> doubleValue() {
        return primitive("DoubleValue", "number", node -> node.get(VALUE_FIELD).doubleValue());
    }

    public static OutputSpec<String> stringValue() {
        return primitive("StringValue", "string", node -> node.get(VALUE_FIELD).textValue());
    }

    public static OutputSpec<Boolean> boolValue() {
        return primitive("BoolValue", "boolean", node -> node.get(VALUE_FIELD).booleanValue());
    }

    /**
     * List output whose elements each satisfy {@code itemSpec}.
     */
    public static <T> OutputSpec<List<T>> listOf(OutputSpec<T> itemSpec) {
        Map<String, Object> arraySchema = new LinkedHashMap<>();
        arraySchema.put("type", "array");
        arraySchema.put("items", itemSpec.getJsonSchema());

        return new OutputSpec<>("ListOf" + itemSpec.getName(), "A list of " + itemSpec.getName() + " items",
                wrapper(ITEMS_FIELD, arraySchema), node -> {
                    List<T> items = new ArrayList<>();
                    for (JsonNode element : node.get(ITEMS_FIELD)) {
                        items.add(itemSpec.fromJson(element));
                    }
                    return Collections.unmodifiableList(items);
                });
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public Map<String, Object> getJsonSchema() {
        return jsonSchema;
    }

    public T fromJson(JsonNode node) {
        return fromJson.apply(node);
    }

    /**
     * Tool definition that lets the model return the object as a call to a
     * tool named after this output.
     */
    public ToolDefinition toToolDefinition() {
        return ToolDefinition.builder()
                .name(name)
                .description(description != null ? description : "Return the result as " + name)
                .inputSchema(jsonSchema)
                .build();
    }

    private static <T> OutputSpec<T> primitive(String name, String jsonType, Function<JsonNode, T> fromJson) {
        return new OutputSpec<>(name, "A single " + jsonType + " value", wrapper(VALUE_FIELD, Map.of("type", jsonType)),
                fromJson);
    }

    private static Map<String, Object> wrapper(String field, Map<String, Object> fieldSchema) {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", Map.of(field, fieldSchema));
        schema.put("required", List.of(field));
        return schema;
    }
}
