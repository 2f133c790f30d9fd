package me.golemcore.llm.domain.model;

/**
 * Decoded structured output together with the model response it came from.
 */
public record GenerateObjectResult<T>(T object, LlmResponse response) {
}
