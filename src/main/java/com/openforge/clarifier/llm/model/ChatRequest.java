package com.openforge.clarifier.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;

/**
 * The request body sent to an OpenAI-compatible /chat/completions endpoint.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatRequest(
        String model,
        List<Message> messages,
        Double temperature,
        Integer maxTokens
) {

    public static ChatRequest of(String model, List<Message> messages, double temperature, Integer maxTokens) {
        return ChatRequest.builder()
                .model(model)
                .messages(List.copyOf(messages))
                .temperature(temperature)
                .maxTokens(maxTokens)
                .build();
    }
}
