package com.openforge.chatrouter.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Request body for Gemini {@code models/{model}:generateContent}.
 *
 * Gemini uses camelCase on the wire, so these records opt out of the
 * application-wide snake_case naming.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
public record GeminiRequest(
        List<Content> contents,
        Content systemInstruction,
        GenerationConfig generationConfig
) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
    public record Content(String role, List<Part> parts) {

        public static Content of(String role, String text) {
            return new Content(role, List.of(new Part(text)));
        }
    }

    public record Part(String text) {}

    @JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
    public record GenerationConfig(Double temperature, Integer maxOutputTokens) {}
}
