package com.openforge.chatrouter.llm.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Response from Gemini {@code generateContent}.
 */
@JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
public record GeminiResponse(
        List<Candidate> candidates,
        UsageMetadata usageMetadata,
        String modelVersion
) {

    /** Concatenated text parts of the first candidate, or null. */
    public String firstText() {
        if (candidates == null || candidates.isEmpty()) return null;
        GeminiRequest.Content content = candidates.get(0).content();
        if (content == null || content.parts() == null) return null;
        StringBuilder sb = new StringBuilder();
        for (GeminiRequest.Part part : content.parts()) {
            if (part.text() != null) sb.append(part.text());
        }
        return sb.toString();
    }

    @JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
    public record Candidate(GeminiRequest.Content content, String finishReason) {}

    @JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
    public record UsageMetadata(int promptTokenCount, int candidatesTokenCount, int totalTokenCount) {}
}
