package com.openforge.chatrouter.llm.model;

import java.util.List;

/**
 * Top-level response from {@code /chat/completions}.
 */
public record ChatResponse(
        String id,
        String object,
        Long created,
        String model,
        List<Choice> choices,
        Usage usage
) {

    /** Text of the first choice, or null when the provider returned none. */
    public String firstText() {
        if (choices == null || choices.isEmpty()) return null;
        Message message = choices.get(0).message();
        return message == null ? null : message.content();
    }

    public record Choice(
            int index,
            Message message,
            String finishReason
    ) {}

    public record Usage(
            int promptTokens,
            int completionTokens,
            int totalTokens
    ) {}
}
