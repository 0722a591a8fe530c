package com.openforge.chatrouter.chat.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.openforge.chatrouter.chat.ChatResult;

import java.util.List;
import java.util.Locale;

/**
 * Response body for POST /api/chat.
 *
 * camelCase on the wire, overriding the global snake_case strategy used for
 * provider payloads.
 */
@JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
public record ChatResponseBody(
        String       conversationId,
        String       content,
        String       provider,
        String       model,
        int          tier,
        int          tokensUsed,
        long         latencyMs,
        boolean      cached,
        boolean      degraded,
        String       queryType,
        List<String> memoryReferences
) {

    public static ChatResponseBody from(String conversationId, ChatResult r) {
        return new ChatResponseBody(
                conversationId,
                r.content(),
                r.provider(),
                r.model(),
                r.tier(),
                r.tokensUsed(),
                r.latencyMs(),
                r.cached(),
                r.degraded(),
                r.queryType().name().toLowerCase(Locale.ROOT),
                r.memoryReferences()
        );
    }
}
