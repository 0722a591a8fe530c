package com.openforge.chatrouter.chat;

import com.openforge.chatrouter.classifier.QueryType;

import java.util.List;

/**
 * What {@link ChatOrchestrator#handleChatRequest} returns.
 *
 * @param memoryReferences ids of the memory records used to build the prompt
 * @param state            terminal state: RESPONDED or DEGRADED_RESPONDED
 */
public record ChatResult(
        String       content,
        String       provider,
        String       model,
        int          tier,
        int          tokensUsed,
        long         latencyMs,
        boolean      cached,
        boolean      degraded,
        QueryType    queryType,
        List<String> memoryReferences,
        RequestState state
) {

    public ChatResult {
        memoryReferences = memoryReferences == null ? List.of() : List.copyOf(memoryReferences);
    }
}
