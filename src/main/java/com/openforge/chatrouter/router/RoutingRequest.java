package com.openforge.chatrouter.router;

import com.openforge.chatrouter.classifier.QueryClassification;
import com.openforge.chatrouter.llm.ProviderPrompt;
import com.openforge.chatrouter.llm.SendParams;
import com.openforge.chatrouter.llm.model.Message;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything the {@link FallbackRouter} needs for one request.
 *
 * @param memoryContext formatted memory block, or null when none was retrieved
 * @param history       earlier turns of the conversation, oldest first
 */
public record RoutingRequest(
        String              requestId,
        QueryClassification classification,
        String              systemPrompt,
        String              memoryContext,
        List<Message>       history,
        String              message,
        SendParams          params
) {

    public RoutingRequest {
        history = history == null ? List.of() : List.copyOf(history);
    }

    /**
     * System prompt, then history, then the user turn.  When memory context is
     * present it is prepended to the user turn so every provider sees it next
     * to the question.
     */
    public ProviderPrompt toPrompt() {
        List<Message> messages = new ArrayList<>(history.size() + 2);
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.add(Message.system(systemPrompt));
        }
        messages.addAll(history);
        String userTurn = memoryContext == null || memoryContext.isBlank()
                ? message
                : memoryContext + "\n\nUser's current question: " + message;
        messages.add(Message.user(userTurn));
        return new ProviderPrompt(messages);
    }
}
