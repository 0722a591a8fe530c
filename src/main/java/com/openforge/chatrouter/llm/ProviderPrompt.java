package com.openforge.chatrouter.llm;

import com.openforge.chatrouter.llm.model.Message;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Provider-neutral prompt: an ordered list of role/content messages.
 * System messages may appear anywhere; adapters that need a single system
 * instruction use {@link #systemText()}.
 */
public record ProviderPrompt(List<Message> messages) {

    public ProviderPrompt {
        messages = List.copyOf(messages);
        if (messages.isEmpty()) {
            throw new IllegalArgumentException("Prompt must contain at least one message");
        }
    }

    public static ProviderPrompt of(Message... messages) {
        return new ProviderPrompt(List.of(messages));
    }

    /** All system messages joined by blank lines, or null if there are none. */
    public String systemText() {
        String joined = messages.stream()
                .filter(Message::isSystem)
                .map(Message::content)
                .collect(Collectors.joining("\n\n"));
        return joined.isEmpty() ? null : joined;
    }

    public List<Message> conversation() {
        return messages.stream().filter(m -> !m.isSystem()).toList();
    }

    /** Rough size used for token estimates when a provider reports no usage. */
    public int characterCount() {
        return messages.stream().mapToInt(m -> m.content() == null ? 0 : m.content().length()).sum();
    }
}
