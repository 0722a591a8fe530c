package com.openforge.chatrouter.chat;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.Set;

/**
 * Request handling settings.
 *
 * chat-router:
 *   chat:
 *     memory-chat-types: [study_assistant]
 *     max-message-length: 8000
 *     history-window: 20
 *     personal-context-limit: 8
 *     default-context-limit: 5
 *     default-context-level: balanced
 *
 * @param memoryChatTypes chat types that get long-term memory and fact extraction
 * @param historyWindow   earlier messages kept per conversation and sent to providers
 */
@ConfigurationProperties(prefix = "chat-router.chat")
public record ChatProperties(
        @DefaultValue("study_assistant") Set<String> memoryChatTypes,
        @DefaultValue("8000")            int         maxMessageLength,
        @DefaultValue("20")              int         historyWindow,
        @DefaultValue("8")               int         personalContextLimit,
        @DefaultValue("5")               int         defaultContextLimit,
        @DefaultValue("balanced")        String      defaultContextLevel
) {

    public static ChatProperties defaults() {
        return new ChatProperties(Set.of("study_assistant"), 8000, 20, 8, 5, "balanced");
    }

    public boolean memoryEnabledFor(String chatType) {
        return chatType != null && memoryChatTypes.contains(chatType);
    }
}
