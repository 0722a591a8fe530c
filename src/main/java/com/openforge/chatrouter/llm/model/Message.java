package com.openforge.chatrouter.llm.model;

/**
 * A single entry in a chat prompt, in OpenAI role/content form.
 *
 * role variants:
 *   "system"     persona, instructions and injected memory context
 *   "user"       human turn
 *   "assistant"  earlier model reply
 */
public record Message(
        String role,
        String content
) {

    public static final String SYSTEM    = "system";
    public static final String USER      = "user";
    public static final String ASSISTANT = "assistant";

    public static Message system(String content) {
        return new Message(SYSTEM, content);
    }

    public static Message user(String content) {
        return new Message(USER, content);
    }

    public static Message assistant(String content) {
        return new Message(ASSISTANT, content);
    }

    public boolean isSystem() {
        return SYSTEM.equals(role);
    }
}
