package com.openforge.chatrouter.chat;

/** A chat request rejected before any provider was contacted. */
public class ChatRequestException extends RuntimeException {

    public ChatRequestException(String message) {
        super(message);
    }
}
