package com.openforge.chatrouter.llm;

/**
 * The caller stopped waiting (thread interrupted) while a provider call was
 * in flight.  The call has already been counted against the provider's quota.
 */
public class RequestCancelledException extends RuntimeException {

    public RequestCancelledException(String message) {
        super(message);
    }
}
