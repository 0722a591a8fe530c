package com.openforge.chatrouter.classifier;

/**
 * Coarse category of an incoming chat message.
 *
 * Drives cache TTL, memory retrieval depth and provider preference.
 */
public enum QueryType {

    /** References dates, times or "current" information. */
    TEMPORAL,

    /** Depends on facts previously stored about the user. */
    PERSONAL,

    GENERAL
}
