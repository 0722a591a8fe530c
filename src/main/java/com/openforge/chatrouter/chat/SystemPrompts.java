package com.openforge.chatrouter.chat;

import com.openforge.chatrouter.classifier.QueryType;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/** System prompt per chat type, with a suffix per query type. */
final class SystemPrompts {

    static final String STUDY_ASSISTANT = "study_assistant";

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("EEEE, yyyy-MM-dd HH:mm 'UTC'")
            .withZone(ZoneOffset.UTC);

    private static final String STUDY_BASE = """
            You are Study Buddy, a friendly and patient study assistant for students.
            Explain concepts step by step, check understanding, and keep answers focused on learning.
            When information about the student is provided, use it to personalise the answer.""";

    private static final String GENERAL_BASE = """
            You are a helpful assistant. Answer clearly and concisely.""";

    private static final String PERSONAL_SUFFIX = """

            The student is asking about themselves. Answer from the facts provided about them.
            If the facts do not contain the answer, say honestly that you don't know yet and invite them to tell you.""";

    private static final String TEMPORAL_SUFFIX = """

            The current date and time is %s. If the question needs live information you do not have, say so.""";

    private SystemPrompts() {}

    static String build(String chatType, QueryType queryType, Instant now) {
        String base = STUDY_ASSISTANT.equals(chatType) ? STUDY_BASE : GENERAL_BASE;
        return switch (queryType) {
            case PERSONAL -> base + PERSONAL_SUFFIX;
            case TEMPORAL -> base + TEMPORAL_SUFFIX.formatted(DATE.format(now));
            case GENERAL  -> base;
        };
    }
}
