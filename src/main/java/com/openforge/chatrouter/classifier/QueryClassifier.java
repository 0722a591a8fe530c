package com.openforge.chatrouter.classifier;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tags a message as {@link QueryType#TEMPORAL}, {@link QueryType#PERSONAL} or
 * {@link QueryType#GENERAL}.
 *
 * Pure function of the message text and the optional {@link Hints}: the same
 * input always yields the same classification.  When both personal and
 * temporal phrasing is present the message is PERSONAL, since answering it
 * needs the user's stored facts.
 */
@Component
public class QueryClassifier {

    static final double DEFAULT_CONFIDENCE = 0.8;

    private static final double BASE_MATCH_CONFIDENCE = 0.6;
    private static final double PER_SIGNAL_BONUS      = 0.1;
    private static final double MAX_CONFIDENCE        = 0.95;

    private static final List<String> PERSONAL_PHRASES = List.of(
            "my name", "do you know", "who am i", "what is my", "what's my",
            "remember me", "about me", "remember that i", "did i tell you",
            "my favorite", "my favourite", "my goal", "my exam", "my age",
            "my school", "my subject", "where do i", "how old am i"
    );

    private static final Pattern TEMPORAL_PATTERN = Pattern.compile(
            "\\b(today|tonight|tomorrow|yesterday|now|right now|currently|current|latest|recent|"
          + "this (?:morning|afternoon|evening|week|month|year)|"
          + "(?:next|last) (?:week|month|year|monday|tuesday|wednesday|thursday|friday|saturday|sunday)|"
          + "monday|tuesday|wednesday|thursday|friday|saturday|sunday|"
          + "january|february|march|april|june|july|august|september|october|november|december|"
          + "deadline|schedule|due date|"
          + "\\d{4}-\\d{2}-\\d{2}|\\d{1,2}/\\d{1,2}(?:/\\d{2,4})?|\\d{1,2}(?::\\d{2})?\\s?(?:am|pm)|"
          + "what time|what day|what date)\\b");

    /**
     * Optional caller-provided flags.
     *
     * @param assumePersonal force PERSONAL regardless of phrasing
     * @param timeSensitive  force TEMPORAL unless the message is personal
     */
    public record Hints(boolean assumePersonal, boolean timeSensitive) {
        public static final Hints NONE = new Hints(false, false);
    }

    public QueryClassification classify(String message) {
        return classify(message, Hints.NONE);
    }

    public QueryClassification classify(String message, Hints hints) {
        if (message == null || message.isBlank()) {
            return QueryClassification.general();
        }
        Hints effective = hints == null ? Hints.NONE : hints;
        String text = message.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ").trim();

        List<String> personal = new ArrayList<>();
        for (String phrase : PERSONAL_PHRASES) {
            if (text.contains(phrase)) personal.add(phrase);
        }
        if (effective.assumePersonal()) personal.add("hint:personal");
        if (!personal.isEmpty()) {
            return new QueryClassification(QueryType.PERSONAL, confidenceFor(personal.size()), personal);
        }

        List<String> temporal = new ArrayList<>();
        Matcher m = TEMPORAL_PATTERN.matcher(text);
        while (m.find()) {
            temporal.add(m.group(1));
        }
        if (effective.timeSensitive()) temporal.add("hint:time-sensitive");
        if (!temporal.isEmpty()) {
            return new QueryClassification(QueryType.TEMPORAL, confidenceFor(temporal.size()), temporal);
        }

        return QueryClassification.general();
    }

    private static double confidenceFor(int signalCount) {
        return Math.min(MAX_CONFIDENCE, BASE_MATCH_CONFIDENCE + PER_SIGNAL_BONUS * (signalCount - 1));
    }
}
