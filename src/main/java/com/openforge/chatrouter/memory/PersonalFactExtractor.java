package com.openforge.chatrouter.memory;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern-based extraction of identity facts.
 *
 * Used in two directions: reading {@code personalFacts} back out of stored
 * memory text ("User's name is Kunal" → name: Kunal), and spotting new facts
 * in a user's message ("my name is Kunal") so they can be stored.
 */
@Component
public class PersonalFactExtractor {

    /** A fact found in free text, with the canonical sentence to store for it. */
    public record Fact(String tag, String value, String statement, int importance) {}

    private record Rule(String tag, Pattern pattern, String template, int importance) {}

    private static final String PROPER = "(\\p{Lu}[\\p{L}'-]*(?:\\s+\\p{Lu}[\\p{L}'-]*){0,2})";

    private static final List<Rule> RULES = List.of(
            new Rule("name", Pattern.compile(
                    "(?i:\\b(?:user'?s name is|my name is|name is|call me|i'?m called|i am called))\\s+"
                    + "(\\p{L}[\\p{L}'-]*)"),
                    "User's name is %s", 5),
            new Rule("age", Pattern.compile(
                    "(?i)\\b(?:(?:age is|aged)\\s+(\\d{1,3})\\b"
                    + "|(?:i am|i'm|user is)\\s+(\\d{1,3})\\s*(?:years?\\s+old|yo)\\b)"),
                    "User is %s years old", 4),
            new Rule("location", Pattern.compile(
                    "(?i:\\b(?:i live in|i'm from|i am from|lives in|is from|based in))\\s+" + PROPER),
                    "User lives in %s", 3),
            new Rule("school", Pattern.compile(
                    "(?i:\\b(?:i study at|i go to|studies at|attends|student at|enrolled at))\\s+" + PROPER),
                    "User studies at %s", 3),
            new Rule("subject", Pattern.compile(
                    "(?i)\\b(?:i am studying|i'm studying|user is studying|studying|majoring in|my subject is)\\s+"
                    + "(?!at\\b)([\\p{L}][\\p{L} ]{1,40}?)(?=\\s+(?:at|for|because)\\b|[.,!?;]|$)"),
                    "User is studying %s", 3),
            new Rule("goal", Pattern.compile(
                    "(?i)\\b(?:my goal is to|user's goal is to|goal is to|i want to|i plan to|preparing for)\\s+"
                    + "([^.!?\\n]{3,80})"),
                    "User's goal is to %s", 3)
    );

    private static final Map<String, String> TAG_ALIASES = Map.ofEntries(
            Map.entry("name", "name"), Map.entry("called", "name"),
            Map.entry("age", "age"), Map.entry("old", "age"), Map.entry("birthday", "age"),
            Map.entry("location", "location"), Map.entry("live", "location"), Map.entry("from", "location"),
            Map.entry("city", "location"), Map.entry("country", "location"),
            Map.entry("school", "school"), Map.entry("college", "school"), Map.entry("university", "school"),
            Map.entry("subject", "subject"), Map.entry("studying", "subject"), Map.entry("study", "subject"),
            Map.entry("major", "subject"), Map.entry("course", "subject"),
            Map.entry("goal", "goal"), Map.entry("goals", "goal"), Map.entry("plan", "goal"), Map.entry("aim", "goal")
    );

    /**
     * Tags a personal query is asking about, used to force-include records
     * tagged with them.  Includes the query's own content words so custom
     * tags match too; "who am i" maps to {@code name}.
     */
    public Set<String> queryTags(String query) {
        Set<String> tags  = new LinkedHashSet<>(HashingEmbeddingAdapter.tokenize(query));
        String      lower = query.toLowerCase(Locale.ROOT);
        if (lower.contains("who am i")) tags.add("name");
        for (String word : lower.split("[^\\p{L}]+")) {
            String tag = TAG_ALIASES.get(word);
            if (tag != null) tags.add(tag);
        }
        return tags;
    }

    /**
     * Facts in {@code texts}, first occurrence per tag winning.  Callers pass
     * the most relevant text first.
     */
    public Map<String, String> facts(List<String> texts) {
        Map<String, String> facts = new LinkedHashMap<>();
        for (String text : texts) {
            for (Fact f : extract(text)) {
                facts.putIfAbsent(f.tag(), f.value());
            }
        }
        return facts;
    }

    /** Every fact stated in one piece of text, at most one per tag. */
    public List<Fact> extract(String text) {
        List<Fact> found = new ArrayList<>();
        if (text == null || text.isBlank()) return found;
        for (Rule rule : RULES) {
            Matcher m = rule.pattern().matcher(text);
            if (!m.find()) continue;
            String value = clean(rule.tag(), firstGroup(m));
            if (value.isEmpty()) continue;
            found.add(new Fact(rule.tag(), value, rule.template().formatted(value), rule.importance()));
        }
        return found;
    }

    // Rules with alternative phrasings capture the value in whichever branch matched.
    private static String firstGroup(Matcher m) {
        for (int i = 1; i <= m.groupCount(); i++) {
            if (m.group(i) != null) return m.group(i);
        }
        return "";
    }

    private static String clean(String tag, String raw) {
        String value = raw.trim().replaceAll("\\s+", " ");
        if (tag.equals("name") && !value.isEmpty()) {
            value = Character.toUpperCase(value.charAt(0)) + value.substring(1);
        }
        if (tag.equals("age")) {
            int age = Integer.parseInt(value);
            return age > 0 && age < 130 ? value : "";
        }
        return value;
    }
}
