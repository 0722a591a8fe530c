package com.openforge.chatrouter.router;

import com.openforge.chatrouter.classifier.QueryType;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;
import java.util.Map;

/**
 * chat-router:
 *   router:
 *     preferences:
 *       temporal: [gemini]
 *     event-history-size: 200
 *
 * {@code preferences} lists providers that move to the front of the tier
 * order for a given query type.
 */
@ConfigurationProperties(prefix = "chat-router.router")
public record RouterProperties(
        Map<QueryType, List<String>> preferences,
        @DefaultValue("I apologize, but I'm experiencing high demand right now. "
                + "Please try again in a few moments, and I'll be happy to help!") String degradedMessage,
        @DefaultValue("200") int eventHistorySize
) {

    public RouterProperties {
        preferences = preferences == null ? Map.of() : Map.copyOf(preferences);
    }
}
