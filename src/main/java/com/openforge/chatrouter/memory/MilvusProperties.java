package com.openforge.chatrouter.memory;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Connection parameters for the Milvus vector database.
 *
 * chat-router:
 *   milvus:
 *     enabled: true
 *     host: localhost
 *     port: 19530
 *     collection-name: chat_memories
 *
 * The vector dimension follows {@code chat-router.embedding.dimensions}.
 */
@ConfigurationProperties(prefix = "chat-router.milvus")
public record MilvusProperties(
        @DefaultValue("false")         boolean enabled,
        @DefaultValue("localhost")     String  host,
        @DefaultValue("19530")         int     port,
        @DefaultValue("chat_memories") String  collectionName
) {}
