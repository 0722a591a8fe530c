package com.openforge.chatrouter.memory;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;

/**
 * Picks the embedding adapter: the remote endpoint when
 * {@code chat-router.embedding.base-url} is set, otherwise local hashing.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties({MemoryProperties.class, EmbeddingProperties.class})
public class MemoryConfig {

    @Bean
    public EmbeddingAdapter embeddingAdapter(EmbeddingProperties props,
                                             HttpClient httpClient,
                                             ObjectMapper objectMapper) {
        if (props.remote()) {
            log.info("[Memory] Embeddings via {} model={} dim={}", props.baseUrl(), props.model(), props.dimensions());
            return new EmbeddingClient(httpClient, objectMapper, props);
        }
        log.info("[Memory] No embedding endpoint configured; using local hashing embeddings (dim={})",
                props.dimensions());
        return new HashingEmbeddingAdapter(props.dimensions());
    }

    @Bean
    public MemoryRanker memoryRanker(MemoryProperties props) {
        return new MemoryRanker(props);
    }
}
