package com.openforge.chatrouter.config;

import com.openforge.chatrouter.cache.CacheProperties;
import com.openforge.chatrouter.llm.LlmProperties;
import com.openforge.chatrouter.memory.EmbeddingProperties;
import com.openforge.chatrouter.memory.MemoryProperties;
import com.openforge.chatrouter.memory.MilvusProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Prints a structured startup summary after the application context is fully ready.
 *
 * Checks performed:
 *   - MySQL: opens a real JDBC connection and reads the server version
 *   - Provider tiers: id, tier, model, limits (API key masked)
 *   - Response cache: size and TTL table
 *   - Memory: store, embedding source, retention and ranking weights
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final DataSource          dataSource;
    private final LlmProperties       llmProperties;
    private final CacheProperties     cacheProperties;
    private final MemoryProperties    memoryProperties;
    private final EmbeddingProperties embeddingProperties;
    private final MilvusProperties    milvusProperties;
    private final Environment         env;

    @Override
    public void run(ApplicationArguments args) {
        StringBuilder providers = new StringBuilder();
        for (LlmProperties.ProviderConfig p : llmProperties.providers()) {
            providers.append("\n║    tier %d  %-12s %-32s rpm=%d rpmonth=%d %s key=%s".formatted(
                    p.tier(), p.id(), p.model(), p.requestsPerMinute(), p.requestsPerMonth(),
                    p.enabled() ? "" : "[disabled]", maskKey(p.apiKey())));
        }

        String memoryStore = milvusProperties.enabled()
                ? "Milvus %s:%d/%s".formatted(milvusProperties.host(), milvusProperties.port(),
                        milvusProperties.collectionName())
                : "in-process (not persistent)";
        String embedding = embeddingProperties.remote()
                ? "%s  dim=%d  %s".formatted(embeddingProperties.model(), embeddingProperties.dimensions(),
                        embeddingProperties.baseUrl())
                : "local hashing  dim=%d".formatted(embeddingProperties.dimensions());

        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║             Chat Router  —  Startup Summary              ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Server                                                  ║
                ║    HTTP Port      : {}
                ║    Java Version   : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Database (MySQL)                                        ║
                ║    {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Provider Tiers ({}){}
                ╠══════════════════════════════════════════════════════════╣
                ║  Response Cache                                          ║
                ║    Enabled        : {}  max={}
                ║    TTL            : {}  skip={}
                ╠══════════════════════════════════════════════════════════╣
                ║  Memory                                                  ║
                ║    Store          : {}
                ║    Embedding      : {}
                ║    Retention      : {}
                ║    Weights        : {}
                ╚══════════════════════════════════════════════════════════╝
                """,
                env.getProperty("server.port", "8080"),
                System.getProperty("java.version"),

                probeDatabase(),

                llmProperties.providers().size(), providers,

                cacheProperties.enabled(), cacheProperties.maximumSize(),
                cacheProperties.ttl(), cacheProperties.skipTypes(),

                memoryStore,
                embedding,
                memoryProperties.retention(),
                memoryProperties.weights()
        );
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    /**
     * Opens a real JDBC connection and reads the DB server version.
     * Returns a one-line summary or error message.
     */
    private String probeDatabase() {
        try (Connection conn = dataSource.getConnection()) {
            String url     = conn.getMetaData().getURL();
            String version = conn.getMetaData().getDatabaseProductVersion();
            String safeUrl = url.replaceAll("password=[^&;]*", "password=***");
            return "✔ Connected  version=" + version + "  url=" + safeUrl;
        } catch (SQLException e) {
            return "✘ FAILED — " + e.getMessage();
        }
    }

    /** First 6 chars + "..." + last 4; "(not set)" for blank keys. */
    static String maskKey(String key) {
        if (key == null || key.isBlank()) {
            return "(not set)";
        }
        if (key.length() <= 10) return "***";
        return key.substring(0, 6) + "..." + key.substring(key.length() - 4);
    }
}
