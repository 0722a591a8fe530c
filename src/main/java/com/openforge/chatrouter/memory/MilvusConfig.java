package com.openforge.chatrouter.memory;

import io.milvus.v2.client.ConnectConfig;
import io.milvus.v2.client.MilvusClientV2;
import io.milvus.v2.common.DataType;
import io.milvus.v2.common.IndexParam;
import io.milvus.v2.service.collection.request.AddFieldReq;
import io.milvus.v2.service.collection.request.CreateCollectionReq;
import io.milvus.v2.service.collection.request.HasCollectionReq;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.Map;

/**
 * Milvus client and collection bootstrap, active when
 * {@code chat-router.milvus.enabled=true}.
 *
 * Collection schema (chat_memories):
 * ┌──────────────────┬─────────────────────┬──────────────────────────────────┐
 * │ Field            │ Type                │ Notes                            │
 * ├──────────────────┼─────────────────────┼──────────────────────────────────┤
 * │ id               │ VARCHAR(64) PK      │ UUID assigned by MemoryService   │
 * │ owner_id         │ VARCHAR(64)         │ every query filters on it        │
 * │ content          │ VARCHAR(4096)       │                                  │
 * │ importance       │ INT32               │ 1 – 5                            │
 * │ tags             │ ARRAY<VARCHAR(64)>  │ up to 16                         │
 * │ create_time_ms   │ INT64               │ epoch millis                     │
 * │ expires_at_ms    │ INT64               │ epoch millis                     │
 * │ active           │ BOOL                │                                  │
 * │ embedding        │ FLOAT_VECTOR        │ dim = embedding.dimensions       │
 * └──────────────────┴─────────────────────┴──────────────────────────────────┘
 *
 * Index: HNSW on embedding with COSINE, so scores are comparable across
 * embedding providers whether or not they normalise their vectors.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "chat-router.milvus.enabled", havingValue = "true")
public class MilvusConfig {

    static final int MAX_TAGS = 16;

    @Bean(destroyMethod = "close")
    public MilvusClientV2 milvusClient(MilvusProperties props, EmbeddingProperties embeddingProps) {
        log.info("[Milvus] Connecting to {}:{}...", props.host(), props.port());
        MilvusClientV2 client = new MilvusClientV2(
                ConnectConfig.builder()
                        .uri("http://%s:%d".formatted(props.host(), props.port()))
                        .connectTimeoutMs(15_000)
                        .build());
        log.info("[Milvus] Connected successfully.");
        ensureCollectionExists(client, props.collectionName(), embeddingProps.dimensions());
        return client;
    }

    // ── Collection bootstrap ─────────────────────────────────────────────────

    private void ensureCollectionExists(MilvusClientV2 client, String name, int dimension) {
        boolean exists = client.hasCollection(HasCollectionReq.builder().collectionName(name).build());
        if (exists) {
            log.info("[Milvus] Collection '{}' already exists, skipping creation.", name);
            return;
        }

        log.info("[Milvus] Creating collection '{}' (dim={})...", name, dimension);

        CreateCollectionReq.CollectionSchema schema = CreateCollectionReq.CollectionSchema.builder().build();
        schema.addField(AddFieldReq.builder().fieldName("id")
                .dataType(DataType.VarChar).maxLength(64).isPrimaryKey(true).autoID(false).build());
        schema.addField(AddFieldReq.builder().fieldName("owner_id")
                .dataType(DataType.VarChar).maxLength(64).build());
        schema.addField(AddFieldReq.builder().fieldName("content")
                .dataType(DataType.VarChar).maxLength(4096).build());
        schema.addField(AddFieldReq.builder().fieldName("importance")
                .dataType(DataType.Int32).build());
        schema.addField(AddFieldReq.builder().fieldName("tags")
                .dataType(DataType.Array).elementType(DataType.VarChar)
                .maxCapacity(MAX_TAGS).maxLength(64).build());
        schema.addField(AddFieldReq.builder().fieldName("create_time_ms")
                .dataType(DataType.Int64).build());
        schema.addField(AddFieldReq.builder().fieldName("expires_at_ms")
                .dataType(DataType.Int64).build());
        schema.addField(AddFieldReq.builder().fieldName("active")
                .dataType(DataType.Bool).build());
        schema.addField(AddFieldReq.builder().fieldName("embedding")
                .dataType(DataType.FloatVector).dimension(dimension).build());

        IndexParam vectorIndex = IndexParam.builder()
                .fieldName("embedding")
                .indexType(IndexParam.IndexType.HNSW)
                .metricType(IndexParam.MetricType.COSINE)
                .extraParams(Map.of("M", 16, "efConstruction", 256))
                .build();
        IndexParam ownerIndex = IndexParam.builder()
                .fieldName("owner_id")
                .indexType(IndexParam.IndexType.TRIE)
                .build();

        client.createCollection(CreateCollectionReq.builder()
                .collectionName(name)
                .collectionSchema(schema)
                .indexParams(List.of(vectorIndex, ownerIndex))
                .build());

        log.info("[Milvus] Collection '{}' created successfully.", name);
    }
}
