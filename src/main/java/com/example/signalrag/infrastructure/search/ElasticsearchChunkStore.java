package com.example.signalrag.infrastructure.search;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.query_dsl.MatchQuery;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch._types.query_dsl.TextExpansionQuery;
import co.elastic.clients.elasticsearch.cluster.HealthResponse;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.GetRequest;
import co.elastic.clients.elasticsearch.core.GetResponse;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.bulk.BulkOperation;
import co.elastic.clients.elasticsearch.core.bulk.BulkResponseItem;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import co.elastic.clients.elasticsearch.indices.ExistsRequest;
import com.example.signalrag.domain.model.ChunkDocument;
import com.example.signalrag.domain.model.ChunkHit;
import com.example.signalrag.domain.model.ChunkKey;
import com.example.signalrag.domain.model.DenseVector;
import com.example.signalrag.domain.model.IndexResult;
import com.example.signalrag.domain.model.StoredChunk;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
public class ElasticsearchChunkStore implements ChunkStore {

    private static final Logger log = LoggerFactory.getLogger(ElasticsearchChunkStore.class);

    static final String MAPPING_RESOURCE = "/elasticsearch/chunk-index.json";
    static final String DIMS_PLACEHOLDER = "__DENSE_DIMS__";

    public static final String FIELD_TEXT = "text";
    public static final String FIELD_CONTENT = "content";
    public static final String FIELD_CHUNK_ID = "chunk_id";
    public static final String FIELD_DOCUMENT_ID = "document_id";
    public static final String FIELD_FILENAME = "filename";
    public static final String FIELD_SOURCE_URL = "source_url";
    public static final String FIELD_TOKEN_COUNT = "token_count";
    public static final String FIELD_CHAR_COUNT = "char_count";
    public static final String FIELD_DENSE = "dense_embedding";
    public static final String FIELD_SPARSE = "sparse_expansion";
    public static final String FIELD_INDEXED_AT = "indexed_at";

    private static final List<String> VECTOR_FIELDS = List.of(FIELD_DENSE, FIELD_SPARSE);

    private final ElasticsearchClient client;
    private final String indexName;
    private final int denseDimensions;
    private final String expansionModelId;

    private volatile boolean indexReady;

    public ElasticsearchChunkStore(
            ElasticsearchClient client,
            @Value("${signalrag.elasticsearch.index}") String indexName,
            @Value("${signalrag.embedding.dense.dimensions}") int denseDimensions,
            @Value("${signalrag.embedding.sparse.model-id}") String expansionModelId
    ) {
        this.client = client;
        this.indexName = indexName;
        this.denseDimensions = denseDimensions;
        this.expansionModelId = expansionModelId;
    }

    @Override
    public void ensureIndexExists() {
        if (indexReady) {
            return;
        }
        try {
            boolean exists = client.indices().exists(ExistsRequest.of(e -> e.index(indexName))).value();
            if (exists) {
                indexReady = true;
                return;
            }
            String mapping = loadMapping();
            client.indices().create(CreateIndexRequest.of(c -> c
                    .index(indexName)
                    .withJson(new StringReader(mapping))));
            indexReady = true;
            log.info("event=es_index_created index={} denseDims={}", indexName, denseDimensions);
        } catch (ElasticsearchException e) {
            // another instance created it between exists() and create()
            if ("resource_already_exists_exception".equals(e.error().type())) {
                indexReady = true;
                return;
            }
            throw new ChunkStoreException("Failed to ensure Elasticsearch index exists: " + indexName, e);
        } catch (IOException e) {
            throw new ChunkStoreException("Failed to ensure Elasticsearch index exists: " + indexName, e);
        }
    }

    @Override
    public IndexResult upsertAll(List<ChunkDocument> documents) {
        if (documents == null || documents.isEmpty()) {
            return IndexResult.EMPTY;
        }

        List<BulkOperation> ops = new ArrayList<>(documents.size());
        for (ChunkDocument doc : documents) {
            Map<String, Object> source = toSource(doc);
            ops.add(BulkOperation.of(b -> b
                    .index(i -> i
                            .index(indexName)
                            .id(doc.key().storeId())
                            .document(source)
                    )));
        }

        try {
            ensureIndexExists();
            BulkResponse resp = client.bulk(BulkRequest.of(b -> b.operations(ops)));

            int indexed = 0;
            int errors = 0;
            for (BulkResponseItem item : resp.items()) {
                if (item.error() != null) {
                    errors++;
                    log.error("event=es_bulk_item_error id={} type={} reason={}",
                            item.id(), item.error().type(), item.error().reason());
                } else if (item.status() >= 200 && item.status() < 300) {
                    indexed++;
                } else {
                    errors++;
                    log.error("event=es_bulk_item_error id={} status={}", item.id(), item.status());
                }
            }
            // items missing from the response were not written
            errors += Math.max(0, documents.size() - resp.items().size());

            if (resp.errors()) {
                log.warn("event=es_bulk_index_errors index={} indexed={} errors={} took={}ms",
                        indexName, indexed, errors, resp.took());
            } else {
                log.info("event=es_bulk_index_ok index={} count={} took={}ms", indexName, indexed, resp.took());
            }
            return new IndexResult(indexed, errors);
        } catch (IOException | RuntimeException e) {
            log.error("event=es_bulk_index_failed index={} count={} firstId={} err={}",
                    indexName, documents.size(), documents.get(0).key(), e.toString());
            return new IndexResult(0, documents.size());
        }
    }

    @Override
    public Optional<StoredChunk> find(ChunkKey key) {
        ensureIndexExists();
        try {
            GetResponse<Map> resp = client.get(GetRequest.of(g -> g
                            .index(indexName)
                            .id(key.storeId())
                            .sourceExcludes(VECTOR_FIELDS)),
                    Map.class);
            if (!resp.found() || resp.source() == null) {
                return Optional.empty();
            }
            return Optional.of(toStoredChunk(resp.source()));
        } catch (IOException | ElasticsearchException e) {
            throw new ChunkStoreException("Elasticsearch get failed for " + key, e);
        }
    }

    @Override
    public List<ChunkHit> lexicalSearch(String query, int size) {
        Query match = MatchQuery.of(m -> m.field(FIELD_TEXT).query(query))._toQuery();
        return search("lexical", SearchRequest.of(s -> s
                .index(indexName)
                .query(match)
                .size(size)
                .source(src -> src.filter(f -> f.excludes(VECTOR_FIELDS)))));
    }

    @Override
    public List<ChunkHit> denseSearch(DenseVector queryVector, int size) {
        int numCandidates = Math.max(size * 5, 100);
        return search("dense", SearchRequest.of(s -> s
                .index(indexName)
                .knn(k -> k
                        .field(FIELD_DENSE)
                        .queryVector(queryVector.toList())
                        .k(size)
                        .numCandidates(numCandidates))
                .size(size)
                .source(src -> src.filter(f -> f.excludes(VECTOR_FIELDS)))));
    }

    @Override
    public List<ChunkHit> sparseSearch(String query, int size) {
        Query expansion = TextExpansionQuery.of(t -> t
                .field(FIELD_SPARSE)
                .modelId(expansionModelId)
                .modelText(query))._toQuery();
        return search("sparse", SearchRequest.of(s -> s
                .index(indexName)
                .query(expansion)
                .size(size)
                .source(src -> src.filter(f -> f.excludes(VECTOR_FIELDS)))));
    }

    @Override
    public String health() {
        try {
            HealthResponse health = client.cluster().health();
            return health.status().jsonValue();
        } catch (IOException | ElasticsearchException e) {
            throw new ChunkStoreException("Elasticsearch health check failed", e);
        }
    }

    private List<ChunkHit> search(String signal, SearchRequest request) {
        ensureIndexExists();
        long t0 = System.nanoTime();
        try {
            SearchResponse<Map> response = client.search(request, Map.class);

            List<ChunkHit> hits = new ArrayList<>();
            for (Hit<Map> hit : response.hits().hits()) {
                Map src = hit.source();
                if (src == null) {
                    continue;
                }
                double score = hit.score() == null ? 0.0 : hit.score();
                hits.add(new ChunkHit(toStoredChunk(src), score));
            }

            log.info("event=es_search signal={} size={} returned={} ms={}",
                    signal, request.size(), hits.size(), (System.nanoTime() - t0) / 1_000_000);
            return hits;
        } catch (IOException | ElasticsearchException e) {
            throw new ChunkStoreException("Elasticsearch " + signal + " search failed", e);
        }
    }

    static Map<String, Object> toSource(ChunkDocument doc) {
        Map<String, Object> source = new LinkedHashMap<>();
        source.put(FIELD_TEXT, doc.chunk().text());
        source.put(FIELD_CONTENT, doc.chunk().text());
        source.put(FIELD_CHUNK_ID, doc.chunk().chunkId());
        source.put(FIELD_DOCUMENT_ID, doc.chunk().documentId());
        source.put(FIELD_FILENAME, nullToEmpty(doc.chunk().filename()));
        source.put(FIELD_SOURCE_URL, nullToEmpty(doc.chunk().sourceUrl()));
        source.put(FIELD_TOKEN_COUNT, doc.chunk().tokenCount());
        source.put(FIELD_CHAR_COUNT, doc.chunk().charCount());
        doc.denseEmbedding().ifPresent(v -> source.put(FIELD_DENSE, v.toList()));
        doc.sparseExpansion().ifPresent(s -> source.put(FIELD_SPARSE, s.weights()));
        source.put(FIELD_INDEXED_AT, doc.indexedAt().toString());
        return source;
    }

    static StoredChunk toStoredChunk(Map<?, ?> src) {
        Object text = src.get(FIELD_TEXT);
        if (text == null) {
            text = src.get(FIELD_CONTENT);
        }
        return new StoredChunk(
                String.valueOf(src.get(FIELD_DOCUMENT_ID)),
                intValue(src.get(FIELD_CHUNK_ID)),
                stringValue(src.get(FIELD_FILENAME)),
                stringValue(src.get(FIELD_SOURCE_URL)),
                stringValue(text),
                intValue(src.get(FIELD_TOKEN_COUNT)),
                intValue(src.get(FIELD_CHAR_COUNT)),
                instantValue(src.get(FIELD_INDEXED_AT))
        );
    }

    private String loadMapping() throws IOException {
        try (InputStream in = ElasticsearchChunkStore.class.getResourceAsStream(MAPPING_RESOURCE)) {
            if (in == null) {
                throw new IOException("Missing index mapping resource " + MAPPING_RESOURCE);
            }
            String template = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            return template.replace(DIMS_PLACEHOLDER, String.valueOf(denseDimensions));
        }
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    private static String stringValue(Object o) {
        return o == null ? "" : String.valueOf(o);
    }

    private static int intValue(Object o) {
        if (o instanceof Number n) {
            return n.intValue();
        }
        if (o == null) {
            return 0;
        }
        try {
            return Integer.parseInt(String.valueOf(o));
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static Instant instantValue(Object o) {
        if (o == null) {
            return null;
        }
        try {
            return Instant.parse(String.valueOf(o));
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
