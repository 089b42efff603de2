package com.example.signalrag.infrastructure.search;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.example.signalrag.domain.model.Chunk;
import com.example.signalrag.domain.model.ChunkDocument;
import com.example.signalrag.domain.model.ChunkKey;
import com.example.signalrag.domain.model.IndexResult;
import com.example.signalrag.domain.model.StoredChunk;
import com.example.signalrag.infrastructure.embedding.DenseEmbeddingGenerator;
import com.example.signalrag.infrastructure.embedding.ExpansionModelClient;
import com.example.signalrag.infrastructure.embedding.SparseExpansionGenerator;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.embedding.EmbeddingModel;

class ChunkIndexerTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    private InMemoryChunkStore store;
    private SparseExpansionGenerator sparse;

    @BeforeEach
    void setUp() {
        store = new InMemoryChunkStore();
        sparse = new SparseExpansionGenerator(new ExpansionModelClient() {
            @Override
            public List<Map<String, Float>> infer(List<String> texts) {
                List<Map<String, Float>> out = new ArrayList<>();
                texts.forEach(t -> out.add(Map.of("term", 1.0f)));
                return out;
            }

            @Override
            public String modelId() {
                return "test-elser";
            }
        }, true);
    }

    @Test
    void emptyInputIndexesNothing() {
        ChunkIndexer indexer = indexer(new DenseEmbeddingGenerator(null, 3));

        assertEquals(new IndexResult(0, 0), indexer.indexChunks(List.of()));
        assertEquals(0, store.size());
    }

    @Test
    void chunksAreIndexedWithoutDenseModel() {
        ChunkIndexer indexer = indexer(new DenseEmbeddingGenerator(null, 3));

        IndexResult result = indexer.indexChunks(List.of(chunk("doc", 0, "a"), chunk("doc", 1, "b"), chunk("doc", 2, "c")));

        assertEquals(new IndexResult(3, 0), result);
        ChunkDocument stored = store.document(new ChunkKey("doc", 1)).orElseThrow();
        assertTrue(stored.denseEmbedding().isEmpty());
        assertTrue(stored.sparseExpansion().isPresent());
    }

    @Test
    void denseEmbeddingsAreStoredNormalized() {
        EmbeddingModel model = mock(EmbeddingModel.class);
        when(model.embed(anyString())).thenReturn(new float[]{2f, 0f, 0f});
        ChunkIndexer indexer = indexer(new DenseEmbeddingGenerator(model, 3));

        indexer.indexChunks(List.of(chunk("doc", 0, "a")));

        ChunkDocument stored = store.document(new ChunkKey("doc", 0)).orElseThrow();
        assertEquals(1.0, stored.denseEmbedding().orElseThrow().l2Norm(), 1e-6);
    }

    @Test
    void reindexingSameKeysOverwrites() {
        ChunkIndexer indexer = indexer(new DenseEmbeddingGenerator(null, 3));

        indexer.indexChunks(List.of(chunk("doc", 0, "first"), chunk("doc", 1, "second")));
        indexer.indexChunks(List.of(chunk("doc", 0, "first v2"), chunk("doc", 1, "second v2")));

        assertEquals(2, store.size());
        assertEquals("first v2", indexer.find("doc", 0).orElseThrow().text());
    }

    @Test
    void storedTextRoundTrips() {
        ChunkIndexer indexer = indexer(new DenseEmbeddingGenerator(null, 3));
        String text = "Solar panels convert  sunlight\ninto electricity.";

        indexer.indexChunks(List.of(chunk("doc-7", 4, text)));

        StoredChunk stored = indexer.find("doc-7", 4).orElseThrow();
        assertEquals(text, stored.text());
        assertEquals(NOW, stored.indexedAt());
    }

    @Test
    void invalidChunksAreCountedAsErrors() {
        ChunkIndexer indexer = indexer(new DenseEmbeddingGenerator(null, 3));

        IndexResult result = indexer.indexChunks(Arrays.asList(chunk("doc", 0, "ok"), null, chunk(" ", 1, "no id")));

        assertEquals(new IndexResult(1, 2), result);
    }

    @Test
    void sparseFailureDoesNotBlockIndexing() {
        SparseExpansionGenerator failing = new SparseExpansionGenerator(new ExpansionModelClient() {
            @Override
            public List<Map<String, Float>> infer(List<String> texts) throws IOException {
                throw new IOException("inference timeout");
            }

            @Override
            public String modelId() {
                return "test-elser";
            }
        }, true);
        ChunkIndexer indexer = new ChunkIndexer(store, new DenseEmbeddingGenerator(null, 3), failing,
                Clock.fixed(NOW, ZoneOffset.UTC));

        IndexResult result = indexer.indexChunks(List.of(chunk("doc", 0, "a"), chunk("doc", 1, "b")));

        assertEquals(new IndexResult(2, 0), result);
        assertTrue(store.document(new ChunkKey("doc", 0)).orElseThrow().sparseExpansion().isEmpty());
    }

    private ChunkIndexer indexer(DenseEmbeddingGenerator dense) {
        return new ChunkIndexer(store, dense, sparse, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static Chunk chunk(String documentId, int chunkId, String text) {
        return new Chunk(chunkId, documentId, "file.pdf", "http://docs/file.pdf", text, 1, text.length());
    }
}
