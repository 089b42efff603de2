package com.example.signalrag.infrastructure.search;

import com.example.signalrag.domain.model.ChunkDocument;
import com.example.signalrag.domain.model.ChunkHit;
import com.example.signalrag.domain.model.ChunkKey;
import com.example.signalrag.domain.model.DenseVector;
import com.example.signalrag.domain.model.IndexResult;
import com.example.signalrag.domain.model.StoredChunk;
import java.util.List;
import java.util.Optional;

/**
 * Document store holding one document per chunk with lexical, dense and sparse fields.
 *
 * <p>Search methods throw {@link ChunkStoreException} when the store cannot answer; an index without
 * matching chunks yields an empty list.
 */
public interface ChunkStore {

    /**
     * Creates the chunk index with its fixed schema if it is absent; an existing index is left untouched.
     */
    void ensureIndexExists();

    /**
     * Upserts by {@link ChunkKey#storeId()}. Per-document failures are counted, never thrown.
     */
    IndexResult upsertAll(List<ChunkDocument> documents);

    Optional<StoredChunk> find(ChunkKey key);

    List<ChunkHit> lexicalSearch(String query, int size);

    List<ChunkHit> denseSearch(DenseVector queryVector, int size);

    List<ChunkHit> sparseSearch(String query, int size);

    String health();
}
