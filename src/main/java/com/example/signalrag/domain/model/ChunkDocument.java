package com.example.signalrag.domain.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything persisted for one chunk: the chunk itself plus whichever embeddings could be produced.
 */
public record ChunkDocument(
        Chunk chunk,
        Optional<DenseVector> denseEmbedding,
        Optional<SparseExpansion> sparseExpansion,
        Instant indexedAt
) {

    public ChunkDocument {
        Objects.requireNonNull(chunk, "chunk");
        denseEmbedding = denseEmbedding == null ? Optional.empty() : denseEmbedding;
        sparseExpansion = sparseExpansion == null ? Optional.empty() : sparseExpansion;
        indexedAt = indexedAt == null ? Instant.now() : indexedAt;
    }

    public ChunkKey key() {
        return chunk.key();
    }
}
