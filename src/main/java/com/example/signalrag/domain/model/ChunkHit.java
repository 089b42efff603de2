package com.example.signalrag.domain.model;

/**
 * One hit of a single-signal query with the store's native score.
 */
public record ChunkHit(StoredChunk chunk, double score) {

    public ChunkKey key() {
        return chunk.key();
    }
}
