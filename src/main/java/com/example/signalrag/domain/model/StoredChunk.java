package com.example.signalrag.domain.model;

import java.time.Instant;

/**
 * A chunk as read back from the store. Vector fields are not loaded.
 */
public record StoredChunk(
        String documentId,
        int chunkId,
        String filename,
        String sourceUrl,
        String text,
        int tokenCount,
        int charCount,
        Instant indexedAt
) {

    public ChunkKey key() {
        return new ChunkKey(documentId, chunkId);
    }
}
