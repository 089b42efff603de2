package com.example.signalrag.domain.model;

public record Chunk(
        int chunkId,
        String documentId,
        String filename,
        String sourceUrl,
        String text,
        int tokenCount,
        int charCount
) {

    public ChunkKey key() {
        return new ChunkKey(documentId, chunkId);
    }
}
