package com.example.signalrag.domain.model;

import java.util.Comparator;

/**
 * Composite identity of a chunk inside the store: one document per (documentId, chunkId).
 */
public record ChunkKey(String documentId, int chunkId) implements Comparable<ChunkKey> {

    private static final Comparator<ChunkKey> ORDER = Comparator
            .comparing(ChunkKey::documentId, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparingInt(ChunkKey::chunkId);

    /**
     * Store document id. Writing twice with the same key overwrites the same document.
     */
    public String storeId() {
        return documentId + "_" + chunkId;
    }

    @Override
    public int compareTo(ChunkKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return storeId();
    }
}
