package com.example.signalrag.application.service;

import com.example.signalrag.domain.model.ChunkKey;
import com.example.signalrag.domain.model.RetrievalSignal;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * One retrieval result. {@code score} is the store's native score for single-signal modes and the
 * reciprocal-rank-fusion score for fused modes.
 */
public record ScoredChunk(
        @JsonProperty("document_id") String documentId,
        @JsonProperty("chunk_id") int chunkId,
        String content,
        String filename,
        @JsonProperty("source_url") String sourceUrl,
        double score,
        List<RetrievalSignal> signals
) {

    public ScoredChunk {
        signals = signals == null ? List.of() : List.copyOf(signals);
    }

    public ChunkKey key() {
        return new ChunkKey(documentId, chunkId);
    }
}
