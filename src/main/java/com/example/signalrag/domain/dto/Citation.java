package com.example.signalrag.domain.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Citation(
        @JsonProperty("source_id") int sourceId,
        String filename,
        @JsonProperty("chunk_id") int chunkId,
        @JsonProperty("content_excerpt") String contentExcerpt,
        double score,
        @JsonProperty("source_url") String sourceUrl
) {
}
