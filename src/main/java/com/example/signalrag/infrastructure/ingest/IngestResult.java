package com.example.signalrag.infrastructure.ingest;

import com.fasterxml.jackson.annotation.JsonProperty;

public record IngestResult(
        @JsonProperty("documents_received") int documentsReceived,
        @JsonProperty("documents_processed") int documentsProcessed,
        @JsonProperty("chunks_indexed") int chunksIndexed,
        int errors
) {
}
