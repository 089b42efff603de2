package com.example.signalrag.infrastructure.ingest;

import com.example.signalrag.domain.model.Chunk;
import com.example.signalrag.domain.model.IndexResult;
import com.example.signalrag.domain.model.ParsedDocument;
import com.example.signalrag.infrastructure.search.ChunkIndexer;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Ingest pipeline: parsed documents -> token chunking -> dense/sparse enrichment -> Elasticsearch upsert.
 *
 * <p>Documents whose extraction failed or that carry no text are skipped. All chunks of the batch are
 * indexed in one call so that sparse expansion and the bulk write happen once per request.
 */
@Service
public class IngestService {

    private static final Logger log = LoggerFactory.getLogger(IngestService.class);

    private final TokenTextChunker chunker;
    private final ChunkIndexer indexer;

    public IngestService(TokenTextChunker chunker, ChunkIndexer indexer) {
        this.chunker = chunker;
        this.indexer = indexer;
    }

    public IngestResult ingest(List<ParsedDocument> documents) {
        if (documents == null || documents.isEmpty()) {
            return new IngestResult(0, 0, 0, 0);
        }

        long t0 = System.nanoTime();
        int processed = 0;
        List<Chunk> chunks = new ArrayList<>();
        for (ParsedDocument document : documents) {
            if (document == null || !document.indexable()) {
                log.info("event=ingest_skip documentId={} extractionSuccess={}",
                        document == null ? null : document.documentId(),
                        document != null && document.extractionSuccess());
                continue;
            }
            chunks.addAll(chunker.chunk(document));
            processed++;
        }

        IndexResult result = indexer.indexChunks(chunks);

        log.info("event=ingest_complete received={} processed={} chunks={} indexed={} errors={} ms={}",
                documents.size(), processed, chunks.size(), result.indexed(), result.errors(),
                (System.nanoTime() - t0) / 1_000_000);

        return new IngestResult(documents.size(), processed, result.indexed(), result.errors());
    }
}
