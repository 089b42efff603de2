package com.example.signalrag.infrastructure.search;

import com.example.signalrag.domain.model.Chunk;
import com.example.signalrag.domain.model.ChunkDocument;
import com.example.signalrag.domain.model.ChunkKey;
import com.example.signalrag.domain.model.DenseVector;
import com.example.signalrag.domain.model.IndexResult;
import com.example.signalrag.domain.model.StoredChunk;
import com.example.signalrag.infrastructure.embedding.ChunkExpansion;
import com.example.signalrag.infrastructure.embedding.DenseEmbeddingGenerator;
import com.example.signalrag.infrastructure.embedding.SparseExpansionGenerator;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Embeds chunks and upserts them into the {@link ChunkStore}. Failures are per chunk: a chunk that
 * cannot be built or written is counted in {@link IndexResult#errors()} and the rest of the batch goes on.
 */
@Service
public class ChunkIndexer {

    private static final Logger log = LoggerFactory.getLogger(ChunkIndexer.class);

    private final ChunkStore store;
    private final DenseEmbeddingGenerator denseGenerator;
    private final SparseExpansionGenerator sparseGenerator;
    private final Clock clock;

    @Autowired
    public ChunkIndexer(
            ChunkStore store,
            DenseEmbeddingGenerator denseGenerator,
            SparseExpansionGenerator sparseGenerator
    ) {
        this(store, denseGenerator, sparseGenerator, Clock.systemUTC());
    }

    public ChunkIndexer(
            ChunkStore store,
            DenseEmbeddingGenerator denseGenerator,
            SparseExpansionGenerator sparseGenerator,
            Clock clock
    ) {
        this.store = store;
        this.denseGenerator = denseGenerator;
        this.sparseGenerator = sparseGenerator;
        this.clock = clock;
    }

    public IndexResult indexChunks(List<Chunk> chunks) {
        if (chunks == null || chunks.isEmpty()) {
            return IndexResult.EMPTY;
        }
        long t0 = System.nanoTime();

        List<Chunk> present = chunks.stream().filter(Objects::nonNull).toList();
        int buildErrors = chunks.size() - present.size();
        if (buildErrors > 0) {
            log.error("event=index_chunk_null count={}", buildErrors);
        }

        // one inference request for the whole batch, before the per-chunk loop
        List<ChunkExpansion> expansions = sparseGenerator.expandAll(present);

        Instant now = clock.instant();
        List<ChunkDocument> documents = new ArrayList<>(expansions.size());
        int withDense = 0;
        int withSparse = 0;
        for (ChunkExpansion expansion : expansions) {
            Chunk chunk = expansion.chunk();
            try {
                requireIndexable(chunk);
                Optional<DenseVector> dense = denseGenerator.embed(chunk.text());
                ChunkDocument doc = new ChunkDocument(chunk, dense, expansion.expansion(), now);
                documents.add(doc);
                if (dense.isPresent()) {
                    withDense++;
                }
                if (doc.sparseExpansion().isPresent()) {
                    withSparse++;
                }
            } catch (RuntimeException e) {
                buildErrors++;
                log.error("event=index_chunk_failed key={} err={}", chunk.key(), e.toString());
            }
        }

        IndexResult written = store.upsertAll(documents);
        IndexResult result = written.plus(new IndexResult(0, buildErrors));

        log.info("event=index_chunks_done received={} indexed={} errors={} dense={} sparse={} ms={}",
                chunks.size(), result.indexed(), result.errors(), withDense, withSparse,
                (System.nanoTime() - t0) / 1_000_000);
        return result;
    }

    public Optional<StoredChunk> find(String documentId, int chunkId) {
        return store.find(new ChunkKey(documentId, chunkId));
    }

    private static void requireIndexable(Chunk chunk) {
        if (chunk.documentId() == null || chunk.documentId().isBlank()) {
            throw new IllegalArgumentException("chunk has no document id");
        }
        if (chunk.chunkId() < 0) {
            throw new IllegalArgumentException("chunk id must be >= 0");
        }
        if (chunk.text() == null) {
            throw new IllegalArgumentException("chunk has no text");
        }
    }
}
