package com.example.signalrag.application.service;

import com.example.signalrag.controller.exception.BusinessException;
import com.example.signalrag.controller.exception.RetrievalFailedException;
import com.example.signalrag.domain.model.ChunkHit;
import com.example.signalrag.domain.model.ChunkKey;
import com.example.signalrag.domain.model.DenseVector;
import com.example.signalrag.domain.model.RetrievalSignal;
import com.example.signalrag.domain.model.SearchMode;
import com.example.signalrag.infrastructure.embedding.DenseEmbeddingGenerator;
import com.example.signalrag.infrastructure.search.ChunkStore;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Queries every signal of the requested {@link SearchMode} in parallel and merges the ranked lists.
 *
 * <p>Signals that fail or time out are dropped as long as one signal of the mode answered. Each
 * signal is asked for {@code max(topK, minCandidates)} hits so that fusion can promote chunks that
 * several signals agree on.
 */
@Service
public class HybridRetriever implements ChunkRetriever {

    private static final Logger log = LoggerFactory.getLogger(HybridRetriever.class);

    private final ChunkStore store;
    private final DenseEmbeddingGenerator denseGenerator;
    private final Executor executor;
    private final ReciprocalRankFusion fusion;
    private final int minCandidates;
    private final long signalTimeoutMs;

    public HybridRetriever(
            ChunkStore store,
            DenseEmbeddingGenerator denseGenerator,
            @Qualifier("hybridSearchExecutor") Executor executor,
            @Value("${signalrag.rag.retrieve.rrf-k:60}") int rrfK,
            @Value("${signalrag.rag.retrieve.min-candidates:20}") int minCandidates,
            @Value("${signalrag.rag.retrieve.signal-timeout-ms:5000}") long signalTimeoutMs
    ) {
        this.store = store;
        this.denseGenerator = denseGenerator;
        this.executor = executor;
        this.fusion = new ReciprocalRankFusion(rrfK);
        this.minCandidates = Math.max(1, minCandidates);
        this.signalTimeoutMs = Math.max(1, signalTimeoutMs);
    }

    @Override
    public List<ScoredChunk> retrieve(String query, int topK, SearchMode mode) {
        if (mode == null) {
            throw BusinessException.badRequest("search mode is required");
        }
        if (query == null || query.isBlank()) {
            throw BusinessException.badRequest("query must not be blank");
        }
        if (topK < 1) {
            throw BusinessException.badRequest("top_k must be >= 1");
        }

        long t0 = System.nanoTime();
        int candidates = Math.max(topK, minCandidates);

        Map<RetrievalSignal, CompletableFuture<List<ChunkHit>>> pending = new EnumMap<>(RetrievalSignal.class);
        for (RetrievalSignal signal : mode.signals()) {
            pending.put(signal, CompletableFuture.supplyAsync(
                    () -> querySignal(signal, query, candidates),
                    executor
            ));
        }

        Map<RetrievalSignal, List<ChunkHit>> ranked = new EnumMap<>(RetrievalSignal.class);
        Set<RetrievalSignal> failed = EnumSet.noneOf(RetrievalSignal.class);
        Throwable lastFailure = null;
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(signalTimeoutMs);

        for (Map.Entry<RetrievalSignal, CompletableFuture<List<ChunkHit>>> entry : pending.entrySet()) {
            RetrievalSignal signal = entry.getKey();
            CompletableFuture<List<ChunkHit>> future = entry.getValue();
            try {
                long remaining = Math.max(0, deadline - System.nanoTime());
                ranked.put(signal, future.get(remaining, TimeUnit.NANOSECONDS));
            } catch (TimeoutException e) {
                future.cancel(true);
                failed.add(signal);
                lastFailure = e;
                log.warn("event=signal_timeout signal={} mode={} timeoutMs={}",
                        signal.label(), mode.wireName(), signalTimeoutMs);
            } catch (ExecutionException e) {
                failed.add(signal);
                lastFailure = e.getCause();
                log.warn("event=signal_failed signal={} mode={} err={}",
                        signal.label(), mode.wireName(), String.valueOf(e.getCause()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                pending.values().forEach(f -> f.cancel(true));
                throw new RetrievalFailedException("Retrieval interrupted", e);
            }
        }

        if (ranked.isEmpty()) {
            log.error("event=retrieve_failed mode={} failed={}", mode.wireName(), failed);
            throw new RetrievalFailedException(mode, failed, lastFailure);
        }

        List<ScoredChunk> results = mode.fused()
                ? fusion.fuse(ranked, topK)
                : nativeOrder(ranked, topK);

        log.info("event=retrieve_done mode={} topK={} candidates={} lists={} failed={} returned={} ms={}",
                mode.wireName(), topK, candidates, listSizes(ranked), failed, results.size(),
                (System.nanoTime() - t0) / 1_000_000);
        return results;
    }

    private List<ChunkHit> querySignal(RetrievalSignal signal, String query, int size) {
        return switch (signal) {
            case LEXICAL -> store.lexicalSearch(query, size);
            case DENSE -> {
                DenseVector vector = denseGenerator.embed(query)
                        .orElseThrow(() -> new IllegalStateException("dense query embedding unavailable"));
                yield store.denseSearch(vector, size);
            }
            case SPARSE -> store.sparseSearch(query, size);
        };
    }

    // single-signal modes keep the store's native score and order
    private static List<ScoredChunk> nativeOrder(Map<RetrievalSignal, List<ChunkHit>> ranked, int topK) {
        List<ScoredChunk> out = new ArrayList<>(topK);
        Set<ChunkKey> seen = new HashSet<>();
        for (Map.Entry<RetrievalSignal, List<ChunkHit>> entry : ranked.entrySet()) {
            for (ChunkHit hit : entry.getValue()) {
                if (out.size() >= topK) {
                    return out;
                }
                if (!seen.add(hit.key())) {
                    continue;
                }
                out.add(new ScoredChunk(
                        hit.chunk().documentId(),
                        hit.chunk().chunkId(),
                        hit.chunk().text(),
                        hit.chunk().filename(),
                        hit.chunk().sourceUrl(),
                        hit.score(),
                        List.of(entry.getKey())
                ));
            }
        }
        return out;
    }

    private static Map<String, Integer> listSizes(Map<RetrievalSignal, List<ChunkHit>> ranked) {
        Map<String, Integer> sizes = new LinkedHashMap<>();
        ranked.forEach((signal, hits) -> sizes.put(signal.label(), hits.size()));
        return sizes;
    }
}
