package com.example.signalrag.application.service;

import com.example.signalrag.domain.model.ChunkHit;
import com.example.signalrag.domain.model.ChunkKey;
import com.example.signalrag.domain.model.RetrievalSignal;
import com.example.signalrag.domain.model.StoredChunk;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reciprocal-rank fusion: a chunk scores {@code sum(1 / (rank + k))} over every list it appears in,
 * with 1-based ranks. Ties go to the better single-list rank, then to the lower composite key.
 */
public class ReciprocalRankFusion {

    public static final int DEFAULT_K = 60;

    private static final Comparator<Candidate> ORDER = Comparator
            .comparingDouble(Candidate::score).reversed()
            .thenComparingInt(Candidate::bestRank)
            .thenComparing(Candidate::key);

    private final int k;

    public ReciprocalRankFusion(int k) {
        if (k < 0) {
            throw new IllegalArgumentException("rrf k must be >= 0");
        }
        this.k = k;
    }

    public int k() {
        return k;
    }

    public List<ScoredChunk> fuse(Map<RetrievalSignal, List<ChunkHit>> rankedLists, int topK) {
        Map<ChunkKey, Candidate> candidates = new HashMap<>();

        for (Map.Entry<RetrievalSignal, List<ChunkHit>> entry : rankedLists.entrySet()) {
            Set<ChunkKey> seen = new HashSet<>();
            int rank = 0;
            for (ChunkHit hit : entry.getValue()) {
                if (!seen.add(hit.key())) {
                    continue;
                }
                rank++;
                candidates.computeIfAbsent(hit.key(), key -> new Candidate(key, hit.chunk()))
                        .add(entry.getKey(), rank);
            }
        }

        List<Candidate> ordered = new ArrayList<>(candidates.values());
        ordered.forEach(c -> c.computeScore(k));
        ordered.sort(ORDER);

        List<ScoredChunk> out = new ArrayList<>(Math.min(topK, ordered.size()));
        for (Candidate c : ordered) {
            if (out.size() >= topK) {
                break;
            }
            out.add(c.toScoredChunk());
        }
        return out;
    }

    private static final class Candidate {
        private final ChunkKey key;
        private final StoredChunk chunk;
        private final EnumSet<RetrievalSignal> signals = EnumSet.noneOf(RetrievalSignal.class);
        private final List<Integer> ranks = new ArrayList<>(RetrievalSignal.values().length);
        private double score;
        private int bestRank = Integer.MAX_VALUE;

        Candidate(ChunkKey key, StoredChunk chunk) {
            this.key = key;
            this.chunk = chunk;
        }

        void add(RetrievalSignal signal, int rank) {
            signals.add(signal);
            ranks.add(rank);
            bestRank = Math.min(bestRank, rank);
        }

        // summed in ascending rank order so equal rank multisets give bit-identical scores
        void computeScore(int k) {
            Collections.sort(ranks);
            double sum = 0.0;
            for (int rank : ranks) {
                sum += 1.0 / (rank + k);
            }
            score = sum;
        }

        ChunkKey key() {
            return key;
        }

        double score() {
            return score;
        }

        int bestRank() {
            return bestRank;
        }

        ScoredChunk toScoredChunk() {
            return new ScoredChunk(
                    chunk.documentId(),
                    chunk.chunkId(),
                    chunk.text(),
                    chunk.filename(),
                    chunk.sourceUrl(),
                    score,
                    List.copyOf(signals)
            );
        }
    }
}
