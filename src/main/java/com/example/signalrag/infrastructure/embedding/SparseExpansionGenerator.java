package com.example.signalrag.infrastructure.embedding;

import com.example.signalrag.domain.model.Chunk;
import com.example.signalrag.domain.model.SparseExpansion;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class SparseExpansionGenerator {

    private static final Logger log = LoggerFactory.getLogger(SparseExpansionGenerator.class);

    private final ExpansionModelClient modelClient;
    private final boolean enabled;

    public SparseExpansionGenerator(
            ExpansionModelClient modelClient,
            @Value("${signalrag.embedding.sparse.enabled:true}") boolean enabled
    ) {
        this.modelClient = modelClient;
        this.enabled = enabled;
        log.info("event=sparse_model_config modelId={} enabled={}", modelClient.modelId(), enabled);
    }

    public boolean enabled() {
        return enabled;
    }

    /**
     * Expands all chunks with one inference request. Any failure of that request, or a result count that
     * does not match the input, leaves every chunk without an expansion.
     */
    public List<ChunkExpansion> expandAll(List<Chunk> chunks) {
        if (chunks == null || chunks.isEmpty()) {
            return List.of();
        }
        List<ChunkExpansion> out = new ArrayList<>(chunks.size());
        if (!enabled) {
            chunks.forEach(c -> out.add(new ChunkExpansion(c, Optional.empty())));
            return out;
        }

        List<String> texts = chunks.stream().map(Chunk::text).toList();
        List<Map<String, Float>> results;
        long t0 = System.nanoTime();
        try {
            results = modelClient.infer(texts);
        } catch (Exception e) {
            log.warn("event=sparse_batch_failed modelId={} size={} err={}",
                    modelClient.modelId(), chunks.size(), e.toString());
            chunks.forEach(c -> out.add(new ChunkExpansion(c, Optional.empty())));
            return out;
        }

        if (results == null || results.size() != chunks.size()) {
            log.warn("event=sparse_batch_size_mismatch modelId={} expected={} actual={}",
                    modelClient.modelId(), chunks.size(), results == null ? 0 : results.size());
            chunks.forEach(c -> out.add(new ChunkExpansion(c, Optional.empty())));
            return out;
        }

        int missing = 0;
        for (int i = 0; i < chunks.size(); i++) {
            Optional<SparseExpansion> expansion = toExpansion(results.get(i));
            if (expansion.isEmpty()) {
                missing++;
            }
            out.add(new ChunkExpansion(chunks.get(i), expansion));
        }
        log.info("event=sparse_batch_ok modelId={} size={} missing={} ms={}",
                modelClient.modelId(), chunks.size(), missing, (System.nanoTime() - t0) / 1_000_000);
        return out;
    }

    public Optional<SparseExpansion> expand(String text) {
        if (!enabled || text == null || text.isBlank()) {
            return Optional.empty();
        }
        try {
            List<Map<String, Float>> results = modelClient.infer(List.of(text));
            if (results == null || results.size() != 1) {
                return Optional.empty();
            }
            return toExpansion(results.get(0));
        } catch (Exception e) {
            log.warn("event=sparse_expand_failed modelId={} err={}", modelClient.modelId(), e.toString());
            return Optional.empty();
        }
    }

    private static Optional<SparseExpansion> toExpansion(Map<String, Float> tokens) {
        if (tokens == null) {
            return Optional.empty();
        }
        SparseExpansion expansion = new SparseExpansion(tokens);
        return expansion.isEmpty() ? Optional.empty() : Optional.of(expansion);
    }
}
