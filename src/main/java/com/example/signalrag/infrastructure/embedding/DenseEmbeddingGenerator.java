package com.example.signalrag.infrastructure.embedding;

import com.example.signalrag.domain.model.DenseVector;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Best-effort dense embeddings. When no model is configured every call yields {@link Optional#empty()};
 * a failing call is logged and also yields empty, so callers never see an exception from here.
 */
@Component
public class DenseEmbeddingGenerator {

    private static final Logger log = LoggerFactory.getLogger(DenseEmbeddingGenerator.class);

    private final EmbeddingModel embeddingModel;
    private final int dimensions;

    @Autowired
    public DenseEmbeddingGenerator(
            ObjectProvider<EmbeddingModel> embeddingModel,
            @Value("${signalrag.embedding.dense.enabled:true}") boolean enabled,
            @Value("${signalrag.embedding.dense.dimensions}") int dimensions
    ) {
        this(enabled ? embeddingModel.getIfAvailable() : null, dimensions);
    }

    public DenseEmbeddingGenerator(EmbeddingModel embeddingModel, int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be > 0");
        }
        this.embeddingModel = embeddingModel;
        this.dimensions = dimensions;
        if (embeddingModel == null) {
            log.warn("event=dense_model_unavailable dimensions={} dense embeddings disabled", dimensions);
        } else {
            log.info("event=dense_model_config model={} dimensions={}",
                    embeddingModel.getClass().getSimpleName(), dimensions);
        }
    }

    public boolean available() {
        return embeddingModel != null;
    }

    public int dimensions() {
        return dimensions;
    }

    public Optional<DenseVector> embed(String text) {
        if (embeddingModel == null || text == null || text.isBlank()) {
            return Optional.empty();
        }
        try {
            float[] raw = embeddingModel.embed(text);
            if (raw == null || raw.length != dimensions) {
                log.warn("event=dense_embed_bad_dims expected={} actual={}",
                        dimensions, raw == null ? 0 : raw.length);
                return Optional.empty();
            }
            return Optional.of(DenseVector.normalized(raw));
        } catch (RuntimeException e) {
            log.warn("event=dense_embed_failed chars={} err={}", text.length(), e.toString());
            return Optional.empty();
        }
    }
}
