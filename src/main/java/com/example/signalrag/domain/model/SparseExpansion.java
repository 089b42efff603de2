package com.example.signalrag.domain.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Term-to-weight map produced by the expansion model. Only positive, finite weights are kept.
 */
public record SparseExpansion(Map<String, Float> weights) {

    public SparseExpansion {
        Map<String, Float> cleaned = new LinkedHashMap<>();
        if (weights != null) {
            weights.forEach((term, weight) -> {
                if (term != null && !term.isBlank() && weight != null
                        && weight > 0f && !Float.isNaN(weight) && !Float.isInfinite(weight)) {
                    cleaned.put(term, weight);
                }
            });
        }
        weights = Map.copyOf(cleaned);
    }

    public int size() {
        return weights.size();
    }

    public boolean isEmpty() {
        return weights.isEmpty();
    }
}
