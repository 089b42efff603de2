package com.example.signalrag.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Retrieval strategies. Each mode fixes which signals are queried; modes with more than one signal are
 * combined with reciprocal-rank fusion.
 */
public enum SearchMode {
    LEXICAL_ONLY("lexical_only", EnumSet.of(RetrievalSignal.LEXICAL)),
    DENSE_ONLY("dense_only", EnumSet.of(RetrievalSignal.DENSE)),
    SPARSE_ONLY("sparse_only", EnumSet.of(RetrievalSignal.SPARSE)),
    DENSE_LEXICAL("dense_lexical", EnumSet.of(RetrievalSignal.LEXICAL, RetrievalSignal.DENSE)),
    FULL_HYBRID("full_hybrid", EnumSet.allOf(RetrievalSignal.class));

    private final String wireName;
    private final Set<RetrievalSignal> signals;

    SearchMode(String wireName, EnumSet<RetrievalSignal> signals) {
        this.wireName = wireName;
        this.signals = Collections.unmodifiableSet(signals);
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public Set<RetrievalSignal> signals() {
        return signals;
    }

    public boolean fused() {
        return signals.size() > 1;
    }

    /**
     * Exact, case-sensitive lookup by wire name.
     */
    public static Optional<SearchMode> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(m -> m.wireName.equals(value))
                .findFirst();
    }

    public static String allowedValues() {
        return String.join(", ", Arrays.stream(values()).map(SearchMode::wireName).toList());
    }
}
