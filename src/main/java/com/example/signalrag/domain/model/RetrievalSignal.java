package com.example.signalrag.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RetrievalSignal {
    LEXICAL("lexical"),
    DENSE("dense"),
    SPARSE("sparse");

    private final String label;

    RetrievalSignal(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
