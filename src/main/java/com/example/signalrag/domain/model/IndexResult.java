package com.example.signalrag.domain.model;

public record IndexResult(int indexed, int errors) {

    public static final IndexResult EMPTY = new IndexResult(0, 0);

    public IndexResult plus(IndexResult other) {
        return new IndexResult(indexed + other.indexed, errors + other.errors);
    }
}
