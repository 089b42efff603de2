package com.example.signalrag.application.service;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CacheStats(
        @JsonProperty("cache_size") int size,
        long hits,
        long misses,
        @JsonProperty("max_entries") int maxEntries,
        @JsonProperty("cache_ttl") long ttlSeconds
) {
}
