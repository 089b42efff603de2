package com.example.signalrag.application.service;

import com.example.signalrag.domain.model.SearchMode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Service;

/**
 * Memoizes retrieval results by the exact (query, mode, topK) triple. The query is not normalized, so
 * queries differing only in case or whitespace are separate entries.
 *
 * <p>Backed by a Caffeine cache: entries expire after the configured TTL (zero keeps them until
 * {@link #clear()}) and the cache holds at most {@code maxEntries}. Concurrent misses on the same key
 * share one retrieval. Failed retrievals are not cached.
 */
@Service
@Primary
public class CachedRetriever implements ChunkRetriever {

    private static final Logger log = LoggerFactory.getLogger(CachedRetriever.class);

    private final ChunkRetriever delegate;
    private final Duration ttl;
    private final int maxEntries;
    private final Cache<CacheKey, List<ScoredChunk>> cache;

    @Autowired
    public CachedRetriever(
            @Qualifier("hybridRetriever") ChunkRetriever delegate,
            @Value("${signalrag.cache.ttl-seconds:300}") long ttlSeconds,
            @Value("${signalrag.cache.max-entries:1000}") int maxEntries
    ) {
        this(delegate, Duration.ofSeconds(Math.max(0, ttlSeconds)), maxEntries, Ticker.systemTicker());
    }

    public CachedRetriever(ChunkRetriever delegate, Duration ttl, int maxEntries, Ticker ticker) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be >= 1");
        }
        this.delegate = delegate;
        this.ttl = ttl;
        this.maxEntries = maxEntries;

        Caffeine<Object, Object> builder = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .recordStats()
                .ticker(ticker)
                .executor(Runnable::run);
        if (!ttl.isZero()) {
            builder.expireAfterWrite(ttl);
        }
        this.cache = builder.build();

        log.info("event=result_cache_config ttlSeconds={} maxEntries={}", ttl.getSeconds(), maxEntries);
    }

    @Override
    public List<ScoredChunk> retrieve(String query, int topK, SearchMode mode) {
        CacheKey key = new CacheKey(query, mode, topK);
        boolean[] loaded = {false};

        List<ScoredChunk> results = cache.get(key, k -> {
            loaded[0] = true;
            return List.copyOf(delegate.retrieve(query, topK, mode));
        });

        log.info("event={} mode={} topK={} query={}",
                loaded[0] ? "cache_miss" : "cache_hit",
                mode == null ? null : mode.wireName(), topK, preview(query));
        return results;
    }

    public void clear() {
        long size = cache.estimatedSize();
        cache.invalidateAll();
        cache.cleanUp();
        log.info("event=cache_cleared entries={}", size);
    }

    public CacheStats stats() {
        cache.cleanUp();
        com.github.benmanes.caffeine.cache.stats.CacheStats s = cache.stats();
        return new CacheStats((int) cache.estimatedSize(), s.hitCount(), s.missCount(), maxEntries, ttl.getSeconds());
    }

    private static String preview(String query) {
        if (query == null) {
            return "";
        }
        return query.length() <= 50 ? query : query.substring(0, 50) + "...";
    }

    private record CacheKey(String query, SearchMode mode, int topK) {
    }
}
