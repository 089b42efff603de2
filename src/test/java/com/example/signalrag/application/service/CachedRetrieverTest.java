package com.example.signalrag.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.signalrag.controller.exception.RetrievalFailedException;
import com.example.signalrag.domain.model.RetrievalSignal;
import com.example.signalrag.domain.model.SearchMode;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CachedRetrieverTest {

    private CountingRetriever delegate;
    private FakeTicker ticker;

    @BeforeEach
    void setUp() {
        delegate = new CountingRetriever();
        ticker = new FakeTicker();
    }

    @Test
    void identicalQueryHitsCache() {
        CachedRetriever cache = new CachedRetriever(delegate, Duration.ofMinutes(5), 100, ticker);

        List<ScoredChunk> first = cache.retrieve("solar", 5, SearchMode.FULL_HYBRID);
        List<ScoredChunk> second = cache.retrieve("solar", 5, SearchMode.FULL_HYBRID);

        assertEquals(1, delegate.calls.get());
        assertSame(first, second);
        assertEquals(new CacheStats(1, 1, 1, 100, 300), cache.stats());
    }

    @Test
    void differentTopKOrModeIsAMiss() {
        CachedRetriever cache = new CachedRetriever(delegate, Duration.ofMinutes(5), 100, ticker);

        cache.retrieve("solar", 5, SearchMode.FULL_HYBRID);
        cache.retrieve("solar", 3, SearchMode.FULL_HYBRID);
        cache.retrieve("solar", 5, SearchMode.LEXICAL_ONLY);
        cache.retrieve("Solar", 5, SearchMode.FULL_HYBRID);

        assertEquals(4, delegate.calls.get());
        assertEquals(4, cache.stats().misses());
    }

    @Test
    void expiredEntryIsRecomputed() {
        CachedRetriever cache = new CachedRetriever(delegate, Duration.ofSeconds(60), 100, ticker);

        cache.retrieve("solar", 5, SearchMode.DENSE_LEXICAL);
        ticker.advance(Duration.ofSeconds(59));
        cache.retrieve("solar", 5, SearchMode.DENSE_LEXICAL);
        ticker.advance(Duration.ofSeconds(2));
        cache.retrieve("solar", 5, SearchMode.DENSE_LEXICAL);

        assertEquals(2, delegate.calls.get());
        assertEquals(1, cache.stats().hits());
    }

    @Test
    void zeroTtlNeverExpires() {
        CachedRetriever cache = new CachedRetriever(delegate, Duration.ZERO, 100, ticker);

        cache.retrieve("solar", 5, SearchMode.DENSE_LEXICAL);
        ticker.advance(Duration.ofDays(30));
        cache.retrieve("solar", 5, SearchMode.DENSE_LEXICAL);

        assertEquals(1, delegate.calls.get());
        assertEquals(0, cache.stats().ttlSeconds());
    }

    @Test
    void sizeStaysWithinMaxEntries() {
        CachedRetriever cache = new CachedRetriever(delegate, Duration.ZERO, 2, ticker);

        for (String query : List.of("a", "b", "c", "d", "e")) {
            cache.retrieve(query, 5, SearchMode.LEXICAL_ONLY);
        }

        CacheStats stats = cache.stats();
        assertTrue(stats.size() <= 2, "size " + stats.size());
        assertEquals(2, stats.maxEntries());
        assertEquals(5, delegate.calls.get());
    }

    @Test
    void failuresAreNotCached() {
        CachedRetriever cache = new CachedRetriever(delegate, Duration.ofMinutes(5), 100, ticker);
        delegate.fail = true;

        assertThrows(RetrievalFailedException.class, () -> cache.retrieve("solar", 5, SearchMode.SPARSE_ONLY));
        delegate.fail = false;
        cache.retrieve("solar", 5, SearchMode.SPARSE_ONLY);

        assertEquals(2, delegate.calls.get());
        assertEquals(1, cache.stats().size());
    }

    @Test
    void clearEmptiesCache() {
        CachedRetriever cache = new CachedRetriever(delegate, Duration.ofMinutes(5), 100, ticker);
        cache.retrieve("solar", 5, SearchMode.FULL_HYBRID);

        cache.clear();
        assertEquals(0, cache.stats().size());
        cache.retrieve("solar", 5, SearchMode.FULL_HYBRID);

        assertEquals(2, delegate.calls.get());
    }

    @Test
    void concurrentIdenticalMissesShareOneRetrieval() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();
        ChunkRetriever slow = (query, topK, mode) -> {
            calls.incrementAndGet();
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return List.of(new ScoredChunk("doc", 0, "text", "doc.pdf", "", 1.0, List.of(RetrievalSignal.DENSE)));
        };
        CachedRetriever cache = new CachedRetriever(slow, Duration.ofMinutes(5), 100, ticker);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            CompletableFuture<List<ScoredChunk>> first = CompletableFuture.supplyAsync(
                    () -> cache.retrieve("wind", 5, SearchMode.DENSE_ONLY), pool);
            assertTrue(entered.await(5, TimeUnit.SECONDS));
            CompletableFuture<List<ScoredChunk>> second = CompletableFuture.supplyAsync(
                    () -> cache.retrieve("wind", 5, SearchMode.DENSE_ONLY), pool);
            Thread.sleep(100);
            release.countDown();

            assertSame(first.get(5, TimeUnit.SECONDS), second.get(5, TimeUnit.SECONDS));
            assertEquals(1, calls.get());
        } finally {
            pool.shutdownNow();
        }
    }

    private static final class CountingRetriever implements ChunkRetriever {
        private final AtomicInteger calls = new AtomicInteger();
        private volatile boolean fail;

        @Override
        public List<ScoredChunk> retrieve(String query, int topK, SearchMode mode) {
            int call = calls.incrementAndGet();
            if (fail) {
                throw new RetrievalFailedException("store down", null);
            }
            return List.of(new ScoredChunk("doc", call, "text for " + query, "doc.pdf", "", 1.0,
                    List.of(RetrievalSignal.LEXICAL)));
        }
    }

    private static final class FakeTicker implements Ticker {
        private final AtomicLong nanos = new AtomicLong();

        void advance(Duration d) {
            nanos.addAndGet(d.toNanos());
        }

        @Override
        public long read() {
            return nanos.get();
        }
    }
}
