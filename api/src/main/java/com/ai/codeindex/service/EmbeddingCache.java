package com.ai.codeindex.service;

import com.ai.codeindex.config.EmbeddingProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Embedding cache keyed by content fingerprint, with hit/miss counters kept per job.
 */
@Service
public class EmbeddingCache {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingCache.class);

    public record CacheStats(long hits, long misses) {
        public double hitRate() {
            long total = hits + misses;
            return total == 0 ? 0.0 : (double) hits / total;
        }
    }

    private final EmbeddingCacheStore store;
    private final EmbeddingProperties properties;
    private final Map<UUID, Counters> perJob = new ConcurrentHashMap<>();
    private final Counters global = new Counters();

    public EmbeddingCache(EmbeddingCacheStore store, EmbeddingProperties properties) {
        this.store = store;
        this.properties = properties;
    }

    public Optional<float[]> get(String contentHash) {
        Optional<float[]> vector = store.find(contentHash);
        global.record(vector.isPresent());
        return vector;
    }

    /**
     * Lookup counted against {@code jobId}.
     */
    public Optional<float[]> get(UUID jobId, String contentHash) {
        Optional<float[]> vector = get(contentHash);
        perJob.computeIfAbsent(jobId, id -> new Counters()).record(vector.isPresent());
        return vector;
    }

    public void put(String contentHash, float[] vector) {
        if (vector == null || vector.length == 0) {
            log.warn("[EmbeddingCache] Refusing to cache empty vector for {}", contentHash);
            return;
        }
        store.putIfAbsent(contentHash, vector, properties.getModel());
    }

    /**
     * Returns and resets the counters gathered for {@code jobId}.
     */
    public CacheStats drainStats(UUID jobId) {
        Counters counters = perJob.remove(jobId);
        return counters == null ? new CacheStats(0, 0) : counters.snapshot();
    }

    public CacheStats globalStats() {
        return global.snapshot();
    }

    private static final class Counters {
        private final AtomicLong hits = new AtomicLong();
        private final AtomicLong misses = new AtomicLong();

        void record(boolean hit) {
            (hit ? hits : misses).incrementAndGet();
        }

        CacheStats snapshot() {
            return new CacheStats(hits.get(), misses.get());
        }
    }
}
