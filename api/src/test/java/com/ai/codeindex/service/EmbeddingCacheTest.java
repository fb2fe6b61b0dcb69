package com.ai.codeindex.service;

import com.ai.codeindex.config.EmbeddingProperties;
import com.ai.codeindex.support.InMemoryEmbeddingCacheStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class EmbeddingCacheTest {

    private InMemoryEmbeddingCacheStore store;
    private EmbeddingCache cache;

    @BeforeEach
    void setUp() {
        store = new InMemoryEmbeddingCacheStore();
        cache = new EmbeddingCache(store, new EmbeddingProperties());
    }

    @Test
    void missThenHit() {
        UUID job = UUID.randomUUID();

        assertThat(cache.get(job, "h1")).isEmpty();
        cache.put("h1", new float[]{1f, 2f});
        assertThat(cache.get(job, "h1")).hasValueSatisfying(v -> assertThat(v).containsExactly(1f, 2f));

        EmbeddingCache.CacheStats stats = cache.drainStats(job);
        assertThat(stats.hits()).isEqualTo(1);
        assertThat(stats.misses()).isEqualTo(1);
        assertThat(stats.hitRate()).isEqualTo(0.5);
    }

    @Test
    void drainStats_resetsJobCounters() {
        UUID job = UUID.randomUUID();
        cache.get(job, "missing");

        cache.drainStats(job);

        assertThat(cache.drainStats(job)).isEqualTo(new EmbeddingCache.CacheStats(0, 0));
        assertThat(cache.globalStats().misses()).isEqualTo(1);
    }

    @Test
    void put_keepsFirstVectorForFingerprint() {
        cache.put("h", new float[]{1f});
        cache.put("h", new float[]{9f});

        assertThat(cache.get("h")).hasValueSatisfying(v -> assertThat(v).containsExactly(1f));
    }

    @Test
    void put_refusesEmptyVector() {
        cache.put("h", new float[0]);

        assertThat(store.size()).isZero();
    }

    @Test
    void hitRate_isZeroWithoutLookups() {
        assertThat(new EmbeddingCache.CacheStats(0, 0).hitRate()).isZero();
    }
}
