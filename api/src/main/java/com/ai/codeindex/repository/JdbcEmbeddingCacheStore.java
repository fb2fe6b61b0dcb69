package com.ai.codeindex.repository;

import com.ai.codeindex.service.EmbeddingCacheStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * embedding_cache table. Cache trouble is never fatal: reads degrade to a miss and
 * failed writes are only logged.
 */
@Repository
public class JdbcEmbeddingCacheStore implements EmbeddingCacheStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcEmbeddingCacheStore.class);

    private final JdbcTemplate jdbcTemplate;

    public JdbcEmbeddingCacheStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<float[]> find(String contentHash) {
        try {
            return jdbcTemplate.query("""
                            UPDATE embedding_cache
                            SET hit_count = hit_count + 1, last_accessed_at = NOW()
                            WHERE content_hash = ?
                            RETURNING embedding::text
                            """,
                    (rs, i) -> PgVectors.parseVector(rs.getString(1)), contentHash)
                    .stream().findFirst();
        } catch (DataAccessException e) {
            log.warn("[EmbeddingCache] Lookup failed for {}, treating as miss: {}", contentHash, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void putIfAbsent(String contentHash, float[] vector, String model) {
        try {
            jdbcTemplate.update("""
                            INSERT INTO embedding_cache (content_hash, model, dimensions, embedding, hit_count,
                                                         created_at, last_accessed_at)
                            VALUES (?, ?, ?, cast(? as vector), 0, NOW(), NOW())
                            ON CONFLICT (content_hash) DO NOTHING
                            """,
                    contentHash, model, vector.length, PgVectors.toVectorString(vector));
        } catch (DataAccessException e) {
            log.warn("[EmbeddingCache] Failed to store {}: {}", contentHash, e.getMessage());
        }
    }
}
