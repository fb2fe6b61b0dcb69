package com.ai.codeindex.service;

import java.util.Optional;

/**
 * Persistent map from content fingerprint to embedding vector.
 */
public interface EmbeddingCacheStore {

    /**
     * Returns the vector and records the access.
     */
    Optional<float[]> find(String contentHash);

    /**
     * Stores the vector unless an entry for the fingerprint already exists.
     */
    void putIfAbsent(String contentHash, float[] vector, String model);
}
