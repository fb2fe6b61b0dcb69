package com.ai.codeindex.index;

import java.util.List;

public interface VectorIndex {

    /**
     * Stores the embedding of an already written record, overwriting any previous one.
     *
     * @throws com.ai.codeindex.exception.IndexStorageException when the store is unreachable
     */
    void upsert(IndexRecord record, float[] vector);

    /**
     * Nearest neighbours by cosine similarity, best first, at most {@code limit}.
     */
    List<IndexHit> search(float[] vector, SearchFilters filters, int limit);
}
