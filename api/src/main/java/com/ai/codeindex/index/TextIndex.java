package com.ai.codeindex.index;

import java.util.List;
import java.util.Optional;

/**
 * Lexical side of the index. Also the source of record for citations.
 */
public interface TextIndex {

    /**
     * Inserts or overwrites by {@link IndexRecord#id()}.
     *
     * @throws com.ai.codeindex.exception.IndexStorageException when the store is unreachable
     */
    void upsert(IndexRecord record);

    /**
     * Best-first lexical hits, at most {@code limit}.
     */
    List<IndexHit> search(String query, SearchFilters filters, int limit);

    Optional<IndexRecord> findById(String recordId);
}
