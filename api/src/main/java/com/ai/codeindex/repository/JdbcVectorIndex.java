package com.ai.codeindex.repository;

import com.ai.codeindex.index.IndexHit;
import com.ai.codeindex.index.IndexRecord;
import com.ai.codeindex.index.SearchFilters;
import com.ai.codeindex.index.VectorIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;

/**
 * pgvector side of index_records. The column is picked from the vector dimension.
 */
@Repository
public class JdbcVectorIndex implements VectorIndex {

    private static final Logger log = LoggerFactory.getLogger(JdbcVectorIndex.class);

    private final JdbcTemplate jdbcTemplate;

    public JdbcVectorIndex(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void upsert(IndexRecord record, float[] vector) {
        String column = PgVectors.vectorColumn(vector.length);
        try {
            int updated = jdbcTemplate.update(
                    String.format("UPDATE index_records SET %s = cast(? as vector) WHERE id = ?", column),
                    PgVectors.toVectorString(vector), record.id());
            if (updated == 0) {
                throw new IllegalStateException("No text record " + record.id() + " to attach a vector to");
            }
        } catch (DataAccessException e) {
            throw PgVectors.translate(e, "vector upsert");
        }
    }

    @Override
    public List<IndexHit> search(float[] vector, SearchFilters filters, int limit) {
        String column = PgVectors.vectorColumn(vector.length);
        String vectorString = PgVectors.toVectorString(vector);

        StringBuilder sql = new StringBuilder(String.format("""
                SELECT r.id, 1 - (r.%s <=> cast(? as vector)) AS score
                FROM index_records r
                WHERE r.%s IS NOT NULL
                """, column, column));
        List<Object> args = new ArrayList<>();
        args.add(vectorString);
        JdbcTextIndex.appendFilters(sql, args, filters);
        sql.append(String.format(" ORDER BY r.%s <=> cast(? as vector), r.id LIMIT ?", column));
        args.add(vectorString);
        args.add(limit);

        try {
            List<IndexHit> hits = jdbcTemplate.query(sql.toString(),
                    (rs, i) -> new IndexHit(rs.getString("id"), rs.getDouble("score")), args.toArray());
            log.debug("[JdbcVectorIndex] {} vector hits using {}", hits.size(), column);
            return hits;
        } catch (DataAccessException e) {
            throw PgVectors.translate(e, "vector search");
        }
    }
}
