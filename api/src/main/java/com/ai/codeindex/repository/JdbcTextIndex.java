package com.ai.codeindex.repository;

import com.ai.codeindex.index.IndexHit;
import com.ai.codeindex.index.IndexRecord;
import com.ai.codeindex.index.SearchFilters;
import com.ai.codeindex.index.TextIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Full-text index over index_records.content_tsv, ranked with ts_rank_cd.
 */
@Repository
public class JdbcTextIndex implements TextIndex {

    private static final Logger log = LoggerFactory.getLogger(JdbcTextIndex.class);

    private static final RowMapper<IndexRecord> RECORD_MAPPER = (rs, i) -> new IndexRecord(
            rs.getString("id"),
            rs.getObject("job_id", UUID.class),
            rs.getString("repo_id"),
            rs.getString("commit_ref"),
            rs.getString("path"),
            rs.getInt("start_line"),
            rs.getInt("end_line"),
            rs.getString("language"),
            rs.getString("kind"),
            rs.getString("content_hash"),
            rs.getString("content"));

    private final JdbcTemplate jdbcTemplate;

    public JdbcTextIndex(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void upsert(IndexRecord record) {
        try {
            jdbcTemplate.update("""
                            INSERT INTO index_records (id, job_id, repo_id, commit_ref, path, start_line, end_line,
                                                       language, kind, content_hash, content, indexed_at)
                            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, NOW())
                            ON CONFLICT (id) DO UPDATE SET job_id = EXCLUDED.job_id, indexed_at = NOW()
                            """,
                    record.id(), record.jobId(), record.repoId(), record.commit(), record.path(),
                    record.startLine(), record.endLine(), record.language(), record.kind(),
                    record.contentHash(), record.content());
        } catch (DataAccessException e) {
            throw PgVectors.translate(e, "text upsert");
        }
    }

    @Override
    public List<IndexHit> search(String query, SearchFilters filters, int limit) {
        String tsQuery = toOrQuery(query);
        if (tsQuery.isEmpty()) {
            return List.of();
        }

        StringBuilder sql = new StringBuilder("""
                SELECT r.id, ts_rank_cd(r.content_tsv, q) AS score
                FROM index_records r, to_tsquery('simple', ?) q
                WHERE r.content_tsv @@ q
                """);
        List<Object> args = new ArrayList<>();
        args.add(tsQuery);
        appendFilters(sql, args, filters);
        sql.append(" ORDER BY score DESC, r.id LIMIT ?");
        args.add(limit);

        try {
            List<IndexHit> hits = jdbcTemplate.query(sql.toString(),
                    (rs, i) -> new IndexHit(rs.getString("id"), rs.getDouble("score")), args.toArray());
            log.debug("[JdbcTextIndex] {} lexical hits for '{}'", hits.size(), tsQuery);
            return hits;
        } catch (DataAccessException e) {
            throw PgVectors.translate(e, "lexical search");
        }
    }

    @Override
    public Optional<IndexRecord> findById(String recordId) {
        try {
            return jdbcTemplate.query("""
                            SELECT id, job_id, repo_id, commit_ref, path, start_line, end_line, language, kind,
                                   content_hash, content
                            FROM index_records WHERE id = ?
                            """, RECORD_MAPPER, recordId)
                    .stream().findFirst();
        } catch (DataAccessException e) {
            throw PgVectors.translate(e, "record lookup");
        }
    }

    static void appendFilters(StringBuilder sql, List<Object> args, SearchFilters filters) {
        if (filters == null) {
            return;
        }
        if (filters.repoId() != null) {
            sql.append(" AND r.repo_id = ?");
            args.add(filters.repoId());
        }
        if (filters.commit() != null) {
            sql.append(" AND r.commit_ref = ?");
            args.add(filters.commit());
        }
    }

    /**
     * Turns free text into an OR of its word tokens, so partial matches still rank.
     */
    static String toOrQuery(String query) {
        if (query == null) {
            return "";
        }
        return Arrays.stream(query.split("[^\\p{Alnum}_]+"))
                .filter(t -> !t.isBlank())
                .map(t -> t.toLowerCase(Locale.ROOT))
                .distinct()
                .collect(Collectors.joining(" | "));
    }
}
