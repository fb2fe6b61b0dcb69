package com.ai.codeindex.service;

import com.ai.codeindex.config.RetrievalProperties;
import com.ai.codeindex.dto.Citation;
import com.ai.codeindex.dto.SearchResponse;
import com.ai.codeindex.dto.SearchResult;
import com.ai.codeindex.exception.SearchUnavailableException;
import com.ai.codeindex.index.IndexHit;
import com.ai.codeindex.index.IndexRecord;
import com.ai.codeindex.index.SearchFilters;
import com.ai.codeindex.index.TextIndex;
import com.ai.codeindex.index.VectorIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Hybrid retrieval: lexical and vector search run concurrently, their rankings are fused
 * with weighted RRF, and every returned result carries a citation. When one branch fails
 * the other one's ranking is served and the response is marked degraded.
 */
@Service
public class HybridSearchService {

    private static final Logger log = LoggerFactory.getLogger(HybridSearchService.class);
    private static final int SNIPPET_CHARS = 300;

    private final TextIndex textIndex;
    private final VectorIndex vectorIndex;
    private final EmbeddingProvider embeddingProvider;
    private final EmbeddingCache embeddingCache;
    private final ContentHasher hasher;
    private final RetrievalProperties properties;
    private final ExecutorService executor;
    private final ReciprocalRankFusion fusion;

    public HybridSearchService(TextIndex textIndex, VectorIndex vectorIndex, EmbeddingProvider embeddingProvider,
                               EmbeddingCache embeddingCache, ContentHasher hasher, RetrievalProperties properties,
                               @Qualifier("searchExecutor") ExecutorService executor) {
        this.textIndex = textIndex;
        this.vectorIndex = vectorIndex;
        this.embeddingProvider = embeddingProvider;
        this.embeddingCache = embeddingCache;
        this.hasher = hasher;
        this.properties = properties;
        this.executor = executor;
        this.fusion = new ReciprocalRankFusion(properties.getRrfK(), properties.getLexicalWeight(),
                properties.getVectorWeight());
    }

    private record BranchResult(List<IndexHit> hits, String failure) {
        boolean failed() {
            return failure != null;
        }
    }

    public SearchResponse search(String query, SearchFilters filters, Integer requestedTopN) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query must not be blank");
        }
        int topN = requestedTopN == null || requestedTopN <= 0
                ? properties.getDefaultTopN()
                : Math.min(requestedTopN, properties.getMaxTopN());
        int candidates = topN * Math.max(1, properties.getCandidateMultiplier());
        SearchFilters effectiveFilters = filters != null ? filters : SearchFilters.none();
        long started = System.nanoTime();

        CompletableFuture<List<IndexHit>> lexicalFuture = CompletableFuture.supplyAsync(
                () -> textIndex.search(query, effectiveFilters, candidates), executor);
        CompletableFuture<List<IndexHit>> vectorFuture = CompletableFuture.supplyAsync(
                () -> vectorIndex.search(embedQuery(query), effectiveFilters, candidates), executor);

        long deadline = System.nanoTime() + properties.getQueryTimeout().toNanos();
        BranchResult lexical = await("lexical", lexicalFuture, deadline);
        BranchResult vector = await("vector", vectorFuture, deadline);

        if (lexical.failed() && vector.failed()) {
            throw new SearchUnavailableException("Both retrieval branches failed: lexical ("
                    + lexical.failure() + "), vector (" + vector.failure() + ")");
        }

        List<ReciprocalRankFusion.FusedCandidate> fused = fusion.fuse(lexical.hits(), vector.hits());
        List<SearchResult> results = new ArrayList<>(topN);
        int dropped = 0;
        for (ReciprocalRankFusion.FusedCandidate candidate : fused) {
            if (results.size() >= topN) {
                break;
            }
            Optional<IndexRecord> record = lookup(candidate.id());
            if (record.isEmpty() || !isCitable(record.get())) {
                dropped++;
                continue;
            }
            results.add(toResult(candidate, record.get()));
        }

        List<String> failedBranches = new ArrayList<>();
        if (lexical.failed()) {
            failedBranches.add("lexical: " + lexical.failure());
        }
        if (vector.failed()) {
            failedBranches.add("vector: " + vector.failure());
        }
        long tookMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        log.info("[HybridSearch] '{}' -> {} results (lexical={}, vector={}, fused={}, dropped={}, degraded={}) in {} ms",
                query, results.size(), lexical.hits().size(), vector.hits().size(), fused.size(), dropped,
                !failedBranches.isEmpty(), tookMs);

        return new SearchResponse(query, results, new SearchResponse.Diagnostics(
                lexical.hits().size(),
                vector.hits().size(),
                fused.size(),
                dropped,
                fusion.k(),
                fusion.lexicalWeight(),
                fusion.vectorWeight(),
                !failedBranches.isEmpty(),
                failedBranches,
                tookMs));
    }

    /**
     * Query vectors go through the embedding cache like indexed content.
     */
    private float[] embedQuery(String query) {
        String key = hasher.fingerprint(query, embeddingProvider.modelId());
        Optional<float[]> cached = embeddingCache.get(key);
        if (cached.isPresent()) {
            return cached.get();
        }
        float[] vector = embeddingProvider.embed(List.of(query)).get(0);
        embeddingCache.put(key, vector);
        return vector;
    }

    private BranchResult await(String branch, CompletableFuture<List<IndexHit>> future, long deadlineNanos) {
        long remaining = Math.max(0, deadlineNanos - System.nanoTime());
        try {
            List<IndexHit> hits = future.get(remaining, TimeUnit.NANOSECONDS);
            return new BranchResult(hits != null ? hits : List.of(), null);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[HybridSearch] {} branch timed out", branch);
            return new BranchResult(List.of(), "timed out after " + properties.getQueryTimeout().toMillis() + " ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("[HybridSearch] {} branch failed: {}", branch, cause.getMessage());
            return new BranchResult(List.of(), cause.getClass().getSimpleName() + ": " + cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return new BranchResult(List.of(), "interrupted");
        }
    }

    private Optional<IndexRecord> lookup(String recordId) {
        try {
            return textIndex.findById(recordId);
        } catch (RuntimeException e) {
            log.warn("[HybridSearch] Cannot resolve citation for {}: {}", recordId, e.getMessage());
            return Optional.empty();
        }
    }

    private static boolean isCitable(IndexRecord record) {
        return record.path() != null && !record.path().isBlank()
                && record.commit() != null && !record.commit().isBlank()
                && record.startLine() >= 1 && record.endLine() >= record.startLine();
    }

    private static SearchResult toResult(ReciprocalRankFusion.FusedCandidate candidate, IndexRecord record) {
        SearchResult.ResultSource source;
        if (candidate.lexicalRank() != null && candidate.vectorRank() != null) {
            source = SearchResult.ResultSource.FUSED;
        } else if (candidate.lexicalRank() != null) {
            source = SearchResult.ResultSource.LEXICAL;
        } else {
            source = SearchResult.ResultSource.VECTOR;
        }
        String content = record.content() != null ? record.content() : "";
        String snippet = content.length() > SNIPPET_CHARS ? content.substring(0, SNIPPET_CHARS) + "..." : content;
        return new SearchResult(
                candidate.id(),
                candidate.score(),
                source,
                new Citation(record.path(), record.startLine(), record.endLine(), record.commit()),
                candidate.lexicalRank(),
                candidate.vectorRank(),
                record.language(),
                snippet);
    }
}
