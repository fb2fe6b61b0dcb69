package com.ai.codeindex.service;

import com.ai.codeindex.index.IndexHit;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Weighted Reciprocal Rank Fusion of a lexical and a vector ranking. Each list contributes
 * {@code weight / (k + rank)} per document, ranks starting at 1. Raw branch scores are
 * ignored, only positions matter.
 */
public class ReciprocalRankFusion {

    /**
     * Fused document with its 1-based rank in each branch (null when absent).
     */
    public record FusedCandidate(String id, double score, Integer lexicalRank, Integer vectorRank) {
    }

    /**
     * Score descending; ties prefer the better lexical rank, then presence in the vector
     * list by rank, then id.
     */
    static final Comparator<FusedCandidate> ORDER = Comparator
            .comparingDouble(FusedCandidate::score).reversed()
            .thenComparing(FusedCandidate::lexicalRank, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(FusedCandidate::vectorRank, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(FusedCandidate::id);

    private final int k;
    private final double lexicalWeight;
    private final double vectorWeight;

    public ReciprocalRankFusion(int k, double lexicalWeight, double vectorWeight) {
        if (k < 0) {
            throw new IllegalArgumentException("RRF constant must not be negative");
        }
        this.k = k;
        this.lexicalWeight = lexicalWeight;
        this.vectorWeight = vectorWeight;
    }

    public static double contribution(double weight, int k, int rank) {
        return weight / (k + rank);
    }

    public List<FusedCandidate> fuse(List<IndexHit> lexical, List<IndexHit> vector) {
        Map<String, Integer> lexicalRanks = ranks(lexical);
        Map<String, Integer> vectorRanks = ranks(vector);

        Map<String, FusedCandidate> fused = new LinkedHashMap<>();
        lexicalRanks.forEach((id, rank) ->
                fused.put(id, new FusedCandidate(id, contribution(lexicalWeight, k, rank), rank, null)));
        vectorRanks.forEach((id, rank) -> fused.merge(id,
                new FusedCandidate(id, contribution(vectorWeight, k, rank), null, rank),
                (a, b) -> new FusedCandidate(id, a.score() + b.score(), a.lexicalRank(), b.vectorRank())));

        List<FusedCandidate> ordered = new ArrayList<>(fused.values());
        ordered.sort(ORDER);
        return ordered;
    }

    public int k() {
        return k;
    }

    public double lexicalWeight() {
        return lexicalWeight;
    }

    public double vectorWeight() {
        return vectorWeight;
    }

    // a document listed twice keeps its best rank and does not push later documents down
    private static Map<String, Integer> ranks(List<IndexHit> hits) {
        Map<String, Integer> ranks = new LinkedHashMap<>();
        if (hits == null) {
            return ranks;
        }
        int rank = 1;
        for (IndexHit hit : hits) {
            if (ranks.putIfAbsent(hit.recordId(), rank) == null) {
                rank++;
            }
        }
        return ranks;
    }
}
