package com.ai.codeindex.repository;

import com.ai.codeindex.exception.IndexStorageException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessResourceException;

/**
 * pgvector helpers shared by the JDBC adapters.
 */
final class PgVectors {

    private PgVectors() {
    }

    /**
     * Convert float array to PostgreSQL vector string format.
     * Format: [0.1,0.2,0.3,...]
     */
    static String toVectorString(float[] embedding) {
        if (embedding == null || embedding.length == 0) {
            return null;
        }

        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < embedding.length; i++) {
            if (i > 0)
                sb.append(",");
            sb.append(embedding[i]);
        }
        sb.append("]");
        return sb.toString();
    }

    static float[] parseVector(String text) {
        if (text == null) {
            return null;
        }
        String body = text.trim();
        if (body.startsWith("[")) {
            body = body.substring(1);
        }
        if (body.endsWith("]")) {
            body = body.substring(0, body.length() - 1);
        }
        if (body.isBlank()) {
            return new float[0];
        }
        String[] parts = body.split(",");
        float[] vector = new float[parts.length];
        for (int i = 0; i < parts.length; i++) {
            vector[i] = Float.parseFloat(parts[i].trim());
        }
        return vector;
    }

    /**
     * Column holding vectors of the given dimension.
     */
    static String vectorColumn(int dimensions) {
        return switch (dimensions) {
            case 384 -> "embedding_384";
            case 768 -> "embedding_768";
            case 1024 -> "embedding_1024";
            default -> throw new IllegalArgumentException("Unsupported embedding dimension: " + dimensions);
        };
    }

    /**
     * Connectivity failures become {@link IndexStorageException}; anything else is a
     * problem with the record being written and is returned unchanged.
     */
    static RuntimeException translate(DataAccessException e, String operation) {
        if (e instanceof DataAccessResourceFailureException || e instanceof TransientDataAccessResourceException) {
            return new IndexStorageException("Index store unreachable during " + operation + ": "
                    + e.getMostSpecificCause().getMessage(), e);
        }
        return e;
    }
}
