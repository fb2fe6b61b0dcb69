package com.ai.codeindex.index;

/**
 * Equality filters applied inside both branches. Null fields do not filter.
 */
public record SearchFilters(String repoId, String commit) {

    public static SearchFilters none() {
        return new SearchFilters(null, null);
    }

    public boolean matches(IndexRecord record) {
        return (repoId == null || repoId.equals(record.repoId()))
                && (commit == null || commit.equals(record.commit()));
    }
}
