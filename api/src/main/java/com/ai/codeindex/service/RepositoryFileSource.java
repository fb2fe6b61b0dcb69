package com.ai.codeindex.service;

import java.util.List;

/**
 * Read access to a repository snapshot. Paths are relative, '/'-separated.
 */
public interface RepositoryFileSource {

    /**
     * All candidate files. Order is not significant; callers sort.
     *
     * @throws IllegalArgumentException when {@code repositoryRef} does not resolve to a repository
     */
    List<String> listFiles(String repositoryRef);

    /**
     * @throws java.io.UncheckedIOException when the file cannot be read or decoded
     */
    String readFile(String repositoryRef, String path);

    String repositoryId(String repositoryRef);

    /**
     * Commit the snapshot belongs to, used in citations.
     */
    String resolveCommit(String repositoryRef);
}
