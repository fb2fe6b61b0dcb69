package com.ai.codeindex.service;

import com.ai.codeindex.entity.FileOutcome;

/**
 * Processes one file end to end and reports how it went.
 *
 * <p>File-level problems come back as an ERROR or SKIPPED outcome. Only
 * {@link com.ai.codeindex.exception.CredentialUnavailableException} and
 * {@link com.ai.codeindex.exception.IndexStorageException} escape, because they concern
 * every remaining file of the run.
 */
@FunctionalInterface
public interface FileProcessor {

    FileOutcome process(FileTask task, String path);
}
