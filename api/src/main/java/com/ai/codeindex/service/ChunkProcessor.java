package com.ai.codeindex.service;

import com.ai.codeindex.config.IndexingProperties;
import com.ai.codeindex.entity.FileErrorType;
import com.ai.codeindex.entity.FileOutcome;
import com.ai.codeindex.exception.CredentialUnavailableException;
import com.ai.codeindex.exception.EmbeddingProviderException;
import com.ai.codeindex.exception.IndexStorageException;
import com.ai.codeindex.index.IndexRecord;
import com.ai.codeindex.index.TextIndex;
import com.ai.codeindex.index.VectorIndex;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Read, parse, embed (cache first) and index a single file.
 */
@Service
public class ChunkProcessor implements FileProcessor {

    private static final Logger log = LoggerFactory.getLogger(ChunkProcessor.class);

    private enum Stage { READ, PARSE, EMBED, WRITE }

    private record PreparedUnit(SemanticUnit unit, String contentHash) {
    }

    private final RepositoryFileSource files;
    private final SourceParser parser;
    private final ContentHasher hasher;
    private final EmbeddingCache cache;
    private final EmbeddingProvider provider;
    private final TextIndex textIndex;
    private final VectorIndex vectorIndex;
    private final IndexingProperties properties;
    private final Clock clock;
    private final ExecutorService parseExecutor;

    public ChunkProcessor(RepositoryFileSource files, SourceParser parser, ContentHasher hasher,
                          EmbeddingCache cache, EmbeddingProvider provider, TextIndex textIndex,
                          VectorIndex vectorIndex, IndexingProperties properties, Clock clock) {
        this.files = files;
        this.parser = parser;
        this.hasher = hasher;
        this.cache = cache;
        this.provider = provider;
        this.textIndex = textIndex;
        this.vectorIndex = vectorIndex;
        this.properties = properties;
        this.clock = clock;
        AtomicInteger threadCount = new AtomicInteger();
        this.parseExecutor = Executors.newFixedThreadPool(Math.max(1, properties.getWorkerThreads()), r -> {
            Thread t = new Thread(r, "index-parse-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public FileOutcome process(FileTask task, String path) {
        UUID jobId = task.jobId();
        int attempt = task.attempt();

        if (!FileEligibility.isTextEligible(path)) {
            log.debug("[ChunkProcessor] SKIP: File not text-eligible: {}", path);
            return FileOutcome.skipped(jobId, path, "Filtered: non-text or binary file type", attempt, now());
        }

        Stage stage = Stage.READ;
        try {
            String content = files.readFile(task.repositoryRef(), path);
            long bytes = content.getBytes(StandardCharsets.UTF_8).length;
            if (bytes > properties.getMaxFileBytes()) {
                return FileOutcome.skipped(jobId, path, "File exceeds " + properties.getMaxFileBytes() + " bytes",
                        attempt, now());
            }

            stage = Stage.PARSE;
            List<SemanticUnit> units = parseWithTimeout(path, content);
            if (units.isEmpty()) {
                return FileOutcome.skipped(jobId, path, "No indexable content", attempt, now());
            }

            List<PreparedUnit> prepared = new ArrayList<>(units.size());
            for (SemanticUnit unit : units) {
                prepared.add(new PreparedUnit(unit, hasher.fingerprint(unit.content(), provider.modelId())));
            }

            stage = Stage.EMBED;
            Map<String, float[]> vectors = resolveEmbeddings(jobId, prepared);

            stage = Stage.WRITE;
            for (PreparedUnit p : prepared) {
                SemanticUnit unit = p.unit();
                IndexRecord record = new IndexRecord(
                        hasher.recordId(p.contentHash(), task.repoId(), task.commit(), path, unit.startLine()),
                        jobId,
                        task.repoId(),
                        task.commit(),
                        path,
                        unit.startLine(),
                        unit.endLine(),
                        unit.language(),
                        unit.kind(),
                        p.contentHash(),
                        unit.content());
                textIndex.upsert(record);
                vectorIndex.upsert(record, vectors.get(p.contentHash()));
            }

            log.debug("[ChunkProcessor] OK: {} ({} units)", path, prepared.size());
            return FileOutcome.success(jobId, path, prepared.size(), attempt, now());

        } catch (CredentialUnavailableException | IndexStorageException e) {
            throw e;
        } catch (ParseTimeoutException e) {
            log.warn("[ChunkProcessor] TIMEOUT: {}: {}", path, e.getMessage());
            return FileOutcome.error(jobId, path, FileErrorType.TIMEOUT, e.getMessage(), attempt, now());
        } catch (EmbeddingProviderException e) {
            log.warn("[ChunkProcessor] EMBED ERROR: {}: {}", path, e.getMessage());
            FileErrorType type = e.isTimeout() ? FileErrorType.TIMEOUT : FileErrorType.EMBEDDING;
            return FileOutcome.error(jobId, path, type, e.getMessage(), attempt, now());
        } catch (RuntimeException e) {
            FileErrorType type = errorTypeOf(stage);
            String detail = e instanceof UncheckedIOException && e.getCause() != null
                    ? e.getMessage() + ": " + e.getCause().getClass().getSimpleName()
                    : e.getClass().getSimpleName() + ": " + e.getMessage();
            log.warn("[ChunkProcessor] {} ERROR: {}: {}", type, path, detail);
            return FileOutcome.error(jobId, path, type, detail, attempt, now());
        }
    }

    private List<SemanticUnit> parseWithTimeout(String path, String content) {
        Duration timeout = properties.getParseTimeout();
        Future<List<SemanticUnit>> future = parseExecutor.submit(() -> parser.parse(path, content));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ParseTimeoutException("Parsing took longer than " + timeout.toMillis() + " ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Parser failed: " + cause, cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while parsing " + path, e);
        }
    }

    /**
     * Cache first; misses are embedded in batches and written back to the cache.
     */
    private Map<String, float[]> resolveEmbeddings(UUID jobId, List<PreparedUnit> prepared) {
        Map<String, float[]> byHash = new LinkedHashMap<>();
        Map<String, String> misses = new LinkedHashMap<>();

        for (PreparedUnit p : prepared) {
            String hash = p.contentHash();
            if (byHash.containsKey(hash) || misses.containsKey(hash)) {
                continue;
            }
            Optional<float[]> cached = cache.get(jobId, hash);
            if (cached.isPresent()) {
                byHash.put(hash, cached.get());
            } else {
                misses.put(hash, p.unit().content());
            }
        }

        if (misses.isEmpty()) {
            return byHash;
        }

        List<String> hashes = new ArrayList<>(misses.keySet());
        int batchSize = Math.max(1, provider.maxBatchSize());
        for (int from = 0; from < hashes.size(); from += batchSize) {
            List<String> batchHashes = hashes.subList(from, Math.min(from + batchSize, hashes.size()));
            List<String> texts = batchHashes.stream().map(misses::get).toList();
            List<float[]> vectors = provider.embed(texts);
            if (vectors.size() != texts.size()) {
                throw new EmbeddingProviderException("Expected " + texts.size() + " embeddings, got " + vectors.size());
            }
            for (int i = 0; i < batchHashes.size(); i++) {
                byHash.put(batchHashes.get(i), vectors.get(i));
                cache.put(batchHashes.get(i), vectors.get(i));
            }
        }
        return byHash;
    }

    private static FileErrorType errorTypeOf(Stage stage) {
        return switch (stage) {
            case READ -> FileErrorType.READ;
            case PARSE -> FileErrorType.PARSE;
            case EMBED -> FileErrorType.EMBEDDING;
            case WRITE -> FileErrorType.INDEX_WRITE;
        };
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }

    @PreDestroy
    public void shutdown() {
        parseExecutor.shutdownNow();
    }

    static final class ParseTimeoutException extends RuntimeException {
        ParseTimeoutException(String message) {
            super(message);
        }
    }
}
