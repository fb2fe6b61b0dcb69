package com.ai.codeindex.service;

import com.ai.codeindex.config.EmbeddingProperties;
import com.ai.codeindex.config.IndexingProperties;
import com.ai.codeindex.entity.FileErrorType;
import com.ai.codeindex.entity.FileOutcome;
import com.ai.codeindex.entity.FileOutcomeStatus;
import com.ai.codeindex.exception.CredentialUnavailableException;
import com.ai.codeindex.exception.EmbeddingProviderException;
import com.ai.codeindex.exception.IndexStorageException;
import com.ai.codeindex.index.IndexRecord;
import com.ai.codeindex.index.SearchFilters;
import com.ai.codeindex.index.TextIndex;
import com.ai.codeindex.support.FakeEmbeddingProvider;
import com.ai.codeindex.support.InMemoryEmbeddingCacheStore;
import com.ai.codeindex.support.InMemoryIndex;
import com.ai.codeindex.support.InMemoryRepositoryFileSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChunkProcessorTest {

    private static final String JAVA_SOURCE = """
            package demo;

            public class Greeter {
                public String greet(String name) {
                    return "hello " + name;
                }
            }
            """;

    private InMemoryRepositoryFileSource files;
    private IndexingProperties properties;
    private InMemoryIndex index;
    private EmbeddingCache cache;
    private FakeEmbeddingProvider provider;
    private ContentHasher hasher;
    private FileTask task;
    private ChunkProcessor processor;

    @BeforeEach
    void setUp() {
        files = new InMemoryRepositoryFileSource("demo", "abc123");
        properties = new IndexingProperties();
        index = new InMemoryIndex();
        cache = new EmbeddingCache(new InMemoryEmbeddingCacheStore(), new EmbeddingProperties());
        provider = new FakeEmbeddingProvider();
        hasher = new ContentHasher();
        task = new FileTask(UUID.randomUUID(), "/repos/demo", "demo", "abc123", 1);
        processor = newProcessor(new TextBlockParser(properties), provider, index);
    }

    @AfterEach
    void tearDown() {
        processor.shutdown();
    }

    private ChunkProcessor newProcessor(SourceParser parser, EmbeddingProvider embeddings, TextIndex textIndex) {
        return new ChunkProcessor(files, parser, hasher, cache, embeddings, textIndex, index, properties,
                Clock.systemUTC());
    }

    // ------ success ------

    @Test
    void process_indexesUnitsWithCitationsAndVectors() {
        files.put("src/Greeter.java", JAVA_SOURCE);

        FileOutcome outcome = processor.process(task, "src/Greeter.java");

        assertThat(outcome.getStatus()).isEqualTo(FileOutcomeStatus.SUCCESS);
        assertThat(outcome.getEntitiesEmitted()).isEqualTo(1);
        assertThat(outcome.getAttempt()).isEqualTo(1);

        List<IndexRecord> records = index.recordsForPath("src/Greeter.java");
        assertThat(records).hasSize(1);
        IndexRecord record = records.get(0);
        assertThat(record.commit()).isEqualTo("abc123");
        assertThat(record.repoId()).isEqualTo("demo");
        assertThat(record.startLine()).isEqualTo(1);
        assertThat(record.endLine()).isEqualTo(7);
        assertThat(record.language()).isEqualTo("java");
        assertThat(index.hasVector(record.id())).isTrue();
    }

    @Test
    void process_sameContentTwice_embedsOnceAndKeepsSeparateRecords() {
        files.put("a/Greeter.java", JAVA_SOURCE).put("b/Greeter.java", JAVA_SOURCE);

        processor.process(task, "a/Greeter.java");
        processor.process(task, "b/Greeter.java");

        assertThat(provider.texts()).isEqualTo(1);
        assertThat(index.records()).hasSize(2);
        EmbeddingCache.CacheStats stats = cache.drainStats(task.jobId());
        assertThat(stats.hits()).isEqualTo(1);
        assertThat(stats.misses()).isEqualTo(1);
    }

    @Test
    void process_reprocessingOverwritesInsteadOfDuplicating() {
        files.put("src/Greeter.java", JAVA_SOURCE);

        processor.process(task, "src/Greeter.java");
        processor.process(task, "src/Greeter.java");

        assertThat(index.records()).hasSize(1);
        String id = index.recordsForPath("src/Greeter.java").get(0).id();
        assertThat(index.textWrites(id)).isEqualTo(2);
    }

    @Test
    void process_sameFileAtAnotherCommitOrRepository_getsItsOwnRecord() {
        files.put("src/Greeter.java", JAVA_SOURCE);
        FileTask nextCommit = new FileTask(task.jobId(), "/repos/demo", "demo", "def456", 1);
        FileTask otherRepo = new FileTask(UUID.randomUUID(), "/repos/fork", "fork", "abc123", 1);

        processor.process(task, "src/Greeter.java");
        processor.process(nextCommit, "src/Greeter.java");
        processor.process(otherRepo, "src/Greeter.java");

        assertThat(index.records()).hasSize(3);
        assertThat(provider.texts()).isEqualTo(1);
        assertThat(index.search("greet", new SearchFilters("demo", "abc123"), 10)).hasSize(1);
        assertThat(index.search("greet", new SearchFilters("demo", "def456"), 10)).hasSize(1);
        assertThat(index.search("greet", new SearchFilters("fork", null), 10)).hasSize(1);
        String cited = index.search("greet", new SearchFilters(null, "def456"), 10).get(0).recordId();
        assertThat(index.findById(cited).orElseThrow().commit()).isEqualTo("def456");
    }

    @Test
    void process_repeatedBlocksInOneFile_keepEveryLocation() {
        files.put("src/Repeats.java", "ignored by the stub parser");
        SourceParser repeating = (path, content) -> List.of(
                new SemanticUnit("return null;", 3, 3, "java", "block"),
                new SemanticUnit("return null;", 40, 40, "java", "block"));
        ChunkProcessor repeats = newProcessor(repeating, provider, index);

        try {
            FileOutcome outcome = repeats.process(task, "src/Repeats.java");

            assertThat(outcome.getEntitiesEmitted()).isEqualTo(2);
            assertThat(index.recordsForPath("src/Repeats.java"))
                    .extracting(IndexRecord::startLine)
                    .containsExactlyInAnyOrder(3, 40);
            assertThat(provider.texts()).isEqualTo(1);
        } finally {
            repeats.shutdown();
        }
    }

    @Test
    void process_batchesMissesByProviderLimit() {
        properties.setBlockChars(100);
        properties.setBlockOverlapLines(0);
        StringBuilder content = new StringBuilder();
        for (int i = 0; i < 40; i++) {
            content.append("unique line ").append(i).append(" of a long markdown file\n");
        }
        files.put("docs/long.md", content.toString());
        FakeEmbeddingProvider smallBatches = new FakeEmbeddingProvider(2);
        ChunkProcessor batching = newProcessor(new TextBlockParser(properties), smallBatches, index);

        try {
            FileOutcome outcome = batching.process(task, "docs/long.md");

            assertThat(outcome.isSuccess()).isTrue();
            assertThat(smallBatches.texts()).isEqualTo(outcome.getEntitiesEmitted());
            assertThat(smallBatches.calls()).isEqualTo((outcome.getEntitiesEmitted() + 1) / 2);
        } finally {
            batching.shutdown();
        }
    }

    // ------ skipped ------

    @Test
    void process_binaryExtensionIsSkippedWithoutReading() {
        FileOutcome outcome = processor.process(task, "assets/logo.png");

        assertThat(outcome.getStatus()).isEqualTo(FileOutcomeStatus.SKIPPED);
        assertThat(outcome.getErrorType()).isEqualTo(FileErrorType.UNSUPPORTED);
    }

    @Test
    void process_emptyFileIsSkipped() {
        files.put("README.md", "");

        assertThat(processor.process(task, "README.md").getStatus()).isEqualTo(FileOutcomeStatus.SKIPPED);
        assertThat(provider.calls()).isZero();
    }

    @Test
    void process_oversizedFileIsSkipped() {
        properties.setMaxFileBytes(10);
        files.put("big.txt", "more than ten bytes of text");

        assertThat(processor.process(task, "big.txt").getStatus()).isEqualTo(FileOutcomeStatus.SKIPPED);
    }

    // ------ per-file errors ------

    @Test
    void process_unreadableFileIsReadError() {
        FileOutcome outcome = processor.process(task, "missing.java");

        assertThat(outcome.getStatus()).isEqualTo(FileOutcomeStatus.ERROR);
        assertThat(outcome.getErrorType()).isEqualTo(FileErrorType.READ);
    }

    @Test
    void process_binaryContentIsParseError() {
        files.put("weird.txt", "abc\u0000def");

        FileOutcome outcome = processor.process(task, "weird.txt");

        assertThat(outcome.getErrorType()).isEqualTo(FileErrorType.PARSE);
        assertThat(index.records()).isEmpty();
    }

    @Test
    void process_slowParserTimesOut() {
        properties.setParseTimeout(Duration.ofMillis(50));
        files.put("slow.java", JAVA_SOURCE);
        SourceParser slow = (path, content) -> {
            try {
                Thread.sleep(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return List.of();
        };
        ChunkProcessor slowProcessor = newProcessor(slow, provider, index);

        try {
            FileOutcome outcome = slowProcessor.process(task, "slow.java");

            assertThat(outcome.getErrorType()).isEqualTo(FileErrorType.TIMEOUT);
        } finally {
            slowProcessor.shutdown();
        }
    }

    @Test
    void process_embeddingFailureIsEmbeddingError() {
        files.put("src/Greeter.java", JAVA_SOURCE);
        EmbeddingProvider failing = failingProvider(new EmbeddingProviderException("HTTP 500"));

        FileOutcome outcome = newProcessor(new TextBlockParser(properties), failing, index)
                .process(task, "src/Greeter.java");

        assertThat(outcome.getErrorType()).isEqualTo(FileErrorType.EMBEDDING);
        assertThat(index.records()).isEmpty();
    }

    @Test
    void process_embeddingTimeoutIsTimeoutError() {
        files.put("src/Greeter.java", JAVA_SOURCE);
        EmbeddingProvider failing = failingProvider(new EmbeddingProviderException("timed out", null, true));

        FileOutcome outcome = newProcessor(new TextBlockParser(properties), failing, index)
                .process(task, "src/Greeter.java");

        assertThat(outcome.getErrorType()).isEqualTo(FileErrorType.TIMEOUT);
    }

    // ------ run-level failures propagate ------

    @Test
    void process_credentialFailurePropagates() {
        files.put("src/Greeter.java", JAVA_SOURCE);
        EmbeddingProvider failing = failingProvider(new CredentialUnavailableException("breaker open"));

        ChunkProcessor p = newProcessor(new TextBlockParser(properties), failing, index);

        assertThatThrownBy(() -> p.process(task, "src/Greeter.java"))
                .isInstanceOf(CredentialUnavailableException.class);
    }

    @Test
    void process_indexStoreFailurePropagates() {
        files.put("src/Greeter.java", JAVA_SOURCE);
        TextIndex broken = new InMemoryIndex() {
            @Override
            public void upsert(IndexRecord record) {
                throw new IndexStorageException("connection refused");
            }
        };

        ChunkProcessor p = newProcessor(new TextBlockParser(properties), provider, broken);

        assertThatThrownBy(() -> p.process(task, "src/Greeter.java"))
                .isInstanceOf(IndexStorageException.class);
    }

    private static EmbeddingProvider failingProvider(RuntimeException failure) {
        return new EmbeddingProvider() {
            @Override
            public String modelId() {
                return "fake-embed";
            }

            @Override
            public int maxBatchSize() {
                return 16;
            }

            @Override
            public List<float[]> embed(List<String> texts) {
                throw failure;
            }
        };
    }
}
