package com.ai.codeindex.service;

import com.ai.codeindex.config.EmbeddingProperties;
import com.ai.codeindex.config.IndexingProperties;
import com.ai.codeindex.credential.Credential;
import com.ai.codeindex.credential.CredentialResult;
import com.ai.codeindex.credential.CredentialSource;
import com.ai.codeindex.credential.CredentialSourceType;
import com.ai.codeindex.credential.CredentialSupervisor;
import com.ai.codeindex.support.FakeEmbeddingProvider;
import com.ai.codeindex.support.InMemoryEmbeddingCacheStore;
import com.ai.codeindex.support.InMemoryIndex;
import com.ai.codeindex.support.InMemoryRepositoryFileSource;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * In-memory wiring of the indexing pipeline shared by orchestrator tests.
 */
class IndexingFixture {

    static final String REPO = "/repos/demo";

    final Clock clock = Clock.systemUTC();
    final InMemoryRepositoryFileSource files = new InMemoryRepositoryFileSource("demo", "c0ffee");
    final InMemoryIndex index = new InMemoryIndex();
    final InMemoryEmbeddingCacheStore cacheStore = new InMemoryEmbeddingCacheStore();
    final FakeEmbeddingProvider provider = new FakeEmbeddingProvider();
    final IndexingProperties indexing = new IndexingProperties();
    final EmbeddingProperties embedding = new EmbeddingProperties();
    final EmbeddingCache cache = new EmbeddingCache(cacheStore, embedding);
    final ProgressBroadcaster progress = new ProgressBroadcaster(clock, indexing);
    final CredentialSupervisor credentials;

    private final List<ChunkProcessor> processors = new ArrayList<>();
    private final List<IndexJobOrchestrator> orchestrators = new ArrayList<>();

    IndexingFixture() {
        indexing.setWorkerThreads(1);
        CredentialSource staticToken = new CredentialSource() {
            @Override
            public CredentialSourceType type() {
                return CredentialSourceType.ENVIRONMENT;
            }

            @Override
            public CredentialResult fetch() {
                return CredentialResult.success(new Credential("test-token", clock.instant(), null, type()));
            }
        };
        credentials = new CredentialSupervisor(List.of(staticToken), clock, Duration.ofMinutes(30),
                Duration.ofSeconds(5), 3, Duration.ofSeconds(60));
        credentials.start();
    }

    IndexingFixture withJavaFiles(int count) {
        for (int i = 0; i < count; i++) {
            String name = String.format("File%03d", i);
            files.put("src/" + name + ".java", "class " + name + " {\n    int value = " + i + ";\n}\n");
        }
        return this;
    }

    ChunkProcessor chunkProcessor() {
        ChunkProcessor processor = new ChunkProcessor(files, new TextBlockParser(indexing), new ContentHasher(),
                cache, provider, index, index, indexing, clock);
        processors.add(processor);
        return processor;
    }

    IndexJobOrchestrator orchestrator(CheckpointStore store, FileProcessor processor) {
        IndexJobOrchestrator orchestrator = new IndexJobOrchestrator(store, files, processor, credentials, cache,
                progress, indexing, embedding, clock);
        orchestrators.add(orchestrator);
        return orchestrator;
    }

    void close() {
        orchestrators.forEach(IndexJobOrchestrator::shutdown);
        processors.forEach(ChunkProcessor::shutdown);
        credentials.shutdown();
    }
}
