package com.ai.codeindex.service;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileChunkTest {

    private final UUID jobId = UUID.randomUUID();

    @Test
    void partition_preservesOrderAndSizes() {
        List<FileChunk> chunks = FileChunk.partition(jobId, List.of("a", "b", "c", "d", "e"), 2);

        assertThat(chunks).extracting(FileChunk::filePaths)
                .containsExactly(List.of("a", "b"), List.of("c", "d"), List.of("e"));
        assertThat(chunks).extracting(FileChunk::chunkIndex).containsExactly(0, 1, 2);
    }

    @Test
    void partition_emptyListYieldsNoChunks() {
        assertThat(FileChunk.partition(jobId, List.of(), 10)).isEmpty();
    }

    @Test
    void partition_rejectsNonPositiveSize() {
        assertThatThrownBy(() -> FileChunk.partition(jobId, List.of("a"), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
