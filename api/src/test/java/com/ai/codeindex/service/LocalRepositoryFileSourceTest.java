package com.ai.codeindex.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalRepositoryFileSourceTest {

    @TempDir
    Path repo;

    private final LocalRepositoryFileSource source = new LocalRepositoryFileSource();

    private void write(String relative, String content) throws IOException {
        Path file = repo.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    @Test
    void listFiles_returnsRelativePathsAndSkipsToolingDirectories() throws IOException {
        write("src/main/App.java", "class App {}");
        write("README.md", "# demo");
        write("node_modules/lib/index.js", "module.exports = 1;");
        write("target/classes/App.class", "binary");
        write(".git/HEAD", "ref: refs/heads/main\n");

        assertThat(source.listFiles(repo.toString()))
                .containsExactlyInAnyOrder("src/main/App.java", "README.md");
    }

    @Test
    void listFiles_unknownRepositoryIsRejected() {
        assertThatThrownBy(() -> source.listFiles(repo.resolve("missing").toString()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void readFile_decodesUtf8() throws IOException {
        write("notes.txt", "grüße");

        assertThat(source.readFile(repo.toString(), "notes.txt")).isEqualTo("grüße");
    }

    @Test
    void readFile_rejectsInvalidUtf8() throws IOException {
        Files.write(repo.resolve("latin1.txt"), new byte[]{'a', (byte) 0xE9, 'b'});

        assertThatThrownBy(() -> source.readFile(repo.toString(), "latin1.txt"))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("UTF-8");
    }

    @Test
    void readFile_rejectsPathsOutsideRoot() {
        assertThatThrownBy(() -> source.readFile(repo.toString(), "../etc/passwd"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void resolveCommit_followsLooseRef() throws IOException {
        write(".git/HEAD", "ref: refs/heads/main\n");
        write(".git/refs/heads/main", "4b825dc642cb6eb9a060e54bf8d69288fbee4904\n");

        assertThat(source.resolveCommit(repo.toString())).isEqualTo("4b825dc642cb6eb9a060e54bf8d69288fbee4904");
    }

    @Test
    void resolveCommit_followsPackedRef() throws IOException {
        write(".git/HEAD", "ref: refs/heads/main\n");
        write(".git/packed-refs", "# pack-refs with: peeled\nabc123 refs/heads/main\n");

        assertThat(source.resolveCommit(repo.toString())).isEqualTo("abc123");
    }

    @Test
    void resolveCommit_detachedHead() throws IOException {
        write(".git/HEAD", "def456\n");

        assertThat(source.resolveCommit(repo.toString())).isEqualTo("def456");
    }

    @Test
    void resolveCommit_withoutGitFallsBackToWorkingTree() {
        assertThat(source.resolveCommit(repo.toString())).isEqualTo("working-tree");
    }

    @Test
    void repositoryId_isDirectoryName() {
        assertThat(source.repositoryId(repo.toString())).isEqualTo(repo.getFileName().toString());
    }
}
