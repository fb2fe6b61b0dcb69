package com.ai.codeindex.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Repository checked out on the local filesystem; {@code repositoryRef} is its directory.
 */
@Service
public class LocalRepositoryFileSource implements RepositoryFileSource {

    private static final Logger log = LoggerFactory.getLogger(LocalRepositoryFileSource.class);
    private static final String WORKING_TREE = "working-tree";

    private static final Set<String> EXCLUDED_DIRS = Set.of(
            ".git", ".idea", ".vscode", "node_modules", "target", "build", "dist", "__pycache__", ".venv");

    @Override
    public List<String> listFiles(String repositoryRef) {
        Path root = resolveRoot(repositoryRef);
        List<String> paths = new ArrayList<>();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(root) && EXCLUDED_DIRS.contains(dir.getFileName().toString())) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile()) {
                        paths.add(toRelative(root, file));
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException e) {
                    log.warn("[LocalRepository] Cannot visit {}: {}", file, e.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to enumerate " + root, e);
        }
        log.info("[LocalRepository] Discovered {} files under {}", paths.size(), root);
        return paths;
    }

    @Override
    public String readFile(String repositoryRef, String path) {
        Path root = resolveRoot(repositoryRef);
        Path file = root.resolve(path).normalize();
        if (!file.startsWith(root)) {
            throw new IllegalArgumentException("Path escapes repository root: " + path);
        }
        try {
            byte[] bytes = Files.readAllBytes(file);
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new UncheckedIOException("Not valid UTF-8: " + path, e);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + path, e);
        }
    }

    @Override
    public String repositoryId(String repositoryRef) {
        Path root = resolveRoot(repositoryRef);
        Path name = root.getFileName();
        return name != null ? name.toString() : root.toString();
    }

    /**
     * Reads .git/HEAD, following a symbolic ref through loose refs and packed-refs.
     */
    @Override
    public String resolveCommit(String repositoryRef) {
        Path gitDir = resolveRoot(repositoryRef).resolve(".git");
        Path head = gitDir.resolve("HEAD");
        if (!Files.isRegularFile(head)) {
            return WORKING_TREE;
        }
        try {
            String value = Files.readString(head).trim();
            if (!value.startsWith("ref:")) {
                return value;
            }
            String ref = value.substring(4).trim();
            Path loose = gitDir.resolve(ref);
            if (Files.isRegularFile(loose)) {
                return Files.readString(loose).trim();
            }
            Path packed = gitDir.resolve("packed-refs");
            if (Files.isRegularFile(packed)) {
                for (String line : Files.readAllLines(packed)) {
                    if (line.endsWith(" " + ref)) {
                        return line.substring(0, line.indexOf(' '));
                    }
                }
            }
        } catch (IOException e) {
            log.warn("[LocalRepository] Cannot resolve HEAD of {}: {}", repositoryRef, e.getMessage());
        }
        return WORKING_TREE;
    }

    private Path resolveRoot(String repositoryRef) {
        if (repositoryRef == null || repositoryRef.isBlank()) {
            throw new IllegalArgumentException("repository_ref is required");
        }
        Path root = Path.of(repositoryRef).toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            throw new IllegalArgumentException("Repository not found: " + repositoryRef);
        }
        return root;
    }

    private static String toRelative(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }
}
