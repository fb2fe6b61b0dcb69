package com.ai.codeindex.service;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;

/**
 * Include and exclude globs over repository-relative paths, for example {@code *.java} or
 * {@code **}{@code /test/**}. A pattern without a slash matches the file name in any
 * directory; a pattern starting with {@code **}{@code /} also matches at the repository root.
 * No include patterns means every file is included.
 */
public final class FileSelection {

    private static final FileSelection ALL = new FileSelection(List.of(), List.of());

    private final List<String> includes;
    private final List<String> excludes;
    private final List<PathMatcher> includeMatchers;
    private final List<PathMatcher> excludeMatchers;

    private FileSelection(List<String> includes, List<String> excludes) {
        this.includes = clean(includes);
        this.excludes = clean(excludes);
        this.includeMatchers = this.includes.stream().map(FileSelection::matcher).toList();
        this.excludeMatchers = this.excludes.stream().map(FileSelection::matcher).toList();
    }

    /**
     * @throws IllegalArgumentException when a pattern is not a valid glob
     */
    public static FileSelection of(List<String> includes, List<String> excludes) {
        if ((includes == null || includes.isEmpty()) && (excludes == null || excludes.isEmpty())) {
            return ALL;
        }
        return new FileSelection(includes, excludes);
    }

    public static FileSelection all() {
        return ALL;
    }

    public boolean matches(String relativePath) {
        Path path = Path.of(relativePath);
        boolean included = includeMatchers.isEmpty()
                || includeMatchers.stream().anyMatch(m -> m.matches(path));
        return included && excludeMatchers.stream().noneMatch(m -> m.matches(path));
    }

    public List<String> includes() {
        return includes;
    }

    public List<String> excludes() {
        return excludes;
    }

    private static List<String> clean(List<String> patterns) {
        if (patterns == null) {
            return List.of();
        }
        return patterns.stream()
                .filter(p -> p != null && !p.isBlank())
                .map(String::strip)
                .distinct()
                .toList();
    }

    private static PathMatcher matcher(String pattern) {
        if (!pattern.contains("/")) {
            return either(glob(pattern, pattern), glob(pattern, "**/" + pattern));
        }
        if (pattern.startsWith("**/")) {
            return either(glob(pattern, pattern.substring(3)), glob(pattern, pattern));
        }
        return glob(pattern, pattern);
    }

    private static PathMatcher either(PathMatcher first, PathMatcher second) {
        return path -> first.matches(path) || second.matches(path);
    }

    private static PathMatcher glob(String pattern, String glob) {
        try {
            return FileSystems.getDefault().getPathMatcher("glob:" + glob);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Invalid file pattern '" + pattern + "': " + e.getMessage(), e);
        }
    }
}
