package com.ai.codeindex.service;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Decides from the path alone whether a file is worth reading as text.
 */
final class FileEligibility {

    private static final Set<String> VALID_NAMES = Set.of(
            "license", "dockerfile", "makefile", "procfile", "gemfile", "pipfile");

    private static final List<String> VALID_EXTENSIONS = List.of(
            ".md", ".txt", ".java", ".ts", ".js", ".json", ".yml", ".yaml", ".xml",
            ".properties", ".env", ".gitignore", ".py", ".c", ".cpp", ".h", ".hpp",
            ".cs", ".sh", ".bash", ".sql", ".css", ".html", ".kt", ".rs", ".go");

    private FileEligibility() {
    }

    static boolean isTextEligible(String path) {
        if (path == null)
            return false;
        String fileName = path.toLowerCase(Locale.ROOT);

        String justName = fileName.contains("/") ? fileName.substring(fileName.lastIndexOf("/") + 1) : fileName;
        if (VALID_NAMES.contains(justName))
            return true;

        for (String ext : VALID_EXTENSIONS) {
            if (fileName.endsWith(ext))
                return true;
        }

        return false;
    }
}
