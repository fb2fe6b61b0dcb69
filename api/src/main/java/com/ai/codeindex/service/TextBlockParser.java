package com.ai.codeindex.service;

import com.ai.codeindex.config.IndexingProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Splits content into line-aligned blocks of roughly {@code blockChars} characters with a
 * few lines of overlap, so every unit has exact line coordinates for citations.
 */
@Service
public class TextBlockParser implements SourceParser {

    private static final Logger log = LoggerFactory.getLogger(TextBlockParser.class);
    private static final int MAX_BLOCKS = 10000;

    private static final Map<String, String> LANGUAGES = Map.ofEntries(
            Map.entry("java", "java"), Map.entry("kt", "kotlin"), Map.entry("py", "python"),
            Map.entry("ts", "typescript"), Map.entry("js", "javascript"), Map.entry("go", "go"),
            Map.entry("rs", "rust"), Map.entry("c", "c"), Map.entry("h", "c"), Map.entry("cpp", "cpp"),
            Map.entry("hpp", "cpp"), Map.entry("cs", "csharp"), Map.entry("sh", "shell"),
            Map.entry("bash", "shell"), Map.entry("sql", "sql"), Map.entry("md", "markdown"),
            Map.entry("yml", "yaml"), Map.entry("yaml", "yaml"), Map.entry("json", "json"),
            Map.entry("xml", "xml"), Map.entry("html", "html"), Map.entry("css", "css"));

    private final int blockChars;
    private final int overlapLines;

    public TextBlockParser(IndexingProperties properties) {
        this.blockChars = Math.max(100, properties.getBlockChars());
        this.overlapLines = Math.max(0, properties.getBlockOverlapLines());
    }

    @Override
    public List<SemanticUnit> parse(String path, String content) {
        if (content == null || content.isBlank()) {
            return List.of();
        }
        if (content.indexOf('\u0000') >= 0) {
            throw new IllegalArgumentException("Binary content (NUL byte) in " + path);
        }

        String language = languageOf(path);
        String[] lines = content.replace("\r\n", "\n").split("\n", -1);
        if (lines.length > 1 && lines[lines.length - 1].isEmpty()) {
            lines = Arrays.copyOf(lines, lines.length - 1);
        }
        List<SemanticUnit> units = new ArrayList<>();

        int start = 0;
        while (start < lines.length) {
            int end = start;
            int size = 0;
            // always take at least one line, then grow until the block is full
            while (end < lines.length && (end == start || size + lines[end].length() + 1 <= blockChars)) {
                size += lines[end].length() + 1;
                end++;
            }

            String block = String.join("\n", Arrays.copyOfRange(lines, start, end));
            if (!block.isBlank()) {
                units.add(new SemanticUnit(block, start + 1, end, language, "block"));
            }
            if (end >= lines.length) {
                break;
            }

            start = Math.max(start + 1, end - overlapLines);

            if (units.size() > MAX_BLOCKS) {
                log.warn("[TextBlockParser] Too many blocks in {}, stopping at {}", path, MAX_BLOCKS);
                break;
            }
        }

        log.debug("[TextBlockParser] Split {} ({} lines) into {} blocks", path, lines.length, units.size());
        return units;
    }

    static String languageOf(String path) {
        int dot = path.lastIndexOf('.');
        int slash = path.lastIndexOf('/');
        if (dot <= slash + 1) {
            return "text";
        }
        return LANGUAGES.getOrDefault(path.substring(dot + 1).toLowerCase(Locale.ROOT), "text");
    }
}
