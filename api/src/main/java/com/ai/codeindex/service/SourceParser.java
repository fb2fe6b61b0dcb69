package com.ai.codeindex.service;

import java.util.List;

/**
 * Splits a file into semantic units. May throw on unparseable input; the caller records
 * that as a PARSE error for the file.
 */
public interface SourceParser {

    List<SemanticUnit> parse(String path, String content);
}
