package com.ai.codeindex.service;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.text.Normalizer;
import java.util.HexFormat;

/**
 * Content fingerprints used as embedding cache keys and index record ids.
 */
@Component
public class ContentHasher {

    /**
     * Bumped whenever block boundaries change, so cached vectors of the old layout stop matching.
     */
    public static final String CHUNKING_VERSION = "blocks-v1";

    /**
     * CRLF to LF, trailing whitespace removed per line, outer whitespace trimmed, NFC.
     */
    public String normalize(String text) {
        if (text == null) {
            return "";
        }
        String unixLines = text.replace("\r\n", "\n").replace('\r', '\n');
        String[] lines = unixLines.split("\n", -1);
        StringBuilder sb = new StringBuilder(unixLines.length());
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                sb.append('\n');
            }
            sb.append(lines[i].stripTrailing());
        }
        return Normalizer.normalize(sb.toString().strip(), Normalizer.Form.NFC);
    }

    /**
     * Fingerprint of a unit's text under a given embedding model.
     */
    public String fingerprint(String text, String modelId) {
        return sha256Hex(normalize(text) + '\u0000' + modelId + '\u0000' + CHUNKING_VERSION);
    }

    /**
     * Stable index record id. Re-indexing the same content at the same location of the same
     * repository snapshot maps to the same record; another commit or repository gets its own.
     */
    public String recordId(String contentHash, String repoId, String commit, String path, int startLine) {
        return sha256Hex(contentHash + '|' + repoId + '|' + commit + '|' + path + '|' + startLine);
    }

    static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
