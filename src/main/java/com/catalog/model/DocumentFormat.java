package com.catalog.model;

import com.catalog.exception.DocumentDecodeException;
import java.util.Locale;
import java.util.Optional;

/**
 * The two interchange formats. Both carry the same document shape.
 */
public enum DocumentFormat {
    JSON("json"),
    YAML("yaml");

    private final String token;

    DocumentFormat(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }

    /**
     * @param token {@code "json"}, {@code "yaml"} or {@code "yml"}, case-insensitive.
     * @return The matching format.
     * @throws DocumentDecodeException if the token names neither format.
     */
    public static DocumentFormat fromToken(String token) {
        String normalized = token == null ? "" : token.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "json":
                return JSON;
            case "yaml":
            case "yml":
                return YAML;
            default:
                throw new DocumentDecodeException("Unknown document format '" + token + "', expected json or yaml");
        }
    }

    public static Optional<DocumentFormat> fromFileName(String fileName) {
        if (fileName == null) {
            return Optional.empty();
        }
        String lower = fileName.toLowerCase(Locale.ROOT);
        int query = lower.indexOf('?');
        if (query >= 0) {
            lower = lower.substring(0, query);
        }
        if (lower.endsWith(".json")) {
            return Optional.of(JSON);
        }
        if (lower.endsWith(".yaml") || lower.endsWith(".yml")) {
            return Optional.of(YAML);
        }
        return Optional.empty();
    }

    /**
     * Guesses the format from content: a first non-whitespace byte of <code>{</code> or <code>[</code>
     * means JSON, anything else YAML. A leading UTF-8 byte order mark is skipped.
     */
    public static DocumentFormat sniff(byte[] content) {
        int start = 0;
        if (content.length >= 3 && (content[0] & 0xFF) == 0xEF && (content[1] & 0xFF) == 0xBB && (content[2] & 0xFF) == 0xBF) {
            start = 3;
        }
        for (int i = start; i < content.length; i++) {
            byte b = content[i];
            if (b == ' ' || b == '\t' || b == '\r' || b == '\n') {
                continue;
            }
            return (b == '{' || b == '[') ? JSON : YAML;
        }
        return YAML;
    }
}
