package com.catalog.model;

/**
 * Raw document bytes fetched from a file or URL.
 *
 * @param content    The bytes as read.
 * @param formatHint The format suggested by the file extension, or {@code null} if none.
 * @param origin     The resolved location, used in log and error messages.
 */
public record LoadedDocument(byte[] content, DocumentFormat formatHint, String origin) {
}
