package com.catalog.dto.request;

import com.catalog.model.DocumentFormat;

/**
 * What the {@code import} command was asked to read.
 *
 * @param source A URL, {@code file:} URI or local path.
 * @param format The declared format, or {@code null} to infer it.
 */
public record ImportRequest(String source, DocumentFormat format) {

    public static ImportRequest of(String source, String formatToken) {
        return new ImportRequest(source, formatToken == null ? null : DocumentFormat.fromToken(formatToken));
    }
}
