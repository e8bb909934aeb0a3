package com.catalog.service.api;

import com.catalog.model.DocumentFormat;
import com.catalog.model.openapi.SchemaDocument;

public interface DocumentDecoder {

    /**
     * Decodes raw document bytes into the schema AST.
     * <p>
     * YAML is parsed into a generic tree first and then goes through the same binding path as
     * JSON. Entries that cannot be bound (a parameter that is not an object, a response with
     * the wrong shape, and so on) are dropped and reported in
     * {@link SchemaDocument#getDecodeWarnings()}.
     *
     * @param content The document bytes.
     * @param format  The declared format, or {@code null} to sniff it from the content.
     * @return The decoded document, never {@code null}.
     * @throws com.catalog.exception.DocumentDecodeException if the bytes do not parse, the root is
     *         not an object, or {@code info.title}, {@code info.version} or {@code paths} is missing.
     */
    SchemaDocument decode(byte[] content, DocumentFormat format);
}
