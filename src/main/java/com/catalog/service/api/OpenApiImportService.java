package com.catalog.service.api;

import com.catalog.model.DocumentFormat;
import com.catalog.model.ImportStats;

/**
 * Runs a whole import: decode, then in one unit of work create the service, project the
 * schemas and import the endpoints. A service with the same name and version is replaced.
 */
public interface OpenApiImportService {

    /**
     * @param format The declared format, or {@code null} to sniff it.
     */
    ImportStats importDocument(byte[] content, DocumentFormat format);

    /**
     * @param source A URL, {@code file:} URI or path.
     * @param format The declared format, or {@code null} to use the extension or sniff it.
     */
    ImportStats importFromSource(String source, DocumentFormat format);
}
