package com.catalog.service.api;

import com.catalog.model.LoadedDocument;

public interface DocumentSourceLoader {

    /**
     * Reads a document from an {@code http(s)} URL, a {@code file:} URI or a plain path.
     *
     * @throws com.catalog.exception.CatalogNotFoundException if a local file does not exist.
     * @throws com.catalog.exception.CatalogException if the remote fetch fails.
     */
    LoadedDocument load(String source);
}
