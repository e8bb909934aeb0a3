package com.catalog.service.api;

import com.catalog.model.DocumentFormat;
import io.swagger.v3.oas.models.OpenAPI;
import java.util.UUID;

public interface DocumentExporter {

    /**
     * Rebuilds an OpenAPI document for a catalog service.
     *
     * @throws com.catalog.exception.CatalogNotFoundException if the service does not exist.
     */
    OpenAPI buildModel(UUID serviceId);

    /**
     * Rebuilds and serializes the document. Keys are sorted at every level; JSON and YAML are
     * written from the same in-memory dictionary.
     */
    byte[] export(UUID serviceId, DocumentFormat format);
}
