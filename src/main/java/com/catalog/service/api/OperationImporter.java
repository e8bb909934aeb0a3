package com.catalog.service.api;

import com.catalog.model.CatalogApiCall;
import com.catalog.model.CatalogService;
import com.catalog.model.ImportStats;
import com.catalog.model.openapi.SchemaDocument;
import java.util.List;

public interface OperationImporter {

    /**
     * Creates one API call per (path, method) under {@code paths}, with its path and query
     * parameters and its responses, and links request and response bodies to schemas that
     * already exist for the service.
     * <p>
     * Problems with single items are added to {@code stats} as warnings and never abort the run.
     *
     * @return The created calls in document order.
     */
    List<CatalogApiCall> importPaths(SchemaDocument document, CatalogService service, ImportStats stats);
}
