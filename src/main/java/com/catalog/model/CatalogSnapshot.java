package com.catalog.model;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * The full catalog content, as written to and read from the snapshot file.
 */
@Data
public class CatalogSnapshot {
    private List<CatalogService> services = new ArrayList<>();
    private List<CatalogSchema> schemas = new ArrayList<>();
    private List<CatalogAttribute> attributes = new ArrayList<>();
    private List<CatalogApiCall> apiCalls = new ArrayList<>();
    private List<CatalogParameter> parameters = new ArrayList<>();
    private List<CatalogApiResponse> responses = new ArrayList<>();
    private List<SchemaLink> callLinks = new ArrayList<>();
    private List<SchemaLink> responseLinks = new ArrayList<>();
}
