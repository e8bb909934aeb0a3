package com.catalog.model;

import java.util.List;

/**
 * A schema row and its attribute rows, before ids and owners are assigned by the repository.
 */
public record ProjectedSchema(CatalogSchema schema, List<CatalogAttribute> attributes) {
}
