package com.catalog.model;

import com.catalog.model.openapi.SchemaNode;

/**
 * A named schema picked from {@code components.schemas}.
 */
public record ExtractedSchema(String name, SchemaNode node, boolean root) {
}
