package com.catalog.service.api;

import com.catalog.model.ExtractedSchema;
import com.catalog.model.openapi.SchemaNode;
import java.util.List;
import java.util.Map;
import java.util.Set;

public interface SchemaGraphExtractor {

    /**
     * Lists the named root schemas once each, in source order.
     *
     * @param schemas The {@code components.schemas} mapping; may be {@code null}.
     * @return One entry per distinct name.
     */
    List<ExtractedSchema> extractAll(Map<String, SchemaNode> schemas);

    /**
     * Computes every schema name reachable from {@code name} through {@code $ref}s in
     * properties, items and compositions. Cycles terminate; the root itself is not listed.
     *
     * @throws com.catalog.exception.CatalogNotFoundException if {@code name} is not declared.
     */
    Set<String> dependenciesOf(String name, Map<String, SchemaNode> schemas);
}
