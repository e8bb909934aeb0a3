package com.catalog.model.openapi;

import com.catalog.model.SkippedItemWarning;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;

/**
 * The decoded form of an OpenAPI document: the root of the schema AST.
 * <p>
 * Maps keep source order. Items the decoder had to drop before binding are listed in
 * {@link #getDecodeWarnings()} and are carried into the import statistics.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class SchemaDocument {
    private String openapi;
    private DocumentInfo info;
    private List<ServerNode> servers;
    private Map<String, PathItemNode> paths = new LinkedHashMap<>();
    private ComponentsNode components;

    @JsonIgnore
    private List<SkippedItemWarning> decodeWarnings = new ArrayList<>();

    /**
     * @return The named root schemas, or an empty map when the document declares none.
     */
    public Map<String, SchemaNode> componentSchemas() {
        if (components == null || components.getSchemas() == null) {
            return Collections.emptyMap();
        }
        return components.getSchemas();
    }
}
