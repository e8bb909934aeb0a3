package com.catalog.model.openapi;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Map;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ComponentsNode {
    private Map<String, SchemaNode> schemas;
}
