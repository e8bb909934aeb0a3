package com.catalog.model.openapi;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class MediaTypeNode {
    private SchemaNode schema;
    private JsonValue example;
}
