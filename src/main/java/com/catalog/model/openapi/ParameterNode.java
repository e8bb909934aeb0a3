package com.catalog.model.openapi;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * A single operation or path-level parameter. {@code in} is kept as raw text so that
 * unexpected locations can be reported instead of failing the decode.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ParameterNode {
    private String name;

    @JsonProperty("in")
    private String location;

    private String description;
    private Boolean required;
    private SchemaNode schema;
    private JsonValue example;
}
