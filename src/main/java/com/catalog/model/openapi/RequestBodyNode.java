package com.catalog.model.openapi;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Map;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class RequestBodyNode {
    private String description;
    private Boolean required;
    private Map<String, MediaTypeNode> content;
}
