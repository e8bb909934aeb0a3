package com.catalog.model.openapi;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.Map;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class OperationNode {

    @JsonAlias("operation_id")
    private String operationId;

    private String summary;
    private String description;
    private List<String> tags;
    private Boolean deprecated;
    private List<ParameterNode> parameters;

    @JsonAlias("request_body")
    private RequestBodyNode requestBody;

    private Map<String, ResponseNode> responses;
}
