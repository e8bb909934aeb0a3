package com.catalog.model.openapi;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;

/**
 * All operations declared under one path, plus parameters shared by every operation on it.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PathItemNode {
    private String summary;
    private String description;
    private List<ParameterNode> parameters;

    private OperationNode get;
    private OperationNode put;
    private OperationNode post;
    private OperationNode delete;
    private OperationNode options;
    private OperationNode head;
    private OperationNode patch;
    private OperationNode trace;

    /**
     * @return The declared operations keyed by upper-case verb, in a fixed verb order.
     */
    public Map<String, OperationNode> operations() {
        Map<String, OperationNode> operations = new LinkedHashMap<>();
        putIfPresent(operations, "GET", get);
        putIfPresent(operations, "POST", post);
        putIfPresent(operations, "PUT", put);
        putIfPresent(operations, "DELETE", delete);
        putIfPresent(operations, "PATCH", patch);
        putIfPresent(operations, "HEAD", head);
        putIfPresent(operations, "OPTIONS", options);
        putIfPresent(operations, "TRACE", trace);
        return operations;
    }

    private static void putIfPresent(Map<String, OperationNode> operations, String verb, OperationNode operation) {
        if (operation != null) {
            operations.put(verb, operation);
        }
    }
}
