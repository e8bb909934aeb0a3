package com.catalog.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.Data;

/**
 * One endpoint of a service, identified by path and method. Owns its parameters and responses.
 */
@Data
public class CatalogApiCall {
    private UUID id;
    private UUID serviceId;
    private String path;
    private HttpMethod method;
    private String operationId;
    private String summary;
    private String description;
    private List<String> tags = new ArrayList<>();
    private boolean deprecated;
    private String requestBodyDescription;
    private boolean requestBodyRequired;
    private Instant createdAt;
}
