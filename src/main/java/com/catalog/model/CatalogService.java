package com.catalog.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.Data;

/**
 * A documented service. Owns its API calls and its schemas.
 */
@Data
public class CatalogService {
    private UUID id;
    private String name;
    private String version;
    private String description;
    private String owner;
    private String contactEmail;
    private List<ServiceEnvironment> environments = new ArrayList<>();
    private Instant createdAt;
    private Instant updatedAt;
}
