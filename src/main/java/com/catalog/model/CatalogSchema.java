package com.catalog.model;

import java.time.Instant;
import java.util.UUID;
import lombok.Data;

/**
 * A named data shape of a service. Unique per (service, name); owns its attributes.
 */
@Data
public class CatalogSchema {
    private UUID id;
    private UUID serviceId;
    private String name;
    private String type;
    private SchemaShape shape;
    private String title;
    private String description;
    private boolean reference;
    private String referencedModelName;
    private Instant createdAt;
}
