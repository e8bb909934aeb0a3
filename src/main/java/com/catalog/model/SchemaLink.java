package com.catalog.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.UUID;
import lombok.Data;

/**
 * Pivot row between a schema and an API call (request body) or an API response.
 * {@code kind} is {@code "Items"} when the body is an array of the schema, otherwise null.
 */
@Data
public class SchemaLink {
    public static final String ITEMS_KIND = "Items";

    private UUID id;
    private UUID schemaId;
    private UUID ownerId;
    private String kind;

    @JsonIgnore
    public boolean isItems() {
        return ITEMS_KIND.equals(kind);
    }
}
