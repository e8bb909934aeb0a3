package com.catalog.model;

import java.util.UUID;
import lombok.Data;

@Data
public class CatalogParameter {
    private UUID id;
    private UUID apiCallId;
    private String name;
    private String type;
    private String format;
    private ParameterLocation location;
    private boolean required;
    private String description;
    private String example;
    private int position;
}
