package com.catalog.model;

import lombok.Data;

/**
 * One deployment of a service, created from a {@code servers[]} entry.
 */
@Data
public class ServiceEnvironment {
    private String name;
    private EnvironmentType type;
    private String baseUrl;
    private String host;
    private String description;
}
