package com.catalog.model.openapi;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * The {@code info} block of a document. {@code title} and {@code version} are required.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class DocumentInfo {
    private String title;
    private String version;
    private String description;
    private ContactNode contact;
}
