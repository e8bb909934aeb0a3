package com.catalog.model.openapi;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ContactNode {
    private String name;
    private String email;
    private String url;
}
