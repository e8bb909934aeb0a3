package com.catalog.model;

import java.util.UUID;
import lombok.Data;

/**
 * A declared response of an API call. {@code statusCode} keeps the document's key verbatim,
 * so {@code "default"} and range keys such as {@code "4XX"} survive a round trip.
 */
@Data
public class CatalogApiResponse {
    private UUID id;
    private UUID apiCallId;
    private String statusCode;
    private String description;
    private String contentType;
    private int position;
}
