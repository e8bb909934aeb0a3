package com.catalog.model;

/**
 * The schema a request or response body should be linked to.
 *
 * @param schemaName  Name to look up, exact match.
 * @param kind        {@code "Items"} for array-of-ref bodies, otherwise null.
 * @param synthesized Whether the name was generated for an inline body.
 */
public record SchemaLinkTarget(String schemaName, String kind, boolean synthesized) {
}
