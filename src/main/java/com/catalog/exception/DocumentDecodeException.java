package com.catalog.exception;

/**
 * Raised when an OpenAPI document cannot be turned into a {@link com.catalog.model.openapi.SchemaDocument}.
 * <p>
 * This is fatal for an import: the bytes were not valid JSON/YAML, the root was not an object,
 * or one of the mandatory sections ({@code info.title}, {@code info.version}, {@code paths})
 * is missing. No catalog rows are written when this is thrown.
 */
public class DocumentDecodeException extends CatalogException {

    public DocumentDecodeException(String message) {
        super(message);
    }

    public DocumentDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
