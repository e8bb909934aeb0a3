package com.catalog.exception;

/**
 * Base runtime exception for failures inside the API catalog.
 * <p>
 * Every error the catalog raises on purpose extends this type, so shell commands and the
 * startup runner can render a single, readable message instead of a stack trace. Per-item
 * problems during an import are never thrown; they are collected as
 * {@link com.catalog.model.SkippedItemWarning}s instead.
 */
public class CatalogException extends RuntimeException {

    /**
     * Constructs a new CatalogException with the specified detail message.
     *
     * @param message The detail message.
     */
    public CatalogException(String message) {
        super(message);
    }

    /**
     * Constructs a new CatalogException with the specified detail message and cause.
     *
     * @param message The detail message.
     * @param cause   The underlying cause, may be {@code null}.
     */
    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
