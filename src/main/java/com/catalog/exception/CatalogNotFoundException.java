package com.catalog.exception;

/**
 * Signals that a referenced catalog entity or document source does not exist.
 * Surfaced to the caller as-is; it is never retried.
 */
public class CatalogNotFoundException extends CatalogException {

    public CatalogNotFoundException(String message) {
        super(message);
    }
}
