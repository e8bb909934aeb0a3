package com.catalog.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

public enum HttpMethod {
    GET, POST, PUT, DELETE, PATCH, HEAD, OPTIONS;

    /**
     * Verbs the operation importer brings into the catalog. HEAD and OPTIONS can still be
     * stored and exported.
     */
    public static final Set<HttpMethod> IMPORTABLE = EnumSet.of(GET, POST, PUT, DELETE, PATCH);

    public static Optional<HttpMethod> fromToken(String token) {
        if (token == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(token.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
