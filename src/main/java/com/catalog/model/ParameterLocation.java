package com.catalog.model;

import java.util.Locale;
import java.util.Optional;

public enum ParameterLocation {
    QUERY, PATH, HEADER, COOKIE;

    public String token() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<ParameterLocation> fromToken(String token) {
        if (token == null) {
            return Optional.empty();
        }
        for (ParameterLocation location : values()) {
            if (location.token().equalsIgnoreCase(token.trim())) {
                return Optional.of(location);
            }
        }
        return Optional.empty();
    }
}
