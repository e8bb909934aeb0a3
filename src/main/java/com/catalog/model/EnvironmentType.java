package com.catalog.model;

import java.util.Locale;

public enum EnvironmentType {
    DEVELOPMENT, STAGE, PREPROD, PROD;

    /**
     * Infers the environment from words in a server URL. Pre-production is checked before
     * production since its names contain the shorter one.
     */
    public static EnvironmentType fromUrl(String url) {
        if (url == null) {
            return DEVELOPMENT;
        }
        String lower = url.toLowerCase(Locale.ROOT);
        if (lower.contains("stage") || lower.contains("staging")) {
            return STAGE;
        }
        if (lower.contains("preprod") || lower.contains("pre-production")) {
            return PREPROD;
        }
        if (lower.contains("prod") || lower.contains("production")) {
            return PROD;
        }
        return DEVELOPMENT;
    }
}
