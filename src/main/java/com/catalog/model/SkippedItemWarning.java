package com.catalog.model;

/**
 * A non-fatal problem found while importing a document. The offending item is left out and
 * the import carries on; warnings are reported through {@link ImportStats}.
 *
 * @param kind     What went wrong.
 * @param location Where in the document, e.g. {@code paths./users.get.parameters[2]}.
 * @param message  A human-readable explanation.
 */
public record SkippedItemWarning(Kind kind, String location, String message) {

    public enum Kind {
        MALFORMED_PARAMETER,
        DROPPED_PARAMETER,
        MALFORMED_RESPONSE,
        MALFORMED_PATH_ITEM,
        MALFORMED_SCHEMA,
        UNSUPPORTED_METHOD,
        UNRESOLVED_SCHEMA_LINK
    }

    @Override
    public String toString() {
        return kind + " at " + location + ": " + message;
    }
}
