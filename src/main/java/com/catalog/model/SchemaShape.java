package com.catalog.model;

/**
 * How a root schema was projected, which drives how it is exported again.
 */
public enum SchemaShape {
    /** Properties became attributes. */
    OBJECT,
    /** A single synthesized attribute carries the enum. */
    ENUMERATION,
    /** A primitive or array root carried by a single {@code value} attribute. */
    VALUE,
    /** The root is only a {@code $ref} to another schema. */
    REFERENCE
}
