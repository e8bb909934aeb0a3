package com.catalog.model;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.Data;

/**
 * One field of a {@link CatalogSchema}.
 * <p>
 * {@code type} is an open tag: a primitive name, {@code object}, {@code array}, {@code enum}
 * or the name of another schema. {@code elementType} is the item type of an array, the
 * target of a reference, or the primitive behind an enum. Default and example values are
 * stored in their canonical string form.
 */
@Data
public class CatalogAttribute {
    private UUID id;
    private UUID schemaId;
    private String name;
    private String type;
    private String elementType;
    private String format;
    private boolean nullable;
    private boolean required;
    private String description;
    private String defaultValue;
    private List<String> enumValues = new ArrayList<>();
    private String example;
    private int position;
}
