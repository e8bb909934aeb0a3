package com.catalog.model.openapi;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.Data;

/**
 * A recursive JSON-Schema-like node as found under {@code components.schemas}, inside
 * properties, array items, compositions, parameters and media types.
 * <p>
 * A node with {@link #getRef() ref} set carries no other semantic field once
 * {@link #enforceReferenceExclusivity()} has run; the decoder applies it to every node it
 * produces. Unknown {@code type} strings are kept as-is.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class SchemaNode {

    public static final String COMPONENTS_PREFIX = "#/components/schemas/";

    @JsonProperty("$ref")
    @JsonAlias("ref")
    private String ref;

    private String type;
    private String format;
    private String title;
    private String description;
    private String pattern;

    private Double minimum;
    private Double maximum;

    @JsonAlias("exclusive_minimum")
    private JsonValue exclusiveMinimum;

    @JsonAlias("exclusive_maximum")
    private JsonValue exclusiveMaximum;

    @JsonAlias("min_length")
    private Integer minLength;

    @JsonAlias("max_length")
    private Integer maxLength;

    private Boolean nullable;

    @JsonProperty("enum")
    @JsonDeserialize(using = EnumValuesDeserializer.class)
    private List<String> enumValues;

    private SchemaNode items;
    private Map<String, SchemaNode> properties;
    private List<String> required;

    @JsonAlias("all_of")
    private List<SchemaNode> allOf;

    @JsonAlias("any_of")
    private List<SchemaNode> anyOf;

    @JsonAlias("one_of")
    private List<SchemaNode> oneOf;

    @JsonProperty("default")
    private JsonValue defaultValue;

    private JsonValue example;

    public static SchemaNode reference(String name) {
        SchemaNode node = new SchemaNode();
        node.setRef(COMPONENTS_PREFIX + name);
        return node;
    }

    /**
     * Accepts both the OpenAPI 3.0 string form and the 3.1 array form of {@code type}. In the
     * array form the first non-{@code "null"} entry becomes the type and a {@code "null"} entry
     * marks the node nullable.
     */
    @JsonSetter("type")
    void decodeType(JsonNode node) {
        if (node == null || node.isNull()) {
            this.type = null;
        } else if (node.isArray()) {
            String first = null;
            for (JsonNode member : node) {
                String text = member.asText();
                if ("null".equals(text)) {
                    this.nullable = Boolean.TRUE;
                } else if (first == null) {
                    first = text;
                }
            }
            this.type = first;
        } else {
            this.type = node.asText();
        }
    }

    public boolean isReference() {
        return ref != null && !ref.isBlank();
    }

    public boolean hasProperties() {
        return properties != null && !properties.isEmpty();
    }

    public boolean hasEnum() {
        return enumValues != null && !enumValues.isEmpty();
    }

    public boolean hasAllOf() {
        return allOf != null && !allOf.isEmpty();
    }

    public boolean isRequired(String propertyName) {
        return required != null && required.contains(propertyName);
    }

    /**
     * @return The last path segment of {@code $ref}, or {@code null} when this is not a reference.
     */
    public String referencedName() {
        return isReference() ? lastSegment(ref) : null;
    }

    public static String lastSegment(String ref) {
        int slash = ref.lastIndexOf('/');
        return slash >= 0 ? ref.substring(slash + 1) : ref;
    }

    /**
     * Clears every sibling of {@code $ref} on this node and, recursively, on all nested nodes.
     */
    public void enforceReferenceExclusivity() {
        if (isReference()) {
            String keep = ref;
            type = null;
            format = null;
            title = null;
            description = null;
            pattern = null;
            minimum = null;
            maximum = null;
            exclusiveMinimum = null;
            exclusiveMaximum = null;
            minLength = null;
            maxLength = null;
            nullable = null;
            enumValues = null;
            items = null;
            properties = null;
            required = null;
            allOf = null;
            anyOf = null;
            oneOf = null;
            defaultValue = null;
            example = null;
            ref = keep;
            return;
        }
        if (items != null) {
            items.enforceReferenceExclusivity();
        }
        if (properties != null) {
            properties.values().stream().filter(Objects::nonNull).forEach(SchemaNode::enforceReferenceExclusivity);
        }
        enforceAll(allOf);
        enforceAll(anyOf);
        enforceAll(oneOf);
    }

    private static void enforceAll(List<SchemaNode> nodes) {
        if (nodes != null) {
            nodes.stream().filter(Objects::nonNull).forEach(SchemaNode::enforceReferenceExclusivity);
        }
    }
}
