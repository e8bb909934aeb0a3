package com.catalog.service.impl;

import com.catalog.model.CatalogAttribute;
import com.catalog.model.CatalogSchema;
import com.catalog.model.ProjectedSchema;
import com.catalog.model.SchemaShape;
import com.catalog.model.openapi.JsonValue;
import com.catalog.model.openapi.SchemaNode;
import com.catalog.service.api.RelationalProjector;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Flattens a root schema into attribute rows.
 * <ul>
 *   <li>Objects, and {@code allOf} compositions, get one attribute per property.</li>
 *   <li>An enum root without properties gets one attribute named after its title.</li>
 *   <li>A primitive or array root gets one attribute called {@code value}.</li>
 *   <li>A {@code $ref} root becomes a reference schema without attributes.</li>
 * </ul>
 */
@Service
@Slf4j
public class RelationalProjectorImpl implements RelationalProjector {

    static final String ENUM_DEFAULT_SEPARATOR = " ||";
    static final String VALUE_ATTRIBUTE = "value";

    private static final Set<String> VALUE_TYPES = Set.of("string", "integer", "number", "boolean", "array");

    @Override
    public ProjectedSchema project(String name, SchemaNode node, Map<String, SchemaNode> registry) {
        CatalogSchema schema = new CatalogSchema();
        schema.setName(name);
        schema.setTitle(node.getTitle());
        schema.setDescription(node.getDescription());

        List<CatalogAttribute> attributes;
        if (node.isReference()) {
            schema.setShape(SchemaShape.REFERENCE);
            schema.setType("reference");
            schema.setReference(true);
            schema.setReferencedModelName(node.referencedName());
            attributes = Collections.emptyList();
        } else if (node.hasProperties() || node.hasAllOf()) {
            schema.setShape(SchemaShape.OBJECT);
            schema.setType("object");
            attributes = projectProperties(name, node, registry == null ? Collections.emptyMap() : registry);
        } else if (node.hasEnum()) {
            schema.setShape(SchemaShape.ENUMERATION);
            schema.setType("enum");
            attributes = List.of(enumRootAttribute(node));
        } else if (node.getType() != null && VALUE_TYPES.contains(node.getType())) {
            schema.setShape(SchemaShape.VALUE);
            schema.setType(node.getType());
            attributes = List.of(valueAttribute(node));
        } else {
            schema.setShape(SchemaShape.OBJECT);
            schema.setType(node.getType() != null ? node.getType() : "object");
            attributes = Collections.emptyList();
        }
        log.debug("Projected schema '{}' as {} with {} attributes", name, schema.getShape(), attributes.size());
        return new ProjectedSchema(schema, attributes);
    }

    private List<CatalogAttribute> projectProperties(String name, SchemaNode node, Map<String, SchemaNode> registry) {
        Map<String, SchemaNode> properties = new LinkedHashMap<>();
        Set<String> required = new LinkedHashSet<>();
        Set<String> visited = new HashSet<>();
        visited.add(name);
        collectProperties(node, registry, properties, required, visited);

        List<CatalogAttribute> attributes = new ArrayList<>();
        int position = 0;
        for (Map.Entry<String, SchemaNode> property : properties.entrySet()) {
            attributes.add(propertyAttribute(property.getKey(), property.getValue(), required.contains(property.getKey()), position++));
        }
        return attributes;
    }

    // First declaration of a property name wins; allOf refs are followed once each.
    private void collectProperties(SchemaNode node, Map<String, SchemaNode> registry, Map<String, SchemaNode> properties,
                                   Set<String> required, Set<String> visited) {
        if (node.getProperties() != null) {
            node.getProperties().forEach((propertyName, property) -> {
                if (property != null) {
                    properties.putIfAbsent(propertyName, property);
                }
            });
        }
        if (node.getRequired() != null) {
            required.addAll(node.getRequired());
        }
        if (node.getAllOf() == null) {
            return;
        }
        for (SchemaNode member : node.getAllOf()) {
            if (member == null) {
                continue;
            }
            if (member.isReference()) {
                String target = member.referencedName();
                SchemaNode resolved = registry.get(target);
                if (resolved != null && visited.add(target)) {
                    collectProperties(resolved, registry, properties, required, visited);
                }
            } else {
                collectProperties(member, registry, properties, required, visited);
            }
        }
    }

    private CatalogAttribute propertyAttribute(String name, SchemaNode property, boolean required, int position) {
        CatalogAttribute attribute = baseAttribute(name, property, position);
        attribute.setRequired(required);
        attribute.setDescription(property.getDescription());
        String type = resolveType(property);
        attribute.setType(type);
        if (property.isReference()) {
            attribute.setElementType(property.referencedName());
        } else if ("array".equals(type)) {
            attribute.setElementType(elementTypeOf(property.getItems()));
        } else if ("enum".equals(type)) {
            attribute.setElementType(property.getType());
        } else if (isSingleReferenceComposition(property)) {
            attribute.setElementType(type);
        }
        return attribute;
    }

    private CatalogAttribute enumRootAttribute(SchemaNode node) {
        CatalogAttribute attribute = baseAttribute(node.getTitle() != null ? node.getTitle() : "unknown", node, 0);
        attribute.setType("enum");
        attribute.setElementType(node.getType());
        attribute.setDescription(node.getDescription());
        if (node.getDefaultValue() == null) {
            attribute.setDefaultValue(String.join(ENUM_DEFAULT_SEPARATOR, node.getEnumValues()));
        }
        return attribute;
    }

    private CatalogAttribute valueAttribute(SchemaNode node) {
        CatalogAttribute attribute = baseAttribute(VALUE_ATTRIBUTE, node, 0);
        attribute.setType(node.getType());
        attribute.setRequired(true);
        if ("array".equals(node.getType())) {
            attribute.setElementType(elementTypeOf(node.getItems()));
        }
        return attribute;
    }

    private CatalogAttribute baseAttribute(String name, SchemaNode node, int position) {
        CatalogAttribute attribute = new CatalogAttribute();
        attribute.setName(name);
        attribute.setPosition(position);
        attribute.setFormat(node.getFormat());
        attribute.setNullable(Boolean.TRUE.equals(node.getNullable()));
        attribute.setDefaultValue(canonical(node.getDefaultValue()));
        attribute.setExample(canonical(node.getExample()));
        if (node.hasEnum()) {
            attribute.setEnumValues(new ArrayList<>(node.getEnumValues()));
        }
        return attribute;
    }

    /**
     * Type tag of a nested schema: the referenced name, then {@code enum}, then the declared
     * type, then the target of a single-member {@code allOf}, and {@code object} otherwise.
     */
    static String resolveType(SchemaNode node) {
        if (node.isReference()) {
            return node.referencedName();
        }
        if (node.hasEnum()) {
            return "enum";
        }
        if (node.getType() != null) {
            return node.getType();
        }
        if (isSingleReferenceComposition(node)) {
            return node.getAllOf().get(0).referencedName();
        }
        return "object";
    }

    private static String elementTypeOf(SchemaNode items) {
        if (items == null) {
            return null;
        }
        if (items.isReference()) {
            return items.referencedName();
        }
        return items.getType() != null ? items.getType() : resolveType(items);
    }

    private static boolean isSingleReferenceComposition(SchemaNode node) {
        return node.getAllOf() != null && node.getAllOf().size() == 1
                && node.getAllOf().get(0) != null && node.getAllOf().get(0).isReference();
    }

    private static String canonical(JsonValue value) {
        return value == null ? null : value.toCanonicalString();
    }
}
