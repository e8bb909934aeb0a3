package com.catalog.service.impl;

import com.catalog.exception.CatalogNotFoundException;
import com.catalog.model.ExtractedSchema;
import com.catalog.model.openapi.SchemaNode;
import com.catalog.service.api.SchemaGraphExtractor;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Walks the named schemas of a document. Schemas refer to each other by name, so cycle
 * detection works on names rather than on node identity.
 */
@Service
@Slf4j
public class SchemaGraphExtractorImpl implements SchemaGraphExtractor {

    /**
     * {@inheritDoc}
     * <p>
     * Only roots are emitted. Inline nested schemas stay with the attribute that declares them,
     * and nested {@code $ref}s are resolved by name later.
     */
    @Override
    public List<ExtractedSchema> extractAll(Map<String, SchemaNode> schemas) {
        if (schemas == null || schemas.isEmpty()) {
            return Collections.emptyList();
        }
        List<ExtractedSchema> extracted = new ArrayList<>();
        Set<String> processed = new HashSet<>();
        schemas.forEach((name, node) -> {
            if (node != null && processed.add(name)) {
                extracted.add(new ExtractedSchema(name, node, true));
            }
        });
        log.debug("Extracted {} root schemas", extracted.size());
        return extracted;
    }

    @Override
    public Set<String> dependenciesOf(String name, Map<String, SchemaNode> schemas) {
        if (schemas == null || !schemas.containsKey(name)) {
            throw new CatalogNotFoundException("Schema '" + name + "' is not declared under components.schemas");
        }
        Set<String> reached = new LinkedHashSet<>();
        Set<String> visited = new HashSet<>();
        Deque<String> pending = new ArrayDeque<>();
        pending.add(name);
        while (!pending.isEmpty()) {
            String current = pending.poll();
            if (!visited.add(current)) {
                continue;
            }
            SchemaNode node = schemas.get(current);
            if (node == null) {
                continue;
            }
            Set<String> direct = new LinkedHashSet<>();
            collectReferences(node, direct);
            for (String target : direct) {
                if (!target.equals(name)) {
                    reached.add(target);
                }
                pending.add(target);
            }
        }
        return reached;
    }

    private void collectReferences(SchemaNode node, Set<String> into) {
        if (node.isReference()) {
            into.add(node.referencedName());
            return;
        }
        if (node.getItems() != null) {
            collectReferences(node.getItems(), into);
        }
        if (node.getProperties() != null) {
            node.getProperties().values().stream()
                    .filter(property -> property != null)
                    .forEach(property -> collectReferences(property, into));
        }
        collectAll(node.getAllOf(), into);
        collectAll(node.getAnyOf(), into);
        collectAll(node.getOneOf(), into);
    }

    private void collectAll(List<SchemaNode> members, Set<String> into) {
        if (members != null) {
            members.stream()
                    .filter(member -> member != null)
                    .forEach(member -> collectReferences(member, into));
        }
    }
}
