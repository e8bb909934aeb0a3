package com.catalog.service.api;

import com.catalog.model.ProjectedSchema;
import com.catalog.model.openapi.SchemaNode;
import java.util.Collections;
import java.util.Map;

public interface RelationalProjector {

    /**
     * Converts one root schema into a schema row and its attribute rows. Pure: nothing is
     * persisted and no ids are assigned.
     *
     * @param name     The schema's name under {@code components.schemas}.
     * @param node     The schema itself.
     * @param registry All root schemas of the document, used to flatten {@code allOf} members.
     */
    ProjectedSchema project(String name, SchemaNode node, Map<String, SchemaNode> registry);

    default ProjectedSchema project(String name, SchemaNode node) {
        return project(name, node, Collections.emptyMap());
    }
}
