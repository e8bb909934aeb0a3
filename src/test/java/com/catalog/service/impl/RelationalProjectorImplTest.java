package com.catalog.service.impl;

import static com.catalog.TestDocuments.bytes;
import static org.assertj.core.api.Assertions.assertThat;

import com.catalog.model.CatalogAttribute;
import com.catalog.model.DocumentFormat;
import com.catalog.model.ProjectedSchema;
import com.catalog.model.SchemaShape;
import com.catalog.model.openapi.SchemaNode;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RelationalProjectorImplTest {

    private RelationalProjectorImpl projector;
    private Map<String, SchemaNode> petstore;

    @BeforeEach
    void setUp() {
        projector = new RelationalProjectorImpl();
        petstore = new DocumentDecoderImpl().decode(bytes("petstore.json"), DocumentFormat.JSON).componentSchemas();
    }

    @Test
    void project_shouldCreateOneAttributePerProperty() {
        ProjectedSchema projected = projector.project("Pet", petstore.get("Pet"), petstore);

        assertThat(projected.schema().getShape()).isEqualTo(SchemaShape.OBJECT);
        assertThat(projected.schema().getType()).isEqualTo("object");
        assertThat(names(projected)).containsExactly("id", "name", "status", "weight", "tags", "owner");

        CatalogAttribute id = attribute(projected, "id");
        assertThat(id.getType()).isEqualTo("integer");
        assertThat(id.getFormat()).isEqualTo("int64");
        assertThat(id.isRequired()).isTrue();
        assertThat(id.getPosition()).isZero();

        assertThat(attribute(projected, "name").getExample()).isEqualTo("Rex");
        assertThat(attribute(projected, "weight").getDefaultValue()).isEqualTo("1.5");
        assertThat(attribute(projected, "weight").isRequired()).isFalse();
    }

    @Test
    void project_shouldResolveReferenceAndArrayTypes() {
        ProjectedSchema projected = projector.project("Pet", petstore.get("Pet"), petstore);

        CatalogAttribute status = attribute(projected, "status");
        assertThat(status.getType()).isEqualTo("PetStatus");
        assertThat(status.getElementType()).isEqualTo("PetStatus");

        CatalogAttribute tags = attribute(projected, "tags");
        assertThat(tags.getType()).isEqualTo("array");
        assertThat(tags.getElementType()).isEqualTo("string");

        CatalogAttribute owner = attribute(projected, "owner");
        assertThat(owner.getType()).isEqualTo("Owner");
    }

    @Test
    void project_shouldTagEnumProperties() {
        ProjectedSchema projected = projector.project("NewPet", petstore.get("NewPet"), petstore);

        CatalogAttribute status = attribute(projected, "status");
        assertThat(status.getType()).isEqualTo("enum");
        assertThat(status.getElementType()).isEqualTo("string");
        assertThat(status.getEnumValues()).containsExactly("available", "sold");
        assertThat(status.getDefaultValue()).isEqualTo("available");
    }

    @Test
    void project_shouldSynthesizeEnumRootAttribute() {
        ProjectedSchema projected = projector.project("PetStatus", petstore.get("PetStatus"), petstore);

        assertThat(projected.schema().getShape()).isEqualTo(SchemaShape.ENUMERATION);
        assertThat(projected.attributes()).singleElement().satisfies(attribute -> {
            assertThat(attribute.getName()).isEqualTo("status");
            assertThat(attribute.getType()).isEqualTo("enum");
            assertThat(attribute.getDefaultValue()).isEqualTo("available ||pending ||sold");
        });
    }

    @Test
    void project_shouldNameUntitledEnumRootUnknown() {
        SchemaNode node = new SchemaNode();
        node.setEnumValues(List.of("a", "b"));

        ProjectedSchema projected = projector.project("Letters", node);

        assertThat(projected.attributes()).singleElement()
                .satisfies(attribute -> assertThat(attribute.getName()).isEqualTo("unknown"));
    }

    @Test
    void project_shouldGivePrimitiveRootsAValueAttribute() {
        ProjectedSchema projected = projector.project("PetName", petstore.get("PetName"), petstore);

        assertThat(projected.schema().getShape()).isEqualTo(SchemaShape.VALUE);
        assertThat(projected.attributes()).singleElement().satisfies(attribute -> {
            assertThat(attribute.getName()).isEqualTo("value");
            assertThat(attribute.getType()).isEqualTo("string");
            assertThat(attribute.getFormat()).isEqualTo("hostname");
            assertThat(attribute.isRequired()).isTrue();
        });

        SchemaNode ids = new SchemaNode();
        ids.setType("array");
        ids.setItems(SchemaNode.reference("Pet"));
        assertThat(projector.project("PetIds", ids).attributes()).singleElement()
                .satisfies(attribute -> assertThat(attribute.getElementType()).isEqualTo("Pet"));
    }

    @Test
    void project_shouldMarkReferenceRoots() {
        ProjectedSchema projected = projector.project("PetAlias", petstore.get("PetAlias"), petstore);

        assertThat(projected.schema().isReference()).isTrue();
        assertThat(projected.schema().getType()).isEqualTo("reference");
        assertThat(projected.schema().getReferencedModelName()).isEqualTo("Pet");
        assertThat(projected.attributes()).isEmpty();
    }

    @Test
    void project_shouldGiveObjectsWithoutPropertiesNoAttributes() {
        SchemaNode node = new SchemaNode();
        node.setType("object");

        ProjectedSchema projected = projector.project("Empty", node);

        assertThat(projected.schema().getShape()).isEqualTo(SchemaShape.OBJECT);
        assertThat(projected.attributes()).isEmpty();
    }

    @Test
    void project_shouldFlattenAllOfCompositions() {
        Map<String, SchemaNode> orders = new DocumentDecoderImpl()
                .decode(bytes("composition.yaml"), DocumentFormat.YAML).componentSchemas();

        ProjectedSchema projected = projector.project("Order", orders.get("Order"), orders);

        assertThat(names(projected)).containsExactly("createdAt", "id", "note", "parent");
        CatalogAttribute id = attribute(projected, "id");
        assertThat(id.getType()).isEqualTo("string");
        assertThat(id.getDescription()).isEqualTo("audit id");
        assertThat(id.isRequired()).isTrue();
        assertThat(attribute(projected, "createdAt").isRequired()).isTrue();
        assertThat(attribute(projected, "note").isNullable()).isTrue();
        assertThat(attribute(projected, "parent").getType()).isEqualTo("Order");
    }

    @Test
    void project_shouldStopOnCyclicAllOf() {
        SchemaNode a = new SchemaNode();
        a.setAllOf(List.of(SchemaNode.reference("B")));
        SchemaNode b = new SchemaNode();
        SchemaNode x = new SchemaNode();
        x.setType("string");
        b.setProperties(Map.of("x", x));
        b.setAllOf(List.of(SchemaNode.reference("A")));

        ProjectedSchema projected = projector.project("A", a, Map.of("A", a, "B", b));

        assertThat(names(projected)).containsExactly("x");
    }

    @Test
    void resolveType_shouldFollowPriorityOrder() {
        SchemaNode enumWithType = new SchemaNode();
        enumWithType.setType("integer");
        enumWithType.setEnumValues(List.of("1"));
        SchemaNode untyped = new SchemaNode();

        assertThat(RelationalProjectorImpl.resolveType(SchemaNode.reference("X"))).isEqualTo("X");
        assertThat(RelationalProjectorImpl.resolveType(enumWithType)).isEqualTo("enum");
        assertThat(RelationalProjectorImpl.resolveType(untyped)).isEqualTo("object");
    }

    private static List<String> names(ProjectedSchema projected) {
        return projected.attributes().stream().map(CatalogAttribute::getName).collect(Collectors.toList());
    }

    private static CatalogAttribute attribute(ProjectedSchema projected, String name) {
        return projected.attributes().stream()
                .filter(attribute -> attribute.getName().equals(name))
                .findFirst()
                .orElseThrow();
    }
}
