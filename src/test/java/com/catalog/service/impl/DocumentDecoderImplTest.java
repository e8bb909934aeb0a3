package com.catalog.service.impl;

import static com.catalog.TestDocuments.bytes;
import static com.catalog.TestDocuments.utf8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.catalog.exception.DocumentDecodeException;
import com.catalog.model.DocumentFormat;
import com.catalog.model.SkippedItemWarning;
import com.catalog.model.openapi.JsonValue;
import com.catalog.model.openapi.OperationNode;
import com.catalog.model.openapi.SchemaDocument;
import com.catalog.model.openapi.SchemaNode;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DocumentDecoderImplTest {

    private DocumentDecoderImpl decoder;

    @BeforeEach
    void setUp() {
        decoder = new DocumentDecoderImpl();
    }

    @Test
    void decode_shouldReadJsonDocument() {
        SchemaDocument document = decoder.decode(bytes("users.json"), DocumentFormat.JSON);

        assertThat(document.getInfo().getTitle()).isEqualTo("Users");
        assertThat(document.getInfo().getVersion()).isEqualTo("1.0.0");
        assertThat(document.getInfo().getContact().getEmail()).isEqualTo("identity@example.com");
        assertThat(document.getServers()).hasSize(2);
        assertThat(document.getPaths()).containsOnlyKeys("/users/{id}");

        OperationNode get = document.getPaths().get("/users/{id}").getGet();
        assertThat(get.getOperationId()).isEqualTo("getUser");
        assertThat(get.getParameters()).singleElement().satisfies(parameter -> {
            assertThat(parameter.getLocation()).isEqualTo("path");
            assertThat(parameter.getRequired()).isTrue();
        });
        SchemaNode body = get.getResponses().get("200").getContent().get("application/json").getSchema();
        assertThat(body.isReference()).isTrue();
        assertThat(body.referencedName()).isEqualTo("User");
        assertThat(document.getDecodeWarnings()).isEmpty();
    }

    @Test
    void decode_shouldProduceSameTreeForYamlAndJson() {
        SchemaDocument fromJson = decoder.decode(bytes("users.json"), DocumentFormat.JSON);
        SchemaDocument fromYaml = decoder.decode(bytes("users.yaml"), DocumentFormat.YAML);

        assertThat(fromYaml).isEqualTo(fromJson);
    }

    @Test
    void decode_shouldSniffFormatWhenNoneIsDeclared() {
        SchemaDocument document = decoder.decode(bytes("users.yaml"), null);

        assertThat(document.componentSchemas()).containsOnlyKeys("User");
    }

    @Test
    void decode_shouldKeepNumericYamlVersionAsText() {
        SchemaDocument document = decoder.decode(bytes("composition.yaml"), DocumentFormat.YAML);

        assertThat(document.getInfo().getVersion()).isEqualTo("3");
    }

    @Test
    void decode_shouldNormalizeEnumMembersToStrings() {
        SchemaDocument document = decoder.decode(bytes("composition.yaml"), DocumentFormat.YAML);

        assertThat(document.componentSchemas().get("Priority").getEnumValues()).containsExactly("1", "2", "3.5");
    }

    @Test
    void decode_shouldReadTypeArraysAsNullableType() {
        SchemaDocument document = decoder.decode(bytes("composition.yaml"), DocumentFormat.YAML);

        SchemaNode note = document.componentSchemas().get("Order").getAllOf().get(1).getProperties().get("note");
        assertThat(note.getType()).isEqualTo("string");
        assertThat(note.getNullable()).isTrue();
    }

    @Test
    void decode_shouldAcceptDefaultsOfAnyJsonType() {
        String json = "{\"info\":{\"title\":\"t\",\"version\":\"1\"},\"paths\":{},\"components\":{\"schemas\":{"
                + "\"A\":{\"type\":\"object\",\"default\":{\"k\":[1,2.5,true,null]}},"
                + "\"B\":{\"type\":\"integer\",\"default\":3,\"example\":\"three\"},"
                + "\"C\":{\"type\":\"string\",\"default\":null}}}}";

        SchemaDocument document = decoder.decode(utf8(json), DocumentFormat.JSON);

        assertThat(document.componentSchemas().get("A").getDefaultValue().toCanonicalString())
                .isEqualTo("{\"k\":[1,2.5,true,null]}");
        assertThat(document.componentSchemas().get("B").getDefaultValue()).isEqualTo(JsonValue.ofInteger(3));
        assertThat(document.componentSchemas().get("B").getExample()).isEqualTo(JsonValue.ofString("three"));
        assertThat(document.componentSchemas().get("C").getDefaultValue()).isEqualTo(JsonValue.nullValue());
    }

    @Test
    void decode_shouldDropSiblingsOfReferences() {
        String json = "{\"info\":{\"title\":\"t\",\"version\":\"1\"},\"paths\":{},\"components\":{\"schemas\":{"
                + "\"A\":{\"$ref\":\"#/components/schemas/B\",\"type\":\"object\",\"description\":\"ignored\"},"
                + "\"B\":{\"type\":\"object\",\"properties\":{\"c\":{\"$ref\":\"#/components/schemas/A\",\"nullable\":true}}}}}}";

        SchemaDocument document = decoder.decode(utf8(json), DocumentFormat.JSON);

        SchemaNode a = document.componentSchemas().get("A");
        assertThat(a.getRef()).isEqualTo("#/components/schemas/B");
        assertThat(a.getType()).isNull();
        assertThat(a.getDescription()).isNull();
        assertThat(document.componentSchemas().get("B").getProperties().get("c").getNullable()).isNull();
    }

    @Test
    void decode_shouldIgnoreUnknownFieldsAndUnknownTypes() {
        String json = "{\"info\":{\"title\":\"t\",\"version\":\"1\",\"x-team\":\"core\"},\"paths\":{},"
                + "\"x-extra\":true,\"components\":{\"securitySchemes\":{\"k\":{\"type\":\"apiKey\"}},"
                + "\"schemas\":{\"A\":{\"type\":\"uuid\",\"discriminator\":{\"propertyName\":\"kind\"}}}}}";

        SchemaDocument document = decoder.decode(utf8(json), DocumentFormat.JSON);

        assertThat(document.componentSchemas().get("A").getType()).isEqualTo("uuid");
    }

    @Test
    void decode_shouldSkipMalformedEntriesWithWarnings() {
        SchemaDocument document = decoder.decode(bytes("malformed.json"), DocumentFormat.JSON);

        assertThat(document.getPaths()).containsOnlyKeys("/things");
        assertThat(document.getPaths().get("/things").getGet().getParameters()).hasSize(4);
        assertThat(document.getPaths().get("/things").getGet().getResponses()).containsOnlyKeys("200");
        assertThat(document.getDecodeWarnings().stream().map(SkippedItemWarning::kind).collect(Collectors.toList()))
                .containsExactlyInAnyOrder(
                        SkippedItemWarning.Kind.MALFORMED_PARAMETER,
                        SkippedItemWarning.Kind.MALFORMED_RESPONSE,
                        SkippedItemWarning.Kind.MALFORMED_PATH_ITEM);
    }

    @Test
    void decode_shouldFailWithoutInfoTitleOrVersion() {
        assertThatThrownBy(() -> decoder.decode(utf8("{\"info\":{\"version\":\"1\"},\"paths\":{}}"), DocumentFormat.JSON))
                .isInstanceOf(DocumentDecodeException.class)
                .hasMessageContaining("info.title");
        assertThatThrownBy(() -> decoder.decode(utf8("{\"info\":{\"title\":\"t\"},\"paths\":{}}"), DocumentFormat.JSON))
                .isInstanceOf(DocumentDecodeException.class)
                .hasMessageContaining("info.version");
        assertThatThrownBy(() -> decoder.decode(utf8("{\"paths\":{}}"), DocumentFormat.JSON))
                .isInstanceOf(DocumentDecodeException.class);
    }

    @Test
    void decode_shouldFailWithoutPaths() {
        assertThatThrownBy(() -> decoder.decode(utf8("{\"info\":{\"title\":\"t\",\"version\":\"1\"}}"), DocumentFormat.JSON))
                .isInstanceOf(DocumentDecodeException.class)
                .hasMessageContaining("paths");
    }

    @Test
    void decode_shouldFailOnUnparseableBytes() {
        assertThatThrownBy(() -> decoder.decode(utf8("{\"info\": "), DocumentFormat.JSON))
                .isInstanceOf(DocumentDecodeException.class);
        assertThatThrownBy(() -> decoder.decode(utf8("info: [unclosed"), DocumentFormat.YAML))
                .isInstanceOf(DocumentDecodeException.class);
        assertThatThrownBy(() -> decoder.decode(utf8("[1, 2]"), DocumentFormat.JSON))
                .isInstanceOf(DocumentDecodeException.class)
                .hasMessageContaining("root");
        assertThatThrownBy(() -> decoder.decode(new byte[0], DocumentFormat.JSON))
                .isInstanceOf(DocumentDecodeException.class);
    }
}
