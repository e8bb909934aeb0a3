package com.catalog.service.impl;

import static com.catalog.TestDocuments.bytes;
import static com.catalog.TestDocuments.path;
import static com.catalog.TestDocuments.utf8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.catalog.exception.DocumentDecodeException;
import com.catalog.model.CatalogApiCall;
import com.catalog.model.CatalogApiResponse;
import com.catalog.model.CatalogSchema;
import com.catalog.model.CatalogService;
import com.catalog.model.DocumentFormat;
import com.catalog.model.EnvironmentType;
import com.catalog.model.HttpMethod;
import com.catalog.model.ImportStats;
import com.catalog.model.ParameterLocation;
import com.catalog.model.SkippedItemWarning;
import com.catalog.model.openapi.ServerNode;
import com.catalog.service.api.OperationImporter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

class OpenApiImportServiceImplTest {

    private InMemoryCatalogRepository repository;
    private OpenApiImportServiceImpl importService;

    @BeforeEach
    void setUp() {
        repository = new InMemoryCatalogRepository("unused.json", false);
        importService = newService(new OperationImporterImpl(repository, new SchemaNameSynthesizerImpl()));
    }

    private OpenApiImportServiceImpl newService(OperationImporter operationImporter) {
        return new OpenApiImportServiceImpl(new DocumentDecoderImpl(), new SchemaGraphExtractorImpl(),
                new RelationalProjectorImpl(), operationImporter, repository,
                new DocumentSourceLoaderImpl(WebClient.create()));
    }

    @Test
    void importDocument_shouldImportUsersScenario() {
        ImportStats stats = importService.importDocument(bytes("users.json"), DocumentFormat.JSON);

        CatalogService service = repository.resolveService("Users", "1.0.0");
        assertThat(stats.getServiceId()).isEqualTo(service.getId());

        assertThat(repository.schemasOf(service.getId())).singleElement().satisfies(schema -> {
            assertThat(schema.getName()).isEqualTo("User");
            assertThat(repository.attributesOf(schema.getId())).singleElement().satisfies(attribute -> {
                assertThat(attribute.getName()).isEqualTo("id");
                assertThat(attribute.getType()).isEqualTo("string");
                assertThat(attribute.isRequired()).isTrue();
            });
        });

        assertThat(repository.apiCallsOf(service.getId())).singleElement().satisfies(call -> {
            assertThat(call.getMethod()).isEqualTo(HttpMethod.GET);
            assertThat(call.getPath()).isEqualTo("/users/{id}");
            assertThat(call.getOperationId()).isEqualTo("getUser");
        });
        CatalogApiCall call = repository.apiCallsOf(service.getId()).get(0);
        assertThat(repository.parametersOf(call.getId())).singleElement().satisfies(parameter -> {
            assertThat(parameter.getName()).isEqualTo("id");
            assertThat(parameter.getLocation()).isEqualTo(ParameterLocation.PATH);
            assertThat(parameter.isRequired()).isTrue();
        });
        CatalogApiResponse response = repository.responsesOf(call.getId()).get(0);
        assertThat(response.getStatusCode()).isEqualTo("200");
        CatalogSchema user = repository.findSchemaByName(service.getId(), "User").orElseThrow();
        assertThat(repository.responseLinksOf(response.getId())).singleElement()
                .satisfies(link -> assertThat(link.getSchemaId()).isEqualTo(user.getId()));

        assertThat(stats.getImportedSchemas()).isEqualTo(1);
        assertThat(stats.getImportedAttributes()).isEqualTo(1);
        assertThat(stats.getImportedEndpoints()).isEqualTo(1);
        assertThat(stats.getImportedParameters()).isEqualTo(1);
        assertThat(stats.getImportedResponses()).isEqualTo(1);
        assertThat(stats.getLinkedSchemas()).isEqualTo(1);
        assertThat(stats.getSkippedItems()).isZero();
    }

    @Test
    void importDocument_shouldRecordServiceDetailsAndEnvironments() {
        importService.importDocument(bytes("users.yaml"), DocumentFormat.YAML);

        CatalogService service = repository.resolveService("Users", null);
        assertThat(service.getDescription()).isEqualTo("User directory");
        assertThat(service.getOwner()).isEqualTo("Identity Team");
        assertThat(service.getContactEmail()).isEqualTo("identity@example.com");
        assertThat(service.getEnvironments()).hasSize(2);
        assertThat(service.getEnvironments().get(0).getType()).isEqualTo(EnvironmentType.STAGE);
        assertThat(service.getEnvironments().get(0).getName()).isEqualTo("staging");
        assertThat(service.getEnvironments().get(0).getHost()).isEqualTo("users.stage.example.com");
        assertThat(service.getEnvironments().get(1).getType()).isEqualTo(EnvironmentType.DEVELOPMENT);
        assertThat(service.getEnvironments().get(1).getName()).isEqualTo("development");
    }

    @Test
    void importDocument_shouldCountEverythingInPetstore() {
        ImportStats stats = importService.importDocument(bytes("petstore.json"), null);

        assertThat(stats.getImportedSchemas()).isEqualTo(7);
        assertThat(stats.getImportedAttributes()).isEqualTo(13);
        assertThat(stats.getImportedEndpoints()).isEqualTo(4);
        assertThat(stats.getImportedParameters()).isEqualTo(3);
        assertThat(stats.getImportedResponses()).isEqualTo(6);
        assertThat(stats.getLinkedSchemas()).isEqualTo(6);
        assertThat(stats.getWarnings()).singleElement()
                .satisfies(warning -> assertThat(warning.kind()).isEqualTo(SkippedItemWarning.Kind.DROPPED_PARAMETER));
    }

    @Test
    void importDocument_shouldReplaceServiceWithSameNameAndVersion() {
        importService.importDocument(bytes("petstore.json"), DocumentFormat.JSON);
        ImportStats second = importService.importDocument(bytes("petstore.json"), DocumentFormat.JSON);

        assertThat(repository.listServices()).singleElement()
                .satisfies(service -> assertThat(service.getId()).isEqualTo(second.getServiceId()));
        assertThat(repository.schemasOf(second.getServiceId())).hasSize(7);
        assertThat(second.getLinkedSchemas()).isEqualTo(6);
    }

    @Test
    void importDocument_shouldKeepOtherVersionsSideBySide() {
        importService.importDocument(bytes("users.json"), DocumentFormat.JSON);
        String v2 = new String(bytes("users.json")).replace("\"1.0.0\"", "\"2.0.0\"");

        importService.importDocument(utf8(v2), DocumentFormat.JSON);

        assertThat(repository.findServicesByName("Users")).extracting(CatalogService::getVersion)
                .containsExactly("1.0.0", "2.0.0");
    }

    @Test
    void importDocument_shouldCarryDecodeWarningsIntoStats() {
        ImportStats stats = importService.importDocument(bytes("malformed.json"), DocumentFormat.JSON);

        assertThat(stats.getImportedEndpoints()).isEqualTo(1);
        assertThat(stats.getSkippedItems()).isEqualTo(8);
        assertThat(stats.getWarnings()).extracting(SkippedItemWarning::kind).contains(
                SkippedItemWarning.Kind.MALFORMED_PATH_ITEM,
                SkippedItemWarning.Kind.MALFORMED_RESPONSE,
                SkippedItemWarning.Kind.UNSUPPORTED_METHOD);
    }

    @Test
    void importDocument_shouldFlattenCompositionsAndLinkInlineBodies() {
        ImportStats stats = importService.importDocument(bytes("composition.yaml"), DocumentFormat.YAML);

        CatalogService service = repository.resolveService("Orders", "3");
        CatalogSchema order = repository.findSchemaByName(service.getId(), "Order").orElseThrow();
        assertThat(repository.attributesOf(order.getId())).hasSize(4);
        assertThat(stats.getLinkedSchemas()).isEqualTo(2);
        assertThat(stats.getSkippedItems()).isZero();
    }

    @Test
    void importDocument_shouldLeaveCatalogUntouchedOnDecodeFailure() {
        assertThatThrownBy(() -> importService.importDocument(utf8("{\"paths\":{}}"), DocumentFormat.JSON))
                .isInstanceOf(DocumentDecodeException.class);

        assertThat(repository.listServices()).isEmpty();
    }

    @Test
    void importDocument_shouldRollBackWhenImportFailsHalfway() {
        importService.importDocument(bytes("users.json"), DocumentFormat.JSON);
        CatalogService original = repository.resolveService("Users", "1.0.0");
        OperationImporter failing = mock(OperationImporter.class);
        when(failing.importPaths(any(), any(), any())).thenThrow(new IllegalStateException("storage offline"));

        assertThatThrownBy(() -> newService(failing).importDocument(bytes("users.json"), DocumentFormat.JSON))
                .isInstanceOf(IllegalStateException.class);

        assertThat(repository.listServices()).singleElement()
                .satisfies(service -> assertThat(service.getId()).isEqualTo(original.getId()));
        assertThat(repository.schemasOf(original.getId())).hasSize(1);
    }

    @Test
    void importFromSource_shouldUseFileExtensionAsFormat() {
        ImportStats stats = importService.importFromSource(path("users.yaml"), null);

        assertThat(stats.getServiceName()).isEqualTo("Users");
        assertThat(stats.getImportedEndpoints()).isEqualTo(1);
    }

    @Test
    void toEnvironment_shouldFallBackToUnknownHost() {
        ServerNode server = new ServerNode();
        server.setUrl("/relative/base");

        assertThat(OpenApiImportServiceImpl.toEnvironment(server).getHost()).isEqualTo("unknown");
    }
}
