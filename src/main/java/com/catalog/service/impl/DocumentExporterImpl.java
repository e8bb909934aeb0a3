package com.catalog.service.impl;

import com.catalog.exception.CatalogException;
import com.catalog.exception.CatalogNotFoundException;
import com.catalog.model.CatalogApiCall;
import com.catalog.model.CatalogApiResponse;
import com.catalog.model.CatalogAttribute;
import com.catalog.model.CatalogParameter;
import com.catalog.model.CatalogSchema;
import com.catalog.model.CatalogService;
import com.catalog.model.DocumentFormat;
import com.catalog.model.ParameterLocation;
import com.catalog.model.SchemaLink;
import com.catalog.model.SchemaShape;
import com.catalog.model.ServiceEnvironment;
import com.catalog.model.openapi.JsonValue;
import com.catalog.model.openapi.SchemaNode;
import com.catalog.service.api.CatalogRepository;
import com.catalog.service.api.DocumentExporter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import io.swagger.v3.core.util.Json;
import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.Operation;
import io.swagger.v3.oas.models.PathItem;
import io.swagger.v3.oas.models.Paths;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.parameters.Parameter;
import io.swagger.v3.oas.models.parameters.RequestBody;
import io.swagger.v3.oas.models.responses.ApiResponse;
import io.swagger.v3.oas.models.responses.ApiResponses;
import io.swagger.v3.oas.models.servers.Server;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Rebuilds OpenAPI documents from catalog rows, inverting the import projection.
 * <p>
 * The document is assembled as a swagger-core {@link OpenAPI} model, turned into a plain
 * dictionary by swagger's own mapper, sorted, and only then written as JSON or YAML, so the
 * two formats always carry the same content. Parameters and responses of an operation are
 * built on the export pool; all repository reads happen on the calling thread.
 */
@Service
@Slf4j
public class DocumentExporterImpl implements DocumentExporter {

    static final String OPENAPI_VERSION = "3.0.3";
    static final String DEFAULT_RESPONSE_DESCRIPTION = "Response";

    private static final Set<String> PRIMITIVE_TYPES = Set.of("string", "integer", "number", "boolean", "object", "array");

    private final CatalogRepository repository;
    private final ExecutorService exportExecutor;
    private final ObjectMapper jsonMapper = new ObjectMapper();
    private final ObjectMapper yamlMapper = new ObjectMapper(YAMLFactory.builder()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .build());

    public DocumentExporterImpl(CatalogRepository repository, @Qualifier("exportExecutor") ExecutorService exportExecutor) {
        this.repository = repository;
        this.exportExecutor = exportExecutor;
    }

    @Override
    public byte[] export(UUID serviceId, DocumentFormat format) {
        OpenAPI model = buildModel(serviceId);
        Map<String, Object> dictionary = Json.mapper().convertValue(model, new TypeReference<Map<String, Object>>() {});
        Object sorted = sortKeys(dropReferenceSiblings(dictionary));
        try {
            byte[] bytes = format == DocumentFormat.YAML
                    ? yamlMapper.writeValueAsBytes(sorted)
                    : jsonMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(sorted);
            log.info("Exported service '{}' {} as {} ({} bytes)",
                    model.getInfo().getTitle(), model.getInfo().getVersion(), format.token(), bytes.length);
            return bytes;
        } catch (JsonProcessingException e) {
            throw new CatalogException("Could not write " + format.token() + " document: " + e.getMessage(), e);
        }
    }

    @Override
    public OpenAPI buildModel(UUID serviceId) {
        CatalogService service = repository.findService(serviceId)
                .orElseThrow(() -> new CatalogNotFoundException("No service with id " + serviceId));
        OpenAPI openApi = new OpenAPI();
        openApi.setOpenapi(OPENAPI_VERSION);
        openApi.setInfo(info(service));
        if (!service.getEnvironments().isEmpty()) {
            openApi.setServers(service.getEnvironments().stream().map(this::server).collect(Collectors.toList()));
        }

        Map<UUID, CatalogSchema> schemasById = new LinkedHashMap<>();
        repository.schemasOf(serviceId).forEach(schema -> schemasById.put(schema.getId(), schema));
        Set<String> schemaNames = schemasById.values().stream().map(CatalogSchema::getName).collect(Collectors.toSet());

        Paths paths = new Paths();
        for (CatalogApiCall call : repository.apiCallsOf(serviceId)) {
            PathItem pathItem = paths.computeIfAbsent(call.getPath(), path -> new PathItem());
            pathItem.operation(PathItem.HttpMethod.valueOf(call.getMethod().name()), operation(call, schemasById));
        }
        openApi.setPaths(paths);

        Map<String, Schema> componentSchemas = new LinkedHashMap<>();
        for (CatalogSchema schema : schemasById.values()) {
            componentSchemas.put(schema.getName(), schemaModel(schema, repository.attributesOf(schema.getId()), schemaNames));
        }
        Components components = new Components();
        components.setSchemas(componentSchemas);
        openApi.setComponents(components);
        return openApi;
    }

    private Info info(CatalogService service) {
        Info info = new Info().title(service.getName()).version(service.getVersion()).description(service.getDescription());
        if (service.getOwner() != null || service.getContactEmail() != null) {
            info.setContact(new Contact().name(service.getOwner()).email(service.getContactEmail()));
        }
        return info;
    }

    private Server server(ServiceEnvironment environment) {
        return new Server().url(environment.getBaseUrl()).description(environment.getDescription());
    }

    private Operation operation(CatalogApiCall call, Map<UUID, CatalogSchema> schemasById) {
        Operation operation = new Operation()
                .operationId(call.getOperationId())
                .summary(call.getSummary())
                .description(call.getDescription());
        if (!call.getTags().isEmpty()) {
            operation.setTags(new ArrayList<>(call.getTags()));
        }
        if (call.isDeprecated()) {
            operation.setDeprecated(true);
        }

        List<Parameter> parameters = fanOut(repository.parametersOf(call.getId()), this::parameter);
        if (!parameters.isEmpty()) {
            operation.setParameters(parameters);
        }

        List<SchemaLink> requestLinks = repository.callLinksOf(call.getId());
        if (!requestLinks.isEmpty() && schemasById.containsKey(requestLinks.get(0).getSchemaId())) {
            SchemaLink link = requestLinks.get(0);
            RequestBody requestBody = new RequestBody()
                    .description(call.getRequestBodyDescription())
                    .content(new Content().addMediaType(OperationImporterImpl.JSON_CONTENT,
                            new MediaType().schema(bodySchema(schemasById.get(link.getSchemaId()).getName(), link))));
            if (call.isRequestBodyRequired()) {
                requestBody.setRequired(true);
            }
            operation.setRequestBody(requestBody);
        }

        List<CatalogApiResponse> responses = repository.responsesOf(call.getId());
        Map<UUID, List<SchemaLink>> responseLinks = new HashMap<>();
        responses.forEach(response -> responseLinks.put(response.getId(), repository.responseLinksOf(response.getId())));
        List<ApiResponse> built = fanOut(responses, response -> response(response, responseLinks.get(response.getId()), schemasById));
        ApiResponses apiResponses = new ApiResponses();
        for (int i = 0; i < responses.size(); i++) {
            apiResponses.addApiResponse(responses.get(i).getStatusCode(), built.get(i));
        }
        operation.setResponses(apiResponses);
        return operation;
    }

    private Parameter parameter(CatalogParameter parameter) {
        Schema<Object> schema = new Schema<>();
        schema.setType(parameter.getType() != null ? parameter.getType() : "string");
        schema.setFormat(parameter.getFormat());
        Parameter exported = new Parameter()
                .name(parameter.getName())
                .in(parameter.getLocation().token())
                .description(parameter.getDescription())
                .schema(schema);
        // OpenAPI requires path parameters to be marked required.
        if (parameter.isRequired() || parameter.getLocation() == ParameterLocation.PATH) {
            exported.setRequired(true);
        }
        Object example = typedValue(parameter.getExample(), schema.getType());
        if (example != null) {
            exported.setExample(example);
        }
        return exported;
    }

    private ApiResponse response(CatalogApiResponse response, List<SchemaLink> links, Map<UUID, CatalogSchema> schemasById) {
        ApiResponse exported = new ApiResponse().description(
                response.getDescription() != null ? response.getDescription() : DEFAULT_RESPONSE_DESCRIPTION);
        if (links != null && !links.isEmpty() && schemasById.containsKey(links.get(0).getSchemaId())) {
            SchemaLink link = links.get(0);
            String contentType = response.getContentType() != null ? response.getContentType() : OperationImporterImpl.JSON_CONTENT;
            exported.setContent(new Content().addMediaType(contentType,
                    new MediaType().schema(bodySchema(schemasById.get(link.getSchemaId()).getName(), link))));
        }
        return exported;
    }

    private Schema<?> bodySchema(String schemaName, SchemaLink link) {
        if (link.isItems()) {
            Schema<Object> array = new Schema<>();
            array.setType("array");
            array.setItems(reference(schemaName));
            return array;
        }
        return reference(schemaName);
    }

    /**
     * @param schemaNames Names of every schema of the service; only these become {@code $ref} targets.
     */
    Schema<?> schemaModel(CatalogSchema schema, List<CatalogAttribute> attributes, Set<String> schemaNames) {
        SchemaShape shape = schema.getShape() != null ? schema.getShape() : SchemaShape.OBJECT;
        if (shape == SchemaShape.REFERENCE || schema.isReference()) {
            return reference(schema.getReferencedModelName());
        }
        CatalogAttribute first = attributes.isEmpty() ? null : attributes.get(0);
        Schema<?> exported;
        switch (shape) {
            case ENUMERATION:
                exported = enumRootSchema(first);
                break;
            case VALUE:
                exported = first != null ? attributeSchema(first, schemaNames) : new Schema<>().type(schema.getType());
                if (exported.get$ref() != null) {
                    return exported;
                }
                break;
            default:
                exported = objectSchema(schema, attributes, schemaNames);
                break;
        }
        if (schema.getTitle() != null) {
            exported.setTitle(schema.getTitle());
        }
        if (schema.getDescription() != null) {
            exported.setDescription(schema.getDescription());
        }
        return exported;
    }

    private Schema<?> objectSchema(CatalogSchema schema, List<CatalogAttribute> attributes, Set<String> schemaNames) {
        Schema<Object> exported = new Schema<>();
        exported.setType(schema.getType() != null ? schema.getType() : "object");
        if (!attributes.isEmpty()) {
            Map<String, Schema> properties = new LinkedHashMap<>();
            List<String> required = new ArrayList<>();
            for (CatalogAttribute attribute : attributes) {
                properties.put(attribute.getName(), attributeSchema(attribute, schemaNames));
                if (attribute.isRequired()) {
                    required.add(attribute.getName());
                }
            }
            exported.setProperties(properties);
            if (!required.isEmpty()) {
                exported.setRequired(required);
            }
        }
        return exported;
    }

    private Schema<?> enumRootSchema(CatalogAttribute attribute) {
        Schema<Object> exported = new Schema<>();
        if (attribute == null) {
            return exported;
        }
        exported.setType(attribute.getElementType());
        if (!attribute.getEnumValues().isEmpty()) {
            exported.setEnum(typedValues(attribute.getEnumValues(), attribute.getElementType()));
        }
        if (!"unknown".equals(attribute.getName())) {
            exported.setTitle(attribute.getName());
        }
        String sentinel = String.join(RelationalProjectorImpl.ENUM_DEFAULT_SEPARATOR, attribute.getEnumValues());
        if (attribute.getDefaultValue() != null && !attribute.getDefaultValue().equals(sentinel)) {
            exported.setDefault(typedValue(attribute.getDefaultValue(), attribute.getElementType()));
        }
        return exported;
    }

    /**
     * Inverts the attribute projection. A type tag naming one of {@code schemaNames} becomes a
     * bare {@code $ref}; any other tag is written as the {@code type}.
     */
    Schema<?> attributeSchema(CatalogAttribute attribute, Set<String> schemaNames) {
        String type = attribute.getType();
        if (type != null && !PRIMITIVE_TYPES.contains(type) && schemaNames.contains(type)) {
            return reference(type);
        }
        Schema<Object> exported = new Schema<>();
        String valueType = type;
        if ("array".equals(type)) {
            exported.setType("array");
            exported.setItems(typeOrReference(attribute.getElementType(), schemaNames));
        } else if ("enum".equals(type)) {
            valueType = attribute.getElementType();
            exported.setType(valueType);
        } else {
            exported.setType(type);
        }
        exported.setFormat(attribute.getFormat());
        exported.setDescription(attribute.getDescription());
        if (attribute.isNullable()) {
            exported.setNullable(true);
        }
        if (!attribute.getEnumValues().isEmpty()) {
            exported.setEnum(typedValues(attribute.getEnumValues(), valueType));
        }
        Object defaultValue = typedValue(attribute.getDefaultValue(), valueType);
        if (defaultValue != null) {
            exported.setDefault(defaultValue);
        }
        Object example = typedValue(attribute.getExample(), valueType);
        if (example != null) {
            exported.setExample(example);
        }
        return exported;
    }

    private Schema<?> typeOrReference(String elementType, Set<String> schemaNames) {
        if (elementType == null) {
            return new Schema<>();
        }
        if (!PRIMITIVE_TYPES.contains(elementType) && schemaNames.contains(elementType)) {
            return reference(elementType);
        }
        return new Schema<>().type(elementType);
    }

    private static Schema<?> reference(String schemaName) {
        Schema<Object> reference = new Schema<>();
        reference.set$ref(SchemaNode.COMPONENTS_PREFIX + schemaName);
        return reference;
    }

    /**
     * Turns a stored canonical string back into a value of the declared type. String-typed
     * values are kept verbatim; numeric and boolean types only accept a literal of their kind.
     */
    static Object typedValue(String canonical, String declaredType) {
        if (canonical == null) {
            return null;
        }
        JsonValue value = JsonValue.fromCanonicalString(canonical);
        Object guessed = value.toPlainObject();
        if (declaredType == null) {
            return guessed;
        }
        switch (declaredType) {
            case "string":
                return canonical;
            case "integer":
            case "number":
                return guessed instanceof Number ? guessed : canonical;
            case "boolean":
                return guessed instanceof Boolean ? guessed : canonical;
            default:
                return guessed;
        }
    }

    private static List<Object> typedValues(List<String> members, String declaredType) {
        return members.stream().map(member -> typedValue(member, declaredType)).collect(Collectors.toList());
    }

    private <T, R> List<R> fanOut(List<T> items, Function<T, R> task) {
        List<CompletableFuture<R>> futures = items.stream()
                .map(item -> CompletableFuture.supplyAsync(() -> task.apply(item), exportExecutor))
                .collect(Collectors.toList());
        try {
            return futures.stream().map(CompletableFuture::join).collect(Collectors.toList());
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof CatalogException) {
                throw (CatalogException) cause;
            }
            throw new CatalogException("Export failed: " + cause.getMessage(), cause);
        }
    }

    /**
     * Removes every sibling of a {@code $ref} key, at any depth.
     */
    static Object dropReferenceSiblings(Object node) {
        if (node instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) node;
            if (map.containsKey("$ref")) {
                Map<String, Object> only = new LinkedHashMap<>();
                only.put("$ref", map.get("$ref"));
                return only;
            }
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((key, value) -> copy.put(String.valueOf(key), dropReferenceSiblings(value)));
            return copy;
        }
        if (node instanceof List) {
            return ((List<?>) node).stream().map(DocumentExporterImpl::dropReferenceSiblings).collect(Collectors.toList());
        }
        return node;
    }

    static Object sortKeys(Object node) {
        if (node instanceof Map) {
            Map<String, Object> sorted = new TreeMap<>();
            ((Map<?, ?>) node).forEach((key, value) -> sorted.put(String.valueOf(key), sortKeys(value)));
            return sorted;
        }
        if (node instanceof List) {
            return ((List<?>) node).stream().map(DocumentExporterImpl::sortKeys).collect(Collectors.toList());
        }
        return node;
    }
}
