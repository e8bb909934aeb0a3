package com.catalog.service.impl;

import com.catalog.model.CatalogApiCall;
import com.catalog.model.CatalogApiResponse;
import com.catalog.model.CatalogParameter;
import com.catalog.model.CatalogSchema;
import com.catalog.model.CatalogService;
import com.catalog.model.HttpMethod;
import com.catalog.model.ImportStats;
import com.catalog.model.ParameterLocation;
import com.catalog.model.SchemaLink;
import com.catalog.model.SchemaLinkTarget;
import com.catalog.model.SkippedItemWarning;
import com.catalog.model.SkippedItemWarning.Kind;
import com.catalog.model.openapi.JsonValue;
import com.catalog.model.openapi.MediaTypeNode;
import com.catalog.model.openapi.OperationNode;
import com.catalog.model.openapi.ParameterNode;
import com.catalog.model.openapi.PathItemNode;
import com.catalog.model.openapi.RequestBodyNode;
import com.catalog.model.openapi.ResponseNode;
import com.catalog.model.openapi.SchemaDocument;
import com.catalog.model.openapi.SchemaNode;
import com.catalog.service.api.CatalogRepository;
import com.catalog.service.api.OperationImporter;
import com.catalog.service.api.SchemaNameSynthesizer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Imports the {@code paths} section of a decoded document.
 * <p>
 * Only path and query parameters are kept. Request and response bodies are linked by the
 * name of an existing schema: the {@code $ref} target, the {@code items.$ref} target of an
 * array body (link kind {@code Items}), or else a synthesized name for an inline body.
 */
@Service
@Slf4j
public class OperationImporterImpl implements OperationImporter {

    static final String JSON_CONTENT = "application/json";

    private final CatalogRepository repository;
    private final SchemaNameSynthesizer nameSynthesizer;

    public OperationImporterImpl(CatalogRepository repository, SchemaNameSynthesizer nameSynthesizer) {
        this.repository = repository;
        this.nameSynthesizer = nameSynthesizer;
    }

    @Override
    public List<CatalogApiCall> importPaths(SchemaDocument document, CatalogService service, ImportStats stats) {
        List<CatalogApiCall> created = new ArrayList<>();
        document.getPaths().forEach((path, pathItem) -> {
            if (pathItem == null) {
                skip(stats, Kind.MALFORMED_PATH_ITEM, "paths." + path, "path item is empty");
                return;
            }
            pathItem.operations().forEach((verb, operation) -> {
                String location = "paths." + path + "." + verb.toLowerCase(Locale.ROOT);
                Optional<HttpMethod> method = HttpMethod.fromToken(verb).filter(HttpMethod.IMPORTABLE::contains);
                if (method.isEmpty()) {
                    skip(stats, Kind.UNSUPPORTED_METHOD, location, verb + " operations are not imported");
                    return;
                }
                created.add(importOperation(path, pathItem, method.get(), operation, service, stats, location));
            });
        });
        log.info("Imported {} endpoints for service '{}'", created.size(), service.getName());
        return created;
    }

    private CatalogApiCall importOperation(String path, PathItemNode pathItem, HttpMethod method, OperationNode operation,
                                           CatalogService service, ImportStats stats, String location) {
        // Inline body names are synthesized from this id, so an operation without one gets a
        // generated id and names like GetUsersByIdOrdersRequest rather than a bare "Request".
        String operationId = operation.getOperationId() != null && !operation.getOperationId().isBlank()
                ? operation.getOperationId()
                : generateOperationId(method.name(), path);

        CatalogApiCall call = new CatalogApiCall();
        call.setPath(path);
        call.setMethod(method);
        call.setOperationId(operationId);
        call.setSummary(operation.getSummary());
        call.setDescription(operation.getDescription() != null ? operation.getDescription() : pathItem.getDescription());
        if (operation.getTags() != null) {
            call.setTags(new ArrayList<>(operation.getTags()));
        }
        call.setDeprecated(Boolean.TRUE.equals(operation.getDeprecated()));
        RequestBodyNode requestBody = operation.getRequestBody();
        if (requestBody != null) {
            call.setRequestBodyDescription(requestBody.getDescription());
            call.setRequestBodyRequired(Boolean.TRUE.equals(requestBody.getRequired()));
        }
        call = repository.createApiCall(service.getId(), call);
        stats.incrementEndpoints();
        log.debug("Created {} {} ({})", method, path, operationId);

        importParameters(call, mergeParameters(pathItem.getParameters(), operation.getParameters()), location, stats);
        linkRequestBody(call, service, requestBody, location, stats);
        importResponses(call, service, operation.getResponses(), location, stats);
        return call;
    }

    // Operation-level parameters override path-level ones with the same name and location.
    private List<ParameterNode> mergeParameters(List<ParameterNode> shared, List<ParameterNode> own) {
        Map<String, ParameterNode> merged = new LinkedHashMap<>();
        int anonymous = 0;
        for (List<ParameterNode> list : List.of(
                shared != null ? shared : List.<ParameterNode>of(),
                own != null ? own : List.<ParameterNode>of())) {
            for (ParameterNode parameter : list) {
                String key = parameter.getName() == null || parameter.getLocation() == null
                        ? "#" + anonymous++
                        : parameter.getLocation() + ":" + parameter.getName();
                merged.put(key, parameter);
            }
        }
        return new ArrayList<>(merged.values());
    }

    private void importParameters(CatalogApiCall call, List<ParameterNode> parameters, String location, ImportStats stats) {
        int position = 0;
        for (int i = 0; i < parameters.size(); i++) {
            ParameterNode parameter = parameters.get(i);
            String parameterLocation = location + ".parameters[" + i + "]";
            if (isBlank(parameter.getName()) || isBlank(parameter.getLocation())) {
                skip(stats, Kind.MALFORMED_PARAMETER, parameterLocation, "parameter has no name or no location");
                continue;
            }
            Optional<ParameterLocation> in = ParameterLocation.fromToken(parameter.getLocation());
            if (in.isEmpty()) {
                skip(stats, Kind.MALFORMED_PARAMETER, parameterLocation,
                        "parameter '" + parameter.getName() + "' has unknown location '" + parameter.getLocation() + "'");
                continue;
            }
            if (in.get() == ParameterLocation.HEADER || in.get() == ParameterLocation.COOKIE) {
                skip(stats, Kind.DROPPED_PARAMETER, parameterLocation,
                        in.get().token() + " parameter '" + parameter.getName() + "' is not imported");
                continue;
            }
            SchemaNode schema = parameter.getSchema();
            CatalogParameter row = new CatalogParameter();
            row.setName(parameter.getName());
            row.setLocation(in.get());
            row.setRequired(Boolean.TRUE.equals(parameter.getRequired()));
            row.setDescription(parameter.getDescription());
            row.setType(schema != null && schema.getType() != null ? schema.getType() : "string");
            row.setFormat(schema != null ? schema.getFormat() : null);
            row.setExample(exampleOf(parameter));
            row.setPosition(position++);
            repository.createParameter(call.getId(), row);
            stats.incrementParameters();
        }
    }

    private void linkRequestBody(CatalogApiCall call, CatalogService service, RequestBodyNode requestBody,
                                 String location, ImportStats stats) {
        SchemaNode schema = requestBody == null ? null : jsonSchemaOf(requestBody.getContent());
        if (schema == null) {
            return;
        }
        SchemaLinkTarget target = resolveTarget(schema, () -> nameSynthesizer.synthesize(
                call.getOperationId(), call.getPath(), call.getMethod(), false, null));
        Optional<CatalogSchema> linked = findTarget(service, target, location + ".requestBody", stats);
        if (linked.isPresent() && repository.attachSchemaToCall(linked.get().getId(), call.getId(), target.kind())) {
            stats.incrementLinkedSchemas();
            log.debug("Linked request of {} {} to schema '{}'", call.getMethod(), call.getPath(), target.schemaName());
        }
    }

    private void importResponses(CatalogApiCall call, CatalogService service, Map<String, ResponseNode> responses,
                                 String location, ImportStats stats) {
        if (responses == null) {
            return;
        }
        int position = 0;
        for (Map.Entry<String, ResponseNode> entry : responses.entrySet()) {
            String statusCode = entry.getKey();
            ResponseNode response = entry.getValue();
            String responseLocation = location + ".responses." + statusCode;
            if (response == null) {
                skip(stats, Kind.MALFORMED_RESPONSE, responseLocation, "response is empty");
                continue;
            }
            CatalogApiResponse row = new CatalogApiResponse();
            row.setStatusCode(statusCode);
            row.setDescription(response.getDescription());
            row.setContentType(response.getContent() != null && !response.getContent().isEmpty()
                    ? response.getContent().keySet().iterator().next()
                    : JSON_CONTENT);
            row.setPosition(position++);
            row = repository.createResponse(call.getId(), row);
            stats.incrementResponses();

            SchemaNode schema = jsonSchemaOf(response.getContent());
            if (schema == null) {
                continue;
            }
            SchemaLinkTarget target = resolveTarget(schema, () -> nameSynthesizer.synthesize(
                    call.getOperationId(), call.getPath(), call.getMethod(), true, statusCode));
            Optional<CatalogSchema> linked = findTarget(service, target, responseLocation, stats);
            if (linked.isPresent() && repository.attachSchemaToResponse(linked.get().getId(), row.getId(), target.kind())) {
                stats.incrementLinkedSchemas();
                log.debug("Linked {} response of {} {} to schema '{}'", statusCode, call.getMethod(), call.getPath(), target.schemaName());
            }
        }
    }

    static SchemaLinkTarget resolveTarget(SchemaNode schema, Supplier<String> synthesizedName) {
        if (schema.isReference()) {
            return new SchemaLinkTarget(schema.referencedName(), null, false);
        }
        if (schema.getItems() != null && schema.getItems().isReference()) {
            return new SchemaLinkTarget(schema.getItems().referencedName(), SchemaLink.ITEMS_KIND, false);
        }
        return new SchemaLinkTarget(synthesizedName.get(), null, true);
    }

    /**
     * Looks the target up by exact name. A missing {@code $ref} target is reported; a missing
     * synthesized name is the normal case for inline bodies and only logged.
     */
    private Optional<CatalogSchema> findTarget(CatalogService service, SchemaLinkTarget target, String location, ImportStats stats) {
        Optional<CatalogSchema> schema = repository.findSchemaByName(service.getId(), target.schemaName());
        if (schema.isEmpty()) {
            if (target.synthesized()) {
                log.debug("No schema named '{}' for inline body at {}", target.schemaName(), location);
            } else {
                skip(stats, Kind.UNRESOLVED_SCHEMA_LINK, location, "no schema named '" + target.schemaName() + "'");
            }
        }
        return schema;
    }

    private static SchemaNode jsonSchemaOf(Map<String, MediaTypeNode> content) {
        if (content == null) {
            return null;
        }
        MediaTypeNode media = content.get(JSON_CONTENT);
        return media == null ? null : media.getSchema();
    }

    private static String exampleOf(ParameterNode parameter) {
        JsonValue example = parameter.getExample();
        if (example == null && parameter.getSchema() != null) {
            example = parameter.getSchema().getExample();
        }
        return example == null ? null : example.toCanonicalString();
    }

    private void skip(ImportStats stats, Kind kind, String location, String message) {
        SkippedItemWarning warning = new SkippedItemWarning(kind, location, message);
        log.warn("Skipped: {}", warning);
        stats.skip(warning);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    static String generateOperationId(String httpMethod, String path) {
        String sanitizedPath = path
                .replaceAll("\\{", "by_")
                .replaceAll("[{}/]", "_")
                .replaceAll("__", "_")
                .replaceAll("^_|_$", "");
        return httpMethod.toLowerCase(Locale.ROOT) + "_" + sanitizedPath;
    }
}
