package com.catalog.service.impl;

import com.catalog.exception.DocumentDecodeException;
import com.catalog.model.DocumentFormat;
import com.catalog.model.SkippedItemWarning;
import com.catalog.model.SkippedItemWarning.Kind;
import com.catalog.model.openapi.MediaTypeNode;
import com.catalog.model.openapi.OperationNode;
import com.catalog.model.openapi.ParameterNode;
import com.catalog.model.openapi.PathItemNode;
import com.catalog.model.openapi.RequestBodyNode;
import com.catalog.model.openapi.ResponseNode;
import com.catalog.model.openapi.SchemaDocument;
import com.catalog.model.openapi.SchemaNode;
import com.catalog.model.openapi.ServerNode;
import com.catalog.service.api.DocumentDecoder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Jackson-based {@link DocumentDecoder}.
 * <p>
 * Decoding happens in three passes over a {@link JsonNode} tree: the required fields are
 * checked, then every path item, operation, parameter, response and component schema is test
 * bound on its own and dropped with a warning if it does not fit, and finally the cleaned tree
 * is bound to {@link SchemaDocument} in one go. The last pass therefore cannot fail on a single
 * malformed entry.
 */
@Service
@Slf4j
public class DocumentDecoderImpl implements DocumentDecoder {

    private static final String[] VERBS = {"get", "put", "post", "delete", "options", "head", "patch", "trace"};

    private final ObjectMapper jsonMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    @Override
    public SchemaDocument decode(byte[] content, DocumentFormat format) {
        if (content == null || content.length == 0) {
            throw new DocumentDecodeException("Document is empty");
        }
        DocumentFormat effective = format != null ? format : DocumentFormat.sniff(content);
        byte[] json = effective == DocumentFormat.YAML ? yamlToJson(content) : content;

        JsonNode root;
        try {
            root = jsonMapper.readTree(json);
        } catch (IOException e) {
            throw new DocumentDecodeException("Could not parse JSON document: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new DocumentDecodeException("Document root must be an object");
        }
        ObjectNode document = (ObjectNode) root;
        requireInfo(document);
        requirePaths(document);

        List<SkippedItemWarning> warnings = new ArrayList<>();
        prunePaths((ObjectNode) document.get("paths"), warnings);
        pruneComponents(document, warnings);
        pruneServers(document);

        SchemaDocument decoded;
        try {
            decoded = jsonMapper.treeToValue(document, SchemaDocument.class);
        } catch (JsonProcessingException e) {
            throw new DocumentDecodeException("Document does not have the shape of an OpenAPI document: " + e.getOriginalMessage(), e);
        }
        enforceReferenceExclusivity(decoded);
        decoded.setDecodeWarnings(warnings);
        warnings.forEach(warning -> log.warn("Skipped while decoding: {}", warning));
        log.info("Decoded {} document '{}' {}: {} paths, {} component schemas",
                effective.token(), decoded.getInfo().getTitle(), decoded.getInfo().getVersion(),
                decoded.getPaths().size(), decoded.componentSchemas().size());
        return decoded;
    }

    private byte[] yamlToJson(byte[] content) {
        try {
            JsonNode tree = yamlMapper.readTree(content);
            if (tree == null || tree.isMissingNode()) {
                throw new DocumentDecodeException("YAML document is empty");
            }
            return jsonMapper.writeValueAsBytes(tree);
        } catch (IOException e) {
            throw new DocumentDecodeException("Could not parse YAML document: " + e.getMessage(), e);
        }
    }

    private void requireInfo(ObjectNode document) {
        JsonNode info = document.get("info");
        if (info == null || !info.isObject()) {
            throw new DocumentDecodeException("Document has no 'info' object");
        }
        requireScalar((ObjectNode) info, "title");
        requireScalar((ObjectNode) info, "version");
    }

    // YAML turns "version: 1.0" into a number; keep its text.
    private void requireScalar(ObjectNode info, String field) {
        JsonNode value = info.get(field);
        if (value == null || !value.isValueNode() || value.isNull() || value.asText().isBlank()) {
            throw new DocumentDecodeException("Document is missing required field 'info." + field + "'");
        }
        if (!value.isTextual()) {
            info.put(field, value.asText());
        }
    }

    private void requirePaths(ObjectNode document) {
        JsonNode paths = document.get("paths");
        if (paths == null || !paths.isObject()) {
            throw new DocumentDecodeException("Document has no 'paths' object");
        }
    }

    private void prunePaths(ObjectNode paths, List<SkippedItemWarning> warnings) {
        Iterator<Map.Entry<String, JsonNode>> entries = paths.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            String location = "paths." + entry.getKey();
            if (!entry.getValue().isObject()) {
                warnings.add(new SkippedItemWarning(Kind.MALFORMED_PATH_ITEM, location, "path item is not an object"));
                entries.remove();
                continue;
            }
            ObjectNode pathItem = (ObjectNode) entry.getValue();
            pruneParameters(pathItem, location, warnings);
            for (String verb : VERBS) {
                pruneOperation(pathItem, verb, location + "." + verb, warnings);
            }
            if (!binds(pathItem, PathItemNode.class)) {
                warnings.add(new SkippedItemWarning(Kind.MALFORMED_PATH_ITEM, location, "path item could not be read"));
                entries.remove();
            }
        }
    }

    private void pruneOperation(ObjectNode pathItem, String verb, String location, List<SkippedItemWarning> warnings) {
        JsonNode operation = pathItem.get(verb);
        if (operation == null) {
            return;
        }
        if (!operation.isObject()) {
            warnings.add(new SkippedItemWarning(Kind.MALFORMED_PATH_ITEM, location, "operation is not an object"));
            pathItem.remove(verb);
            return;
        }
        ObjectNode node = (ObjectNode) operation;
        flattenTags(node);
        pruneParameters(node, location, warnings);
        pruneResponses(node, location, warnings);
        JsonNode requestBody = node.has("requestBody") ? node.get("requestBody") : node.get("request_body");
        if (requestBody != null && !binds(requestBody, RequestBodyNode.class)) {
            warnings.add(new SkippedItemWarning(Kind.MALFORMED_PATH_ITEM, location + ".requestBody", "request body could not be read"));
            node.remove("requestBody");
            node.remove("request_body");
        }
        if (!binds(node, OperationNode.class)) {
            warnings.add(new SkippedItemWarning(Kind.MALFORMED_PATH_ITEM, location, "operation could not be read"));
            pathItem.remove(verb);
        }
    }

    // Tags may be given as objects with a name.
    private void flattenTags(ObjectNode operation) {
        JsonNode tags = operation.get("tags");
        if (tags == null || !tags.isArray()) {
            return;
        }
        ArrayNode names = jsonMapper.createArrayNode();
        for (JsonNode tag : tags) {
            if (tag.isObject() && tag.hasNonNull("name")) {
                names.add(tag.get("name").asText());
            } else if (tag.isValueNode() && !tag.isNull()) {
                names.add(tag.asText());
            }
        }
        operation.set("tags", names);
    }

    private void pruneParameters(ObjectNode owner, String location, List<SkippedItemWarning> warnings) {
        JsonNode parameters = owner.get("parameters");
        if (parameters == null) {
            return;
        }
        if (!parameters.isArray()) {
            warnings.add(new SkippedItemWarning(Kind.MALFORMED_PARAMETER, location + ".parameters", "parameters is not an array"));
            owner.remove("parameters");
            return;
        }
        ArrayNode kept = jsonMapper.createArrayNode();
        for (int i = 0; i < parameters.size(); i++) {
            JsonNode parameter = parameters.get(i);
            if (parameter.isObject() && binds(parameter, ParameterNode.class)) {
                kept.add(parameter);
            } else {
                warnings.add(new SkippedItemWarning(Kind.MALFORMED_PARAMETER,
                        location + ".parameters[" + i + "]", "parameter could not be read"));
            }
        }
        owner.set("parameters", kept);
    }

    private void pruneResponses(ObjectNode operation, String location, List<SkippedItemWarning> warnings) {
        JsonNode responses = operation.get("responses");
        if (responses == null) {
            return;
        }
        if (!responses.isObject()) {
            warnings.add(new SkippedItemWarning(Kind.MALFORMED_RESPONSE, location + ".responses", "responses is not an object"));
            operation.remove("responses");
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> entries = responses.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            if (!entry.getValue().isObject() || !binds(entry.getValue(), ResponseNode.class)) {
                warnings.add(new SkippedItemWarning(Kind.MALFORMED_RESPONSE,
                        location + ".responses." + entry.getKey(), "response could not be read"));
                entries.remove();
            }
        }
    }

    private void pruneComponents(ObjectNode document, List<SkippedItemWarning> warnings) {
        JsonNode components = document.get("components");
        if (components == null) {
            return;
        }
        if (!components.isObject()) {
            warnings.add(new SkippedItemWarning(Kind.MALFORMED_SCHEMA, "components", "components is not an object"));
            document.remove("components");
            return;
        }
        JsonNode schemas = components.get("schemas");
        if (schemas == null) {
            return;
        }
        if (!schemas.isObject()) {
            warnings.add(new SkippedItemWarning(Kind.MALFORMED_SCHEMA, "components.schemas", "schemas is not an object"));
            ((ObjectNode) components).remove("schemas");
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> entries = schemas.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            if (!entry.getValue().isObject() || !binds(entry.getValue(), SchemaNode.class)) {
                warnings.add(new SkippedItemWarning(Kind.MALFORMED_SCHEMA,
                        "components.schemas." + entry.getKey(), "schema could not be read"));
                entries.remove();
            }
        }
        // Other component sections are not modelled; keep them out of binding.
        Iterator<String> names = components.fieldNames();
        while (names.hasNext()) {
            if (!"schemas".equals(names.next())) {
                names.remove();
            }
        }
    }

    private void pruneServers(ObjectNode document) {
        JsonNode servers = document.get("servers");
        if (servers != null && !binds(servers, ServerNode[].class)) {
            log.warn("Ignoring 'servers': entries could not be read");
            document.remove("servers");
        }
    }

    private boolean binds(JsonNode node, Class<?> type) {
        try {
            jsonMapper.treeToValue(node, type);
            return true;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.debug("Entry does not bind to {}: {}", type.getSimpleName(), e.getMessage());
            return false;
        }
    }

    private void enforceReferenceExclusivity(SchemaDocument document) {
        document.componentSchemas().values().forEach(SchemaNode::enforceReferenceExclusivity);
        for (PathItemNode pathItem : document.getPaths().values()) {
            enforceOnParameters(pathItem.getParameters());
            for (OperationNode operation : pathItem.operations().values()) {
                enforceOnParameters(operation.getParameters());
                if (operation.getRequestBody() != null) {
                    enforceOnContent(operation.getRequestBody().getContent());
                }
                if (operation.getResponses() != null) {
                    operation.getResponses().values().forEach(response -> enforceOnContent(response.getContent()));
                }
            }
        }
    }

    private void enforceOnParameters(Collection<ParameterNode> parameters) {
        if (parameters != null) {
            parameters.stream()
                    .filter(parameter -> parameter.getSchema() != null)
                    .forEach(parameter -> parameter.getSchema().enforceReferenceExclusivity());
        }
    }

    private void enforceOnContent(Map<String, MediaTypeNode> content) {
        if (content != null) {
            content.values().stream()
                    .filter(media -> media != null && media.getSchema() != null)
                    .forEach(media -> media.getSchema().enforceReferenceExclusivity());
        }
    }
}
