package com.catalog.service.impl;

import com.catalog.exception.CatalogException;
import com.catalog.exception.CatalogNotFoundException;
import com.catalog.model.CatalogApiCall;
import com.catalog.model.CatalogApiResponse;
import com.catalog.model.CatalogAttribute;
import com.catalog.model.CatalogParameter;
import com.catalog.model.CatalogSchema;
import com.catalog.model.CatalogService;
import com.catalog.model.CatalogSnapshot;
import com.catalog.model.SchemaLink;
import com.catalog.service.api.CatalogRepository;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * A {@link CatalogRepository} that keeps all rows in insertion-ordered maps and optionally
 * mirrors them to a JSON snapshot file.
 * <p>
 * Every method synchronizes on the repository, so a unit of work started with
 * {@link #inTransaction(Supplier)} runs alone. The unit takes a deep copy of the state first
 * and puts it back if the work throws. The snapshot file is rewritten after each committed
 * unit and after each change made outside one.
 */
@Service
@Slf4j
public class InMemoryCatalogRepository implements CatalogRepository {

    private final File storageFile;
    private final boolean persistent;
    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private Map<UUID, CatalogService> services = new LinkedHashMap<>();
    private Map<UUID, CatalogSchema> schemas = new LinkedHashMap<>();
    private Map<UUID, CatalogAttribute> attributes = new LinkedHashMap<>();
    private Map<UUID, CatalogApiCall> apiCalls = new LinkedHashMap<>();
    private Map<UUID, CatalogParameter> parameters = new LinkedHashMap<>();
    private Map<UUID, CatalogApiResponse> responses = new LinkedHashMap<>();
    private Map<UUID, SchemaLink> callLinks = new LinkedHashMap<>();
    private Map<UUID, SchemaLink> responseLinks = new LinkedHashMap<>();

    private int transactionDepth;

    /**
     * @param storageFile Location of the JSON snapshot.
     * @param persistent  Whether the snapshot is read at startup and written after changes.
     */
    public InMemoryCatalogRepository(
            @Value("${catalog.storage.file:${user.home}/.api-catalog/catalog.json}") String storageFile,
            @Value("${catalog.storage.persistent:true}") boolean persistent) {
        this.storageFile = new File(storageFile);
        this.persistent = persistent;
    }

    /**
     * Loads the snapshot file, if there is one, once the bean is constructed.
     */
    @PostConstruct
    public void init() {
        if (persistent) {
            load();
        }
    }

    @Override
    public synchronized <T> T inTransaction(Supplier<T> work) {
        if (transactionDepth > 0) {
            return work.get();
        }
        CatalogSnapshot before = copyOf(snapshot());
        transactionDepth++;
        try {
            T result = work.get();
            // A unit of work only stays in memory once it is on disk.
            save();
            return result;
        } catch (RuntimeException e) {
            restore(before);
            log.warn("Unit of work failed, catalog rolled back: {}", e.getMessage());
            throw e;
        } finally {
            transactionDepth--;
        }
    }

    @Override
    public synchronized CatalogService createService(CatalogService service) {
        service.setId(UUID.randomUUID());
        Instant now = Instant.now();
        service.setCreatedAt(now);
        service.setUpdatedAt(now);
        services.put(service.getId(), service);
        changed();
        return service;
    }

    @Override
    public synchronized Optional<CatalogService> findService(UUID serviceId) {
        return Optional.ofNullable(services.get(serviceId));
    }

    @Override
    public synchronized Optional<CatalogService> findServiceByNameAndVersion(String name, String version) {
        return services.values().stream()
                .filter(service -> service.getName().equals(name) && Objects.equals(service.getVersion(), version))
                .findFirst();
    }

    @Override
    public synchronized List<CatalogService> findServicesByName(String name) {
        return select(services, service -> service.getName().equals(name));
    }

    @Override
    public synchronized List<CatalogService> listServices() {
        return List.copyOf(services.values());
    }

    @Override
    public synchronized void deleteService(UUID serviceId) {
        if (services.remove(serviceId) == null) {
            throw new CatalogNotFoundException("No service with id " + serviceId);
        }
        Set<UUID> schemaIds = ids(schemas, schema -> schema.getServiceId().equals(serviceId), CatalogSchema::getId);
        Set<UUID> callIds = ids(apiCalls, call -> call.getServiceId().equals(serviceId), CatalogApiCall::getId);
        Set<UUID> responseIds = ids(responses, response -> callIds.contains(response.getApiCallId()), CatalogApiResponse::getId);

        schemas.keySet().removeAll(schemaIds);
        attributes.values().removeIf(attribute -> schemaIds.contains(attribute.getSchemaId()));
        apiCalls.keySet().removeAll(callIds);
        parameters.values().removeIf(parameter -> callIds.contains(parameter.getApiCallId()));
        responses.keySet().removeAll(responseIds);
        callLinks.values().removeIf(link -> callIds.contains(link.getOwnerId()) || schemaIds.contains(link.getSchemaId()));
        responseLinks.values().removeIf(link -> responseIds.contains(link.getOwnerId()) || schemaIds.contains(link.getSchemaId()));
        log.info("Deleted service {} with {} schemas and {} API calls", serviceId, schemaIds.size(), callIds.size());
        changed();
    }

    @Override
    public synchronized CatalogSchema createSchema(UUID serviceId, CatalogSchema schema) {
        requireService(serviceId);
        if (findSchemaByName(serviceId, schema.getName()).isPresent()) {
            throw new CatalogException("Service " + serviceId + " already has a schema named '" + schema.getName() + "'");
        }
        schema.setId(UUID.randomUUID());
        schema.setServiceId(serviceId);
        schema.setCreatedAt(Instant.now());
        schemas.put(schema.getId(), schema);
        changed();
        return schema;
    }

    @Override
    public synchronized Optional<CatalogSchema> findSchema(UUID schemaId) {
        return Optional.ofNullable(schemas.get(schemaId));
    }

    @Override
    public synchronized Optional<CatalogSchema> findSchemaByName(UUID serviceId, String name) {
        return schemas.values().stream()
                .filter(schema -> schema.getServiceId().equals(serviceId) && schema.getName().equals(name))
                .findFirst();
    }

    @Override
    public synchronized List<CatalogSchema> schemasOf(UUID serviceId) {
        return select(schemas, schema -> schema.getServiceId().equals(serviceId));
    }

    @Override
    public synchronized CatalogAttribute createAttribute(UUID schemaId, CatalogAttribute attribute) {
        if (!schemas.containsKey(schemaId)) {
            throw new CatalogNotFoundException("No schema with id " + schemaId);
        }
        attribute.setId(UUID.randomUUID());
        attribute.setSchemaId(schemaId);
        attributes.put(attribute.getId(), attribute);
        changed();
        return attribute;
    }

    @Override
    public synchronized List<CatalogAttribute> attributesOf(UUID schemaId) {
        return attributes.values().stream()
                .filter(attribute -> attribute.getSchemaId().equals(schemaId))
                .sorted(Comparator.comparingInt(CatalogAttribute::getPosition))
                .collect(Collectors.toList());
    }

    @Override
    public synchronized CatalogApiCall createApiCall(UUID serviceId, CatalogApiCall apiCall) {
        requireService(serviceId);
        boolean duplicate = apiCalls.values().stream()
                .anyMatch(call -> call.getServiceId().equals(serviceId)
                        && call.getPath().equals(apiCall.getPath())
                        && call.getMethod() == apiCall.getMethod());
        if (duplicate) {
            throw new CatalogException("Service " + serviceId + " already has " + apiCall.getMethod() + " " + apiCall.getPath());
        }
        apiCall.setId(UUID.randomUUID());
        apiCall.setServiceId(serviceId);
        apiCall.setCreatedAt(Instant.now());
        apiCalls.put(apiCall.getId(), apiCall);
        changed();
        return apiCall;
    }

    @Override
    public synchronized List<CatalogApiCall> apiCallsOf(UUID serviceId) {
        return select(apiCalls, call -> call.getServiceId().equals(serviceId));
    }

    @Override
    public synchronized CatalogParameter createParameter(UUID apiCallId, CatalogParameter parameter) {
        requireApiCall(apiCallId);
        parameter.setId(UUID.randomUUID());
        parameter.setApiCallId(apiCallId);
        parameters.put(parameter.getId(), parameter);
        changed();
        return parameter;
    }

    @Override
    public synchronized List<CatalogParameter> parametersOf(UUID apiCallId) {
        return parameters.values().stream()
                .filter(parameter -> parameter.getApiCallId().equals(apiCallId))
                .sorted(Comparator.comparingInt(CatalogParameter::getPosition))
                .collect(Collectors.toList());
    }

    @Override
    public synchronized CatalogApiResponse createResponse(UUID apiCallId, CatalogApiResponse response) {
        requireApiCall(apiCallId);
        response.setId(UUID.randomUUID());
        response.setApiCallId(apiCallId);
        responses.put(response.getId(), response);
        changed();
        return response;
    }

    @Override
    public synchronized List<CatalogApiResponse> responsesOf(UUID apiCallId) {
        return responses.values().stream()
                .filter(response -> response.getApiCallId().equals(apiCallId))
                .sorted(Comparator.comparingInt(CatalogApiResponse::getPosition))
                .collect(Collectors.toList());
    }

    @Override
    public synchronized boolean attachSchemaToCall(UUID schemaId, UUID apiCallId, String kind) {
        requireSchema(schemaId);
        requireApiCall(apiCallId);
        return attach(callLinks, schemaId, apiCallId, kind);
    }

    @Override
    public synchronized boolean attachSchemaToResponse(UUID schemaId, UUID responseId, String kind) {
        requireSchema(schemaId);
        if (!responses.containsKey(responseId)) {
            throw new CatalogNotFoundException("No API response with id " + responseId);
        }
        return attach(responseLinks, schemaId, responseId, kind);
    }

    @Override
    public synchronized List<SchemaLink> callLinksOf(UUID apiCallId) {
        return select(callLinks, link -> link.getOwnerId().equals(apiCallId));
    }

    @Override
    public synchronized List<SchemaLink> responseLinksOf(UUID responseId) {
        return select(responseLinks, link -> link.getOwnerId().equals(responseId));
    }

    private boolean attach(Map<UUID, SchemaLink> links, UUID schemaId, UUID ownerId, String kind) {
        boolean exists = links.values().stream()
                .anyMatch(link -> link.getSchemaId().equals(schemaId)
                        && link.getOwnerId().equals(ownerId)
                        && Objects.equals(link.getKind(), kind));
        if (exists) {
            return false;
        }
        SchemaLink link = new SchemaLink();
        link.setId(UUID.randomUUID());
        link.setSchemaId(schemaId);
        link.setOwnerId(ownerId);
        link.setKind(kind);
        links.put(link.getId(), link);
        changed();
        return true;
    }

    private void requireService(UUID serviceId) {
        if (!services.containsKey(serviceId)) {
            throw new CatalogNotFoundException("No service with id " + serviceId);
        }
    }

    private void requireSchema(UUID schemaId) {
        if (!schemas.containsKey(schemaId)) {
            throw new CatalogNotFoundException("No schema with id " + schemaId);
        }
    }

    private void requireApiCall(UUID apiCallId) {
        if (!apiCalls.containsKey(apiCallId)) {
            throw new CatalogNotFoundException("No API call with id " + apiCallId);
        }
    }

    private static <T> List<T> select(Map<UUID, T> rows, Predicate<T> filter) {
        return rows.values().stream().filter(filter).collect(Collectors.toList());
    }

    private static <T> Set<UUID> ids(Map<UUID, T> rows, Predicate<T> filter, Function<T, UUID> id) {
        return rows.values().stream().filter(filter).map(id).collect(Collectors.toSet());
    }

    private void changed() {
        if (transactionDepth == 0) {
            save();
        }
    }

    CatalogSnapshot snapshot() {
        CatalogSnapshot snapshot = new CatalogSnapshot();
        snapshot.getServices().addAll(services.values());
        snapshot.getSchemas().addAll(schemas.values());
        snapshot.getAttributes().addAll(attributes.values());
        snapshot.getApiCalls().addAll(apiCalls.values());
        snapshot.getParameters().addAll(parameters.values());
        snapshot.getResponses().addAll(responses.values());
        snapshot.getCallLinks().addAll(callLinks.values());
        snapshot.getResponseLinks().addAll(responseLinks.values());
        return snapshot;
    }

    private CatalogSnapshot copyOf(CatalogSnapshot snapshot) {
        return objectMapper.convertValue(snapshot, CatalogSnapshot.class);
    }

    private void restore(CatalogSnapshot snapshot) {
        services = index(snapshot.getServices(), CatalogService::getId);
        schemas = index(snapshot.getSchemas(), CatalogSchema::getId);
        attributes = index(snapshot.getAttributes(), CatalogAttribute::getId);
        apiCalls = index(snapshot.getApiCalls(), CatalogApiCall::getId);
        parameters = index(snapshot.getParameters(), CatalogParameter::getId);
        responses = index(snapshot.getResponses(), CatalogApiResponse::getId);
        callLinks = index(snapshot.getCallLinks(), SchemaLink::getId);
        responseLinks = index(snapshot.getResponseLinks(), SchemaLink::getId);
    }

    private static <T> Map<UUID, T> index(List<T> rows, Function<T, UUID> id) {
        Map<UUID, T> indexed = new LinkedHashMap<>();
        rows.forEach(row -> indexed.put(id.apply(row), row));
        return indexed;
    }

    /**
     * Writes the current state to the snapshot file, creating parent directories as needed.
     *
     * @throws CatalogException if the file cannot be written.
     */
    private void save() {
        if (!persistent) {
            return;
        }
        try {
            File parentDir = storageFile.getAbsoluteFile().getParentFile();
            if (!parentDir.exists() && !parentDir.mkdirs()) {
                throw new IOException("Failed to create parent directories at: " + parentDir.getAbsolutePath());
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(storageFile, snapshot());
        } catch (IOException e) {
            log.error("CRITICAL: Failed to save catalog to {}", storageFile.getAbsolutePath(), e);
            throw new CatalogException("Failed to save catalog", e);
        }
    }

    /**
     * Reads the snapshot file into memory. A missing or empty file means an empty catalog; an
     * unreadable one is moved aside and the catalog starts empty.
     */
    private synchronized void load() {
        if (!storageFile.exists() || storageFile.length() == 0) {
            log.info("No catalog file found at {}, starting with an empty catalog.", storageFile.getAbsolutePath());
            return;
        }
        try {
            restore(objectMapper.readValue(storageFile, CatalogSnapshot.class));
            log.info("Loaded {} services from {}", services.size(), storageFile.getAbsolutePath());
        } catch (IOException e) {
            log.warn("Could not read catalog file at {}. A backup will be created and the catalog starts empty. Error: {}",
                    storageFile.getAbsolutePath(), e.getMessage());
            backupCorruptedFile();
            restore(new CatalogSnapshot());
        }
    }

    private void backupCorruptedFile() {
        File backupFile = new File(storageFile.getAbsolutePath() + ".corrupted." + System.currentTimeMillis());
        try {
            Files.move(storageFile.toPath(), backupFile.toPath(), StandardCopyOption.REPLACE_EXISTING);
            log.info("Backed up corrupted catalog file to {}", backupFile.getAbsolutePath());
        } catch (IOException e) {
            log.error("CRITICAL: Failed to back up corrupted catalog file from {} to {}",
                    storageFile.getAbsolutePath(), backupFile.getAbsolutePath(), e);
        }
    }
}
