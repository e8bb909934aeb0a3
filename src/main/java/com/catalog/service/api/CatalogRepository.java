package com.catalog.service.api;

import com.catalog.exception.CatalogNotFoundException;
import com.catalog.model.CatalogApiCall;
import com.catalog.model.CatalogApiResponse;
import com.catalog.model.CatalogAttribute;
import com.catalog.model.CatalogParameter;
import com.catalog.model.CatalogSchema;
import com.catalog.model.CatalogService;
import com.catalog.model.SchemaLink;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Storage of catalog rows and the links between them.
 * <p>
 * Services own API calls and schemas; API calls own parameters and responses; schemas own
 * attributes. Deleting an owner removes what it owns, links included. Lists come back in
 * creation order.
 */
public interface CatalogRepository {

    /**
     * Runs {@code work} as one unit: if it throws, every change it made is undone.
     */
    <T> T inTransaction(Supplier<T> work);

    CatalogService createService(CatalogService service);

    Optional<CatalogService> findService(UUID serviceId);

    Optional<CatalogService> findServiceByNameAndVersion(String name, String version);

    List<CatalogService> findServicesByName(String name);

    List<CatalogService> listServices();

    void deleteService(UUID serviceId);

    /**
     * Finds a service by name, and by version when one is given. Without a version the most
     * recently created service of that name is returned.
     *
     * @throws CatalogNotFoundException if nothing matches.
     */
    default CatalogService resolveService(String name, String version) {
        if (version != null) {
            return findServiceByNameAndVersion(name, version)
                    .orElseThrow(() -> new CatalogNotFoundException("No service named '" + name + "' with version '" + version + "'"));
        }
        List<CatalogService> matches = findServicesByName(name);
        if (matches.isEmpty()) {
            throw new CatalogNotFoundException("No service named '" + name + "'");
        }
        return matches.get(matches.size() - 1);
    }

    /**
     * @throws com.catalog.exception.CatalogException if the service already has a schema of that name.
     */
    CatalogSchema createSchema(UUID serviceId, CatalogSchema schema);

    Optional<CatalogSchema> findSchema(UUID schemaId);

    Optional<CatalogSchema> findSchemaByName(UUID serviceId, String name);

    List<CatalogSchema> schemasOf(UUID serviceId);

    CatalogAttribute createAttribute(UUID schemaId, CatalogAttribute attribute);

    List<CatalogAttribute> attributesOf(UUID schemaId);

    /**
     * @throws com.catalog.exception.CatalogException if the service already has a call for that path and method.
     */
    CatalogApiCall createApiCall(UUID serviceId, CatalogApiCall apiCall);

    List<CatalogApiCall> apiCallsOf(UUID serviceId);

    CatalogParameter createParameter(UUID apiCallId, CatalogParameter parameter);

    List<CatalogParameter> parametersOf(UUID apiCallId);

    CatalogApiResponse createResponse(UUID apiCallId, CatalogApiResponse response);

    List<CatalogApiResponse> responsesOf(UUID apiCallId);

    /**
     * @return {@code true} if a new link was created, {@code false} if the same link existed.
     */
    boolean attachSchemaToCall(UUID schemaId, UUID apiCallId, String kind);

    boolean attachSchemaToResponse(UUID schemaId, UUID responseId, String kind);

    List<SchemaLink> callLinksOf(UUID apiCallId);

    List<SchemaLink> responseLinksOf(UUID responseId);
}
