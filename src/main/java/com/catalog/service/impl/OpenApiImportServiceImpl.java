package com.catalog.service.impl;

import com.catalog.model.CatalogSchema;
import com.catalog.model.CatalogService;
import com.catalog.model.DocumentFormat;
import com.catalog.model.EnvironmentType;
import com.catalog.model.ExtractedSchema;
import com.catalog.model.ImportStats;
import com.catalog.model.LoadedDocument;
import com.catalog.model.ProjectedSchema;
import com.catalog.model.ServiceEnvironment;
import com.catalog.model.openapi.DocumentInfo;
import com.catalog.model.openapi.SchemaDocument;
import com.catalog.model.openapi.SchemaNode;
import com.catalog.model.openapi.ServerNode;
import com.catalog.service.api.CatalogRepository;
import com.catalog.service.api.DocumentDecoder;
import com.catalog.service.api.DocumentSourceLoader;
import com.catalog.service.api.OpenApiImportService;
import com.catalog.service.api.OperationImporter;
import com.catalog.service.api.RelationalProjector;
import com.catalog.service.api.SchemaGraphExtractor;
import java.net.URI;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class OpenApiImportServiceImpl implements OpenApiImportService {

    private final DocumentDecoder decoder;
    private final SchemaGraphExtractor extractor;
    private final RelationalProjector projector;
    private final OperationImporter operationImporter;
    private final CatalogRepository repository;
    private final DocumentSourceLoader sourceLoader;

    public OpenApiImportServiceImpl(DocumentDecoder decoder, SchemaGraphExtractor extractor, RelationalProjector projector,
                                    OperationImporter operationImporter, CatalogRepository repository,
                                    DocumentSourceLoader sourceLoader) {
        this.decoder = decoder;
        this.extractor = extractor;
        this.projector = projector;
        this.operationImporter = operationImporter;
        this.repository = repository;
        this.sourceLoader = sourceLoader;
    }

    @Override
    public ImportStats importFromSource(String source, DocumentFormat format) {
        log.info("Importing OpenAPI document from: {}", source);
        LoadedDocument loaded = sourceLoader.load(source);
        return importDocument(loaded.content(), format != null ? format : loaded.formatHint());
    }

    /**
     * {@inheritDoc}
     * <p>
     * Decoding happens before the unit of work starts, so a document that does not decode
     * leaves the catalog untouched.
     */
    @Override
    public ImportStats importDocument(byte[] content, DocumentFormat format) {
        SchemaDocument document = decoder.decode(content, format);
        ImportStats stats = repository.inTransaction(() -> importDecoded(document));
        log.info("Imported '{}' {}: {}", stats.getServiceName(), stats.getServiceVersion(), stats.summary());
        return stats;
    }

    private ImportStats importDecoded(SchemaDocument document) {
        ImportStats stats = new ImportStats();
        document.getDecodeWarnings().forEach(stats::skip);

        DocumentInfo info = document.getInfo();
        repository.findServiceByNameAndVersion(info.getTitle(), info.getVersion()).ifPresent(existing -> {
            log.info("Replacing existing service '{}' {}", existing.getName(), existing.getVersion());
            repository.deleteService(existing.getId());
        });
        CatalogService service = repository.createService(toService(document));
        stats.setServiceId(service.getId());
        stats.setServiceName(service.getName());
        stats.setServiceVersion(service.getVersion());

        Map<String, SchemaNode> registry = document.componentSchemas();
        for (ExtractedSchema extracted : extractor.extractAll(registry)) {
            ProjectedSchema projected = projector.project(extracted.name(), extracted.node(), registry);
            CatalogSchema schema = repository.createSchema(service.getId(), projected.schema());
            projected.attributes().forEach(attribute -> repository.createAttribute(schema.getId(), attribute));
            stats.setImportedSchemas(stats.getImportedSchemas() + 1);
            stats.setImportedAttributes(stats.getImportedAttributes() + projected.attributes().size());
        }
        log.info("Projected {} schemas with {} attributes", stats.getImportedSchemas(), stats.getImportedAttributes());

        operationImporter.importPaths(document, service, stats);
        return stats;
    }

    private CatalogService toService(SchemaDocument document) {
        DocumentInfo info = document.getInfo();
        CatalogService service = new CatalogService();
        service.setName(info.getTitle());
        service.setVersion(info.getVersion());
        service.setDescription(info.getDescription());
        if (info.getContact() != null) {
            service.setOwner(info.getContact().getName());
            service.setContactEmail(info.getContact().getEmail());
        }
        if (document.getServers() != null) {
            for (ServerNode server : document.getServers()) {
                if (server != null && server.getUrl() != null && !server.getUrl().isBlank()) {
                    service.getEnvironments().add(toEnvironment(server));
                }
            }
        }
        return service;
    }

    static ServiceEnvironment toEnvironment(ServerNode server) {
        ServiceEnvironment environment = new ServiceEnvironment();
        EnvironmentType type = EnvironmentType.fromUrl(server.getUrl());
        environment.setType(type);
        environment.setBaseUrl(server.getUrl());
        environment.setDescription(server.getDescription());
        environment.setName(server.getDescription() != null ? server.getDescription() : type.name().toLowerCase(Locale.ROOT));
        environment.setHost(hostOf(server.getUrl()));
        return environment;
    }

    // Server URLs may be relative or templated ("https://{region}.example.com").
    private static String hostOf(String url) {
        try {
            String host = URI.create(url).getHost();
            return host != null ? host : "unknown";
        } catch (IllegalArgumentException e) {
            return "unknown";
        }
    }
}
