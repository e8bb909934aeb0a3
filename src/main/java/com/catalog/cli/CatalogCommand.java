package com.catalog.cli;

import com.catalog.dto.response.CommandResponse;
import com.catalog.model.CatalogApiCall;
import com.catalog.model.CatalogAttribute;
import com.catalog.model.CatalogParameter;
import com.catalog.model.CatalogSchema;
import com.catalog.model.CatalogService;
import com.catalog.model.LoadedDocument;
import com.catalog.model.openapi.SchemaDocument;
import com.catalog.service.api.CatalogRepository;
import com.catalog.service.api.DocumentDecoder;
import com.catalog.service.api.DocumentSourceLoader;
import com.catalog.service.api.SchemaGraphExtractor;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * Read-only views over the catalog.
 */
@ShellComponent
public class CatalogCommand {

    public static final String ANSI_RESET = "\u001B[0m";
    public static final String ANSI_CYAN = "\u001B[36m";
    public static final String ANSI_YELLOW = "\u001B[33m";
    public static final String ANSI_PURPLE = "\u001B[35m";

    private static final String NL = System.lineSeparator();

    private final CatalogRepository repository;
    private final DocumentSourceLoader sourceLoader;
    private final DocumentDecoder decoder;
    private final SchemaGraphExtractor extractor;

    public CatalogCommand(CatalogRepository repository, DocumentSourceLoader sourceLoader, DocumentDecoder decoder,
                          SchemaGraphExtractor extractor) {
        this.repository = repository;
        this.sourceLoader = sourceLoader;
        this.decoder = decoder;
        this.extractor = extractor;
    }

    @ShellMethod(key = "services", value = "Lists the services in the catalog.")
    public String services() {
        List<CatalogService> services = repository.listServices();
        if (services.isEmpty()) {
            return ANSI_YELLOW + "The catalog is empty." + ANSI_RESET;
        }
        StringBuilder out = new StringBuilder(ANSI_CYAN + "Services:" + ANSI_RESET);
        for (CatalogService service : services) {
            out.append(NL).append("  ").append(service.getName()).append(' ').append(ANSI_YELLOW)
                    .append(service.getVersion()).append(ANSI_RESET)
                    .append(" (").append(repository.apiCallsOf(service.getId()).size()).append(" endpoints, ")
                    .append(repository.schemasOf(service.getId()).size()).append(" schemas)");
        }
        return out.toString();
    }

    /**
     * Lists the endpoints of a service with their kept parameters.
     */
    @ShellMethod(key = "endpoints", value = "Lists the endpoints of a catalog service.")
    public String endpoints(
            @ShellOption(help = "The service name.") String service,
            @ShellOption(help = "The service version; latest when omitted.", defaultValue = ShellOption.NULL) String version
    ) {
        try {
            CatalogService target = repository.resolveService(service, version);
            StringBuilder out = new StringBuilder(ANSI_CYAN + "Endpoints of " + ANSI_YELLOW + target.getName() + " "
                    + target.getVersion() + ANSI_RESET);
            for (CatalogApiCall call : repository.apiCallsOf(target.getId())) {
                out.append(NL).append("  ").append(ANSI_PURPLE).append(call.getMethod()).append(ANSI_RESET)
                        .append(' ').append(call.getPath()).append("  [").append(call.getOperationId()).append(']');
                for (CatalogParameter parameter : repository.parametersOf(call.getId())) {
                    out.append(NL).append("    - ").append(parameter.getName())
                            .append(" (in: ").append(parameter.getLocation().token())
                            .append(", type: ").append(parameter.getType())
                            .append(", required: ").append(parameter.isRequired()).append(')');
                }
            }
            return out.toString();
        } catch (Exception e) {
            return CommandResponse.failed(e.getMessage()).toAnsiString();
        }
    }

    @ShellMethod(key = "schemas", value = "Lists the schemas of a catalog service with their attributes.")
    public String schemas(
            @ShellOption(help = "The service name.") String service,
            @ShellOption(help = "The service version; latest when omitted.", defaultValue = ShellOption.NULL) String version
    ) {
        try {
            CatalogService target = repository.resolveService(service, version);
            StringBuilder out = new StringBuilder(ANSI_CYAN + "Schemas of " + ANSI_YELLOW + target.getName() + " "
                    + target.getVersion() + ANSI_RESET);
            for (CatalogSchema schema : repository.schemasOf(target.getId())) {
                out.append(NL).append("  ").append(schema.getName()).append(" <").append(schema.getType()).append('>');
                if (schema.isReference()) {
                    out.append(" -> ").append(schema.getReferencedModelName());
                }
                for (CatalogAttribute attribute : repository.attributesOf(schema.getId())) {
                    out.append(NL).append("    - ").append(attribute.getName()).append(": ").append(attribute.getType());
                    if (attribute.getElementType() != null) {
                        out.append('<').append(attribute.getElementType()).append('>');
                    }
                    if (attribute.isRequired()) {
                        out.append(" (required)");
                    }
                }
            }
            return out.toString();
        } catch (Exception e) {
            return CommandResponse.failed(e.getMessage()).toAnsiString();
        }
    }

    /**
     * Prints every schema a named schema depends on, directly or transitively.
     */
    @ShellMethod(key = "schema-deps", value = "Shows the schemas a component schema depends on.")
    public String schemaDependencies(
            @ShellOption(help = "The URL or file path of the OpenAPI document.") String source,
            @ShellOption(help = "The component schema name.") String schema
    ) {
        try {
            LoadedDocument loaded = sourceLoader.load(source);
            SchemaDocument document = decoder.decode(loaded.content(), loaded.formatHint());
            Set<String> dependencies = extractor.dependenciesOf(schema, document.componentSchemas());
            if (dependencies.isEmpty()) {
                return ANSI_YELLOW + "'" + schema + "' has no schema dependencies." + ANSI_RESET;
            }
            return ANSI_CYAN + "'" + schema + "' depends on: " + ANSI_RESET
                    + dependencies.stream().sorted().collect(Collectors.joining(", "));
        } catch (Exception e) {
            return CommandResponse.failed("Failed to resolve dependencies: " + e.getMessage()).toAnsiString();
        }
    }
}
