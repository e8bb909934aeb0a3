package com.catalog.cli;

import com.catalog.cli.ui.Spinner;
import com.catalog.dto.request.ExportRequest;
import com.catalog.dto.response.CommandResponse;
import com.catalog.model.CatalogService;
import com.catalog.model.DocumentFormat;
import com.catalog.service.api.CatalogRepository;
import com.catalog.service.api.DocumentExporter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * Writes catalog services back out as OpenAPI documents.
 */
@ShellComponent
@Slf4j
public class ExportCommand {

    private final CatalogRepository repository;
    private final DocumentExporter exporter;
    private final Spinner spinner;

    public ExportCommand(CatalogRepository repository, DocumentExporter exporter, Spinner spinner) {
        this.repository = repository;
        this.exporter = exporter;
        this.spinner = spinner;
    }

    @ShellMethod(key = "export", value = "Exports a catalog service as an OpenAPI 3.0 document.")
    public String export(
            @ShellOption(help = "The service name.") String service,
            @ShellOption(help = "The service version; latest when omitted.", defaultValue = ShellOption.NULL) String version,
            @ShellOption(help = "The output format: json or yaml.", defaultValue = "json") String format,
            @ShellOption(help = "File to write; printed when omitted.", defaultValue = ShellOption.NULL) String output
    ) {
        try {
            ExportRequest request = new ExportRequest(service, version, DocumentFormat.fromToken(format), output);
            CatalogService target = repository.resolveService(request.serviceName(), request.version());
            byte[] document = spinner.spin("Exporting...", () -> exporter.export(target.getId(), request.format()));
            if (request.output() == null) {
                return new String(document, StandardCharsets.UTF_8);
            }
            Path path = Path.of(request.output());
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            Files.write(path, document);
            return CommandResponse.ok("Exported '" + target.getName() + "' " + target.getVersion() + " to "
                    + path.toAbsolutePath()).toAnsiString();
        } catch (Exception e) {
            log.debug("Export of {} failed", service, e);
            return CommandResponse.failed("Failed to export service: " + e.getMessage()).toAnsiString();
        }
    }
}
