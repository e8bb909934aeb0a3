package com.catalog.cli;

import com.catalog.cli.ui.Spinner;
import com.catalog.dto.request.ImportRequest;
import com.catalog.dto.response.CommandResponse;
import com.catalog.model.ImportStats;
import com.catalog.model.SkippedItemWarning;
import com.catalog.service.api.OpenApiImportService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * Imports OpenAPI documents into the catalog.
 */
@ShellComponent
@Slf4j
public class ImportCommand {

    private final OpenApiImportService importService;
    private final Spinner spinner;

    public ImportCommand(OpenApiImportService importService, Spinner spinner) {
        this.importService = importService;
        this.spinner = spinner;
    }

    /**
     * Imports a document and prints what was created. A service with the same name and
     * version is replaced.
     *
     * @param source URL, {@code file:} URI or path of the document.
     * @param format {@code json} or {@code yaml}; inferred when omitted.
     * @return The colored statistics, followed by one line per skipped item.
     */
    @ShellMethod(key = "import", value = "Imports an OpenAPI document (JSON or YAML) into the catalog.")
    public String importDocument(
            @ShellOption(help = "The URL or file path of the OpenAPI document.") String source,
            @ShellOption(help = "The document format: json or yaml.", defaultValue = ShellOption.NULL) String format
    ) {
        try {
            ImportRequest request = ImportRequest.of(source, format);
            ImportStats stats = spinner.spin("Importing...",
                    () -> importService.importFromSource(request.source(), request.format()));
            StringBuilder out = new StringBuilder(CommandResponse.ok("Imported service '" + stats.getServiceName() + "' "
                    + stats.getServiceVersion() + ": " + stats.summary()).toAnsiString());
            for (SkippedItemWarning warning : stats.getWarnings()) {
                out.append(System.lineSeparator()).append("  skipped ").append(warning);
            }
            return out.toString();
        } catch (Exception e) {
            log.debug("Import of {} failed", source, e);
            return CommandResponse.failed("Failed to import document: " + e.getMessage()).toAnsiString();
        }
    }
}
