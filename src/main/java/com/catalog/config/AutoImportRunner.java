package com.catalog.config;

import com.catalog.model.DocumentFormat;
import com.catalog.model.ImportStats;
import com.catalog.service.api.OpenApiImportService;
import java.io.File;
import java.util.Arrays;
import java.util.Comparator;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Imports every OpenAPI document found in the configured directory when the application
 * starts, so a container can be seeded by mounting a folder of specs.
 * <p>
 * Files are processed in name order. A service that is already in the catalog with the
 * same name and version is replaced, which makes restarts idempotent.
 */
@Component
@Profile("!test")
public class AutoImportRunner implements CommandLineRunner {

    @Value("${catalog.import.directory:/app/openapi}")
    private String importDirectoryPath;

    private final OpenApiImportService importService;

    public AutoImportRunner(OpenApiImportService importService) {
        this.importService = importService;
    }

    @Override
    public void run(String... args) {
        System.out.println("\n--- Starting API Catalog Auto-Import ---");
        File importDir = new File(importDirectoryPath);

        if (!importDir.exists() || !importDir.isDirectory()) {
            System.out.println("Auto-import directory not found at '" + importDirectoryPath + "'. Skipping.");
            System.out.println("--- Auto-Import Complete ---\n");
            return;
        }

        File[] documents = importDir.listFiles((dir, name) -> DocumentFormat.fromFileName(name).isPresent());

        if (documents == null || documents.length == 0) {
            System.out.println("No OpenAPI (.json, .yaml, .yml) files found in '" + importDirectoryPath + "'. Skipping.");
            System.out.println("--- Auto-Import Complete ---\n");
            return;
        }

        Arrays.sort(documents, Comparator.comparing(File::getName));
        for (File file : documents) {
            System.out.println("\nProcessing document: " + file.getName());
            try {
                ImportStats stats = importService.importFromSource(file.getPath(), null);
                System.out.println("  [IMPORT] Imported '" + stats.getServiceName() + "' " + stats.getServiceVersion()
                        + ": " + stats.summary());
                stats.getWarnings().forEach(warning -> System.out.println("  [SKIPPED] " + warning));
            } catch (Exception e) {
                System.err.println("  [IMPORT] FAILED: Could not import '" + file.getName() + "'. Error: " + e.getMessage());
            }
        }
        System.out.println("\n--- Auto-Import Complete. Ready for commands. ---\n");
    }
}
