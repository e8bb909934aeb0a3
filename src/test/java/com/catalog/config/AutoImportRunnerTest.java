package com.catalog.config;

import com.catalog.exception.DocumentDecodeException;
import com.catalog.model.ImportStats;
import com.catalog.service.api.OpenApiImportService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AutoImportRunnerTest {

    @Mock
    private OpenApiImportService importService;

    private AutoImportRunner runner;

    @BeforeEach
    void setUp() {
        runner = new AutoImportRunner(importService);
    }

    @Test
    void run_shouldImportDocumentsInNameOrderAndIgnoreOtherFiles(@TempDir Path directory) throws IOException {
        Path second = Files.writeString(directory.resolve("b-orders.yaml"), "openapi: 3.0.3");
        Path first = Files.writeString(directory.resolve("a-users.json"), "{}");
        Files.writeString(directory.resolve("notes.txt"), "not a document");
        ReflectionTestUtils.setField(runner, "importDirectoryPath", directory.toString());
        when(importService.importFromSource(anyString(), isNull())).thenReturn(stats("users", "1"));

        runner.run();

        InOrder inOrder = inOrder(importService);
        inOrder.verify(importService).importFromSource(first.toString(), null);
        inOrder.verify(importService).importFromSource(second.toString(), null);
        verifyNoMoreInteractions(importService);
    }

    @Test
    void run_shouldKeepGoingWhenOneDocumentFails(@TempDir Path directory) throws IOException {
        Path broken = Files.writeString(directory.resolve("a-broken.json"), "[]");
        Path valid = Files.writeString(directory.resolve("b-valid.yml"), "openapi: 3.0.3");
        ReflectionTestUtils.setField(runner, "importDirectoryPath", directory.toString());
        when(importService.importFromSource(broken.toString(), null)).thenThrow(new DocumentDecodeException("not a mapping"));
        when(importService.importFromSource(valid.toString(), null)).thenReturn(stats("valid", "2"));

        runner.run();

        verify(importService).importFromSource(valid.toString(), null);
    }

    @Test
    void run_shouldSkipMissingDirectory(@TempDir Path directory) {
        ReflectionTestUtils.setField(runner, "importDirectoryPath", directory.resolve("absent").toString());

        runner.run();

        verify(importService, never()).importFromSource(any(), any());
    }

    private static ImportStats stats(String name, String version) {
        ImportStats stats = new ImportStats();
        stats.setServiceName(name);
        stats.setServiceVersion(version);
        return stats;
    }
}
