package com.catalog.service.impl;

import com.catalog.config.HttpClientFactory;
import com.catalog.exception.CatalogException;
import com.catalog.exception.CatalogNotFoundException;
import com.catalog.model.DocumentFormat;
import com.catalog.model.LoadedDocument;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static com.catalog.TestDocuments.path;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocumentSourceLoaderImplTest {

    private MockWebServer mockWebServer;
    private DocumentSourceLoaderImpl loader;

    @BeforeEach
    void setUp() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.start();
        loader = new DocumentSourceLoaderImpl(new HttpClientFactory().webClient(16 * 1024 * 1024));
    }

    @AfterEach
    void tearDown() throws IOException {
        mockWebServer.shutdown();
    }

    private String url(String path) {
        return mockWebServer.url(path).toString();
    }

    @Test
    void load_shouldFetchRemoteDocumentAndTakeFormatFromContentType() throws Exception {
        mockWebServer.enqueue(new MockResponse()
                .setBody("{\"openapi\":\"3.0.3\"}")
                .addHeader("Content-Type", "application/json"));

        LoadedDocument document = loader.load(url("/docs/api"));

        assertThat(new String(document.content(), StandardCharsets.UTF_8)).isEqualTo("{\"openapi\":\"3.0.3\"}");
        assertThat(document.formatHint()).isEqualTo(DocumentFormat.JSON);
        assertThat(document.origin()).endsWith("/docs/api");
        assertThat(mockWebServer.takeRequest().getMethod()).isEqualTo("GET");
    }

    @Test
    void load_shouldPreferUrlExtensionOverContentType() {
        mockWebServer.enqueue(new MockResponse()
                .setBody("openapi: 3.0.3\n")
                .addHeader("Content-Type", "text/plain"));

        LoadedDocument document = loader.load(url("/openapi.yaml"));

        assertThat(document.formatHint()).isEqualTo(DocumentFormat.YAML);
    }

    @Test
    void load_shouldRetryUnavailableResponses() {
        mockWebServer.enqueue(new MockResponse().setResponseCode(503));
        mockWebServer.enqueue(new MockResponse().setResponseCode(429));
        mockWebServer.enqueue(new MockResponse()
                .setBody("{\"openapi\":\"3.0.3\"}")
                .addHeader("Content-Type", "application/json"));

        LoadedDocument document = loader.load(url("/flaky.json"));

        assertThat(document.content()).isNotEmpty();
        assertThat(mockWebServer.getRequestCount()).isEqualTo(3);
    }

    @Test
    void load_shouldGiveUpAfterThreeAttempts() {
        for (int i = 0; i < 3; i++) {
            mockWebServer.enqueue(new MockResponse().setResponseCode(503));
        }

        assertThatThrownBy(() -> loader.load(url("/down.json")))
                .isInstanceOf(CatalogException.class)
                .hasMessageContaining("503");
        assertThat(mockWebServer.getRequestCount()).isEqualTo(3);
    }

    @Test
    void load_shouldReportMissingRemoteDocument() {
        mockWebServer.enqueue(new MockResponse().setResponseCode(404));

        assertThatThrownBy(() -> loader.load(url("/missing.json")))
                .isInstanceOf(CatalogNotFoundException.class);
        assertThat(mockWebServer.getRequestCount()).isEqualTo(1);
    }

    @Test
    void load_shouldNotRetryServerErrors() {
        mockWebServer.enqueue(new MockResponse().setResponseCode(500));

        assertThatThrownBy(() -> loader.load(url("/broken.json")))
                .isInstanceOf(CatalogException.class)
                .isNotInstanceOf(CatalogNotFoundException.class)
                .hasMessageContaining("500");
        assertThat(mockWebServer.getRequestCount()).isEqualTo(1);
    }

    @Test
    void load_shouldRejectEmptyRemoteBody() {
        mockWebServer.enqueue(new MockResponse().setResponseCode(200));

        assertThatThrownBy(() -> loader.load(url("/empty.json")))
                .isInstanceOf(CatalogException.class)
                .hasMessageContaining("empty");
    }

    @Test
    void load_shouldReadLocalFilesByPathAndUri() {
        Path petstore = Path.of(path("petstore.json"));

        LoadedDocument byPath = loader.load(petstore.toString());
        LoadedDocument byUri = loader.load(petstore.toUri().toString());

        assertThat(byPath.formatHint()).isEqualTo(DocumentFormat.JSON);
        assertThat(byUri.content()).isEqualTo(byPath.content());
        assertThat(byPath.origin()).isEqualTo(petstore.toAbsolutePath().toString());
    }

    @Test
    void load_shouldLeaveHintEmptyForUnknownExtension(@TempDir Path directory) throws IOException {
        Path document = Files.writeString(directory.resolve("api.txt"), "{}");

        assertThat(loader.load(document.toString()).formatHint()).isNull();
    }

    @Test
    void load_shouldReportMissingFile(@TempDir Path directory) {
        assertThatThrownBy(() -> loader.load(directory.resolve("nope.json").toString()))
                .isInstanceOf(CatalogNotFoundException.class);
    }

    @Test
    void load_shouldRejectBlankSource() {
        assertThatThrownBy(() -> loader.load("  ")).isInstanceOf(CatalogException.class);
    }
}
