package com.catalog.service.impl;

import com.catalog.exception.CatalogException;
import com.catalog.exception.CatalogNotFoundException;
import com.catalog.model.DocumentFormat;
import com.catalog.model.LoadedDocument;
import com.catalog.service.api.DocumentSourceLoader;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Loads documents from disk or over HTTP. Remote fetches go through the shared
 * {@link WebClient}, which retries throttled and unavailable responses.
 */
@Service
@Slf4j
public class DocumentSourceLoaderImpl implements DocumentSourceLoader {

    private final WebClient webClient;

    public DocumentSourceLoaderImpl(WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    public LoadedDocument load(String source) {
        if (source == null || source.isBlank()) {
            throw new CatalogException("No document source given");
        }
        String lower = source.trim().toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            return fetch(source.trim());
        }
        return read(lower.startsWith("file:") ? Paths.get(URI.create(source.trim())) : Paths.get(source.trim()));
    }

    private LoadedDocument read(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new CatalogNotFoundException("Document not found: " + path.toAbsolutePath());
        }
        try {
            byte[] content = Files.readAllBytes(path);
            log.debug("Read {} bytes from {}", content.length, path.toAbsolutePath());
            DocumentFormat hint = DocumentFormat.fromFileName(path.getFileName().toString()).orElse(null);
            return new LoadedDocument(content, hint, path.toAbsolutePath().toString());
        } catch (IOException e) {
            throw new CatalogException("Could not read document " + path.toAbsolutePath() + ": " + e.getMessage(), e);
        }
    }

    private LoadedDocument fetch(String url) {
        ResponseEntity<byte[]> response;
        try {
            response = webClient.get()
                    .uri(URI.create(url))
                    .retrieve()
                    .toEntity(byte[].class)
                    .block();
        } catch (WebClientResponseException e) {
            if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                throw new CatalogNotFoundException("Document not found: " + url);
            }
            throw new CatalogException("Fetching " + url + " failed with HTTP " + e.getStatusCode().value(), e);
        } catch (RuntimeException e) {
            throw new CatalogException("Could not fetch " + url + ": " + e.getMessage(), e);
        }
        if (response == null || response.getBody() == null || response.getBody().length == 0) {
            throw new CatalogException("Fetching " + url + " returned an empty document");
        }
        log.info("Fetched {} bytes from {}", response.getBody().length, url);
        MediaType contentType = response.getHeaders().getContentType();
        DocumentFormat hint = DocumentFormat.fromFileName(URI.create(url).getPath())
                .orElseGet(() -> formatOf(contentType));
        return new LoadedDocument(response.getBody(), hint, url);
    }

    private static DocumentFormat formatOf(MediaType contentType) {
        if (contentType == null) {
            return null;
        }
        String subtype = contentType.getSubtype().toLowerCase(Locale.ROOT);
        if (subtype.contains("json")) {
            return DocumentFormat.JSON;
        }
        if (subtype.contains("yaml") || subtype.contains("yml")) {
            return DocumentFormat.YAML;
        }
        return null;
    }
}
