package com.catalog.dto.request;

import com.catalog.model.DocumentFormat;

/**
 * @param serviceName The catalog service to export.
 * @param version     A specific version, or {@code null} for the latest of that name.
 * @param format      Output format.
 * @param output      Target file, or {@code null} to print the document.
 */
public record ExportRequest(String serviceName, String version, DocumentFormat format, String output) {
}
