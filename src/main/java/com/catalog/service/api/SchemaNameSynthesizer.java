package com.catalog.service.api;

import com.catalog.model.HttpMethod;

public interface SchemaNameSynthesizer {

    /**
     * Generates the name under which an inline request or response body schema is looked up.
     * Deterministic. Path and method do not take part, so endpoints whose operation ids reduce
     * to the same words share a name.
     *
     * @param operationId The operation id (already defaulted when the document had none).
     * @param path        The endpoint path.
     * @param method      The endpoint method.
     * @param response    {@code true} for a response body, {@code false} for a request body.
     * @param statusCode  The response status key; ignored for requests.
     */
    String synthesize(String operationId, String path, HttpMethod method, boolean response, String statusCode);
}
