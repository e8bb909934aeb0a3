package com.catalog;

import java.io.IOException;
import java.io.InputStream;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;

/**
 * Loads the OpenAPI fixtures under {@code src/test/resources/openapi}.
 */
public final class TestDocuments {

    private TestDocuments() {
    }

    public static byte[] bytes(String name) {
        try (InputStream in = TestDocuments.class.getClassLoader().getResourceAsStream("openapi/" + name)) {
            if (in == null) {
                throw new IllegalArgumentException("No fixture named " + name);
            }
            return in.readAllBytes();
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }

    public static byte[] utf8(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    public static String path(String name) {
        URL resource = TestDocuments.class.getClassLoader().getResource("openapi/" + name);
        if (resource == null) {
            throw new IllegalArgumentException("No fixture named " + name);
        }
        try {
            return Paths.get(resource.toURI()).toFile().getAbsolutePath();
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }
}
