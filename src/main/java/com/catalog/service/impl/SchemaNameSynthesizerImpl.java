package com.catalog.service.impl;

import com.catalog.model.HttpMethod;
import com.catalog.service.api.SchemaNameSynthesizer;
import org.springframework.stereotype.Component;

/**
 * Builds names such as {@code CreateOrder201Response} from operation ids like
 * {@code _api_v1_create_order}: known API prefixes are cut, underscores become word breaks,
 * every word is capitalized and the spaces are dropped.
 */
@Component
public class SchemaNameSynthesizerImpl implements SchemaNameSynthesizer {

    private static final String[] STRIPPED_PREFIXES = {"_api_v1_", "_api_"};

    @Override
    public String synthesize(String operationId, String path, HttpMethod method, boolean response, String statusCode) {
        String cleaned = operationId == null ? "" : operationId;
        for (String prefix : STRIPPED_PREFIXES) {
            cleaned = cleaned.replace(prefix, "");
        }
        StringBuilder name = new StringBuilder(titleCase(cleaned.replace('_', ' ')).replace(" ", ""));
        if (response && statusCode != null) {
            name.append(statusCode);
        }
        name.append(response ? "Response" : "Request");
        return name.toString();
    }

    // Any non-letter starts a new word and is kept as-is.
    static String titleCase(String text) {
        StringBuilder out = new StringBuilder(text.length());
        boolean wordStart = true;
        for (char c : text.toCharArray()) {
            if (Character.isLetter(c)) {
                out.append(wordStart ? Character.toUpperCase(c) : Character.toLowerCase(c));
                wordStart = false;
            } else {
                out.append(c);
                wordStart = true;
            }
        }
        return out.toString();
    }
}
