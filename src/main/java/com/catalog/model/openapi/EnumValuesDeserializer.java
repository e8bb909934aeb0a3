package com.catalog.model.openapi;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Normalizes an {@code enum} array to strings at decode time. Numbers and booleans keep their
 * canonical text ({@code 1}, {@code 2.5}, {@code true}); a non-array value yields an empty list.
 */
public class EnumValuesDeserializer extends StdDeserializer<List<String>> {

    public EnumValuesDeserializer() {
        super(List.class);
    }

    @Override
    public List<String> deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        JsonNode node = parser.getCodec().readTree(parser);
        List<String> values = new ArrayList<>();
        if (node != null && node.isArray()) {
            node.forEach(member -> values.add(JsonValue.fromJsonNode(member).toCanonicalString()));
        }
        return values;
    }
}
