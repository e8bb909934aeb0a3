package com.catalog.model.openapi;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import java.io.IOException;

/**
 * Reads any JSON token into a {@link JsonValue}. An explicit JSON {@code null} becomes
 * {@link JsonValue#nullValue()} rather than a Java {@code null}, so "declared as null" and
 * "absent" stay distinguishable on the AST.
 */
public class JsonValueDeserializer extends StdDeserializer<JsonValue> {

    public JsonValueDeserializer() {
        super(JsonValue.class);
    }

    @Override
    public JsonValue deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        JsonNode node = parser.getCodec().readTree(parser);
        return JsonValue.fromJsonNode(node);
    }

    @Override
    public JsonValue getNullValue(DeserializationContext context) {
        return JsonValue.nullValue();
    }
}
