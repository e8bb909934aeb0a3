package com.catalog.model.openapi;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A dynamically-typed JSON value as it appears in the {@code default} and {@code example}
 * fields of an OpenAPI schema.
 * <p>
 * The catalog stores these values in a single string column, so every value has a canonical
 * string form ({@link #toCanonicalString()}) and can be re-inferred from that form
 * ({@link #fromCanonicalString(String)}). Floating values use a compact {@code %g}-style
 * rendering that always keeps a decimal point or an exponent, so a float never comes back
 * as an integer.
 */
@JsonDeserialize(using = JsonValueDeserializer.class)
public final class JsonValue {

    /**
     * The closed set of shapes a {@link JsonValue} can take.
     */
    public enum Kind {
        STRING, INTEGER, FLOAT, BOOLEAN, NULL, ARRAY, OBJECT
    }

    private static final JsonValue NULL_VALUE = new JsonValue(Kind.NULL, null);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Pattern INTEGER_LITERAL = Pattern.compile("-?(0|[1-9]\\d*)");
    private static final Pattern NUMBER_LITERAL = Pattern.compile("-?(0|[1-9]\\d*)(\\.\\d+)?([eE][+-]?\\d+)?");
    private static final int SIGNIFICANT_DIGITS = 6;

    private final Kind kind;
    private final Object value;

    private JsonValue(Kind kind, Object value) {
        this.kind = kind;
        this.value = value;
    }

    public static JsonValue ofString(String value) {
        return new JsonValue(Kind.STRING, Objects.requireNonNull(value, "value"));
    }

    public static JsonValue ofInteger(long value) {
        return new JsonValue(Kind.INTEGER, value);
    }

    public static JsonValue ofFloat(double value) {
        return new JsonValue(Kind.FLOAT, value);
    }

    public static JsonValue ofBoolean(boolean value) {
        return new JsonValue(Kind.BOOLEAN, value);
    }

    public static JsonValue nullValue() {
        return NULL_VALUE;
    }

    public static JsonValue ofArray(List<JsonValue> elements) {
        return new JsonValue(Kind.ARRAY, Collections.unmodifiableList(new ArrayList<>(elements)));
    }

    public static JsonValue ofObject(Map<String, JsonValue> members) {
        return new JsonValue(Kind.OBJECT, Collections.unmodifiableMap(new LinkedHashMap<>(members)));
    }

    /**
     * Converts a Jackson tree node into a tagged value. Never fails: anything that is not a
     * recognised JSON shape is read as its text.
     *
     * @param node The node to convert; {@code null} and missing nodes become {@link Kind#NULL}.
     * @return The tagged value.
     */
    public static JsonValue fromJsonNode(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return NULL_VALUE;
        }
        if (node.isTextual()) {
            return ofString(node.textValue());
        }
        if (node.isBoolean()) {
            return ofBoolean(node.booleanValue());
        }
        if (node.isIntegralNumber()) {
            return node.canConvertToLong() ? ofInteger(node.longValue()) : ofFloat(node.doubleValue());
        }
        if (node.isNumber()) {
            return ofFloat(node.doubleValue());
        }
        if (node.isArray()) {
            List<JsonValue> elements = new ArrayList<>();
            node.forEach(element -> elements.add(fromJsonNode(element)));
            return ofArray(elements);
        }
        if (node.isObject()) {
            Map<String, JsonValue> members = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                members.put(field.getKey(), fromJsonNode(field.getValue()));
            }
            return ofObject(members);
        }
        return ofString(node.asText());
    }

    /**
     * Re-infers a typed value from the catalog's string storage form. Tried in order: integer
     * literal, number literal, {@code true}/{@code false}, {@code null}, a JSON array, object or
     * quoted string; anything else is kept as a plain string.
     *
     * @param canonical The stored string; {@code null} yields {@code null}.
     * @return The best-effort typed value.
     */
    public static JsonValue fromCanonicalString(String canonical) {
        if (canonical == null) {
            return null;
        }
        if (INTEGER_LITERAL.matcher(canonical).matches()) {
            try {
                return ofInteger(Long.parseLong(canonical));
            } catch (NumberFormatException e) {
                return ofFloat(Double.parseDouble(canonical));
            }
        }
        if (NUMBER_LITERAL.matcher(canonical).matches()) {
            return ofFloat(Double.parseDouble(canonical));
        }
        if ("true".equals(canonical) || "false".equals(canonical)) {
            return ofBoolean(Boolean.parseBoolean(canonical));
        }
        if ("null".equalsIgnoreCase(canonical)) {
            return NULL_VALUE;
        }
        if (canonical.startsWith("[") || canonical.startsWith("{") || canonical.startsWith("\"")) {
            try {
                return fromJsonNode(MAPPER.readTree(canonical));
            } catch (JsonProcessingException e) {
                return ofString(canonical);
            }
        }
        return ofString(canonical);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isNull() {
        return kind == Kind.NULL;
    }

    public String asString() {
        return kind == Kind.STRING ? (String) value : null;
    }

    public Long asLong() {
        return kind == Kind.INTEGER ? (Long) value : null;
    }

    public Double asDouble() {
        return kind == Kind.FLOAT ? (Double) value : null;
    }

    public Boolean asBoolean() {
        return kind == Kind.BOOLEAN ? (Boolean) value : null;
    }

    @SuppressWarnings("unchecked")
    public List<JsonValue> asArray() {
        return kind == Kind.ARRAY ? (List<JsonValue>) value : null;
    }

    @SuppressWarnings("unchecked")
    public Map<String, JsonValue> asObject() {
        return kind == Kind.OBJECT ? (Map<String, JsonValue>) value : null;
    }

    /**
     * Renders the value in the catalog's string storage form: strings verbatim, integers in
     * decimal, floats compact, booleans and null as their literal tokens, arrays and objects as
     * compact JSON.
     *
     * @return The canonical string, never {@code null}.
     */
    public String toCanonicalString() {
        switch (kind) {
            case STRING:
                return (String) value;
            case INTEGER:
                return Long.toString((Long) value);
            case FLOAT:
                return formatFloat((Double) value);
            case BOOLEAN:
                return ((Boolean) value) ? "true" : "false";
            case NULL:
                return "null";
            default:
                try {
                    return MAPPER.writeValueAsString(toJsonNode());
                } catch (JsonProcessingException e) {
                    throw new IllegalStateException("Could not render JSON value of kind " + kind, e);
                }
        }
    }

    /**
     * Converts the value back into a Jackson tree node.
     *
     * @return The equivalent node.
     */
    public JsonNode toJsonNode() {
        JsonNodeFactory factory = JsonNodeFactory.instance;
        switch (kind) {
            case STRING:
                return factory.textNode((String) value);
            case INTEGER:
                return factory.numberNode((Long) value);
            case FLOAT:
                return factory.numberNode((Double) value);
            case BOOLEAN:
                return factory.booleanNode((Boolean) value);
            case ARRAY:
                ArrayNode array = factory.arrayNode();
                asArray().forEach(element -> array.add(element.toJsonNode()));
                return array;
            case OBJECT:
                ObjectNode object = factory.objectNode();
                asObject().forEach((key, member) -> object.set(key, member.toJsonNode()));
                return object;
            default:
                return factory.nullNode();
        }
    }

    /**
     * Converts the value into plain Java objects ({@code String}, {@code Long}, {@code Double},
     * {@code Boolean}, {@code null}, {@code List}, {@code Map}) for models that take {@code Object}.
     *
     * @return The plain representation.
     */
    public Object toPlainObject() {
        switch (kind) {
            case ARRAY:
                List<Object> list = new ArrayList<>();
                asArray().forEach(element -> list.add(element.toPlainObject()));
                return list;
            case OBJECT:
                Map<String, Object> map = new LinkedHashMap<>();
                asObject().forEach((key, member) -> map.put(key, member.toPlainObject()));
                return map;
            default:
                return value;
        }
    }

    static String formatFloat(double number) {
        if (Double.isNaN(number) || Double.isInfinite(number)) {
            return Double.toString(number);
        }
        if (number == 0.0d) {
            return "0.0";
        }
        BigDecimal rounded = new BigDecimal(number).round(new MathContext(SIGNIFICANT_DIGITS, RoundingMode.HALF_EVEN));
        int exponent = rounded.precision() - rounded.scale() - 1;
        String text;
        if (exponent < -4 || exponent >= SIGNIFICANT_DIGITS) {
            String mantissa = rounded.movePointLeft(exponent).stripTrailingZeros().toPlainString();
            text = String.format("%se%s%02d", mantissa, exponent < 0 ? "-" : "+", Math.abs(exponent));
        } else {
            text = rounded.stripTrailingZeros().toPlainString();
        }
        if (text.indexOf('.') < 0 && text.indexOf('e') < 0) {
            text = text + ".0";
        }
        return text;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof JsonValue)) {
            return false;
        }
        JsonValue that = (JsonValue) other;
        return kind == that.kind && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        return kind + "(" + toCanonicalString() + ")";
    }
}
