package app.tiered.entitlement.value;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Converts feature values between native Java objects, the {@link FlexibleValue} union and the
 * tagged JSON wire form: {@code {"type": "integer", "value": 100}} for a single value, or
 * {@code {"en": {"type": ..., "value": ...}, "ar": {...}}} for a per-locale value.
 */
@Component
public class FlexibleValueCodec {

    private static final Logger log = LoggerFactory.getLogger(FlexibleValueCodec.class);

    private static final Pattern LOCALE_CODE = Pattern.compile("^[a-z]{2}(-[A-Z]{2})?$");
    private static final Pattern INTEGER_TEXT = Pattern.compile("^-?\\d+$");
    private static final Pattern DECIMAL_TEXT = Pattern.compile("^-?(\\d+\\.\\d*|\\.\\d+|\\d+)([eE][-+]?\\d+)?$");
    private static final Pattern NUMERIC_KEY = Pattern.compile("^\\d+$");

    private static final Set<String> NULL_WORDS = Set.of("null", "nil", "");
    private static final Set<String> TRUE_WORDS = Set.of("true", "1", "yes", "on");
    private static final Set<String> FALSE_WORDS = Set.of("false", "0", "no", "off");

    private static final String TYPE_FIELD = "type";
    private static final String VALUE_FIELD = "value";

    private final ObjectMapper objectMapper;
    private final JsonNodeFactory nodes = JsonNodeFactory.instance;

    public FlexibleValueCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public static boolean isLocaleCode(String key) {
        return key != null && LOCALE_CODE.matcher(key).matches();
    }

    public JsonNode encode(Object value) {
        return encode(toLocalizable(value));
    }

    public JsonNode encode(LocalizableValue value) {
        if (value instanceof LocalizableValue.Translatable translatable) {
            ObjectNode out = nodes.objectNode();
            translatable.entries().forEach((locale, entry) -> out.set(locale, tagged(entry)));
            return out;
        }
        return tagged(((LocalizableValue.Single) value).value());
    }

    public JsonNode encode(FlexibleValue value) {
        return tagged(value);
    }

    /**
     * Decodes a stored value. Tagged single values and locale maps are read as such; anything else
     * is treated as legacy data and coerced.
     */
    public LocalizableValue decode(JsonNode wire) {
        if (wire == null || wire.isNull() || wire.isMissingNode()) {
            return LocalizableValue.single(FlexibleValue.ofNull());
        }
        if (isTagged(wire)) {
            return LocalizableValue.single(untag(wire));
        }
        if (isTranslatableWire(wire)) {
            Map<String, FlexibleValue> entries = new LinkedHashMap<>();
            wire.properties().forEach(e -> entries.put(e.getKey(), untag(e.getValue())));
            return LocalizableValue.translatable(entries);
        }
        if (wire.isTextual()) {
            return decodeText(wire.asText());
        }
        return LocalizableValue.single(fromJson(wire));
    }

    public LocalizableValue decodeText(String raw) {
        if (raw == null) {
            return LocalizableValue.single(FlexibleValue.ofNull());
        }
        String trimmed = raw.trim();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (NULL_WORDS.contains(lower)) {
            return LocalizableValue.single(FlexibleValue.ofNull());
        }
        if (TRUE_WORDS.contains(lower)) {
            return LocalizableValue.single(new FlexibleValue.BoolValue(true));
        }
        if (FALSE_WORDS.contains(lower)) {
            return LocalizableValue.single(new FlexibleValue.BoolValue(false));
        }
        if (INTEGER_TEXT.matcher(trimmed).matches()) {
            return LocalizableValue.single(integerOf(new BigInteger(trimmed)));
        }
        if (DECIMAL_TEXT.matcher(trimmed).matches()) {
            return LocalizableValue.single(new FlexibleValue.FloatValue(Double.parseDouble(trimmed)));
        }
        if (looksLikeJson(trimmed)) {
            try {
                return decode(objectMapper.readTree(trimmed));
            } catch (JsonProcessingException ex) {
                log.debug("Stored feature value is not valid JSON, keeping raw text: {}", ex.getOriginalMessage());
            }
        }
        return LocalizableValue.single(new FlexibleValue.StringValue(raw));
    }

    public FlexibleValue resolveLocalized(JsonNode wire, String locale, String fallbackLocale) {
        return resolveLocalized(decode(wire), locale, fallbackLocale);
    }

    public FlexibleValue resolveLocalized(LocalizableValue value, String locale, String fallbackLocale) {
        if (value instanceof LocalizableValue.Single single) {
            return single.value();
        }
        Map<String, FlexibleValue> entries = ((LocalizableValue.Translatable) value).entries();
        if (locale != null && entries.containsKey(locale)) {
            return entries.get(locale);
        }
        if (fallbackLocale != null && entries.containsKey(fallbackLocale)) {
            return entries.get(fallbackLocale);
        }
        return entries.values().iterator().next();
    }

    /**
     * Wraps a native value. Non-empty maps keyed only by locale codes become translatable.
     */
    public LocalizableValue toLocalizable(Object value) {
        if (value instanceof LocalizableValue localizable) {
            return localizable;
        }
        if (value instanceof Map<?, ?> map && isTranslatableMap(map)) {
            Map<String, FlexibleValue> entries = new LinkedHashMap<>();
            map.forEach((k, v) -> entries.put((String) k, fromNative(v)));
            return LocalizableValue.translatable(entries);
        }
        return LocalizableValue.single(fromNative(value));
    }

    public FlexibleValue fromNative(Object value) {
        if (value == null) {
            return FlexibleValue.ofNull();
        }
        if (value instanceof FlexibleValue flexible) {
            return flexible;
        }
        if (value instanceof JsonNode node) {
            return fromJson(node);
        }
        if (value instanceof Boolean b) {
            return new FlexibleValue.BoolValue(b);
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return new FlexibleValue.IntValue(((Number) value).longValue());
        }
        if (value instanceof BigInteger big) {
            return integerOf(big);
        }
        if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
            return new FlexibleValue.FloatValue(((Number) value).doubleValue());
        }
        if (value instanceof CharSequence text) {
            return new FlexibleValue.StringValue(text.toString());
        }
        if (value instanceof Collection<?> collection) {
            List<FlexibleValue> items = new ArrayList<>(collection.size());
            for (Object item : collection) {
                items.add(fromNative(item));
            }
            return new FlexibleValue.ListValue(items);
        }
        if (value instanceof Object[] array) {
            return fromNative(Arrays.asList(array));
        }
        if (value instanceof Map<?, ?> map) {
            return fromNativeMap(map);
        }
        throw new IllegalArgumentException("Unsupported feature value type: " + value.getClass().getName());
    }

    public Object toNative(FlexibleValue value) {
        if (value instanceof FlexibleValue.IntValue v) {
            return v.value();
        }
        if (value instanceof FlexibleValue.FloatValue v) {
            return v.value();
        }
        if (value instanceof FlexibleValue.BoolValue v) {
            return v.value();
        }
        if (value instanceof FlexibleValue.StringValue v) {
            return v.value();
        }
        if (value instanceof FlexibleValue.ListValue v) {
            List<Object> out = new ArrayList<>(v.items().size());
            v.items().forEach(item -> out.add(toNative(item)));
            return out;
        }
        if (value instanceof FlexibleValue.ObjectValue v) {
            Map<String, Object> out = new LinkedHashMap<>();
            v.fields().forEach((k, item) -> out.put(k, toNative(item)));
            return out;
        }
        return null;
    }

    public FlexibleValue fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return FlexibleValue.ofNull();
        }
        if (node.isBoolean()) {
            return new FlexibleValue.BoolValue(node.booleanValue());
        }
        if (node.isIntegralNumber()) {
            return integerOf(node.bigIntegerValue());
        }
        if (node.isNumber()) {
            return new FlexibleValue.FloatValue(node.doubleValue());
        }
        if (node.isTextual()) {
            return new FlexibleValue.StringValue(node.textValue());
        }
        if (node.isArray()) {
            List<FlexibleValue> items = new ArrayList<>(node.size());
            node.forEach(item -> items.add(fromJson(item)));
            return new FlexibleValue.ListValue(items);
        }
        if (node.isObject()) {
            Map<String, FlexibleValue> fields = new LinkedHashMap<>();
            node.properties().forEach(e -> fields.put(e.getKey(), fromJson(e.getValue())));
            return new FlexibleValue.ObjectValue(fields);
        }
        throw new IllegalArgumentException("Unsupported JSON node: " + node.getNodeType());
    }

    public JsonNode toJson(FlexibleValue value) {
        if (value instanceof FlexibleValue.IntValue v) {
            return nodes.numberNode(v.value());
        }
        if (value instanceof FlexibleValue.FloatValue v) {
            return nodes.numberNode(v.value());
        }
        if (value instanceof FlexibleValue.BoolValue v) {
            return nodes.booleanNode(v.value());
        }
        if (value instanceof FlexibleValue.StringValue v) {
            return nodes.textNode(v.value());
        }
        if (value instanceof FlexibleValue.ListValue v) {
            ArrayNode out = nodes.arrayNode();
            v.items().forEach(item -> out.add(toJson(item)));
            return out;
        }
        if (value instanceof FlexibleValue.ObjectValue v) {
            ObjectNode out = nodes.objectNode();
            v.fields().forEach((k, item) -> out.set(k, toJson(item)));
            return out;
        }
        return nodes.nullNode();
    }

    private ObjectNode tagged(FlexibleValue value) {
        ObjectNode out = nodes.objectNode();
        out.put(TYPE_FIELD, value.type().wireName());
        out.set(VALUE_FIELD, toJson(value));
        return out;
    }

    private FlexibleValue untag(JsonNode wire) {
        ValueType type = ValueType.fromWire(wire.path(TYPE_FIELD).asText(null))
                .orElseThrow(() -> new IllegalArgumentException("Unknown value type: " + wire.path(TYPE_FIELD)));
        JsonNode raw = wire.get(VALUE_FIELD);
        if (raw == null || raw.isNull()) {
            return FlexibleValue.ofNull();
        }
        switch (type) {
            case INTEGER:
                if (raw.isTextual()) {
                    return integerOf(new BigInteger(raw.asText().trim()));
                }
                return raw.isIntegralNumber()
                        ? integerOf(raw.bigIntegerValue())
                        : new FlexibleValue.IntValue(raw.asLong());
            case FLOAT:
                return new FlexibleValue.FloatValue(raw.isTextual() ? Double.parseDouble(raw.asText().trim()) : raw.asDouble());
            case BOOLEAN:
                if (raw.isTextual()) {
                    return new FlexibleValue.BoolValue(TRUE_WORDS.contains(raw.asText().trim().toLowerCase(Locale.ROOT)));
                }
                return new FlexibleValue.BoolValue(raw.asBoolean());
            case STRING:
                return new FlexibleValue.StringValue(raw.isTextual() ? raw.textValue() : raw.toString());
            case ARRAY:
                if (raw.isObject()) {
                    return fromNativeMap(objectMapper.convertValue(raw, Map.class));
                }
                return fromJson(raw);
            case NULL:
                return FlexibleValue.ofNull();
            default:
                return fromJson(raw);
        }
    }

    private static boolean isTagged(JsonNode wire) {
        if (!wire.isObject() || wire.size() != 2 || !wire.has(TYPE_FIELD) || !wire.has(VALUE_FIELD)) {
            return false;
        }
        JsonNode type = wire.get(TYPE_FIELD);
        return type.isTextual() && ValueType.fromWire(type.textValue()).isPresent();
    }

    private static boolean isTranslatableWire(JsonNode wire) {
        if (!wire.isObject() || wire.isEmpty()) {
            return false;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = wire.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!isLocaleCode(field.getKey()) || !isTagged(field.getValue())) {
                return false;
            }
        }
        return true;
    }

    private boolean isTranslatableMap(Map<?, ?> map) {
        if (map.isEmpty()) {
            return false;
        }
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (!(entry.getKey() instanceof String key) || !isLocaleCode(key) || !isStorable(entry.getValue())) {
                return false;
            }
        }
        return true;
    }

    private boolean isStorable(Object value) {
        if (value == null || value instanceof Boolean || value instanceof Number
                || value instanceof CharSequence || value instanceof FlexibleValue || value instanceof JsonNode) {
            return true;
        }
        if (value instanceof Collection<?> collection) {
            return collection.stream().allMatch(this::isStorable);
        }
        if (value instanceof Object[] array) {
            return isStorable(Arrays.asList(array));
        }
        if (value instanceof Map<?, ?> map) {
            return map.values().stream().allMatch(this::isStorable);
        }
        return false;
    }

    private FlexibleValue fromNativeMap(Map<?, ?> map) {
        if (!map.isEmpty() && map.keySet().stream().allMatch(FlexibleValueCodec::isNumericKey)) {
            TreeMap<Long, Object> ordered = new TreeMap<>();
            map.forEach((k, v) -> ordered.put(Long.parseLong(k.toString()), v));
            return fromNative(new ArrayList<>(ordered.values()));
        }
        Map<String, FlexibleValue> fields = new LinkedHashMap<>();
        map.forEach((k, v) -> fields.put(String.valueOf(k), fromNative(v)));
        return new FlexibleValue.ObjectValue(fields);
    }

    private static boolean isNumericKey(Object key) {
        if (key instanceof Integer || key instanceof Long || key instanceof Short || key instanceof Byte) {
            return ((Number) key).longValue() >= 0;
        }
        return key instanceof String text && NUMERIC_KEY.matcher(text).matches() && text.length() < 19;
    }

    private static FlexibleValue integerOf(BigInteger value) {
        if (value.bitLength() < 64) {
            return new FlexibleValue.IntValue(value.longValue());
        }
        return new FlexibleValue.FloatValue(value.doubleValue());
    }

    private static boolean looksLikeJson(String text) {
        return text.startsWith("{") || text.startsWith("[") || text.startsWith("\"");
    }
}
