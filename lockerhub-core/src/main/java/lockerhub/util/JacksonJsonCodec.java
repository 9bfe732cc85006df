package lockerhub.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@link JsonCodec} backed by a Jackson {@link ObjectMapper}.
 *
 * <p>Objects are read into {@link LinkedHashMap}s so key order is preserved. Temporal
 * values should be put into maps as ISO-8601 strings.
 */
public final class JacksonJsonCodec implements JsonCodec {
    static final JacksonJsonCodec INSTANCE = new JacksonJsonCodec(new ObjectMapper());

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public JacksonJsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper")
                .copy()
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    }

    @Override
    public String toJson(Map<String, Object> values) {
        if (values == null || values.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize values to JSON", e);
        }
    }

    @Override
    public Map<String, Object> parseObject(String json) {
        if (json == null) {
            return Collections.emptyMap();
        }
        String trimmed = json.trim();
        if (trimmed.isEmpty() || "null".equals(trimmed)) {
            return Collections.emptyMap();
        }
        if (!trimmed.startsWith("{")) {
            throw new IllegalArgumentException("Expected JSON object, got: " + abbreviate(trimmed));
        }
        try {
            return Collections.unmodifiableMap(objectMapper.readValue(trimmed, MAP_TYPE));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON object: " + abbreviate(trimmed), e);
        }
    }

    private static String abbreviate(String text) {
        return text.length() <= 64 ? text : text.substring(0, 64) + "...";
    }
}
