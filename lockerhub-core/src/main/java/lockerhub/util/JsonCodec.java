package lockerhub.util;

import java.util.Map;

/**
 * Codec for the structured columns ({@code payload}, {@code details},
 * {@code old_values}, {@code new_values}) stored as JSON text.
 *
 * <p>Maps may nest lists, maps, strings, numbers and booleans. Key order survives a
 * round trip. The default implementation ({@link JacksonJsonCodec}) uses Jackson.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

    /**
     * Returns the default singleton implementation.
     *
     * @return the default {@link JsonCodec}
     */
    static JsonCodec getDefault() {
        return JacksonJsonCodec.INSTANCE;
    }

    /**
     * Encodes a map as a JSON object string. Returns {@code null} if the map is null or empty.
     *
     * @param values the values to encode
     * @return JSON string, or {@code null}
     * @throws IllegalArgumentException if a value cannot be serialized
     */
    String toJson(Map<String, Object> values);

    /**
     * Parses a JSON object string into a map. Returns an empty map for {@code null},
     * empty, or {@code "null"} input.
     *
     * @param json the JSON string to parse
     * @return parsed map (never {@code null})
     * @throws IllegalArgumentException if the input is not a valid JSON object
     */
    Map<String, Object> parseObject(String json);
}
