package checkin.util;

import java.util.List;
import java.util.Map;

/**
 * Codec for the two JSON shapes the engine persists: flat string maps (audit details)
 * and string arrays (a user's check-in times).
 *
 * <p>The default implementation ({@link DefaultJsonCodec}) has no dependencies.
 * Applications with Jackson or Gson on the classpath may implement this interface instead.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

    static JsonCodec getDefault() {
        return DefaultJsonCodec.INSTANCE;
    }

    /**
     * Encodes a string map as a JSON object. Returns {@code null} for a null or empty map.
     */
    String toJson(Map<String, String> values);

    /**
     * Parses a flat JSON object. Returns an empty map for {@code null}, blank or {@code "null"} input.
     * Numbers and booleans are returned in their textual form; {@code null} values are dropped.
     *
     * @throws IllegalArgumentException if the input is not a flat JSON object
     */
    Map<String, String> parseObject(String json);

    /**
     * Encodes a list of strings as a JSON array.
     */
    String toJsonArray(List<String> values);

    /**
     * Parses a JSON array of strings. Returns an empty list for {@code null}, blank or {@code "null"} input.
     *
     * @throws IllegalArgumentException if the input is not a JSON array of strings
     */
    List<String> parseArray(String json);
}
