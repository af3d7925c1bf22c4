package eventsync.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Map;

/**
 * JSON codec used for event payloads, sync metadata, operation log details and the
 * peer wire format.
 *
 * <p>The default implementation ({@link DefaultJsonCodec}) is backed by a shared Jackson
 * {@code ObjectMapper}. Payloads are arbitrary JSON documents, so the codec works on
 * {@link JsonNode} trees rather than on fixed classes.
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
    return DefaultJsonCodec.INSTANCE;
  }

  /**
   * Parses JSON text into a tree.
   *
   * @param json the JSON text
   * @return the parsed tree; a {@code MissingNode} for {@code null} or blank input
   * @throws IllegalArgumentException if the input is not valid JSON
   */
  JsonNode readTree(String json);

  /**
   * Serializes a value (tree, map, record or bean) as compact JSON text.
   *
   * @param value the value to encode
   * @return JSON text, {@code "null"} for a {@code null} value
   * @throws IllegalArgumentException if the value cannot be serialized
   */
  String toJson(Object value);

  /**
   * Parses a JSON object into an ordered map. Returns an empty map for {@code null},
   * blank or {@code "null"} input.
   *
   * @param json the JSON text
   * @return parsed map (never {@code null})
   * @throws IllegalArgumentException if the input is not a JSON object
   */
  Map<String, Object> parseObject(String json);

  /**
   * Binds a tree onto a target type, ignoring properties the type does not declare.
   *
   * @param node the source tree
   * @param type the target type
   * @param <T>  the target type
   * @return the bound value
   * @throws IllegalArgumentException if binding fails
   */
  <T> T treeToValue(JsonNode node, Class<T> type);

  /**
   * Converts a value into a tree.
   */
  JsonNode valueToTree(Object value);

  /**
   * Creates an empty object node.
   */
  ObjectNode createObjectNode();
}
