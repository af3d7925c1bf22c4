package eventsync.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Jackson-backed {@link JsonCodec}.
 *
 * <p>Unknown properties are ignored on binding so that payload classes only need to declare
 * the fields they care about. This is the default implementation, accessible via
 * {@link JsonCodec#getDefault()}.
 */
public final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

  private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
  };

  private final ObjectMapper mapper;

  DefaultJsonCodec() {
    this(new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
  }

  /**
   * Creates a codec around a caller-configured mapper (e.g. the one a Spring context owns).
   */
  public DefaultJsonCodec(ObjectMapper mapper) {
    this.mapper = mapper.copy()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }

  @Override
  public JsonNode readTree(String json) {
    if (json == null || json.isBlank()) {
      return MissingNode.getInstance();
    }
    try {
      return mapper.readTree(json);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Invalid JSON: " + e.getOriginalMessage(), e);
    }
  }

  @Override
  public String toJson(Object value) {
    try {
      return mapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Failed to serialize JSON", e);
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
    if (trimmed.charAt(0) != '{') {
      throw new IllegalArgumentException("Expected JSON object");
    }
    try {
      return mapper.readValue(trimmed, MAP_TYPE);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Invalid JSON object: " + e.getOriginalMessage(), e);
    }
  }

  @Override
  public <T> T treeToValue(JsonNode node, Class<T> type) {
    try {
      return mapper.treeToValue(node, type);
    } catch (JsonProcessingException | IllegalArgumentException e) {
      throw new IllegalArgumentException("Cannot bind JSON to " + type.getSimpleName()
          + ": " + e.getMessage(), e);
    }
  }

  @Override
  public JsonNode valueToTree(Object value) {
    return mapper.valueToTree(value);
  }

  @Override
  public ObjectNode createObjectNode() {
    return mapper.createObjectNode();
  }
}
