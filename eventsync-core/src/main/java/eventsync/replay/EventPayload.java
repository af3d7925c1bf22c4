package eventsync.replay;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.Objects;

/**
 * Read-only view over a stored event payload with named, defaulted accessors.
 *
 * <p>Accessors return the supplied default when the field is absent or JSON {@code null}.
 */
public final class EventPayload {
  private final JsonNode node;

  public EventPayload(JsonNode node) {
    this.node = node == null || node.isMissingNode() || node.isNull()
        ? JsonNodeFactory.instance.objectNode()
        : node;
  }

  public boolean has(String field) {
    JsonNode value = node.get(field);
    return value != null && !value.isNull();
  }

  public String getString(String field) {
    return getString(field, null);
  }

  public String getString(String field, String defaultValue) {
    if (!has(field)) {
      return defaultValue;
    }
    JsonNode value = node.get(field);
    return value.isValueNode() ? value.asText() : value.toString();
  }

  /**
   * Returns a required string field.
   *
   * @throws IllegalArgumentException if the field is absent
   */
  public String requireString(String field) {
    String value = getString(field, null);
    if (value == null) {
      throw new IllegalArgumentException("Missing required field '" + field + "'");
    }
    return value;
  }

  public long getLong(String field, long defaultValue) {
    return has(field) ? node.get(field).asLong(defaultValue) : defaultValue;
  }

  public int getInt(String field, int defaultValue) {
    return has(field) ? node.get(field).asInt(defaultValue) : defaultValue;
  }

  public double getDouble(String field, double defaultValue) {
    return has(field) ? node.get(field).asDouble(defaultValue) : defaultValue;
  }

  public boolean getBoolean(String field, boolean defaultValue) {
    return has(field) ? node.get(field).asBoolean(defaultValue) : defaultValue;
  }

  /**
   * Returns a nested value, or a missing node if absent.
   */
  public JsonNode get(String field) {
    return node.path(field);
  }

  public JsonNode node() {
    return node;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof EventPayload)) {
      return false;
    }
    return node.equals(((EventPayload) o).node);
  }

  @Override
  public int hashCode() {
    return Objects.hash(node);
  }

  @Override
  public String toString() {
    return node.toString();
  }
}
