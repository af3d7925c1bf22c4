package eventsync;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Transient wire representation of an event: {@code {id, type, data, created_at}}.
 *
 * <p>Arrives in a peer's pull response or in a receive request and is consumed by the
 * {@linkplain eventsync.processor.EventProcessor processor}; it is never stored as-is.
 * Every field is optional at this level; validation is the processor's job.
 *
 * @param id        the peer's event identifier, may be {@code null}
 * @param type      the event type, may be {@code null} or empty
 * @param data      the payload, never {@code null} (an empty object when absent)
 * @param createdAt the peer's creation timestamp as sent, may be {@code null}
 */
public record RawEvent(String id, String type, JsonNode data, String createdAt) {

  public RawEvent {
    if (data == null || data.isNull() || data.isMissingNode()) {
      data = JsonNodeFactory.instance.objectNode();
    }
  }

  /**
   * Reads a raw event from one element of a peer's event array.
   *
   * @param node the JSON element
   * @return the raw event
   * @throws IllegalArgumentException if the element is not a JSON object
   */
  public static RawEvent fromJson(JsonNode node) {
    if (node == null || !node.isObject()) {
      throw new IllegalArgumentException("Event must be a JSON object");
    }
    return new RawEvent(
        text(node.get("id")),
        text(node.get("type")),
        node.get("data"),
        text(node.get("created_at")));
  }

  /**
   * Writes this event in wire shape.
   */
  public ObjectNode toJson() {
    ObjectNode node = JsonNodeFactory.instance.objectNode();
    node.put("id", id);
    node.put("type", type);
    node.set("data", data);
    node.put("created_at", createdAt);
    return node;
  }

  private static String text(JsonNode value) {
    if (value == null || value.isNull() || value.isMissingNode()) {
      return null;
    }
    return value.isValueNode() ? value.asText() : value.toString();
  }
}
