package eventsync.receive;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Body of a receive request: {@code {events: [...], source_url, source_name}}.
 *
 * @param events     the pushed event elements, as sent
 * @param sourceUrl  the sender's URL, may be {@code null}
 * @param sourceName the sender's name, may be {@code null}
 */
public record ReceiveRequest(List<JsonNode> events, String sourceUrl, String sourceName) {

  public ReceiveRequest {
    events = events == null ? List.of() : List.copyOf(events);
  }

  /**
   * Reads a request body.
   *
   * @throws IllegalArgumentException if the body is not an object or {@code events} is not an array
   */
  public static ReceiveRequest fromJson(JsonNode body) {
    if (body == null || !body.isObject()) {
      throw new IllegalArgumentException("Request body must be a JSON object");
    }
    JsonNode events = body.path("events");
    List<JsonNode> elements = new ArrayList<>();
    if (events.isArray()) {
      events.forEach(elements::add);
    } else if (!events.isMissingNode() && !events.isNull()) {
      throw new IllegalArgumentException("'events' must be an array");
    }
    return new ReceiveRequest(elements, text(body.get("source_url")), text(body.get("source_name")));
  }

  private static String text(JsonNode node) {
    return node == null || node.isNull() || node.asText().isBlank() ? null : node.asText();
  }
}
