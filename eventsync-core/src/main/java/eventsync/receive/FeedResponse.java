package eventsync.receive;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Feed payload: {@code {success, count, events, source_url, source_name}}.
 */
public record FeedResponse(
    @JsonProperty("success") boolean success,
    @JsonProperty("count") int count,
    @JsonProperty("events") List<ObjectNode> events,
    @JsonProperty("source_url") String sourceUrl,
    @JsonProperty("source_name") String sourceName
) {

  public FeedResponse {
    events = events == null ? List.of() : List.copyOf(events);
  }
}
