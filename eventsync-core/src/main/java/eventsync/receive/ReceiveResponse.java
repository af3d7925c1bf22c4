package eventsync.receive;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response to a receive request.
 *
 * @param success {@code true} unless every event failed
 * @param results per-event outcomes, in request order
 */
public record ReceiveResponse(
    @JsonProperty("success") boolean success,
    @JsonProperty("results") List<ReceivedEventResult> results
) {

  public ReceiveResponse {
    results = results == null ? List.of() : List.copyOf(results);
  }

  @JsonIgnore
  public long processedCount() {
    return results.stream().filter(ReceivedEventResult::isProcessed).count();
  }
}
