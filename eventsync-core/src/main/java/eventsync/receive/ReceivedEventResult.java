package eventsync.receive;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-event outcome reported back to the sender.
 *
 * @param eventId the event identifier, {@code null} if the event had none
 * @param status  {@code processed} or {@code error}
 * @param message detail
 */
public record ReceivedEventResult(
    @JsonProperty("event_id") String eventId,
    @JsonProperty("status") String status,
    @JsonProperty("message") String message
) {
  public static final String PROCESSED = "processed";
  public static final String ERROR = "error";

  static ReceivedEventResult processed(String eventId, String message) {
    return new ReceivedEventResult(eventId, PROCESSED, message);
  }

  static ReceivedEventResult error(String eventId, String message) {
    return new ReceivedEventResult(eventId, ERROR, message);
  }

  @JsonIgnore
  public boolean isProcessed() {
    return PROCESSED.equals(status);
  }
}
