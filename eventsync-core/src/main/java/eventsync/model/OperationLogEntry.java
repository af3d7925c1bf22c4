package eventsync.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Append-only audit record of one orchestrated sync operation.
 *
 * @param id          store-assigned identifier, {@code null} before the entry is appended
 * @param operation   the operation kind
 * @param status      the outcome
 * @param details     operation-specific details (counts, error text, response body)
 * @param eventsCount number of events the operation covered (never negative)
 * @param timestamp   when the entry was recorded
 */
public record OperationLogEntry(
    Long id,
    Operation operation,
    OperationStatus status,
    Map<String, Object> details,
    int eventsCount,
    Instant timestamp
) {

  public OperationLogEntry {
    Objects.requireNonNull(operation, "operation");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(timestamp, "timestamp");
    if (eventsCount < 0) {
      throw new IllegalArgumentException("eventsCount must be >= 0");
    }
    details = details == null
        ? Collections.emptyMap()
        : Collections.unmodifiableMap(new LinkedHashMap<>(details));
  }

  /**
   * Creates a new, not yet persisted entry.
   */
  public static OperationLogEntry of(Operation operation, OperationStatus status,
      int eventsCount, Map<String, Object> details, Instant timestamp) {
    return new OperationLogEntry(null, operation, status, details, eventsCount, timestamp);
  }

  public boolean isSuccessful() {
    return status == OperationStatus.SUCCESS;
  }

  /**
   * Human-readable one-line summary, e.g. {@code "Pull 3 events from source: success"}.
   */
  public String describe() {
    String count = eventsCount > 0 ? eventsCount + " events" : "no events";
    if (operation == Operation.PULL) {
      return "Pull " + count + " from source: " + status.code();
    }
    return operation.code() + " operation: " + status.code();
  }
}
