package eventsync.sync;

import eventsync.RawEvent;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a pull.
 *
 * @param success       whether the pull succeeded
 * @param message       human-readable summary
 * @param failure       why it failed, {@code null} on success
 * @param eventsCount   number of events the source returned
 * @param processed     events stored
 * @param skipped       events filtered out or already present
 * @param errors        per-event failures
 * @param events        the fetched events, populated for dry runs only
 * @param typeBreakdown processed events per type, populated when requested
 */
public record PullResult(
    boolean success,
    String message,
    SyncFailure failure,
    int eventsCount,
    int processed,
    int skipped,
    List<SyncError> errors,
    List<RawEvent> events,
    Map<String, Integer> typeBreakdown
) {

  public PullResult {
    errors = errors == null ? List.of() : List.copyOf(errors);
    events = events == null ? List.of() : List.copyOf(events);
    typeBreakdown = typeBreakdown == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(typeBreakdown));
  }

  static PullResult failed(SyncFailure failure, String message) {
    return new PullResult(false, message, failure, 0, 0, 0, null, null, null);
  }

  public int errorCount() {
    return errors.size();
  }

  /** Process exit code for command-line callers: 0 on success, 1 otherwise. */
  public int exitCode() {
    return success ? 0 : 1;
  }
}
