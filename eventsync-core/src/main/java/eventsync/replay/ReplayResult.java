package eventsync.replay;

import eventsync.sync.SyncError;

import java.util.List;

/**
 * Outcome of a replay run.
 *
 * @param success    whether the run succeeded
 * @param message    human-readable summary
 * @param processed  records replayed and marked
 * @param skipped    records with no registered handler
 * @param errors     records whose handler failed
 * @param batches    batches executed (zero for dry runs)
 * @param candidates pending records found
 */
public record ReplayResult(
    boolean success,
    String message,
    int processed,
    int skipped,
    List<SyncError> errors,
    int batches,
    int candidates
) {

  public ReplayResult {
    errors = errors == null ? List.of() : List.copyOf(errors);
  }

  public int errorCount() {
    return errors.size();
  }

  /** Process exit code for command-line callers: 0 on success, 1 otherwise. */
  public int exitCode() {
    return success ? 0 : 1;
  }
}
