package eventsync.sync;

import eventsync.http.PeerResponse;

/**
 * Outcome of a send.
 *
 * @param success     whether the send succeeded
 * @param message     human-readable summary
 * @param failure     why it failed, {@code null} on success
 * @param eventsCount number of events selected for sending
 * @param response    the destination's response, {@code null} if none was received
 */
public record SendResult(
    boolean success,
    String message,
    SyncFailure failure,
    int eventsCount,
    PeerResponse response
) {

  static SendResult failed(SyncFailure failure, String message, int eventsCount,
      PeerResponse response) {
    return new SendResult(false, message, failure, eventsCount, response);
  }

  /** Process exit code for command-line callers: 0 on success, 1 otherwise. */
  public int exitCode() {
    return success ? 0 : 1;
  }
}
