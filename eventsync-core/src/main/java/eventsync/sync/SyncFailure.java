package eventsync.sync;

/**
 * Reason a pull or send did not succeed.
 */
public enum SyncFailure {
  /** No source URL configured; nothing was attempted. */
  SOURCE_NOT_CONFIGURED("Source URL not configured"),
  /** No destination URL or key configured; nothing was attempted. */
  DESTINATION_NOT_CONFIGURED("Destination URL or API key not configured"),
  /** The peer could not be reached. */
  TRANSPORT("Peer unreachable"),
  /** The peer answered with a non-2xx status. */
  REMOTE_STATUS("Peer returned an error status"),
  /** The peer's body could not be read as an event envelope. */
  INVALID_RESPONSE("Peer returned an unreadable response"),
  /** The local record store could not be read. */
  STORAGE("Local storage failed"),
  /** Every event in the batch failed and none was stored. */
  ALL_EVENTS_FAILED("No events could be processed");

  private final String description;

  SyncFailure(String description) {
    this.description = description;
  }

  public String description() {
    return description;
  }
}
