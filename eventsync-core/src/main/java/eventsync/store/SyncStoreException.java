package eventsync.store;

/**
 * Unchecked exception for storage failures of synced events or operation log entries.
 */
public class SyncStoreException extends RuntimeException {

  public SyncStoreException(String message) {
    super(message);
  }

  public SyncStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
