package eventsync.receive;

/**
 * Thrown when an inbound receive or feed request presents a missing or wrong key.
 */
public class SyncAuthenticationException extends RuntimeException {

  public SyncAuthenticationException(String message) {
    super(message);
  }
}
