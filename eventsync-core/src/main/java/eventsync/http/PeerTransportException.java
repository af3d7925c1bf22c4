package eventsync.http;

/**
 * Thrown when a peer cannot be reached: connection refused, timeout, interrupted exchange
 * or an invalid URL. A peer that answers with an error status is not a transport failure.
 */
public class PeerTransportException extends Exception {

  public PeerTransportException(String message, Throwable cause) {
    super(message, cause);
  }
}
