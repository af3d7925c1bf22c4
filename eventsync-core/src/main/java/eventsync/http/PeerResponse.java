package eventsync.http;

/**
 * HTTP response from a peer.
 *
 * @param statusCode the HTTP status code
 * @param body       the response body as text, never {@code null}
 */
public record PeerResponse(int statusCode, String body) {

  public PeerResponse {
    if (body == null) {
      body = "";
    }
  }

  public boolean isSuccessful() {
    return statusCode >= 200 && statusCode < 300;
  }
}
