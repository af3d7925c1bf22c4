package eventsync.http;

import java.time.Duration;
import java.util.Map;

/**
 * Blocking HTTP transport to a remote peer.
 *
 * @see HttpPeerClient
 */
public interface PeerClient {

  /**
   * Issues a GET request.
   *
   * @param url         the endpoint
   * @param queryParams query parameters to append; {@code null} values are omitted
   * @param headers     request headers
   * @param timeout     request timeout
   * @return the response, whatever its status
   * @throws PeerTransportException if no response was received
   */
  PeerResponse get(String url, Map<String, String> queryParams, Map<String, String> headers,
      Duration timeout) throws PeerTransportException;

  /**
   * Issues a POST request with a JSON body.
   *
   * @param url      the endpoint
   * @param jsonBody the request body
   * @param headers  request headers
   * @param timeout  request timeout
   * @return the response, whatever its status
   * @throws PeerTransportException if no response was received
   */
  PeerResponse postJson(String url, String jsonBody, Map<String, String> headers,
      Duration timeout) throws PeerTransportException;
}
