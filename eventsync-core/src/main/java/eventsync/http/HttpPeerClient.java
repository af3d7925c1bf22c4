package eventsync.http;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * {@link PeerClient} on the JDK {@link HttpClient}.
 */
public final class HttpPeerClient implements PeerClient {
  private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

  private final HttpClient http;

  public HttpPeerClient() {
    this(HttpClient.newBuilder()
        .connectTimeout(CONNECT_TIMEOUT)
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build());
  }

  public HttpPeerClient(HttpClient http) {
    this.http = Objects.requireNonNull(http, "http");
  }

  @Override
  public PeerResponse get(String url, Map<String, String> queryParams, Map<String, String> headers,
      Duration timeout) throws PeerTransportException {
    HttpRequest.Builder request = newRequest(withQuery(url, queryParams), headers, timeout)
        .header("Accept", "application/json")
        .GET();
    return send(request);
  }

  @Override
  public PeerResponse postJson(String url, String jsonBody, Map<String, String> headers,
      Duration timeout) throws PeerTransportException {
    HttpRequest.Builder request = newRequest(url, headers, timeout)
        .header("Accept", "application/json")
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(jsonBody, StandardCharsets.UTF_8));
    return send(request);
  }

  private HttpRequest.Builder newRequest(String url, Map<String, String> headers, Duration timeout)
      throws PeerTransportException {
    HttpRequest.Builder builder;
    try {
      builder = HttpRequest.newBuilder(URI.create(url)).timeout(timeout);
    } catch (IllegalArgumentException e) {
      throw new PeerTransportException("Invalid peer URL: " + url, e);
    }
    if (headers != null) {
      headers.forEach(builder::header);
    }
    return builder;
  }

  private PeerResponse send(HttpRequest.Builder request) throws PeerTransportException {
    HttpRequest built = request.build();
    try {
      HttpResponse<String> response = http.send(built,
          HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
      return new PeerResponse(response.statusCode(), response.body());
    } catch (IOException e) {
      throw new PeerTransportException(built.method() + " " + built.uri() + " failed: "
          + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new PeerTransportException(built.method() + " " + built.uri() + " interrupted", e);
    }
  }

  static String withQuery(String url, Map<String, String> queryParams) {
    if (queryParams == null || queryParams.isEmpty()) {
      return url;
    }
    StringBuilder sb = new StringBuilder(url);
    char separator = url.indexOf('?') >= 0 ? '&' : '?';
    for (Map.Entry<String, String> param : queryParams.entrySet()) {
      if (param.getValue() == null) {
        continue;
      }
      sb.append(separator)
          .append(URLEncoder.encode(param.getKey(), StandardCharsets.UTF_8))
          .append('=')
          .append(URLEncoder.encode(param.getValue(), StandardCharsets.UTF_8));
      separator = '&';
    }
    return sb.toString();
  }
}
