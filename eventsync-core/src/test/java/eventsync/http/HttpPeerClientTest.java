package eventsync.http;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class HttpPeerClientTest {
  private static final Duration TIMEOUT = Duration.ofSeconds(5);

  private HttpServer server;
  private String baseUrl;
  private final AtomicReference<String> lastQuery = new AtomicReference<>();
  private final AtomicReference<String> lastAuthorization = new AtomicReference<>();
  private final AtomicReference<String> lastBody = new AtomicReference<>();
  private final AtomicReference<String> lastContentType = new AtomicReference<>();

  @BeforeEach
  void startServer() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext("/events", exchange -> {
      lastQuery.set(exchange.getRequestURI().getRawQuery());
      lastAuthorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
      lastContentType.set(exchange.getRequestHeaders().getFirst("Content-Type"));
      lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
      byte[] response = "{\"events\":[]}".getBytes(StandardCharsets.UTF_8);
      int status = "Bearer good".equals(lastAuthorization.get()) ? 200 : 401;
      exchange.getResponseHeaders().add("Content-Type", "application/json");
      exchange.sendResponseHeaders(status, response.length);
      exchange.getResponseBody().write(response);
      exchange.close();
    });
    server.start();
    baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
  }

  @AfterEach
  void stopServer() {
    server.stop(0);
  }

  @Test
  void getEncodesQueryAndReturnsBody() throws Exception {
    Map<String, String> params = new LinkedHashMap<>();
    params.put("since", "2024-01-01T00:00:00Z");
    params.put("event_type", "a b");
    params.put("skip", null);

    PeerResponse response = new HttpPeerClient().get(baseUrl + "/events", params,
        Map.of("Authorization", "Bearer good"), TIMEOUT);

    assertTrue(response.isSuccessful());
    assertEquals("{\"events\":[]}", response.body());
    assertEquals("since=2024-01-01T00%3A00%3A00Z&event_type=a+b", lastQuery.get());
  }

  @Test
  void errorStatusIsAResponseNotAnException() throws Exception {
    PeerResponse response = new HttpPeerClient().get(baseUrl + "/events", Map.of(),
        Map.of("Authorization", "Bearer bad"), TIMEOUT);

    assertFalse(response.isSuccessful());
    assertEquals(401, response.statusCode());
  }

  @Test
  void postSendsJsonBody() throws Exception {
    PeerResponse response = new HttpPeerClient().postJson(baseUrl + "/events", "{\"events\":[1]}",
        Map.of("Authorization", "Bearer good"), TIMEOUT);

    assertEquals(200, response.statusCode());
    assertEquals("{\"events\":[1]}", lastBody.get());
    assertEquals("application/json", lastContentType.get());
  }

  @Test
  void unreachablePeerIsTransportException() {
    server.stop(0);

    assertThrows(PeerTransportException.class, () -> new HttpPeerClient().get(baseUrl + "/events",
        Map.of(), Map.of(), TIMEOUT));
  }

  @Test
  void invalidUrlIsTransportException() {
    assertThrows(PeerTransportException.class,
        () -> new HttpPeerClient().get("not a url", Map.of(), Map.of(), TIMEOUT));
  }

  @Test
  void withQueryAppendsToExistingQuery() {
    assertEquals("http://x/y?a=1&b=2", HttpPeerClient.withQuery("http://x/y?a=1", Map.of("b", "2")));
    assertEquals("http://x/y", HttpPeerClient.withQuery("http://x/y", Map.of()));
  }
}
