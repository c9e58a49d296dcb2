package ca.gc.cra.docket.infrastructure.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.docket.application.port.UpstreamRequest;
import ca.gc.cra.docket.application.port.UpstreamResponse;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JdkHttpUpstreamAdapterTest {
  private HttpServer server;
  private boolean stopped;
  private final Map<String, String> seen = new ConcurrentHashMap<>();
  private final JdkHttpUpstreamAdapter adapter = new JdkHttpUpstreamAdapter(Duration.ofSeconds(5));

  @BeforeEach
  void startServer() throws IOException {
    server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
    server.createContext("/v2/projects/7/notes", exchange -> {
      seen.put("method", exchange.getRequestMethod());
      seen.put("query", String.valueOf(exchange.getRequestURI().getRawQuery()));
      seen.put("authorization", String.valueOf(exchange.getRequestHeaders().getFirst("Authorization")));
      seen.put("contentType", String.valueOf(exchange.getRequestHeaders().getFirst("Content-Type")));
      seen.put("body", new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
      reply(exchange, 200, "[{\"id\":1}]");
    });
    server.createContext("/v2/projects/7/emails", exchange -> reply(exchange, 404, "<html>missing</html>"));
    server.start();
  }

  @AfterEach
  void stopServer() {
    if (!stopped) {
      server.stop(0);
    }
  }

  @Test
  void sendsGetWithHeadersAndReturnsBody() throws Exception {
    UpstreamResponse response = adapter.send(UpstreamRequest.get(
        uri("/v2/projects/7/notes?limit=50&offset=0"), Map.of("Authorization", "Bearer tok")));

    assertEquals(200, response.status());
    assertEquals("[{\"id\":1}]", response.body());
    assertEquals("GET", seen.get("method"));
    assertEquals("limit=50&offset=0", seen.get("query"));
    assertEquals("Bearer tok", seen.get("authorization"));
  }

  @Test
  void sendsPostJsonBody() throws Exception {
    adapter.send(UpstreamRequest.post(uri("/v2/projects/7/notes"), Map.of(), "{\"limit\":50,\"offset\":0}"));

    assertEquals("POST", seen.get("method"));
    assertEquals("application/json", seen.get("contentType"));
    assertEquals("{\"limit\":50,\"offset\":0}", seen.get("body"));
  }

  @Test
  void nonSuccessStatusIsReturnedNotThrown() throws Exception {
    UpstreamResponse response = adapter.send(UpstreamRequest.get(uri("/v2/projects/7/emails"), Map.of()));
    assertEquals(404, response.status());
    assertEquals("<html>missing</html>", response.body());
  }

  @Test
  void connectionFailureRaisesIOException() throws Exception {
    URI closed = uri("/v2/projects/7/notes");
    server.stop(0);
    stopped = true;
    assertThrows(IOException.class, () -> adapter.send(UpstreamRequest.get(closed, Map.of())));
  }

  private URI uri(String pathAndQuery) {
    return URI.create("http://127.0.0.1:" + server.getAddress().getPort() + pathAndQuery);
  }

  private static void reply(com.sun.net.httpserver.HttpExchange exchange, int status, String body)
      throws IOException {
    byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
    exchange.sendResponseHeaders(status, bytes.length);
    try (OutputStream out = exchange.getResponseBody()) {
      out.write(bytes);
    }
  }
}
