package io.relay.http;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.relay.spi.WebhookTransport;
import io.relay.util.Truncation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class HttpClientWebhookTransportTest {
  private HttpServer server;
  private ExecutorService serverThreads;
  private HttpClientWebhookTransport transport;
  private final AtomicReference<String> receivedBody = new AtomicReference<>();
  private final AtomicReference<String> receivedSignature = new AtomicReference<>();
  private final AtomicReference<String> receivedContentType = new AtomicReference<>();

  @BeforeEach
  void setUp() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    serverThreads = Executors.newCachedThreadPool();
    server.setExecutor(serverThreads);
    server.createContext("/ok", exchange -> {
      receivedBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
      receivedSignature.set(exchange.getRequestHeaders().getFirst("X-Webhook-Signature"));
      receivedContentType.set(exchange.getRequestHeaders().getFirst("Content-Type"));
      respond(exchange, 200, "{\"received\":true}");
    });
    server.createContext("/error", exchange -> respond(exchange, 503, "maintenance"));
    server.createContext("/redirect", exchange -> {
      exchange.getResponseHeaders().add("Location", "/ok");
      respond(exchange, 302, "");
    });
    server.createContext("/large", exchange -> respond(exchange, 500, "x".repeat(10_000)));
    server.createContext("/slow", exchange -> {
      try {
        Thread.sleep(2_000);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      respond(exchange, 200, "late");
    });
    server.createContext("/trickle", exchange -> {
      exchange.sendResponseHeaders(200, 0);
      try (OutputStream os = exchange.getResponseBody()) {
        for (int i = 0; i < 20; i++) {
          os.write('x');
          os.flush();
          Thread.sleep(200);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } catch (IOException e) {
        // client gave up
      }
      exchange.close();
    });
    server.start();
    transport = HttpClientWebhookTransport.builder().maxConnections(10).maxConnectionsPerRoute(5).build();
  }

  @AfterEach
  void tearDown() {
    transport.close();
    server.stop(0);
    serverThreads.shutdownNow();
  }

  @Test
  void postsBodyWithHeaders() throws IOException {
    WebhookTransport.Response response = transport.send(request("/ok", Duration.ofSeconds(5)));

    assertEquals(200, response.statusCode());
    assertTrue(response.isSuccessful());
    assertEquals("{\"received\":true}", response.body());
    assertEquals("{\"id\":\"evt_1\"}", receivedBody.get());
    assertEquals("t=1,v1=abc", receivedSignature.get());
    assertTrue(receivedContentType.get().startsWith("application/json"));
  }

  @Test
  void returnsErrorStatusWithoutThrowing() throws IOException {
    WebhookTransport.Response response = transport.send(request("/error", Duration.ofSeconds(5)));

    assertEquals(503, response.statusCode());
    assertFalse(response.isSuccessful());
    assertEquals("maintenance", response.body());
  }

  @Test
  void doesNotFollowRedirects() throws IOException {
    WebhookTransport.Response response = transport.send(request("/redirect", Duration.ofSeconds(5)));

    assertEquals(302, response.statusCode());
    assertFalse(response.isSuccessful());
    assertNull(receivedBody.get());
  }

  @Test
  void truncatesLargeBodies() throws IOException {
    WebhookTransport.Response response = transport.send(request("/large", Duration.ofSeconds(5)));

    assertEquals(Truncation.truncate("x".repeat(10_000)), response.body());
    assertTrue(response.body().length() < 10_000);
  }

  @Test
  void slowEndpointTimesOut() {
    assertThrows(IOException.class, () -> transport.send(request("/slow", Duration.ofMillis(200))));
  }

  @Test
  void tricklingEndpointIsCutOffAtDeadline() {
    long started = System.nanoTime();

    SocketTimeoutException ex = assertThrows(SocketTimeoutException.class,
        () -> transport.send(request("/trickle", Duration.ofMillis(500))));

    long elapsedMs = Duration.ofNanos(System.nanoTime() - started).toMillis();
    assertTrue(elapsedMs < 2_000, "attempt ran for " + elapsedMs + " ms");
    assertTrue(ex.getMessage().contains("exceeded 500 ms"));
  }

  @Test
  void transportStaysUsableAfterDeadline() throws IOException {
    assertThrows(SocketTimeoutException.class,
        () -> transport.send(request("/trickle", Duration.ofMillis(300))));

    assertEquals(200, transport.send(request("/ok", Duration.ofSeconds(5))).statusCode());
  }

  @Test
  void refusedConnectionThrows() throws IOException {
    int port;
    try (ServerSocket socket = new ServerSocket(0)) {
      port = socket.getLocalPort();
    }
    WebhookTransport.Request request = new WebhookTransport.Request("http://127.0.0.1:" + port + "/hook",
        Map.of(), "{}", Duration.ofSeconds(2));

    assertThrows(IOException.class, () -> transport.send(request));
  }

  @Test
  void builderValidation() {
    assertThrows(IllegalArgumentException.class, () -> HttpClientWebhookTransport.builder().maxConnections(0).build());
    assertThrows(IllegalArgumentException.class,
        () -> HttpClientWebhookTransport.builder().maxConnectionsPerRoute(0).build());
    assertThrows(IllegalArgumentException.class,
        () -> HttpClientWebhookTransport.builder().connectionRequestTimeout(Duration.ZERO).build());
    assertThrows(NullPointerException.class, () -> HttpClientWebhookTransport.builder().userAgent(null));
  }

  private WebhookTransport.Request request(String path, Duration timeout) {
    return new WebhookTransport.Request("http://127.0.0.1:" + server.getAddress().getPort() + path,
        Map.of("X-Webhook-Signature", "t=1,v1=abc"), "{\"id\":\"evt_1\"}", timeout);
  }

  private static void respond(HttpExchange exchange, int status, String body) throws IOException {
    byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
    exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
    try (OutputStream os = exchange.getResponseBody()) {
      os.write(bytes);
    }
  }
}
