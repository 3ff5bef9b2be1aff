package io.relay.delivery;

import io.relay.model.DeliveryStatus;
import io.relay.model.EventSubscription;
import io.relay.model.WebhookDelivery;
import io.relay.model.WebhookEndpoint;
import io.relay.signature.SignatureEngine;
import io.relay.spi.ConnectionProvider;
import io.relay.spi.WebhookTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.sql.Connection;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DeliveryDispatcherTest {
  private static final Instant START = Instant.parse("2024-03-01T10:00:00Z");
  private static final String SECRET = "whsec_endpoint";

  private MutableClock clock;
  private InMemoryDeliveryStore deliveries;
  private InMemoryEndpointStore endpoints;
  private ScriptedTransport transport;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(START);
    deliveries = new InMemoryDeliveryStore();
    endpoints = new InMemoryEndpointStore();
    transport = new ScriptedTransport();
    endpoints.insert(null, endpoint("ep-1", true));
  }

  // ── Builder validation ──────────────────────────────────────────

  @Test
  void builderRejectsMissingCollaborators() {
    assertThrows(NullPointerException.class, () -> DeliveryDispatcher.builder()
        .deliveryStore(deliveries).endpointStore(endpoints).transport(transport).build());
    assertThrows(NullPointerException.class, () -> DeliveryDispatcher.builder()
        .connectionProvider(stubCp()).deliveryStore(deliveries).endpointStore(endpoints).build());
  }

  @Test
  void builderRejectsBadLimits() {
    assertThrows(IllegalArgumentException.class, () -> builder().maxAttempts(0).build());
    assertThrows(IllegalArgumentException.class, () -> builder().queueCapacity(0).build());
    assertThrows(IllegalArgumentException.class, () -> builder().requestTimeout(Duration.ZERO).build());
  }

  // ── Outcomes ────────────────────────────────────────────────────

  @Test
  void successMarksDeliveredWithSignedHeaders() {
    transport.respond(200, "ok");
    WebhookDelivery d = pending("d-1", "evt-1");

    try (DeliveryDispatcher dispatcher = builder().build()) {
      claimAndProcess(dispatcher, d);
    }

    WebhookDelivery stored = deliveries.get("d-1");
    assertEquals(DeliveryStatus.DELIVERED, stored.status());
    assertEquals(1, stored.attempts());
    assertEquals(200, stored.lastResponseStatus());
    assertEquals("ok", stored.lastResponseBody());
    assertEquals(START, stored.deliveredAt());

    WebhookTransport.Request request = transport.requests.get(0);
    assertEquals("https://hooks.example.com/ep-1", request.url());
    assertEquals(d.payload(), request.body());
    assertEquals(Duration.ofSeconds(30), request.timeout());
    Map<String, String> headers = request.headers();
    assertEquals("application/json", headers.get(WebhookHeaders.CONTENT_TYPE));
    assertEquals("invoice.paid", headers.get(WebhookHeaders.EVENT_TYPE));
    assertEquals("evt-1", headers.get(WebhookHeaders.EVENT_ID));
    assertEquals("d-1", headers.get(WebhookHeaders.DELIVERY_ID));
    assertTrue(new SignatureEngine(clock).verify(headers.get(WebhookHeaders.SIGNATURE), d.payload(), SECRET));
  }

  @Test
  void failuresFollowBackoffScheduleThenExhaust() {
    transport.respond(500, "boom");
    pending("d-1", "evt-1");
    List<Duration> observed = new ArrayList<>();

    try (DeliveryDispatcher dispatcher = builder().build()) {
      for (int attempt = 1; attempt <= 5; attempt++) {
        Instant before = clock.instant();
        claimAndProcess(dispatcher, deliveries.get("d-1"));
        WebhookDelivery after = deliveries.get("d-1");
        assertEquals(attempt, after.attempts());
        if (after.status() == DeliveryStatus.PENDING_RETRY) {
          observed.add(Duration.between(before, after.nextAttemptAt()));
          clock.set(after.nextAttemptAt());
        }
      }
    }

    assertEquals(List.of(Duration.ofMinutes(1), Duration.ofMinutes(5), Duration.ofMinutes(30), Duration.ofHours(2)),
        observed);
    WebhookDelivery exhausted = deliveries.get("d-1");
    assertEquals(DeliveryStatus.FAILED_EXHAUSTED, exhausted.status());
    assertEquals(5, exhausted.attempts());
    assertNull(exhausted.nextAttemptAt());
    assertEquals(500, exhausted.lastResponseStatus());
    assertEquals("boom", exhausted.lastResponseBody());
    assertTrue(exhausted.lastError().contains("exhausted after 5 attempts"));
    assertEquals(5, transport.requests.size());
  }

  @Test
  void clientErrorsAreRetriedLikeServerErrors() {
    transport.respond(404, "gone");
    pending("d-1", "evt-1");

    try (DeliveryDispatcher dispatcher = builder().build()) {
      claimAndProcess(dispatcher, deliveries.get("d-1"));
    }

    WebhookDelivery stored = deliveries.get("d-1");
    assertEquals(DeliveryStatus.PENDING_RETRY, stored.status());
    assertEquals(404, stored.lastResponseStatus());
    assertEquals("Endpoint responded with HTTP 404", stored.lastError());
  }

  @Test
  void networkErrorIsRecordedWithoutStatus() {
    transport.fail(new SocketTimeoutException("Read timed out"));
    pending("d-1", "evt-1");

    try (DeliveryDispatcher dispatcher = builder().build()) {
      claimAndProcess(dispatcher, deliveries.get("d-1"));
    }

    WebhookDelivery stored = deliveries.get("d-1");
    assertEquals(DeliveryStatus.PENDING_RETRY, stored.status());
    assertNull(stored.lastResponseStatus());
    assertEquals("SocketTimeoutException: Read timed out", stored.lastError());
    assertEquals(START.plus(Duration.ofMinutes(1)), stored.nextAttemptAt());
  }

  @Test
  void runtimeExceptionFromTransportDoesNotEscape() {
    transport.fail(new IllegalStateException("pool shut down"));
    pending("d-1", "evt-1");

    try (DeliveryDispatcher dispatcher = builder().build()) {
      assertDoesNotThrow(() -> claimAndProcess(dispatcher, deliveries.get("d-1")));
    }
    assertEquals(DeliveryStatus.PENDING_RETRY, deliveries.get("d-1").status());
  }

  @Test
  void disabledEndpointHandsBackWithoutAttempt() {
    endpoints.setEnabled(null, "ep-1", false, START);
    pending("d-1", "evt-1");

    try (DeliveryDispatcher dispatcher = builder().build()) {
      claimAndProcess(dispatcher, deliveries.get("d-1"));
    }

    WebhookDelivery stored = deliveries.get("d-1");
    assertEquals(DeliveryStatus.PENDING_RETRY, stored.status());
    assertEquals(0, stored.attempts());
    assertEquals(START, stored.nextAttemptAt());
    assertTrue(transport.requests.isEmpty());
  }

  @Test
  void concurrencyCapHandsBackToPreviousStatus() {
    DefaultEndpointConcurrencyLimiter limiter = new DefaultEndpointConcurrencyLimiter(1);
    assertTrue(limiter.tryAcquire("ep-1"));
    pending("d-1", "evt-1");

    try (DeliveryDispatcher dispatcher = builder().limiter(limiter).build()) {
      claimAndProcess(dispatcher, deliveries.get("d-1"));
    }

    WebhookDelivery stored = deliveries.get("d-1");
    assertEquals(DeliveryStatus.PENDING, stored.status());
    assertEquals(0, stored.attempts());
    assertTrue(transport.requests.isEmpty());
    assertEquals(1, limiter.inFlight("ep-1"));
  }

  @Test
  void lostClaimDoesNotOverwriteNewerState() {
    transport.respond(200, "ok");
    WebhookDelivery d = pending("d-1", "evt-1");
    deliveries.claim(null, d.id(), d.version(), START);
    QueuedDelivery stale = new QueuedDelivery(d.claimed(START), DeliveryStatus.PENDING);
    // a second claim after lease expiry bumps the version again
    deliveries.claim(null, d.id(), d.version() + 1, START);

    try (DeliveryDispatcher dispatcher = builder().build()) {
      dispatcher.process(stale);
    }

    WebhookDelivery stored = deliveries.get("d-1");
    assertEquals(DeliveryStatus.IN_FLIGHT, stored.status());
    assertEquals(0, stored.attempts());
  }

  // ── Queue and lifecycle ─────────────────────────────────────────

  @Test
  void handleRefusesWhenQueueFullOrClosed() {
    DeliveryDispatcher dispatcher = builder().queueCapacity(1).build();
    QueuedDelivery a = new QueuedDelivery(pending("d-1", "evt-1"), DeliveryStatus.PENDING);
    QueuedDelivery b = new QueuedDelivery(pending("d-2", "evt-2"), DeliveryStatus.PENDING);

    assertEquals(1, dispatcher.availableCapacity());
    assertTrue(dispatcher.handle(a));
    assertFalse(dispatcher.handle(b));
    assertEquals(0, dispatcher.availableCapacity());

    dispatcher.close();
    assertFalse(dispatcher.handle(b));
    assertEquals(0, dispatcher.availableCapacity());
  }

  @Test
  void workersDrainQueuedDeliveries() throws Exception {
    transport.respond(200, "ok");
    WebhookDelivery d = pending("d-1", "evt-1");
    deliveries.claim(null, d.id(), d.version(), START);

    try (DeliveryDispatcher dispatcher = builder()
        .queueSettings(QueueSettings.of(Map.of(QueueSettings.DELIVERIES, 2)))
        .build()) {
      assertTrue(dispatcher.handle(new QueuedDelivery(d.claimed(START), DeliveryStatus.PENDING)));
      long deadline = System.currentTimeMillis() + 5000;
      while (deliveries.get("d-1").status() != DeliveryStatus.DELIVERED && System.currentTimeMillis() < deadline) {
        Thread.sleep(10);
      }
    }
    assertEquals(DeliveryStatus.DELIVERED, deliveries.get("d-1").status());
  }

  @Test
  void closeIsIdempotent() {
    DeliveryDispatcher dispatcher = builder().build();
    assertDoesNotThrow(() -> {
      dispatcher.close();
      dispatcher.close();
    });
  }

  // ── Helpers ─────────────────────────────────────────────────────

  private DeliveryDispatcher.Builder builder() {
    return DeliveryDispatcher.builder()
        .connectionProvider(stubCp())
        .deliveryStore(deliveries)
        .endpointStore(endpoints)
        .transport(transport)
        .queueSettings(QueueSettings.of(Map.of(QueueSettings.DELIVERIES, 0)))
        .clock(clock)
        .drainTimeoutMs(1000);
  }

  private WebhookDelivery pending(String id, String eventId) {
    WebhookDelivery d = WebhookDelivery.pending(id, "ep-1", eventId, "invoice.paid",
        "{\"id\":\"" + eventId + "\"}", clock.instant());
    deliveries.put(d);
    return d;
  }

  private void claimAndProcess(DeliveryDispatcher dispatcher, WebhookDelivery row) {
    assertTrue(deliveries.claim(null, row.id(), row.version(), clock.instant()));
    dispatcher.process(new QueuedDelivery(row.claimed(clock.instant()), row.status()));
  }

  private static WebhookEndpoint endpoint(String id, boolean enabled) {
    return new WebhookEndpoint(id, "owner-1", "https://hooks.example.com/" + id, SECRET,
        EventSubscription.all(), enabled, null, START, START);
  }

  static ConnectionProvider stubCp() {
    return () -> (Connection) java.lang.reflect.Proxy.newProxyInstance(
        Connection.class.getClassLoader(),
        new Class<?>[]{Connection.class},
        (proxy, method, args) -> null);
  }

  static final class ScriptedTransport implements WebhookTransport {
    final List<Request> requests = new CopyOnWriteArrayList<>();
    private volatile Response response = new Response(200, "");
    private volatile Exception failure;

    void respond(int status, String body) {
      this.response = new Response(status, body);
      this.failure = null;
    }

    void fail(Exception failure) {
      this.failure = failure;
    }

    @Override
    public Response send(Request request) throws IOException {
      requests.add(request);
      Exception f = failure;
      if (f instanceof IOException io) {
        throw io;
      }
      if (f instanceof RuntimeException re) {
        throw re;
      }
      return response;
    }
  }

  static final class MutableClock extends Clock {
    private volatile Instant now;

    MutableClock(Instant now) {
      this.now = now;
    }

    void set(Instant instant) {
      now = instant;
    }

    void advance(Duration duration) {
      now = now.plus(duration);
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }
}
