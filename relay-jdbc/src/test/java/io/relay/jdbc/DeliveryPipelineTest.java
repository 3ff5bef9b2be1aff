package io.relay.jdbc;

import io.relay.StringEventType;
import io.relay.WebhookEvent;
import io.relay.delivery.DeliveryDispatcher;
import io.relay.delivery.DeliveryPoller;
import io.relay.delivery.QueueSettings;
import io.relay.delivery.WebhookHeaders;
import io.relay.delivery.WebhookPublisher;
import io.relay.failed.FailedDeliveryManager;
import io.relay.jdbc.dialect.H2Dialect;
import io.relay.model.DeliveryStatus;
import io.relay.model.EventSubscription;
import io.relay.model.WebhookDelivery;
import io.relay.registry.CreatedEndpoint;
import io.relay.registry.WebhookRegistry;
import io.relay.signature.SignatureEngine;
import io.relay.spi.MetricsExporter;
import io.relay.spi.WebhookTransport;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Publish, poll and deliver against H2 with a controllable clock. The poller hands claims
 * straight to {@link DeliveryDispatcher#process} so every step runs on the test thread.
 */
class DeliveryPipelineTest {
  private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

  private JdbcDataSource dataSource;
  private DataSourceConnectionProvider connectionProvider;
  private JdbcRelayStores stores;
  private MutableClock clock;
  private ScriptedTransport transport;
  private WebhookRegistry registry;
  private WebhookPublisher publisher;
  private FailedDeliveryManager failed;
  private DeliveryDispatcher dispatcher;
  private DeliveryPoller poller;

  @BeforeEach
  void setUp() {
    dataSource = Schemas.h2("pipeline");
    connectionProvider = new DataSourceConnectionProvider(dataSource);
    stores = JdbcRelayStores.create(new H2Dialect(), TableNames.defaults());
    clock = new MutableClock(T0);
    transport = new ScriptedTransport();
    registry = new WebhookRegistry(connectionProvider, stores.endpointStore(), clock);
    publisher = new WebhookPublisher(connectionProvider, stores.endpointStore(), stores.deliveryStore(),
        MetricsExporter.NOOP, clock);
    failed = new FailedDeliveryManager(connectionProvider, stores.deliveryStore(), clock);
    dispatcher = DeliveryDispatcher.builder()
        .connectionProvider(connectionProvider)
        .deliveryStore(stores.deliveryStore())
        .endpointStore(stores.endpointStore())
        .transport(transport)
        .signatureEngine(new SignatureEngine(clock))
        .queueSettings(QueueSettings.of(Map.of(QueueSettings.DELIVERIES, 0)))
        .clock(clock)
        .build();
    poller = DeliveryPoller.builder()
        .connectionProvider(connectionProvider)
        .deliveryStore(stores.deliveryStore())
        .handler(queued -> {
          dispatcher.process(queued);
          return true;
        })
        .clock(clock)
        .build();
  }

  @AfterEach
  void tearDown() {
    poller.close();
    dispatcher.close();
  }

  @Test
  void deliversSignedEventToEverySubscribedEndpoint() {
    CreatedEndpoint paid = registry.register("acct_1", "https://paid.example.com",
        EventSubscription.of(StringEventType.of("invoice.paid")), null);
    CreatedEndpoint everything = registry.register("acct_1", "https://all.example.com", EventSubscription.all(), null);
    registry.register("acct_1", "https://voided.example.com",
        EventSubscription.of(StringEventType.of("invoice.voided")), null);
    registry.register("acct_2", "https://other.example.com", EventSubscription.all(), null);

    List<String> ids = publisher.publish(event("evt_1", "acct_1"));

    assertEquals(2, ids.size());
    assertEquals(2, poller.poll());
    assertEquals(2, transport.requests.size());
    for (WebhookTransport.Request request : transport.requests) {
      String secret = request.url().equals("https://paid.example.com") ? paid.secret() : everything.secret();
      SignatureEngine engine = new SignatureEngine(clock);
      assertTrue(engine.verify(request.headers().get(WebhookHeaders.SIGNATURE), request.body(), secret));
      assertEquals("evt_1", request.headers().get(WebhookHeaders.EVENT_ID));
      assertEquals("invoice.paid", request.headers().get(WebhookHeaders.EVENT_TYPE));
    }
    for (String id : ids) {
      WebhookDelivery delivery = failed.find(id).orElseThrow();
      assertEquals(DeliveryStatus.DELIVERED, delivery.status());
      assertEquals(1, delivery.attempts());
      assertEquals(T0, delivery.deliveredAt());
    }
    assertEquals(0, poller.poll());
  }

  @Test
  void republishingTheSameEventCreatesNoNewDeliveries() {
    registry.register("acct_1", "https://hooks.example.com", EventSubscription.all(), null);

    assertEquals(1, publisher.publish(event("evt_1", "acct_1")).size());
    assertTrue(publisher.publish(event("evt_1", "acct_1")).isEmpty());

    assertEquals(1, poller.poll());
    assertEquals(1, transport.requests.size());
  }

  @Test
  void publishInCallerTransactionRollsBack() throws SQLException {
    registry.register("acct_1", "https://hooks.example.com", EventSubscription.all(), null);

    try (Connection conn = dataSource.getConnection()) {
      conn.setAutoCommit(false);
      assertEquals(1, publisher.publish(conn, event("evt_1", "acct_1")).size());
      conn.rollback();
    }

    assertEquals(0, poller.poll());
    assertTrue(failed.history("evt_1").isEmpty());
  }

  @Test
  void publishInCallerTransactionCommits() throws SQLException {
    registry.register("acct_1", "https://hooks.example.com", EventSubscription.all(), null);

    try (Connection conn = dataSource.getConnection()) {
      conn.setAutoCommit(false);
      publisher.publish(conn, event("evt_1", "acct_1"));
      conn.commit();
    }

    assertEquals(1, poller.poll());
    assertEquals(DeliveryStatus.DELIVERED, failed.history("evt_1").get(0).status());
  }

  @Test
  void failuresFollowRetryScheduleUntilExhausted() {
    registry.register("acct_1", "https://hooks.example.com", EventSubscription.all(), null);
    String id = publisher.publish(event("evt_1", "acct_1")).get(0);
    transport.respond(500, "down").respond(502, "bad gateway").respond(503, null)
        .fail(new ConnectException("Connection refused")).respond(500, "still down");

    Duration[] waits = {Duration.ofMinutes(1), Duration.ofMinutes(5), Duration.ofMinutes(30), Duration.ofHours(2)};
    for (int attempt = 1; attempt <= 4; attempt++) {
      assertEquals(1, poller.poll());
      WebhookDelivery row = failed.find(id).orElseThrow();
      assertEquals(DeliveryStatus.PENDING_RETRY, row.status());
      assertEquals(attempt, row.attempts());
      assertEquals(clock.instant().plus(waits[attempt - 1]), row.nextAttemptAt());

      clock.advance(waits[attempt - 1].minusSeconds(1));
      assertEquals(0, poller.poll(), "not due before the backoff elapses");
      clock.advance(Duration.ofSeconds(1));
    }
    assertEquals(1, poller.poll());

    WebhookDelivery exhausted = failed.find(id).orElseThrow();
    assertEquals(DeliveryStatus.FAILED_EXHAUSTED, exhausted.status());
    assertEquals(5, exhausted.attempts());
    assertEquals(500, exhausted.lastResponseStatus());
    assertEquals(List.of(exhausted), failed.query(null, 10));
    assertEquals(5, transport.requests.size());

    clock.advance(Duration.ofDays(7));
    assertEquals(0, poller.poll());
  }

  @Test
  void recoversOnFifthAttemptAfterFullBackoff() {
    registry.register("acct_1", "https://hooks.example.com", EventSubscription.all(), null);
    String id = publisher.publish(event("evt_1", "acct_1")).get(0);
    transport.respond(500, "down").respond(500, "down").respond(500, "down").respond(500, "down")
        .respond(200, "ok");

    Duration[] waits = {Duration.ofMinutes(1), Duration.ofMinutes(5), Duration.ofMinutes(30), Duration.ofHours(2)};
    for (Duration wait : waits) {
      assertEquals(1, poller.poll());
      assertEquals(DeliveryStatus.PENDING_RETRY, failed.find(id).orElseThrow().status());
      clock.advance(wait.minusSeconds(1));
      assertEquals(0, poller.poll(), "not due before the backoff elapses");
      clock.advance(Duration.ofSeconds(1));
    }
    assertEquals(1, poller.poll());

    WebhookDelivery delivered = failed.find(id).orElseThrow();
    assertEquals(DeliveryStatus.DELIVERED, delivered.status());
    assertEquals(5, delivered.attempts());
    assertEquals(200, delivered.lastResponseStatus());
    assertEquals(5, transport.requests.size());
    Duration elapsed = Duration.between(delivered.createdAt(), delivered.deliveredAt());
    Duration minimum = Duration.ofMinutes(1).plusMinutes(5).plusMinutes(30).plusHours(2);
    assertTrue(elapsed.compareTo(minimum) >= 0, "delivered after " + elapsed);
    assertTrue(failed.query(null, 10).isEmpty());
    assertEquals(0, poller.poll());
  }

  @Test
  void connectionErrorsAreRecordedWithoutStatus() {
    registry.register("acct_1", "https://hooks.example.com", EventSubscription.all(), null);
    String id = publisher.publish(event("evt_1", "acct_1")).get(0);
    transport.fail(new ConnectException("Connection refused"));

    poller.poll();

    WebhookDelivery row = failed.find(id).orElseThrow();
    assertEquals(DeliveryStatus.PENDING_RETRY, row.status());
    assertNull(row.lastResponseStatus());
    assertEquals("ConnectException: Connection refused", row.lastError());
  }

  @Test
  void disabledEndpointHoldsDeliveriesUntilEnabled() {
    String endpointId = registry.register("acct_1", "https://hooks.example.com", EventSubscription.all(), null)
        .endpoint().id();
    String id = publisher.publish(event("evt_1", "acct_1")).get(0);
    registry.disable(endpointId);

    assertEquals(0, poller.poll());
    assertEquals(DeliveryStatus.PENDING, failed.find(id).orElseThrow().status());
    assertTrue(publisher.publish(event("evt_2", "acct_1")).isEmpty(), "disabled endpoints get no new deliveries");

    registry.enable(endpointId);
    assertEquals(1, poller.poll());
    assertEquals(DeliveryStatus.DELIVERED, failed.find(id).orElseThrow().status());
  }

  @Test
  void rotatedSecretSignsLaterAttempts() {
    String endpointId = registry.register("acct_1", "https://hooks.example.com", EventSubscription.all(), null)
        .endpoint().id();
    publisher.publish(event("evt_1", "acct_1"));
    String rotated = registry.rotateSecret(endpointId).orElseThrow();

    poller.poll();

    WebhookTransport.Request request = transport.requests.get(0);
    assertTrue(new SignatureEngine(clock).verify(request.headers().get(WebhookHeaders.SIGNATURE),
        request.body(), rotated));
  }

  @Test
  void cancelledDeliveryIsNeverSent() {
    registry.register("acct_1", "https://hooks.example.com", EventSubscription.all(), null);
    String id = publisher.publish(event("evt_1", "acct_1")).get(0);

    assertTrue(failed.cancel(id));

    assertEquals(0, poller.poll());
    assertTrue(transport.requests.isEmpty());
  }

  private WebhookEvent event(String eventId, String ownerId) {
    return new WebhookEvent(eventId, StringEventType.of("invoice.paid"), ownerId,
        "{\"id\":\"" + eventId + "\",\"amount\":1200}", clock.instant());
  }

  static final class ScriptedTransport implements WebhookTransport {
    final List<Request> requests = new ArrayList<>();
    private final Deque<Object> script = new ArrayDeque<>();

    ScriptedTransport respond(int status, String body) {
      script.add(new Response(status, body));
      return this;
    }

    ScriptedTransport fail(IOException failure) {
      script.add(failure);
      return this;
    }

    @Override
    public synchronized Response send(Request request) throws IOException {
      requests.add(request);
      Object next = script.poll();
      if (next instanceof IOException e) {
        throw e;
      }
      return next != null ? (Response) next : new Response(200, "ok");
    }
  }

  static final class MutableClock extends Clock {
    private volatile Instant now;

    MutableClock(Instant now) {
      this.now = now;
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
