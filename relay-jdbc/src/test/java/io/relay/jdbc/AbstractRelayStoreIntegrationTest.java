package io.relay.jdbc;

import io.relay.jdbc.store.JdbcDeliveryStore;
import io.relay.jdbc.store.JdbcEndpointStore;
import io.relay.jdbc.store.JdbcIdempotencyStore;
import io.relay.jdbc.store.JdbcIncomingEventStore;
import io.relay.model.CachedResponse;
import io.relay.model.DeliveryStatus;
import io.relay.model.EventSubscription;
import io.relay.model.IdempotencyRecord;
import io.relay.model.IdempotencyStatus;
import io.relay.model.IncomingEventStatus;
import io.relay.model.IncomingWebhookEvent;
import io.relay.model.WebhookDelivery;
import io.relay.model.WebhookEndpoint;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Store behaviour shared by every supported database. Subclasses provide the data source
 * (with the schema applied and the tables empty) and the stores.
 */
abstract class AbstractRelayStoreIntegrationTest {
  static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

  abstract DataSource dataSource();

  abstract JdbcRelayStores stores();

  // ── Idempotency keys ────────────────────────────────────────────

  @Test
  void idempotencyInsertIsExclusive() throws Exception {
    JdbcIdempotencyStore store = stores().idempotencyStore();
    try (Connection conn = connection()) {
      assertTrue(store.insertLocked(conn, locked("tok-1")));
      assertFalse(store.insertLocked(conn, locked("tok-2")));

      IdempotencyRecord record = store.find(conn, "acct_1:/charges", "key-1").orElseThrow();
      assertEquals(IdempotencyStatus.LOCKED, record.status());
      assertEquals("tok-1", record.lockToken());
      assertEquals("hash-1", record.requestHash());
      assertEquals(T0, record.lockedAt());
      assertEquals(T0.plus(Duration.ofHours(24)), record.expiresAt());
      assertNull(record.response());
    }
  }

  @Test
  void idempotencyCompleteRequiresCurrentLock() throws Exception {
    JdbcIdempotencyStore store = stores().idempotencyStore();
    CachedResponse response = new CachedResponse(201, "application/json", "{\"id\":\"ch_1\"}");
    try (Connection conn = connection()) {
      store.insertLocked(conn, locked("tok-1"));

      assertFalse(store.complete(conn, "acct_1:/charges", "key-1", "tok-other", response, T0));
      assertTrue(store.complete(conn, "acct_1:/charges", "key-1", "tok-1", response, T0.plusSeconds(1)));
      assertFalse(store.complete(conn, "acct_1:/charges", "key-1", "tok-1", response, T0.plusSeconds(2)));

      IdempotencyRecord record = store.find(conn, "acct_1:/charges", "key-1").orElseThrow();
      assertEquals(IdempotencyStatus.COMPLETED, record.status());
      assertEquals(response, record.response());
      assertEquals(T0.plusSeconds(1), record.completedAt());
    }
  }

  @Test
  void idempotencyStealAndRelease() throws Exception {
    JdbcIdempotencyStore store = stores().idempotencyStore();
    try (Connection conn = connection()) {
      store.insertLocked(conn, locked("tok-1"));

      assertFalse(store.stealLock(conn, "acct_1:/charges", "key-1", "tok-x", "tok-2", T0.plusSeconds(31)));
      assertTrue(store.stealLock(conn, "acct_1:/charges", "key-1", "tok-1", "tok-2", T0.plusSeconds(31)));
      assertEquals(T0.plusSeconds(31), store.find(conn, "acct_1:/charges", "key-1").orElseThrow().lockedAt());

      assertFalse(store.release(conn, "acct_1:/charges", "key-1", "tok-1"));
      assertTrue(store.release(conn, "acct_1:/charges", "key-1", "tok-2"));
      assertTrue(store.find(conn, "acct_1:/charges", "key-1").isEmpty());
    }
  }

  @Test
  void idempotencyDeleteExpiredHonoursExpiry() throws Exception {
    JdbcIdempotencyStore store = stores().idempotencyStore();
    try (Connection conn = connection()) {
      store.insertLocked(conn, locked("tok-1"));

      assertFalse(store.deleteExpired(conn, "acct_1:/charges", "key-1", T0.plus(Duration.ofHours(23))));
      assertTrue(store.deleteExpired(conn, "acct_1:/charges", "key-1", T0.plus(Duration.ofHours(24))));
    }
  }

  // ── Endpoints ───────────────────────────────────────────────────

  @Test
  void endpointRoundTripAndToggles() throws Exception {
    JdbcEndpointStore store = stores().endpointStore();
    EventSubscription subscription = EventSubscription.ofNames(Set.of("invoice.paid", "invoice.voided"));
    try (Connection conn = connection()) {
      store.insert(conn, endpoint("ep-1", "acct_1", subscription, true));
      store.insert(conn, endpoint("ep-2", "acct_1", EventSubscription.all(), false));
      store.insert(conn, endpoint("ep-3", "acct_2", EventSubscription.all(), true));

      WebhookEndpoint loaded = store.findById(conn, "ep-1").orElseThrow();
      assertEquals(subscription, loaded.subscription());
      assertEquals("whsec_ep-1", loaded.secret());
      assertEquals(T0, loaded.createdAt());

      assertEquals(2, store.listByOwner(conn, "acct_1").size());
      assertEquals(List.of("ep-1"), ids(store.listEnabled(conn, "acct_1")));
      assertEquals(2, store.listEnabled(conn, null).size());

      assertEquals(1, store.setEnabled(conn, "ep-2", true, T0.plusSeconds(5)));
      assertEquals(2, store.listEnabled(conn, "acct_1").size());
      assertEquals(1, store.updateSecret(conn, "ep-1", "whsec_new", T0.plusSeconds(6)));
      assertEquals("whsec_new", store.findById(conn, "ep-1").orElseThrow().secret());
      assertEquals(0, store.setEnabled(conn, "missing", true, T0));
    }
  }

  // ── Deliveries ──────────────────────────────────────────────────

  @Test
  void deliveryInsertIsUniquePerEndpointAndEvent() throws Exception {
    JdbcDeliveryStore store = stores().deliveryStore();
    try (Connection conn = connection()) {
      insertEndpoint(conn, "ep-1", true);
      insertEndpoint(conn, "ep-2", true);

      assertTrue(store.insertPending(conn, pending("d-1", "ep-1", "evt-1")));
      assertFalse(store.insertPending(conn, pending("d-2", "ep-1", "evt-1")));
      assertTrue(store.insertPending(conn, pending("d-3", "ep-2", "evt-1")));

      assertEquals(2, store.listByEvent(conn, "evt-1").size());
      WebhookDelivery stored = store.findById(conn, "d-1").orElseThrow();
      assertEquals(DeliveryStatus.PENDING, stored.status());
      assertEquals(0, stored.attempts());
      assertEquals(0L, stored.version());
      assertEquals(T0, stored.nextAttemptAt());
    }
  }

  @Test
  void findDueSkipsFutureAndDisabled() throws Exception {
    JdbcDeliveryStore store = stores().deliveryStore();
    try (Connection conn = connection()) {
      insertEndpoint(conn, "ep-on", true);
      insertEndpoint(conn, "ep-off", false);
      store.insertPending(conn, pending("d-due", "ep-on", "evt-1"));
      store.insertPending(conn, pending("d-off", "ep-off", "evt-1"));
      store.insertPending(conn, WebhookDelivery.pending("d-later", "ep-on", "evt-2", "invoice.paid", "{}",
          T0.plusSeconds(60)));

      List<WebhookDelivery> due = store.findDue(conn, T0, T0.minus(Duration.ofMinutes(5)), 10);

      assertEquals(List.of("d-due"), due.stream().map(WebhookDelivery::id).toList());
    }
  }

  @Test
  void claimIsCompareAndSet() throws Exception {
    JdbcDeliveryStore store = stores().deliveryStore();
    try (Connection conn = connection()) {
      insertEndpoint(conn, "ep-1", true);
      store.insertPending(conn, pending("d-1", "ep-1", "evt-1"));

      assertTrue(store.claim(conn, "d-1", 0L, T0));
      assertFalse(store.claim(conn, "d-1", 0L, T0));

      WebhookDelivery claimed = store.findById(conn, "d-1").orElseThrow();
      assertEquals(DeliveryStatus.IN_FLIGHT, claimed.status());
      assertEquals(1L, claimed.version());
      assertEquals(T0, claimed.claimedAt());
    }
  }

  @Test
  void expiredLeaseIsDueAgain() throws Exception {
    JdbcDeliveryStore store = stores().deliveryStore();
    try (Connection conn = connection()) {
      insertEndpoint(conn, "ep-1", true);
      store.insertPending(conn, pending("d-1", "ep-1", "evt-1"));
      store.claim(conn, "d-1", 0L, T0);

      Instant withinLease = T0.plus(Duration.ofMinutes(4));
      assertTrue(store.findDue(conn, withinLease, withinLease.minus(Duration.ofMinutes(5)), 10).isEmpty());

      Instant afterLease = T0.plus(Duration.ofMinutes(6));
      List<WebhookDelivery> due = store.findDue(conn, afterLease, afterLease.minus(Duration.ofMinutes(5)), 10);
      assertEquals(1, due.size());
      assertTrue(store.claim(conn, "d-1", due.get(0).version(), afterLease));
      assertEquals(0, store.findById(conn, "d-1").orElseThrow().attempts());
    }
  }

  @Test
  void outcomesRequireCurrentVersion() throws Exception {
    JdbcDeliveryStore store = stores().deliveryStore();
    try (Connection conn = connection()) {
      insertEndpoint(conn, "ep-1", true);
      store.insertPending(conn, pending("d-1", "ep-1", "evt-1"));
      store.claim(conn, "d-1", 0L, T0);

      assertEquals(0, store.markDelivered(conn, "d-1", 0L, 200, "ok", T0));
      Instant next = T0.plus(Duration.ofMinutes(1));
      assertEquals(1, store.markRetry(conn, "d-1", 1L, next, 503, "busy", "Endpoint responded with HTTP 503", T0));

      WebhookDelivery retried = store.findById(conn, "d-1").orElseThrow();
      assertEquals(DeliveryStatus.PENDING_RETRY, retried.status());
      assertEquals(1, retried.attempts());
      assertEquals(2L, retried.version());
      assertEquals(next, retried.nextAttemptAt());
      assertEquals(503, retried.lastResponseStatus());
      assertEquals("busy", retried.lastResponseBody());
      assertNull(retried.claimedAt());

      assertEquals(0, store.markDelivered(conn, "d-1", 2L, 200, "ok", T0));
      assertTrue(store.claim(conn, "d-1", 2L, next));
      assertEquals(1, store.markDelivered(conn, "d-1", 3L, 200, "ok", next));

      WebhookDelivery delivered = store.findById(conn, "d-1").orElseThrow();
      assertEquals(DeliveryStatus.DELIVERED, delivered.status());
      assertEquals(2, delivered.attempts());
      assertEquals(next, delivered.deliveredAt());
      assertNull(delivered.lastError());
      assertNull(delivered.nextAttemptAt());
    }
  }

  @Test
  void exhaustedAndNetworkFailureWithoutStatus() throws Exception {
    JdbcDeliveryStore store = stores().deliveryStore();
    try (Connection conn = connection()) {
      insertEndpoint(conn, "ep-1", true);
      store.insertPending(conn, pending("d-1", "ep-1", "evt-1"));
      store.claim(conn, "d-1", 0L, T0);

      assertEquals(1, store.markExhausted(conn, "d-1", 1L, null, null, "ConnectException: refused", T0));

      WebhookDelivery exhausted = store.findById(conn, "d-1").orElseThrow();
      assertEquals(DeliveryStatus.FAILED_EXHAUSTED, exhausted.status());
      assertNull(exhausted.lastResponseStatus());
      assertEquals("ConnectException: refused", exhausted.lastError());
      assertEquals(1, store.countByStatus(conn, DeliveryStatus.FAILED_EXHAUSTED, null));
      assertEquals(1, store.countByStatus(conn, DeliveryStatus.FAILED_EXHAUSTED, "ep-1"));
      assertEquals(0, store.countByStatus(conn, DeliveryStatus.FAILED_EXHAUSTED, "ep-2"));
      assertEquals(1, store.queryByStatus(conn, DeliveryStatus.FAILED_EXHAUSTED, null, 10).size());
    }
  }

  @Test
  void releaseRestoresWaitingStatusWithoutAttempt() throws Exception {
    JdbcDeliveryStore store = stores().deliveryStore();
    try (Connection conn = connection()) {
      insertEndpoint(conn, "ep-1", true);
      store.insertPending(conn, pending("d-1", "ep-1", "evt-1"));
      store.claim(conn, "d-1", 0L, T0);

      assertEquals(1, store.release(conn, "d-1", 1L, DeliveryStatus.PENDING, T0));

      WebhookDelivery released = store.findById(conn, "d-1").orElseThrow();
      assertEquals(DeliveryStatus.PENDING, released.status());
      assertEquals(0, released.attempts());
      assertEquals(T0, released.nextAttemptAt());
      assertEquals(2L, released.version());
    }
  }

  @Test
  void cancelOnlyAppliesToWaitingRows() throws Exception {
    JdbcDeliveryStore store = stores().deliveryStore();
    try (Connection conn = connection()) {
      insertEndpoint(conn, "ep-1", true);
      store.insertPending(conn, pending("d-1", "ep-1", "evt-1"));
      store.insertPending(conn, pending("d-2", "ep-1", "evt-2"));
      store.claim(conn, "d-2", 0L, T0);

      assertEquals(1, store.cancel(conn, "d-1", T0));
      assertEquals(0, store.cancel(conn, "d-1", T0));
      assertEquals(0, store.cancel(conn, "d-2", T0));
      assertEquals(DeliveryStatus.CANCELLED, store.findById(conn, "d-1").orElseThrow().status());
    }
  }

  // ── Incoming events ─────────────────────────────────────────────

  @Test
  void incomingInsertDedupsPerSource() throws Exception {
    JdbcIncomingEventStore store = stores().incomingEventStore();
    try (Connection conn = connection()) {
      assertTrue(store.insertReceived(conn, IncomingWebhookEvent.received("stripe", "evt_1", "{}", T0)));
      assertFalse(store.insertReceived(conn, IncomingWebhookEvent.received("stripe", "evt_1", "{}", T0)));
      assertTrue(store.insertReceived(conn, IncomingWebhookEvent.received("github", "evt_1", "{}", T0)));

      assertEquals(2, store.countByStatus(conn, IncomingEventStatus.RECEIVED, null));
      assertEquals(1, store.countByStatus(conn, IncomingEventStatus.RECEIVED, "stripe"));
    }
  }

  @Test
  void incomingLifecycle() throws Exception {
    JdbcIncomingEventStore store = stores().incomingEventStore();
    try (Connection conn = connection()) {
      store.insertReceived(conn, IncomingWebhookEvent.received("stripe", "evt_1", "{\"id\":\"evt_1\"}", T0));

      assertFalse(store.markProcessed(conn, "stripe", "evt_1", T0));
      assertTrue(store.claim(conn, "stripe", "evt_1", T0));
      assertFalse(store.claim(conn, "stripe", "evt_1", T0));
      assertTrue(store.markError(conn, "stripe", "evt_1", "ledger unavailable", T0.plusSeconds(1)));

      IncomingWebhookEvent failed = store.find(conn, "stripe", "evt_1").orElseThrow();
      assertEquals(IncomingEventStatus.ERROR, failed.status());
      assertEquals("ledger unavailable", failed.errorMessage());
      assertEquals(1, store.queryByStatus(conn, IncomingEventStatus.ERROR, "stripe", 10).size());

      assertTrue(store.transition(conn, "stripe", "evt_1", IncomingEventStatus.ERROR, IncomingEventStatus.RECEIVED));
      assertNull(store.find(conn, "stripe", "evt_1").orElseThrow().errorMessage());
      store.claim(conn, "stripe", "evt_1", T0.plusSeconds(2));
      assertTrue(store.markProcessed(conn, "stripe", "evt_1", T0.plusSeconds(2)));

      IncomingWebhookEvent processed = store.find(conn, "stripe", "evt_1").orElseThrow();
      assertEquals(IncomingEventStatus.PROCESSED, processed.status());
      assertEquals(T0.plusSeconds(2), processed.processedAt());
      assertEquals("{\"id\":\"evt_1\"}", processed.payload());
    }
  }

  @Test
  void incomingStalledClaimsAreReleased() throws Exception {
    JdbcIncomingEventStore store = stores().incomingEventStore();
    try (Connection conn = connection()) {
      store.insertReceived(conn, IncomingWebhookEvent.received("stripe", "evt_old", "{}", T0));
      store.insertReceived(conn, IncomingWebhookEvent.received("stripe", "evt_new", "{}", T0));
      store.insertReceived(conn, IncomingWebhookEvent.received("stripe", "evt_done", "{}", T0));
      assertTrue(store.claim(conn, "stripe", "evt_old", T0));
      assertFalse(store.claim(conn, "stripe", "evt_old", T0));
      assertTrue(store.claim(conn, "stripe", "evt_new", T0.plusSeconds(600)));
      assertTrue(store.claim(conn, "stripe", "evt_done", T0));
      assertTrue(store.markProcessed(conn, "stripe", "evt_done", T0.plusSeconds(1)));

      assertEquals(1, store.releaseStalled(conn, T0.plusSeconds(300)));

      assertEquals(IncomingEventStatus.RECEIVED, store.find(conn, "stripe", "evt_old").orElseThrow().status());
      assertEquals(IncomingEventStatus.PROCESSING, store.find(conn, "stripe", "evt_new").orElseThrow().status());
      assertEquals(IncomingEventStatus.PROCESSED, store.find(conn, "stripe", "evt_done").orElseThrow().status());
      assertTrue(store.claim(conn, "stripe", "evt_old", T0.plusSeconds(301)));
    }
  }

  // ── Helpers ─────────────────────────────────────────────────────

  Connection connection() throws Exception {
    Connection conn = dataSource().getConnection();
    conn.setAutoCommit(true);
    return conn;
  }

  void insertEndpoint(Connection conn, String id, boolean enabled) {
    stores().endpointStore().insert(conn, endpoint(id, "acct_1", EventSubscription.all(), enabled));
  }

  static IdempotencyRecord locked(String token) {
    return IdempotencyRecord.locked("acct_1:/charges", "key-1", "hash-1", token, T0, Duration.ofHours(24));
  }

  static WebhookEndpoint endpoint(String id, String owner, EventSubscription subscription, boolean enabled) {
    return new WebhookEndpoint(id, owner, "https://hooks.example.com/" + id, "whsec_" + id,
        subscription, enabled, null, T0, T0);
  }

  static WebhookDelivery pending(String id, String endpointId, String eventId) {
    return WebhookDelivery.pending(id, endpointId, eventId, "invoice.paid", "{\"n\":1}", T0);
  }

  private static List<String> ids(List<WebhookEndpoint> endpoints) {
    return endpoints.stream().map(WebhookEndpoint::id).toList();
  }
}
