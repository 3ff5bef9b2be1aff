package io.relay.idempotency;

import io.relay.model.CachedResponse;
import io.relay.model.IdempotencyRecord;
import io.relay.model.IdempotencyStatus;
import io.relay.spi.ConnectionProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IdempotencyGateTest {
  private static final String SCOPE = "user-1:/payments";
  private static final String KEY = "key-123";
  private static final String HASH = RequestFingerprint.of("POST", "/payments", "{\"amount\":10}");

  private InMemoryIdempotencyStore store;
  private MutableClock clock;
  private IdempotencyGate gate;

  @BeforeEach
  void setUp() {
    store = new InMemoryIdempotencyStore();
    clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    gate = IdempotencyGate.builder()
        .connectionProvider(stubCp())
        .store(store)
        .clock(clock)
        .build();
  }

  @Test
  void firstAcquireProceeds() {
    AcquireResult result = gate.acquire(KEY, SCOPE, HASH);

    AcquireResult.Proceed proceed = assertInstanceOf(AcquireResult.Proceed.class, result);
    assertEquals(KEY, proceed.lockToken().key());
    assertEquals(SCOPE, proceed.lockToken().scope());
    IdempotencyRecord record = store.find(null, SCOPE, KEY).orElseThrow();
    assertEquals(IdempotencyStatus.LOCKED, record.status());
    assertEquals(clock.instant().plus(Duration.ofHours(24)), record.expiresAt());
  }

  @Test
  void secondAcquireWhileLockedIsLocked() {
    gate.acquire(KEY, SCOPE, HASH);
    assertSame(AcquireResult.LOCKED, gate.acquire(KEY, SCOPE, HASH));
  }

  @Test
  void completedKeyReplaysStoredResponse() {
    LockToken token = ((AcquireResult.Proceed) gate.acquire(KEY, SCOPE, HASH)).lockToken();
    CachedResponse response = new CachedResponse(201, "application/json", "{\"id\":\"pay_1\"}");
    assertTrue(gate.complete(token, response));

    AcquireResult.Replay replay = assertInstanceOf(AcquireResult.Replay.class, gate.acquire(KEY, SCOPE, HASH));
    assertEquals(response, replay.response());
  }

  @Test
  void differentHashConflictsEvenWhenCompleted() {
    LockToken token = ((AcquireResult.Proceed) gate.acquire(KEY, SCOPE, HASH)).lockToken();
    String otherHash = RequestFingerprint.of("POST", "/payments", "{\"amount\":99}");

    assertSame(AcquireResult.CONFLICT, gate.acquire(KEY, SCOPE, otherHash));
    gate.complete(token, new CachedResponse(200, null, null));
    assertSame(AcquireResult.CONFLICT, gate.acquire(KEY, SCOPE, otherHash));
  }

  @Test
  void sameKeyInAnotherScopeIsIndependent() {
    gate.acquire(KEY, SCOPE, HASH);
    assertInstanceOf(AcquireResult.Proceed.class, gate.acquire(KEY, "user-2:/payments", HASH));
  }

  @Test
  void staleLockIsTakenOverAndOldHolderCannotComplete() {
    LockToken first = ((AcquireResult.Proceed) gate.acquire(KEY, SCOPE, HASH)).lockToken();
    clock.advance(Duration.ofSeconds(31));

    AcquireResult.Proceed second = assertInstanceOf(AcquireResult.Proceed.class, gate.acquire(KEY, SCOPE, HASH));
    assertNotEquals(first.token(), second.lockToken().token());

    assertFalse(gate.complete(first, new CachedResponse(200, null, "stale")));
    assertTrue(gate.complete(second.lockToken(), new CachedResponse(200, null, "fresh")));
    AcquireResult.Replay replay = (AcquireResult.Replay) gate.acquire(KEY, SCOPE, HASH);
    assertEquals("fresh", replay.response().body());
  }

  @Test
  void lockWithinStalenessWindowIsNotTakenOver() {
    gate.acquire(KEY, SCOPE, HASH);
    clock.advance(Duration.ofSeconds(30));
    assertSame(AcquireResult.LOCKED, gate.acquire(KEY, SCOPE, HASH));
  }

  @Test
  void expiredRecordBehavesAsUnused() {
    LockToken token = ((AcquireResult.Proceed) gate.acquire(KEY, SCOPE, HASH)).lockToken();
    gate.complete(token, new CachedResponse(200, null, "old"));
    clock.advance(Duration.ofHours(24));

    String otherHash = RequestFingerprint.of("POST", "/payments", "{}");
    assertInstanceOf(AcquireResult.Proceed.class, gate.acquire(KEY, SCOPE, otherHash));
  }

  @Test
  void releaseLetsTheNextRequestProceed() {
    LockToken token = ((AcquireResult.Proceed) gate.acquire(KEY, SCOPE, HASH)).lockToken();
    assertTrue(gate.release(token));
    assertFalse(gate.release(token));
    assertInstanceOf(AcquireResult.Proceed.class, gate.acquire(KEY, SCOPE, HASH));
  }

  @Test
  void executeRunsActionOnceAndReplaysAfterwards() {
    AtomicInteger calls = new AtomicInteger();
    IdempotentResult first = gate.execute(KEY, SCOPE, HASH, () -> {
      calls.incrementAndGet();
      return new CachedResponse(201, "application/json", "{\"ok\":true}");
    });
    IdempotentResult second = gate.execute(KEY, SCOPE, HASH, () -> {
      calls.incrementAndGet();
      return new CachedResponse(201, "application/json", "{\"ok\":false}");
    });

    assertEquals(1, calls.get());
    assertFalse(first.replayed());
    assertTrue(second.replayed());
    assertEquals(first.response(), second.response());
  }

  @Test
  void executeConflictNeverInvokesAction() {
    gate.execute(KEY, SCOPE, HASH, () -> new CachedResponse(200, null, null));
    AtomicInteger calls = new AtomicInteger();

    IdempotencyConflictException e = assertThrows(IdempotencyConflictException.class,
        () -> gate.execute(KEY, SCOPE, "different", () -> {
          calls.incrementAndGet();
          return new CachedResponse(200, null, null);
        }));
    assertEquals(0, calls.get());
    assertEquals(KEY, e.key());
  }

  @Test
  void executeWhileLockedThrowsLocked() {
    gate.acquire(KEY, SCOPE, HASH);
    assertThrows(IdempotencyLockedException.class,
        () -> gate.execute(KEY, SCOPE, HASH, () -> new CachedResponse(200, null, null)));
  }

  @Test
  void executeReleasesKeyOnExceptionAndServerError() {
    assertThrows(IllegalStateException.class, () -> gate.execute(KEY, SCOPE, HASH, () -> {
      throw new IllegalStateException("boom");
    }));
    assertTrue(store.records.isEmpty());

    IdempotentResult result = gate.execute(KEY, SCOPE, HASH, () -> new CachedResponse(503, null, "down"));
    assertEquals(503, result.response().status());
    assertTrue(store.records.isEmpty());
  }

  @Test
  void clientErrorsAreStoredAndReplayed() {
    gate.execute(KEY, SCOPE, HASH, () -> new CachedResponse(400, null, "bad"));
    IdempotentResult replay = gate.execute(KEY, SCOPE, HASH, () -> new CachedResponse(200, null, "ok"));
    assertTrue(replay.replayed());
    assertEquals(400, replay.response().status());
  }

  @Test
  void concurrentRequestsWithSameKeyExecuteExactlyOnce() throws Exception {
    int threads = 8;
    AtomicInteger executions = new AtomicInteger();
    CountDownLatch start = new CountDownLatch(1);
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    try {
      List<Future<AcquireResult>> futures = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        Callable<AcquireResult> task = () -> {
          start.await();
          return gate.acquire(KEY, SCOPE, HASH);
        };
        futures.add(pool.submit(task));
      }
      start.countDown();

      int proceeded = 0;
      int locked = 0;
      for (Future<AcquireResult> f : futures) {
        AcquireResult r = f.get(5, TimeUnit.SECONDS);
        if (r instanceof AcquireResult.Proceed) {
          proceeded++;
          executions.incrementAndGet();
        } else if (r instanceof AcquireResult.Locked) {
          locked++;
        }
      }
      assertEquals(1, proceeded);
      assertEquals(threads - 1, locked);
      assertEquals(1, executions.get());
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void builderValidatesDurations() {
    assertThrows(NullPointerException.class, () -> IdempotencyGate.builder().store(store).build());
    assertThrows(IllegalArgumentException.class, () -> IdempotencyGate.builder()
        .connectionProvider(stubCp()).store(store).ttl(Duration.ZERO).build());
    assertThrows(IllegalArgumentException.class, () -> IdempotencyGate.builder()
        .connectionProvider(stubCp()).store(store)
        .ttl(Duration.ofSeconds(10)).stalenessWindow(Duration.ofSeconds(10)).build());
  }

  @Test
  void blankKeyIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> gate.acquire(" ", SCOPE, HASH));
  }

  static ConnectionProvider stubCp() {
    return () -> (Connection) java.lang.reflect.Proxy.newProxyInstance(
        Connection.class.getClassLoader(),
        new Class<?>[]{Connection.class},
        (proxy, method, args) -> null);
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
