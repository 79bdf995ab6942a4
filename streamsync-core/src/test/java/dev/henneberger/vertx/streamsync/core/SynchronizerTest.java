package dev.henneberger.vertx.streamsync.core;

import static dev.henneberger.vertx.streamsync.core.StreamSyncContractKit.awaitFailure;
import static dev.henneberger.vertx.streamsync.core.StreamSyncContractKit.awaitResult;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.json.JsonObject;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class SynchronizerTest {

  private static final Duration TIMEOUT = Duration.ofSeconds(5);
  private static final RemoteDataClient UNUSED_CLIENT =
    (path, apiKey) -> Future.failedFuture(new IllegalStateException("unexpected request " + path));

  @Test
  void resolvesWithSession() {
    RecordingSynchronizer sync = new RecordingSynchronizer(1L, Map.of());
    RecordingSubscription sub = new RecordingSubscription();

    Session session = awaitResult(sync.synchronize(sub), TIMEOUT);

    assertSame(sub, session.subscription());
  }

  @Test
  void touchesAndSavesBeforeExecuting() {
    RecordingSynchronizer sync = new RecordingSynchronizer(1L, Map.of());
    RecordingSubscription sub = new RecordingSubscription();
    sync.beforeExecute = () -> sub.savesSeenByExecute.add(sub.saves.get());

    awaitResult(sync.synchronize(sub), TIMEOUT);

    assertTrue(sub.timestamp() != null);
    assertEquals(1, sub.saves.get());
    assertEquals(List.of(1), sub.savesSeenByExecute);
    assertTrue(sub.patches.isEmpty());
  }

  @Test
  void passesSkipFlagToEachSession() {
    RecordingSynchronizer sync = new RecordingSynchronizer(1L, Map.of());
    RecordingSubscription sub = new RecordingSubscription();

    Session full = awaitResult(sync.synchronize(sub), TIMEOUT);
    Session skipped = awaitResult(sync.synchronize(sub, true), TIMEOUT);

    assertNotSame(full, skipped);
    assertEquals(Boolean.FALSE, sync.skipBySession.get(full));
    assertEquals(Boolean.TRUE, sync.skipBySession.get(skipped));
    assertEquals(2, sync.skipBySession.size());
  }

  @Test
  void updatesAndDispatchesWhenModified() {
    RecordingSynchronizer sync = new RecordingSynchronizer(42L, Map.of("ABCD2345", 42L));
    RecordingSubscription sub = new RecordingSubscription();

    Session session = awaitResult(sync.synchronize(sub), TIMEOUT);

    assertEquals(1, sub.patches.size());
    JsonObject patch = sub.patches.get(0);
    assertEquals(42L, patch.getLong("version"));
    assertEquals(42L, patch.getJsonObject("versions").getLong("ABCD2345"));
    assertEquals(List.of(session), sync.dispatched);
    assertEquals(42L, sub.version());
    assertEquals(Map.of("ABCD2345", 42L), sub.versions());
  }

  @Test
  void skipsUpdateAndDispatchWhenSkipIsSet() {
    RecordingSynchronizer sync = new RecordingSynchronizer(42L, Map.of("ABCD2345", 42L));
    RecordingSubscription sub = new RecordingSubscription();

    Session session = awaitResult(sync.synchronize(sub, true), TIMEOUT);

    assertTrue(session.isModified());
    assertTrue(sub.patches.isEmpty());
    assertTrue(sync.dispatched.isEmpty());
    assertEquals(1, sub.saves.get());
  }

  @Test
  void skipsUpdateAndDispatchWhenNotModified() {
    RecordingSynchronizer sync = new RecordingSynchronizer(7L, Map.of("ABCD2345", 3L));
    RecordingSubscription sub = new RecordingSubscription();
    sub.setVersions(Map.of("ABCD2345", 3L));

    awaitResult(sync.synchronize(sub), TIMEOUT);

    assertTrue(sub.patches.isEmpty());
    assertTrue(sync.dispatched.isEmpty());
  }

  @Test
  void sessionFailureAbortsBeforeUpdate() {
    IllegalStateException error = new IllegalStateException("remote down");
    Synchronizer sync = new Synchronizer(new PluginRegistry(), (path, apiKey) -> Future.failedFuture(error));
    RecordingSubscription sub = new RecordingSubscription();

    assertSame(error, awaitFailure(sync.synchronize(sub), TIMEOUT));
    assertEquals(1, sub.saves.get());
    assertTrue(sub.patches.isEmpty());
  }

  @Test
  void updateDelegatesWithSkip() {
    List<Object[]> calls = new ArrayList<>();
    Synchronizer sync = new Synchronizer(new PluginRegistry(), UNUSED_CLIENT) {
      @Override
      public Future<Session> synchronize(Subscription subscription, boolean skip) {
        calls.add(new Object[] {subscription, skip});
        return Future.succeededFuture(new Session(subscription, UNUSED_CLIENT));
      }
    };
    Subscription sub = new Subscription("/users/42/items", null);

    awaitResult(sync.update(sub), TIMEOUT);

    assertEquals(1, calls.size());
    assertSame(sub, calls.get(0)[0]);
    assertEquals(true, calls.get(0)[1]);
  }

  @Test
  void dispatchWorksWithoutPlugins() {
    Synchronizer sync = new Synchronizer(new PluginRegistry(), UNUSED_CLIENT);
    Session session = new Session(new Subscription("/users/42/items", null), UNUSED_CLIENT);

    assertNull(awaitFailure(sync.dispatch(session), TIMEOUT));
  }

  @Test
  void dispatchesOnlyToConfiguredPlugins() {
    PluginRegistry registry = new PluginRegistry();
    List<Session> one = new ArrayList<>();
    List<Session> two = new ArrayList<>();
    registry.add("one", (session, done) -> {
      one.add(session);
      done.handle(Future.succeededFuture());
    });
    registry.add(Plugin.of("two", session -> {
      two.add(session);
      return Future.succeededFuture();
    }));
    Subscription sub = new Subscription("/users/42/items", null).addPlugin("one");
    Session session = new Session(sub, UNUSED_CLIENT);

    assertNull(awaitFailure(new Synchronizer(registry, UNUSED_CLIENT).dispatch(session), TIMEOUT));

    assertEquals(List.of(session), one);
    assertTrue(two.isEmpty());
  }

  @Test
  void dispatchSkipsUnknownPlugins() {
    Subscription sub = new Subscription("/users/42/items", null).addPlugin("one").addPlugin("missing");
    Session session = new Session(sub, UNUSED_CLIENT);

    assertNull(awaitFailure(new Synchronizer(new PluginRegistry(), UNUSED_CLIENT).dispatch(session), TIMEOUT));
  }

  @Test
  void dispatchWaitsForPendingPlugins() {
    PluginRegistry registry = new PluginRegistry();
    Promise<Void> slow = Promise.promise();
    AtomicInteger calls = new AtomicInteger();
    registry.add(Plugin.of("three", session -> {
      calls.incrementAndGet();
      return slow.future();
    }));
    Subscription sub = new Subscription("/users/42/items", null).addPlugin("three");

    Future<Void> dispatched = new Synchronizer(registry, UNUSED_CLIENT).dispatch(new Session(sub, UNUSED_CLIENT));

    assertEquals(1, calls.get());
    assertFalse(dispatched.isComplete());
    slow.complete();
    assertNull(awaitFailure(dispatched, TIMEOUT));
  }

  @Test
  void pluginFailuresDoNotStopOtherPlugins() {
    PluginRegistry registry = new PluginRegistry();
    List<String> invoked = new CopyOnWriteArrayList<>();
    registry.add(Plugin.of("throws", session -> {
      invoked.add("throws");
      throw new IllegalStateException("boom");
    }));
    registry.add(Plugin.of("fails", session -> {
      invoked.add("fails");
      return Future.failedFuture("nope");
    }));
    registry.add("callback-error", (session, done) -> {
      invoked.add("callback-error");
      done.handle(Future.failedFuture("callback failed"));
    });
    registry.add(Plugin.of("null", session -> {
      invoked.add("null");
      return null;
    }));
    registry.add(new LoggingPlugin());
    Subscription sub = new Subscription("/users/42/items", null)
      .addPlugin("throws")
      .addPlugin("fails")
      .addPlugin("callback-error")
      .addPlugin("null")
      .addPlugin(LoggingPlugin.NAME);

    assertNull(awaitFailure(new Synchronizer(registry, UNUSED_CLIENT).dispatch(new Session(sub, UNUSED_CLIENT)), TIMEOUT));

    assertEquals(List.of("throws", "fails", "callback-error", "null"), invoked);
  }

  private static final class RecordingSubscription extends Subscription {
    final AtomicInteger saves = new AtomicInteger();
    final List<JsonObject> patches = new CopyOnWriteArrayList<>();
    final List<Integer> savesSeenByExecute = new CopyOnWriteArrayList<>();

    RecordingSubscription() {
      super("/users/42/items", "secret");
    }

    @Override
    public Future<Void> save() {
      saves.incrementAndGet();
      return super.save();
    }

    @Override
    public Future<Void> update(JsonObject patch) {
      patches.add(patch.copy());
      return super.update(patch);
    }
  }

  private static final class RecordingSynchronizer extends Synchronizer {
    final Map<Session, Boolean> skipBySession = Collections.synchronizedMap(new IdentityHashMap<>());
    final List<Session> dispatched = new CopyOnWriteArrayList<>();
    final long remoteVersion;
    final Map<String, Long> remote;
    Runnable beforeExecute = () -> { };

    RecordingSynchronizer(long version, Map<String, Long> remote) {
      super(new PluginRegistry(), UNUSED_CLIENT);
      this.remoteVersion = version;
      this.remote = remote;
    }

    @Override
    protected Session newSession(Subscription subscription) {
      return new Session(subscription, client()) {
        @Override
        public Future<Session> execute(boolean skip) {
          beforeExecute.run();
          skipBySession.put(this, skip);
          setVersion(remoteVersion);
          diff(remote, subscription.versions());
          return Future.succeededFuture(this);
        }
      };
    }

    @Override
    public Future<Void> dispatch(Session session) {
      dispatched.add(session);
      return Future.succeededFuture();
    }
  }
}
