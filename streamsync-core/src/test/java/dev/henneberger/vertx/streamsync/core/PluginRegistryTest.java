package dev.henneberger.vertx.streamsync.core;

import static dev.henneberger.vertx.streamsync.core.StreamSyncContractKit.awaitFailure;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.vertx.core.Future;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class PluginRegistryTest {

  private static final Duration TIMEOUT = Duration.ofSeconds(5);

  @Test
  void replacesPluginsByName() {
    PluginRegistry registry = new PluginRegistry();
    Plugin first = Plugin.of("one", session -> Future.succeededFuture());
    Plugin second = Plugin.of("one", session -> Future.succeededFuture());

    registry.add(first).add(second);

    assertSame(second, registry.lookup("one").orElseThrow());
    assertEquals(1, registry.names().size());
  }

  @Test
  void removesAndResets() {
    PluginRegistry registry = new PluginRegistry()
      .add(new LoggingPlugin())
      .add("other", (session, done) -> done.handle(Future.succeededFuture()));

    assertTrue(registry.remove(LoggingPlugin.NAME));
    assertFalse(registry.remove(LoggingPlugin.NAME));
    assertFalse(registry.lookup(null).isPresent());

    registry.reset();
    assertTrue(registry.names().isEmpty());
  }

  @Test
  void callbackPluginIgnoresSecondCompletion() {
    Plugin plugin = Plugin.fromCallback("twice", (session, done) -> {
      done.handle(Future.succeededFuture());
      done.handle(Future.failedFuture("late"));
    });
    Session session = new Session(new Subscription("/users/1/items", null), (path, apiKey) -> Future.failedFuture("unused"));

    assertNull(awaitFailure(plugin.process(session), TIMEOUT));
  }
}
