package dev.henneberger.vertx.streamsync.core;

import static dev.henneberger.vertx.streamsync.core.StreamSyncContractKit.awaitResult;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SubscriptionTest {

  private static final Duration TIMEOUT = Duration.ofSeconds(5);

  @Test
  void derivesTopicFromLibraryUrl() {
    assertEquals("/users/42", new Subscription("/users/42/items/top", null).topic());
    assertEquals("/groups/7", new Subscription("/groups/7/collections/ABCD/items", null).topic());
    assertEquals("/users/42", new Subscription("/users/42?format=versions", null).topic());
    assertEquals("/publications/items", new Subscription("/publications/items", null).topic());
  }

  @Test
  void generatesDistinctIds() {
    String first = Subscription.newId();

    assertEquals(12, first.length());
    assertNotEquals(first, Subscription.newId());
  }

  @Test
  void carriesKeyIntoStreamSubscription() {
    Subscription subscription = new Subscription("/users/42/items", "secret");

    StreamSubscription stream = subscription.toStreamSubscription();

    assertEquals(subscription.id(), stream.id());
    assertEquals("secret", stream.key());
    assertEquals("/users/42", stream.topic());
  }

  @Test
  void restoresFromJson() {
    Subscription original = new Subscription("abc", "/users/42/items", "secret", new NoopSubscriptionStore())
      .setVersion(17)
      .setVersions(Map.of("AAAA", 3L))
      .addPlugin(new PluginConfig("logger", new JsonObject().put("level", "debug")))
      .touch();

    Subscription restored = Subscription.fromJson(original.toJson(), new NoopSubscriptionStore());

    assertEquals("abc", restored.id());
    assertEquals("/users/42/items", restored.url());
    assertEquals("secret", restored.key());
    assertEquals(17L, restored.version());
    assertEquals(Map.of("AAAA", 3L), restored.versions());
    assertEquals("logger", restored.plugins().get(0).name());
    assertEquals("debug", restored.plugins().get(0).options().getString("level"));
    assertEquals(original.timestamp(), restored.timestamp());
  }

  @Test
  void omitsMissingKeyFromJson() {
    JsonObject json = new Subscription("/users/42/items", null).toJson();

    assertTrue(!json.containsKey("key"));
    assertNull(Subscription.fromJson(json, new NoopSubscriptionStore()).key());
  }

  @Test
  void updateAppliesPatchAndSaves() {
    InMemorySubscriptionStore store = new InMemorySubscriptionStore();
    Subscription subscription = new Subscription("abc", "/users/42/items", null, store).addPlugin("old");

    awaitResult(subscription.update(new JsonObject()
      .put("version", 42)
      .put("versions", new JsonObject().put("AAAA", 42))
      .put("plugins", new JsonArray().add("logger").add(new JsonObject().put("name", "other")))), TIMEOUT);

    assertEquals(42L, subscription.version());
    assertEquals(Map.of("AAAA", 42L), subscription.versions());
    assertEquals(2, subscription.plugins().size());
    assertEquals("other", subscription.plugins().get(1).name());

    Subscription stored = awaitResult(store.load("abc"), TIMEOUT).orElseThrow();
    assertEquals(42L, stored.version());
    assertEquals(Map.of("AAAA", 42L), stored.versions());
  }

  @Test
  void updateKeepsFieldsMissingFromPatch() {
    Subscription subscription = new Subscription("/users/42/items", null)
      .setVersion(5)
      .setVersions(Map.of("AAAA", 5L))
      .addPlugin("logger");

    awaitResult(subscription.update(new JsonObject().put("version", 6)), TIMEOUT);

    assertEquals(6L, subscription.version());
    assertEquals(Map.of("AAAA", 5L), subscription.versions());
    assertEquals(1, subscription.plugins().size());
  }
}
