package dev.henneberger.vertx.streamsync.core;

import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps subscriptions as JSON snapshots, so later changes to a loaded instance are not
 * visible until it is saved again.
 */
public final class InMemorySubscriptionStore implements SubscriptionStore {
  private final Map<String, JsonObject> storage = new ConcurrentHashMap<>();

  @Override
  public Future<Void> save(Subscription subscription) {
    Objects.requireNonNull(subscription, "subscription");
    storage.put(subscription.id(), subscription.toJson());
    return Future.succeededFuture();
  }

  @Override
  public Future<Optional<Subscription>> load(String id) {
    Objects.requireNonNull(id, "id");
    JsonObject json = storage.get(id);
    return Future.succeededFuture(json == null ? Optional.empty() : Optional.of(Subscription.fromJson(json, this)));
  }

  @Override
  public Future<List<Subscription>> list() {
    List<Subscription> subscriptions = new ArrayList<>();
    for (JsonObject json : storage.values()) {
      subscriptions.add(Subscription.fromJson(json, this));
    }
    return Future.succeededFuture(subscriptions);
  }

  @Override
  public Future<Boolean> delete(String id) {
    Objects.requireNonNull(id, "id");
    return Future.succeededFuture(storage.remove(id) != null);
  }
}
