package dev.henneberger.vertx.streamsync.core;

import io.vertx.core.Future;
import java.util.List;
import java.util.Optional;

public interface SubscriptionStore {
  Future<Void> save(Subscription subscription);
  Future<Optional<Subscription>> load(String id);
  Future<List<Subscription>> list();
  Future<Boolean> delete(String id);
}
