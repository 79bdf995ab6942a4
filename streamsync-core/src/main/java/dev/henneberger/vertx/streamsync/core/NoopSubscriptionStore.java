package dev.henneberger.vertx.streamsync.core;

import io.vertx.core.Future;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

public final class NoopSubscriptionStore implements SubscriptionStore {

  @Override
  public Future<Void> save(Subscription subscription) {
    return Future.succeededFuture();
  }

  @Override
  public Future<Optional<Subscription>> load(String id) {
    return Future.succeededFuture(Optional.empty());
  }

  @Override
  public Future<List<Subscription>> list() {
    return Future.succeededFuture(Collections.emptyList());
  }

  @Override
  public Future<Boolean> delete(String id) {
    return Future.succeededFuture(false);
  }
}
