package dev.henneberger.vertx.streamsync.core;

import io.vertx.core.Promise;
import java.util.Objects;

final class PendingRequest {
  private final StreamSubscription subscription;
  private final Promise<StreamSubscription> promise;

  PendingRequest(StreamSubscription subscription, Promise<StreamSubscription> promise) {
    this.subscription = Objects.requireNonNull(subscription, "subscription");
    this.promise = Objects.requireNonNull(promise, "promise");
  }

  StreamSubscription subscription() {
    return subscription;
  }

  Promise<StreamSubscription> promise() {
    return promise;
  }
}
