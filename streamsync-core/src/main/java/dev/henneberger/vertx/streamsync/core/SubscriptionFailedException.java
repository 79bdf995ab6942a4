package dev.henneberger.vertx.streamsync.core;

import java.util.Objects;

/**
 * The stream refused a single topic subscription.
 */
public final class SubscriptionFailedException extends RuntimeException {

  private final StreamSubscription subscription;

  public SubscriptionFailedException(StreamSubscription subscription, String reason) {
    super(reason);
    this.subscription = Objects.requireNonNull(subscription, "subscription");
  }

  public StreamSubscription subscription() {
    return subscription;
  }

  public String reason() {
    return getMessage();
  }
}
