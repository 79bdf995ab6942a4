package dev.henneberger.vertx.streamsync.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Acknowledgement of a subscribe batch. Successes and failures may arrive in the same event.
 */
public final class SubscriptionsCreated {
  private final List<TopicSubscription> subscriptions;
  private final List<SubscriptionError> errors;

  public SubscriptionsCreated(List<TopicSubscription> subscriptions, List<SubscriptionError> errors) {
    this.subscriptions = subscriptions == null
      ? Collections.emptyList()
      : Collections.unmodifiableList(new ArrayList<>(subscriptions));
    this.errors = errors == null
      ? Collections.emptyList()
      : Collections.unmodifiableList(new ArrayList<>(errors));
  }

  public List<TopicSubscription> subscriptions() {
    return subscriptions;
  }

  public List<SubscriptionError> errors() {
    return errors;
  }
}
