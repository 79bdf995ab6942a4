package dev.henneberger.vertx.streamsync.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Pending requests and acknowledged subscriptions of a {@link StreamListener}. Every
 * mutation happens under the ledger monitor; callers complete promises and emit events
 * after the call returns.
 */
final class SubscriptionLedger {
  private final List<PendingRequest> pending = new ArrayList<>();
  private final List<StreamSubscription> current = new ArrayList<>();

  synchronized void register(PendingRequest request) {
    pending.add(Objects.requireNonNull(request, "request"));
  }

  /**
   * Pops every pending request for the pair, oldest first, and records each one as current.
   */
  synchronized List<PendingRequest> resolveMatches(String key, String topic) {
    List<PendingRequest> matched = popMatches(key, topic);
    for (PendingRequest request : matched) {
      putCurrent(request.subscription());
    }
    return matched;
  }

  synchronized List<PendingRequest> rejectMatches(String key, String topic) {
    return popMatches(key, topic);
  }

  synchronized Optional<StreamSubscription> removeCurrent(String id) {
    Iterator<StreamSubscription> it = current.iterator();
    while (it.hasNext()) {
      StreamSubscription subscription = it.next();
      if (subscription.id().equals(id)) {
        it.remove();
        return Optional.of(subscription);
      }
    }
    return Optional.empty();
  }

  synchronized List<StreamSubscription> matchingCurrent(String key, String topic) {
    List<StreamSubscription> matched = new ArrayList<>();
    for (StreamSubscription subscription : current) {
      if (subscription.matches(key, topic)) {
        matched.add(subscription);
      }
    }
    return matched;
  }

  synchronized List<StreamSubscription> current() {
    return Collections.unmodifiableList(new ArrayList<>(current));
  }

  synchronized int pendingCount() {
    return pending.size();
  }

  synchronized List<PendingRequest> drainPending() {
    List<PendingRequest> drained = new ArrayList<>(pending);
    pending.clear();
    return drained;
  }

  synchronized void clearCurrent() {
    current.clear();
  }

  private List<PendingRequest> popMatches(String key, String topic) {
    List<PendingRequest> matched = new ArrayList<>();
    Iterator<PendingRequest> it = pending.iterator();
    while (it.hasNext()) {
      PendingRequest request = it.next();
      if (request.subscription().matches(key, topic)) {
        it.remove();
        matched.add(request);
      }
    }
    return matched;
  }

  private void putCurrent(StreamSubscription subscription) {
    for (int i = 0; i < current.size(); i++) {
      if (current.get(i).id().equals(subscription.id())) {
        current.set(i, subscription);
        return;
      }
    }
    current.add(subscription);
  }
}
