package dev.henneberger.vertx.streamsync.core;

import io.vertx.core.Future;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps stored subscriptions subscribed on the stream and synchronizes a subscription
 * whenever the stream reports an update of its topic.
 */
public class StreamSyncService {

  private static final Logger LOG = LoggerFactory.getLogger(StreamSyncService.class);

  private final StreamListener listener;
  private final Synchronizer synchronizer;
  private final SubscriptionStore store;
  private final List<HandlerRegistration> registrations = new CopyOnWriteArrayList<>();

  public StreamSyncService(StreamListener listener, Synchronizer synchronizer, SubscriptionStore store) {
    this.listener = Objects.requireNonNull(listener, "listener");
    this.synchronizer = Objects.requireNonNull(synchronizer, "synchronizer");
    this.store = Objects.requireNonNull(store, "store");
  }

  public StreamListener listener() {
    return listener;
  }

  public Synchronizer synchronizer() {
    return synchronizer;
  }

  public SubscriptionStore store() {
    return store;
  }

  /**
   * Starts the listener and subscribes every stored subscription. Completes with the
   * subscriptions the stream acknowledged, or fails when the listener is already started.
   */
  public Future<List<StreamSubscription>> start() {
    try {
      listener.start();
    } catch (RuntimeException e) {
      LOG.debug("start failed: {}", e.toString());
      return Future.failedFuture(e);
    }
    registrations.add(listener.onUpdated(this::onUpdated));

    return store.list().compose(stored -> {
      if (stored.isEmpty()) {
        return Future.succeededFuture(Collections.<StreamSubscription>emptyList());
      }
      List<StreamSubscription> targets = new ArrayList<>(stored.size());
      for (Subscription subscription : stored) {
        targets.add(subscription.toStreamSubscription());
      }
      LOG.info("restoring {} stored subscription(s)", targets.size());
      return listener.add(targets);
    });
  }

  public Future<StreamSubscription> subscribe(Subscription subscription) {
    Objects.requireNonNull(subscription, "subscription");
    return subscription.save().compose(v -> listener.add(subscription.toStreamSubscription()));
  }

  /**
   * Removes the subscription from the stream and from the store. A subscription the stream
   * never acknowledged is still deleted.
   */
  public Future<Boolean> unsubscribe(String id) {
    Objects.requireNonNull(id, "id");
    return store.load(id).compose(found -> {
      if (found.isEmpty()) {
        return Future.succeededFuture(false);
      }
      return listener.remove(found.get().toStreamSubscription())
        .<Void>mapEmpty()
        .recover(err -> isNotRegistered(err) ? Future.succeededFuture() : Future.failedFuture(err))
        .compose(v -> store.delete(id));
    });
  }

  /**
   * Synchronizes a stored subscription by id. Fails when no such subscription is stored.
   */
  public Future<Session> synchronize(String id) {
    Objects.requireNonNull(id, "id");
    return store.load(id).compose(found -> found
      .map(synchronizer::synchronize)
      .orElseGet(() -> Future.failedFuture(new StreamListenerException(StreamListenerException.Reason.NOT_REGISTERED, id))));
  }

  public Future<StreamListener> stop(long timeoutMs) {
    for (HandlerRegistration registration : registrations) {
      registration.cancel();
    }
    registrations.clear();
    return listener.stop(timeoutMs);
  }

  private void onUpdated(StreamSubscription subscription) {
    synchronize(subscription.id())
      .onSuccess(session -> LOG.debug("[{}] synchronized at version {}", subscription.id(), session.version()))
      .onFailure(err -> LOG.warn("[{}] synchronization failed", subscription.id(), err));
  }

  private static boolean isNotRegistered(Throwable err) {
    return err instanceof StreamListenerException
      && ((StreamListenerException) err).reason() == StreamListenerException.Reason.NOT_REGISTERED;
  }
}
