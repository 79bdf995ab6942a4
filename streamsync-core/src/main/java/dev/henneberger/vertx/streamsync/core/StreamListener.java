package dev.henneberger.vertx.streamsync.core;

import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Listens to a remote notification stream and reconciles its asynchronous subscription
 * acknowledgements with the subscriptions requested locally.
 *
 * <p>Subscribe requests stay pending until the stream confirms or refuses their topic.
 * Confirmed subscriptions become current and receive {@code updated} notifications for
 * their topic until they are removed. Several local subscriptions may share one remote
 * topic; each of them is acknowledged and notified on its own.
 */
public class StreamListener {

  public static final long DEFAULT_SHUTDOWN_TIMEOUT_MS = 1000L;

  private static final Logger LOG = LoggerFactory.getLogger(StreamListener.class);

  private final Vertx vertx;
  private final StreamConnector connector;
  private final SubscriptionLedger ledger = new SubscriptionLedger();
  private final List<Handler<StreamSubscription>> addedHandlers = new CopyOnWriteArrayList<>();
  private final List<Handler<StreamSubscription>> updatedHandlers = new CopyOnWriteArrayList<>();
  private final List<Handler<Void>> connectedHandlers = new CopyOnWriteArrayList<>();
  private final List<Handler<Throwable>> errorHandlers = new CopyOnWriteArrayList<>();

  private volatile StreamConnection stream;
  private Future<StreamListener> stopping;

  public StreamListener(Vertx vertx, StreamConnector connector) {
    this.vertx = Objects.requireNonNull(vertx, "vertx");
    this.connector = Objects.requireNonNull(connector, "connector");
  }

  public HandlerRegistration onAdded(Handler<StreamSubscription> handler) {
    return register(addedHandlers, handler);
  }

  public HandlerRegistration onUpdated(Handler<StreamSubscription> handler) {
    return register(updatedHandlers, handler);
  }

  public HandlerRegistration onConnected(Handler<Void> handler) {
    return register(connectedHandlers, handler);
  }

  public HandlerRegistration onError(Handler<Throwable> handler) {
    return register(errorHandlers, handler);
  }

  public boolean isStarted() {
    return stream != null;
  }

  /**
   * Acknowledged subscriptions, in acknowledgement order.
   */
  public List<StreamSubscription> current() {
    return ledger.current();
  }

  public int pendingCount() {
    return ledger.pendingCount();
  }

  /**
   * Opens the stream connection and starts reconciling its events.
   *
   * @throws StreamListenerException with {@link StreamListenerException.Reason#ALREADY_STARTED}
   *     when a stream is already held
   */
  public synchronized StreamListener start() {
    if (stream != null) {
      throw new StreamListenerException(StreamListenerException.Reason.ALREADY_STARTED);
    }

    LOG.debug("starting...");

    StreamConnection connection = Objects.requireNonNull(connector.connect(), "connection");
    connection
      .topicUpdatedHandler(this::updated)
      .subscriptionsCreatedHandler(this::subscribed)
      .connectedHandler(v -> emit(connectedHandlers, null))
      .exceptionHandler(err -> emit(errorHandlers, err));
    connection.open();
    stream = connection;
    return this;
  }

  public Future<StreamListener> stop() {
    return stop(DEFAULT_SHUTDOWN_TIMEOUT_MS);
  }

  /**
   * Closes the stream, waiting at most {@code timeoutMs} for it to acknowledge. The stream
   * handlers are detached and the stream is released whatever the outcome. Calls made while
   * a shutdown is in progress share its future.
   */
  public synchronized Future<StreamListener> stop(long timeoutMs) {
    StreamConnection connection = stream;
    if (connection == null) {
      return Future.succeededFuture(this);
    }
    if (stopping != null) {
      return stopping;
    }

    LOG.debug("shutting down (with {}ms grace period)...", timeoutMs);

    Promise<StreamListener> closed = Promise.promise();
    Future<StreamListener> result = closed.future().andThen(ar -> release(connection));
    stopping = result;

    long timer = vertx.setTimer(Math.max(1L, timeoutMs), id -> closed.tryFail(
      new StreamListenerException(StreamListenerException.Reason.SHUTDOWN_TIMEOUT, timeoutMs + "ms")));
    connection.closeHandler(v -> {
      vertx.cancelTimer(timer);
      closed.tryComplete(this);
    });
    try {
      connection.close();
    } catch (RuntimeException e) {
      vertx.cancelTimer(timer);
      closed.tryFail(e);
    }
    return result;
  }

  /**
   * Subscribes a single topic.
   */
  public Future<StreamSubscription> add(StreamSubscription subscription) {
    Objects.requireNonNull(subscription, "subscription");
    return add(Collections.singletonList(subscription)).map(added -> added.get(0));
  }

  /**
   * Sends one subscribe batch for all given subscriptions. The returned future completes
   * once the stream has acknowledged every one of them and fails as soon as one is refused.
   */
  public Future<List<StreamSubscription>> add(List<StreamSubscription> subscriptions) {
    Objects.requireNonNull(subscriptions, "subscriptions");

    StreamConnection connection = stream;
    if (connection == null) {
      return Future.failedFuture(new StreamListenerException(StreamListenerException.Reason.NOT_CONNECTED));
    }
    if (subscriptions.isEmpty()) {
      return Future.failedFuture(new StreamListenerException(StreamListenerException.Reason.EMPTY_REQUEST));
    }

    LOG.debug("adding {} subscription(s)...", subscriptions.size());

    List<StreamSubscription> requested = new ArrayList<>(subscriptions);
    return connection.subscribe(batch(requested)).compose(v -> {
      List<Future<StreamSubscription>> registrations = new ArrayList<>(requested.size());
      synchronized (this) {
        if (stream != connection) {
          LOG.debug("stream closed while adding {} subscription(s)", requested.size());
          return Future.<List<StreamSubscription>>failedFuture(new StreamListenerException(
            StreamListenerException.Reason.NOT_CONNECTED, "stream closed before acknowledgement"));
        }
        for (StreamSubscription subscription : requested) {
          registrations.add(register(subscription));
        }
      }
      return Future.all(registrations).map(all -> {
        List<StreamSubscription> added = new ArrayList<>(registrations.size());
        for (Future<StreamSubscription> registration : registrations) {
          added.add(registration.result());
        }
        return added;
      });
    });
  }

  /**
   * Removes an acknowledged subscription and unsubscribes its topic. The subscription is no
   * longer current once this is called, even when the unsubscribe request fails.
   */
  public Future<StreamSubscription> remove(StreamSubscription subscription) {
    Objects.requireNonNull(subscription, "subscription");

    StreamConnection connection = stream;
    if (connection == null) {
      return Future.failedFuture(new StreamListenerException(StreamListenerException.Reason.NOT_CONNECTED));
    }

    Optional<StreamSubscription> removed = ledger.removeCurrent(subscription.id());
    if (removed.isEmpty()) {
      LOG.debug("failed to remove {}: not registered", subscription.id());
      return Future.failedFuture(
        new StreamListenerException(StreamListenerException.Reason.NOT_REGISTERED, subscription.id()));
    }

    StreamSubscription data = removed.get();
    return connection.unsubscribe(new StreamTopic(data.key(), data.topic()))
      .onFailure(err -> LOG.debug("failed to remove {}: {}", data.id(), err.toString()))
      .map(v -> {
        LOG.debug("successfully removed {} from stream", data.id());
        return data;
      });
  }

  /**
   * Queues a subscription until the stream acknowledges its topic.
   */
  public Future<StreamSubscription> register(StreamSubscription subscription) {
    Promise<StreamSubscription> promise = Promise.promise();
    ledger.register(new PendingRequest(Objects.requireNonNull(subscription, "subscription"), promise));
    return promise.future();
  }

  void subscribed(SubscriptionsCreated event) {
    for (TopicSubscription subscription : event.subscriptions()) {
      for (String topic : subscription.topics()) {
        resolve(subscription.apiKey(), topic);
      }
    }
    for (SubscriptionError error : event.errors()) {
      reject(error.apiKey(), error.topic(), error.error());
    }
  }

  void updated(TopicUpdate update) {
    LOG.debug("topic {} updated...", update.topic());

    for (StreamSubscription subscription : ledger.matchingCurrent(update.apiKey(), update.topic())) {
      emit(updatedHandlers, subscription);
    }
  }

  private void resolve(String key, String topic) {
    for (PendingRequest request : ledger.resolveMatches(key, topic)) {
      StreamSubscription subscription = request.subscription();
      LOG.debug("[{}] listening for updates of {}...", subscription.id(), topic);
      request.promise().tryComplete(subscription);
      emit(addedHandlers, subscription);
    }
  }

  private void reject(String key, String topic, String reason) {
    for (PendingRequest request : ledger.rejectMatches(key, topic)) {
      StreamSubscription subscription = request.subscription();
      LOG.debug("[{}] failed to subscribe {}: {}", subscription.id(), topic, reason);
      request.promise().tryFail(new SubscriptionFailedException(subscription, reason));
    }
  }

  private synchronized void release(StreamConnection connection) {
    connection
      .topicUpdatedHandler(null)
      .subscriptionsCreatedHandler(null)
      .connectedHandler(null)
      .exceptionHandler(null)
      .closeHandler(null);
    if (stream == connection) {
      stream = null;
      stopping = null;
      ledger.clearCurrent();
      for (PendingRequest request : ledger.drainPending()) {
        request.promise().tryFail(new StreamListenerException(
          StreamListenerException.Reason.NOT_CONNECTED, "stream closed before acknowledgement"));
      }
    }
    LOG.debug("shut down complete");
  }

  static List<TopicSubscription> batch(List<StreamSubscription> subscriptions) {
    Map<String, Set<String>> topicsByKey = new LinkedHashMap<>();
    for (StreamSubscription subscription : subscriptions) {
      topicsByKey.computeIfAbsent(subscription.key(), k -> new LinkedHashSet<>()).add(subscription.topic());
    }

    List<TopicSubscription> batch = new ArrayList<>(topicsByKey.size());
    topicsByKey.forEach((key, topics) -> batch.add(new TopicSubscription(key, new ArrayList<>(topics))));
    return batch;
  }

  private static <T> HandlerRegistration register(List<Handler<T>> handlers, Handler<T> handler) {
    Handler<T> resolved = Objects.requireNonNull(handler, "handler");
    handlers.add(resolved);
    return () -> handlers.remove(resolved);
  }

  private static <T> void emit(List<Handler<T>> handlers, T value) {
    for (Handler<T> handler : handlers) {
      try {
        handler.handle(value);
      } catch (RuntimeException e) {
        LOG.warn("listener handler failed", e);
      }
    }
  }
}
