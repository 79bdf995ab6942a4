package dev.henneberger.vertx.streamsync.core;

import io.vertx.core.Future;
import io.vertx.core.Handler;
import java.util.List;

/**
 * Bidirectional channel to the remote notification stream. Passing {@code null} to a
 * handler setter detaches the current handler.
 *
 * <p>A connection does not talk to the remote until {@link #open()} is called, so handlers
 * can be attached first. Writes issued before the channel is established wait for it.
 */
public interface StreamConnection {
  void open();

  Future<Void> subscribe(List<TopicSubscription> subscriptions);
  Future<Void> unsubscribe(StreamTopic topic);
  void close();

  StreamConnection connectedHandler(Handler<Void> handler);
  StreamConnection exceptionHandler(Handler<Throwable> handler);
  StreamConnection subscriptionsCreatedHandler(Handler<SubscriptionsCreated> handler);
  StreamConnection topicUpdatedHandler(Handler<TopicUpdate> handler);
  StreamConnection closeHandler(Handler<Void> handler);
}
