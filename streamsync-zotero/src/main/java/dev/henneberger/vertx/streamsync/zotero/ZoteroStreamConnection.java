/*
 * Copyright (C) 2026 Daniel Henneberger
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.henneberger.vertx.streamsync.zotero;

import dev.henneberger.vertx.streamsync.core.StreamConnection;
import dev.henneberger.vertx.streamsync.core.StreamTopic;
import dev.henneberger.vertx.streamsync.core.SubscriptionsCreated;
import dev.henneberger.vertx.streamsync.core.TopicSubscription;
import dev.henneberger.vertx.streamsync.core.TopicUpdate;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Promise;
import io.vertx.core.http.WebSocket;
import io.vertx.core.http.WebSocketClient;
import io.vertx.core.http.WebSocketConnectOptions;
import io.vertx.core.json.JsonObject;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * WebSocket connection to the Zotero streaming API.
 */
public final class ZoteroStreamConnection implements StreamConnection {

  private static final Logger LOG = LoggerFactory.getLogger(ZoteroStreamConnection.class);

  private final WebSocketClient client;
  private final WebSocketConnectOptions connectOptions;
  private final Promise<WebSocket> socket = Promise.promise();
  private final AtomicBoolean opened = new AtomicBoolean();
  private final AtomicBoolean closed = new AtomicBoolean();

  private volatile Handler<Void> connectedHandler;
  private volatile Handler<Throwable> exceptionHandler;
  private volatile Handler<SubscriptionsCreated> subscriptionsCreatedHandler;
  private volatile Handler<TopicUpdate> topicUpdatedHandler;
  private volatile Handler<Void> closeHandler;

  ZoteroStreamConnection(WebSocketClient client, WebSocketConnectOptions connectOptions) {
    this.client = Objects.requireNonNull(client, "client");
    this.connectOptions = Objects.requireNonNull(connectOptions, "connectOptions");
  }

  @Override
  public void open() {
    if (!opened.compareAndSet(false, true)) {
      throw new IllegalStateException("connection already opened");
    }

    LOG.debug("connecting to {}:{}{}...", connectOptions.getHost(), connectOptions.getPort(), connectOptions.getURI());
    client.connect(connectOptions).onComplete(ar -> {
      if (ar.failed()) {
        LOG.debug("connection failed: {}", ar.cause().toString());
        socket.tryFail(ar.cause());
        fail(ar.cause());
        return;
      }

      WebSocket ws = ar.result();
      ws.textMessageHandler(this::handleFrame);
      ws.exceptionHandler(this::fail);
      ws.closeHandler(v -> closed());
      socket.tryComplete(ws);
    });
  }

  @Override
  public Future<Void> subscribe(List<TopicSubscription> subscriptions) {
    return write(ZoteroMessages.createSubscriptions(subscriptions));
  }

  @Override
  public Future<Void> unsubscribe(StreamTopic topic) {
    return write(ZoteroMessages.deleteSubscriptions(topic));
  }

  /**
   * Closes the socket. A connection that was never opened, or whose socket is already gone,
   * reports closure right away.
   */
  @Override
  public void close() {
    if (opened.compareAndSet(false, true)) {
      socket.tryFail(new IllegalStateException("connection closed before opening"));
    }
    if (closed.get()) {
      notifyClosed();
      return;
    }

    socket.future().onComplete(ar -> {
      if (ar.failed()) {
        closed();
        return;
      }
      ar.result().close().onFailure(err -> {
        LOG.debug("websocket close failed: {}", err.toString());
        closed();
      });
    });
  }

  @Override
  public ZoteroStreamConnection connectedHandler(Handler<Void> handler) {
    connectedHandler = handler;
    return this;
  }

  @Override
  public ZoteroStreamConnection exceptionHandler(Handler<Throwable> handler) {
    exceptionHandler = handler;
    return this;
  }

  @Override
  public ZoteroStreamConnection subscriptionsCreatedHandler(Handler<SubscriptionsCreated> handler) {
    subscriptionsCreatedHandler = handler;
    return this;
  }

  @Override
  public ZoteroStreamConnection topicUpdatedHandler(Handler<TopicUpdate> handler) {
    topicUpdatedHandler = handler;
    return this;
  }

  @Override
  public ZoteroStreamConnection closeHandler(Handler<Void> handler) {
    closeHandler = handler;
    return this;
  }

  private Future<Void> write(JsonObject message) {
    String text = message.encode();
    return socket.future().compose(ws -> {
      LOG.debug("sending {}", message.getString("action"));
      return ws.writeTextMessage(text);
    });
  }

  void handleFrame(String frame) {
    JsonObject message;
    String event;
    SubscriptionsCreated created = null;
    TopicUpdate update = null;
    try {
      message = ZoteroMessages.decode(frame);
      event = ZoteroMessages.event(message);
      if (ZoteroMessages.SUBSCRIPTIONS_CREATED.equals(event)) {
        created = ZoteroMessages.subscriptionsCreated(message);
      } else if (ZoteroMessages.TOPIC_UPDATED.equals(event)) {
        update = ZoteroMessages.topicUpdated(message);
      }
    } catch (IllegalArgumentException e) {
      fail(e);
      return;
    }

    switch (event) {
      case ZoteroMessages.CONNECTED:
        LOG.debug("stream connected");
        dispatch(connectedHandler, null);
        break;
      case ZoteroMessages.SUBSCRIPTIONS_CREATED:
        dispatch(subscriptionsCreatedHandler, created);
        break;
      case ZoteroMessages.TOPIC_UPDATED:
        dispatch(topicUpdatedHandler, update);
        break;
      case ZoteroMessages.SUBSCRIPTIONS_DELETED:
      case ZoteroMessages.TOPIC_ADDED:
      case ZoteroMessages.TOPIC_REMOVED:
        LOG.debug("ignoring {} event", event);
        break;
      default:
        LOG.debug("ignoring unknown event {}", event);
    }
  }

  private void fail(Throwable err) {
    Handler<Throwable> handler = exceptionHandler;
    if (handler == null) {
      LOG.warn("stream error without handler", err);
      return;
    }
    handler.handle(err);
  }

  private void closed() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    LOG.debug("stream closed");
    client.close().onFailure(err -> LOG.debug("websocket client close failed: {}", err.toString()));
    notifyClosed();
  }

  private void notifyClosed() {
    dispatch(closeHandler, null);
  }

  private static <T> void dispatch(Handler<T> handler, T value) {
    if (handler != null) {
      handler.handle(value);
    }
  }
}
