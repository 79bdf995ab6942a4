package dev.henneberger.vertx.streamsync.core;

import io.vertx.core.AsyncResult;
import io.vertx.core.Handler;

@FunctionalInterface
public interface CallbackPlugin {
  void process(Session session, Handler<AsyncResult<Void>> done);
}
