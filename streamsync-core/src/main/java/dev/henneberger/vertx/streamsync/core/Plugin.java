package dev.henneberger.vertx.streamsync.core;

import io.vertx.core.Future;
import io.vertx.core.Promise;
import java.util.Objects;
import java.util.function.Function;

/**
 * Processes the changes found by a synchronization session.
 */
public interface Plugin {
  String name();

  Future<Void> process(Session session);

  static Plugin of(String name, Function<Session, Future<Void>> process) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(process, "process");
    return new Plugin() {
      @Override
      public String name() {
        return name;
      }

      @Override
      public Future<Void> process(Session session) {
        return process.apply(session);
      }
    };
  }

  /**
   * Adapts a plugin that reports completion through a callback.
   */
  static Plugin fromCallback(String name, CallbackPlugin plugin) {
    Objects.requireNonNull(plugin, "plugin");
    return of(name, session -> {
      Promise<Void> promise = Promise.promise();
      plugin.process(session, ar -> {
        if (ar.succeeded()) {
          promise.tryComplete();
        } else {
          promise.tryFail(ar.cause());
        }
      });
      return promise.future();
    });
  }
}
