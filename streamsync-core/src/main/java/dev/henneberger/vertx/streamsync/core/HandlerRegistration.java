package dev.henneberger.vertx.streamsync.core;

@FunctionalInterface
public interface HandlerRegistration {
  void cancel();
}
