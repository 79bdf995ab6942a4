package dev.henneberger.vertx.streamsync.core;

@FunctionalInterface
public interface StreamConnector {
  StreamConnection connect();
}
