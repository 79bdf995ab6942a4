package dev.henneberger.vertx.streamsync.core;

import io.vertx.core.Future;

@FunctionalInterface
public interface RemoteDataClient {
  /**
   * Fetches {@code path}, authenticated with {@code apiKey} when it is not {@code null}.
   * Non-successful responses fail with {@link RemoteRequestException}.
   */
  Future<RemoteResponse> get(String path, String apiKey);
}
