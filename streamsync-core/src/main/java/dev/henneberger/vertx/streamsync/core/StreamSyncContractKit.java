package dev.henneberger.vertx.streamsync.core;

import io.vertx.core.Future;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

public final class StreamSyncContractKit {

  private StreamSyncContractKit() {
  }

  public static void assertStartTwiceFails(StreamListener listener) {
    Objects.requireNonNull(listener, "listener");
    if (!listener.isStarted()) {
      listener.start();
    }
    try {
      listener.start();
    } catch (StreamListenerException e) {
      if (e.reason() != StreamListenerException.Reason.ALREADY_STARTED) {
        throw new AssertionError("Expected ALREADY_STARTED, got " + e.reason(), e);
      }
      return;
    }
    throw new AssertionError("Expected second start() to fail");
  }

  public static void assertStopReleasesStream(StreamListener listener, Duration timeout) {
    Objects.requireNonNull(listener, "listener");
    Objects.requireNonNull(timeout, "timeout");
    awaitCompletion(listener.stop(timeout.toMillis()), timeout.plusSeconds(5));
    if (listener.isStarted()) {
      throw new AssertionError("Expected stop() to release the stream");
    }
  }

  public static <T> T awaitResult(Future<T> future, Duration timeout) {
    Objects.requireNonNull(future, "future");
    Objects.requireNonNull(timeout, "timeout");
    try {
      return future.toCompletionStage().toCompletableFuture().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (ExecutionException e) {
      throw new AssertionError("Expected future to succeed", e.getCause());
    } catch (TimeoutException e) {
      throw new AssertionError("Timed out waiting for future completion", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new AssertionError("Interrupted waiting for future completion", e);
    }
  }

  public static Throwable awaitFailure(Future<?> future, Duration timeout) {
    Objects.requireNonNull(future, "future");
    Objects.requireNonNull(timeout, "timeout");
    try {
      future.toCompletionStage().toCompletableFuture().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      return null;
    } catch (ExecutionException e) {
      return e.getCause();
    } catch (TimeoutException e) {
      throw new AssertionError("Timed out waiting for future completion", e);
    } catch (Exception e) {
      return e;
    }
  }

  private static void awaitCompletion(Future<?> future, Duration timeout) {
    try {
      future.toCompletionStage().toCompletableFuture().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (ExecutionException ignore) {
      // a timed out shutdown still has to release the stream
    } catch (TimeoutException e) {
      throw new AssertionError("Timed out waiting for stop()", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new AssertionError("Interrupted waiting for stop()", e);
    }
  }
}
