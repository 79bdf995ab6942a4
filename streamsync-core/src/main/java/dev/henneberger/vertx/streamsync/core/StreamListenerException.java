package dev.henneberger.vertx.streamsync.core;

import java.util.Objects;

public final class StreamListenerException extends IllegalStateException {

  public enum Reason {
    ALREADY_STARTED("listener already started"),
    NOT_CONNECTED("stream not connected"),
    EMPTY_REQUEST("no subscriptions given"),
    NOT_REGISTERED("not registered"),
    SHUTDOWN_TIMEOUT("shutdown timed out");

    private final String message;

    Reason(String message) {
      this.message = message;
    }
  }

  private final Reason reason;

  public StreamListenerException(Reason reason) {
    this(reason, null);
  }

  public StreamListenerException(Reason reason, String detail) {
    super(describe(Objects.requireNonNull(reason, "reason"), detail));
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }

  private static String describe(Reason reason, String detail) {
    if (detail == null || detail.isBlank()) {
      return reason.message;
    }
    return reason.message + ": " + detail;
  }
}
