package dev.henneberger.vertx.streamsync.core;

import java.util.Objects;

public final class SubscriptionError {
  private final String apiKey;
  private final String topic;
  private final String error;

  public SubscriptionError(String apiKey, String topic, String error) {
    this.apiKey = apiKey;
    this.topic = Objects.requireNonNull(topic, "topic");
    this.error = error == null ? "subscription failed" : error;
  }

  public String apiKey() {
    return apiKey;
  }

  public String topic() {
    return topic;
  }

  public String error() {
    return error;
  }
}
