package dev.henneberger.vertx.streamsync.core;

import java.util.Objects;

public final class StreamTopic {
  private final String apiKey;
  private final String topic;

  public StreamTopic(String apiKey, String topic) {
    this.apiKey = apiKey;
    this.topic = Objects.requireNonNull(topic, "topic");
  }

  public String apiKey() {
    return apiKey;
  }

  public String topic() {
    return topic;
  }
}
