package dev.henneberger.vertx.streamsync.core;

import java.util.Objects;

public final class TopicUpdate {
  private final String apiKey;
  private final String topic;
  private final Long version;

  public TopicUpdate(String apiKey, String topic, Long version) {
    this.apiKey = apiKey;
    this.topic = Objects.requireNonNull(topic, "topic");
    this.version = version;
  }

  /**
   * Key the notification was scoped to, or {@code null} when it applies to every key.
   */
  public String apiKey() {
    return apiKey;
  }

  public String topic() {
    return topic;
  }

  public Long version() {
    return version;
  }
}
