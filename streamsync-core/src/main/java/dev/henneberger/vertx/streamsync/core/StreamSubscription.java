package dev.henneberger.vertx.streamsync.core;

import java.util.Objects;

/**
 * A local subscription to a remote stream topic. Used both as the intent passed to
 * {@link StreamListener#add} and as the acknowledged record kept by the listener.
 */
public final class StreamSubscription {
  private final String id;
  private final String key;
  private final String topic;

  public StreamSubscription(String id, String key, String topic) {
    this.id = Objects.requireNonNull(id, "id");
    this.key = key;
    this.topic = Objects.requireNonNull(topic, "topic");
  }

  public String id() {
    return id;
  }

  /**
   * API key the topic is subscribed with, {@code null} for public topics.
   */
  public String key() {
    return key;
  }

  public String topic() {
    return topic;
  }

  /**
   * Field-wise match that ignores every expected value that is {@code null}.
   */
  public boolean matches(String expectedKey, String expectedTopic) {
    if (expectedKey != null && !expectedKey.equals(key)) {
      return false;
    }
    return expectedTopic == null || expectedTopic.equals(topic);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof StreamSubscription)) {
      return false;
    }
    StreamSubscription other = (StreamSubscription) o;
    return id.equals(other.id) && Objects.equals(key, other.key) && topic.equals(other.topic);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, key, topic);
  }

  @Override
  public String toString() {
    return "StreamSubscription{id=" + id + ", topic=" + topic + "}";
  }
}
