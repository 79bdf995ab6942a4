package dev.henneberger.vertx.streamsync.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One entry of a stream subscribe batch: every topic requested with a single API key.
 */
public final class TopicSubscription {
  private final String apiKey;
  private final List<String> topics;

  public TopicSubscription(String apiKey, List<String> topics) {
    this.apiKey = apiKey;
    this.topics = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(topics, "topics")));
  }

  public String apiKey() {
    return apiKey;
  }

  public List<String> topics() {
    return topics;
  }
}
