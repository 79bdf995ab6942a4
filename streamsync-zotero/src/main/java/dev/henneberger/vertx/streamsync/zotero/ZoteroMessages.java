/*
 * Copyright (C) 2026 Daniel Henneberger
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.henneberger.vertx.streamsync.zotero;

import dev.henneberger.vertx.streamsync.core.StreamTopic;
import dev.henneberger.vertx.streamsync.core.SubscriptionError;
import dev.henneberger.vertx.streamsync.core.SubscriptionsCreated;
import dev.henneberger.vertx.streamsync.core.TopicSubscription;
import dev.henneberger.vertx.streamsync.core.TopicUpdate;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Encodes requests to and decodes events from the Zotero streaming API.
 *
 * <p>Decoding is strict about the fields the listener depends on and throws
 * {@link IllegalArgumentException} for frames it cannot interpret.
 */
public final class ZoteroMessages {

  public static final String CONNECTED = "connected";
  public static final String SUBSCRIPTIONS_CREATED = "subscriptionsCreated";
  public static final String SUBSCRIPTIONS_DELETED = "subscriptionsDeleted";
  public static final String TOPIC_UPDATED = "topicUpdated";
  public static final String TOPIC_ADDED = "topicAdded";
  public static final String TOPIC_REMOVED = "topicRemoved";

  private ZoteroMessages() {
  }

  public static JsonObject createSubscriptions(List<TopicSubscription> subscriptions) {
    Objects.requireNonNull(subscriptions, "subscriptions");
    JsonArray entries = new JsonArray();
    for (TopicSubscription subscription : subscriptions) {
      JsonObject entry = new JsonObject();
      if (subscription.apiKey() != null) {
        entry.put("apiKey", subscription.apiKey());
      }
      entries.add(entry.put("topics", new JsonArray(new ArrayList<>(subscription.topics()))));
    }
    return new JsonObject()
      .put("action", "createSubscriptions")
      .put("subscriptions", entries);
  }

  public static JsonObject deleteSubscriptions(StreamTopic topic) {
    Objects.requireNonNull(topic, "topic");
    JsonObject entry = new JsonObject();
    if (topic.apiKey() != null) {
      entry.put("apiKey", topic.apiKey());
    }
    entry.put("topic", topic.topic());
    return new JsonObject()
      .put("action", "deleteSubscriptions")
      .put("subscriptions", new JsonArray().add(entry));
  }

  /**
   * Parses a text frame. The result always carries a string {@code event} field.
   */
  public static JsonObject decode(String frame) {
    if (frame == null || frame.isBlank()) {
      throw new IllegalArgumentException("empty stream message");
    }
    JsonObject message;
    try {
      message = new JsonObject(frame);
    } catch (DecodeException e) {
      throw new IllegalArgumentException("malformed stream message: " + e.getMessage(), e);
    }
    if (!(message.getValue("event") instanceof String)) {
      throw new IllegalArgumentException("stream message without event: " + frame);
    }
    return message;
  }

  public static String event(JsonObject message) {
    return message.getString("event");
  }

  public static SubscriptionsCreated subscriptionsCreated(JsonObject message) {
    List<TopicSubscription> subscriptions = new ArrayList<>();
    for (JsonObject entry : objects(message, "subscriptions")) {
      List<String> topics = new ArrayList<>();
      for (Object topic : array(entry, "topics")) {
        if (!(topic instanceof String)) {
          throw new IllegalArgumentException("subscription topic must be a string: " + topic);
        }
        topics.add((String) topic);
      }
      subscriptions.add(new TopicSubscription(string(entry, "apiKey", false), topics));
    }

    List<SubscriptionError> errors = new ArrayList<>();
    for (JsonObject entry : objects(message, "errors")) {
      errors.add(new SubscriptionError(
        string(entry, "apiKey", false),
        string(entry, "topic", true),
        string(entry, "error", false)));
    }
    return new SubscriptionsCreated(subscriptions, errors);
  }

  public static TopicUpdate topicUpdated(JsonObject message) {
    Object version = message.getValue("version");
    if (version != null && !(version instanceof Number)) {
      throw new IllegalArgumentException("topic version must be a number: " + version);
    }
    return new TopicUpdate(
      string(message, "apiKey", false),
      string(message, "topic", true),
      version == null ? null : ((Number) version).longValue());
  }

  private static List<JsonObject> objects(JsonObject json, String field) {
    List<JsonObject> values = new ArrayList<>();
    for (Object raw : array(json, field)) {
      if (!(raw instanceof JsonObject)) {
        throw new IllegalArgumentException(field + " entries must be objects");
      }
      values.add((JsonObject) raw);
    }
    return values;
  }

  private static JsonArray array(JsonObject json, String field) {
    Object raw = json.getValue(field);
    if (raw == null) {
      return new JsonArray();
    }
    if (!(raw instanceof JsonArray)) {
      throw new IllegalArgumentException(field + " must be an array");
    }
    return (JsonArray) raw;
  }

  private static String string(JsonObject json, String field, boolean required) {
    Object raw = json.getValue(field);
    if (raw == null) {
      if (required) {
        throw new IllegalArgumentException(field + " is required");
      }
      return null;
    }
    if (!(raw instanceof String)) {
      throw new IllegalArgumentException(field + " must be a string");
    }
    return (String) raw;
  }
}
