package dev.henneberger.vertx.streamsync.core;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Persists subscriptions in a JSON file keyed by subscription id. File access runs on
 * Vert.x worker threads.
 */
public final class FileSubscriptionStore implements SubscriptionStore {

  private final Vertx vertx;
  private final Path file;
  private final Object monitor = new Object();

  public FileSubscriptionStore(Vertx vertx, Path file) {
    this.vertx = Objects.requireNonNull(vertx, "vertx");
    this.file = Objects.requireNonNull(file, "file");
  }

  @Override
  public Future<Void> save(Subscription subscription) {
    Objects.requireNonNull(subscription, "subscription");
    JsonObject json = subscription.toJson();
    return vertx.executeBlocking(() -> {
      synchronized (monitor) {
        Map<String, JsonObject> values = readAll();
        values.put(subscription.id(), json);
        writeAll(values);
      }
      return null;
    });
  }

  @Override
  public Future<Optional<Subscription>> load(String id) {
    Objects.requireNonNull(id, "id");
    return vertx.executeBlocking(() -> {
      synchronized (monitor) {
        JsonObject json = readAll().get(id);
        return json == null ? Optional.<Subscription>empty() : Optional.of(Subscription.fromJson(json, this));
      }
    });
  }

  @Override
  public Future<List<Subscription>> list() {
    return vertx.executeBlocking(() -> {
      synchronized (monitor) {
        List<Subscription> subscriptions = new ArrayList<>();
        for (JsonObject json : readAll().values()) {
          subscriptions.add(Subscription.fromJson(json, this));
        }
        return subscriptions;
      }
    });
  }

  @Override
  public Future<Boolean> delete(String id) {
    Objects.requireNonNull(id, "id");
    return vertx.executeBlocking(() -> {
      synchronized (monitor) {
        Map<String, JsonObject> values = readAll();
        if (values.remove(id) == null) {
          return false;
        }
        writeAll(values);
        return true;
      }
    });
  }

  private Map<String, JsonObject> readAll() throws IOException {
    if (Files.notExists(file)) {
      return new LinkedHashMap<>();
    }

    String raw = Files.readString(file, StandardCharsets.UTF_8);
    if (raw.isBlank()) {
      return new LinkedHashMap<>();
    }

    JsonObject json = new JsonObject(raw);
    Map<String, JsonObject> values = new LinkedHashMap<>();
    for (String id : json.fieldNames()) {
      JsonObject value = json.getJsonObject(id);
      if (value != null) {
        values.put(id, value);
      }
    }
    return values;
  }

  private void writeAll(Map<String, JsonObject> values) throws IOException {
    Path parent = file.getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }

    JsonObject json = new JsonObject();
    values.forEach(json::put);
    Files.writeString(file, json.encodePrettily(), StandardCharsets.UTF_8);
  }
}
