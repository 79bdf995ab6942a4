package dev.henneberger.vertx.streamsync.core;

import io.vertx.core.Future;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A persisted subscription to a remote library URL.
 *
 * <p>Besides the URL and key the subscription remembers the library version and the item
 * versions of its last committed synchronization, plus the ordered list of plugins its
 * changes are dispatched to.
 */
public class Subscription {

  private static final Pattern TOPIC = Pattern.compile("^(/(?:users|groups)/[^/?]+)");

  private final String id;
  private final String url;
  private final String key;
  private final SubscriptionStore store;
  private final List<PluginConfig> plugins = new ArrayList<>();

  private long version;
  private Map<String, Long> versions = new LinkedHashMap<>();
  private Instant timestamp;

  public Subscription(String url, String key) {
    this(newId(), url, key, new NoopSubscriptionStore());
  }

  public Subscription(String id, String url, String key, SubscriptionStore store) {
    this.id = Objects.requireNonNull(id, "id");
    this.url = Objects.requireNonNull(url, "url");
    this.key = key;
    this.store = Objects.requireNonNull(store, "store");
  }

  public static String newId() {
    return UUID.randomUUID().toString().replace("-", "").substring(0, 12);
  }

  public String id() {
    return id;
  }

  public String url() {
    return url;
  }

  public String key() {
    return key;
  }

  /**
   * Stream topic of the library the URL points into, e.g. {@code /users/42} for
   * {@code /users/42/items/top}. URLs outside a user or group library are their own topic.
   */
  public String topic() {
    Matcher matcher = TOPIC.matcher(url);
    return matcher.find() ? matcher.group(1) : url;
  }

  public long version() {
    return version;
  }

  public Subscription setVersion(long version) {
    this.version = version;
    return this;
  }

  public Map<String, Long> versions() {
    return Collections.unmodifiableMap(versions);
  }

  public Subscription setVersions(Map<String, Long> versions) {
    this.versions = versions == null ? new LinkedHashMap<>() : new LinkedHashMap<>(versions);
    return this;
  }

  public List<PluginConfig> plugins() {
    return Collections.unmodifiableList(plugins);
  }

  public Subscription addPlugin(PluginConfig plugin) {
    plugins.add(Objects.requireNonNull(plugin, "plugin"));
    return this;
  }

  public Subscription addPlugin(String name) {
    return addPlugin(new PluginConfig(name));
  }

  public Instant timestamp() {
    return timestamp;
  }

  public StreamSubscription toStreamSubscription() {
    return new StreamSubscription(id, key, topic());
  }

  /**
   * Records that the subscription was just looked at. Not persisted until {@link #save()}.
   */
  public Subscription touch() {
    timestamp = Instant.now();
    return this;
  }

  public Future<Void> save() {
    return store.save(this);
  }

  /**
   * Applies {@code version}, {@code versions} and {@code plugins} from the patch, when
   * present, and saves the subscription.
   */
  public Future<Void> update(JsonObject patch) {
    Objects.requireNonNull(patch, "patch");
    if (patch.containsKey("version")) {
      version = patch.getLong("version", 0L);
    }
    if (patch.containsKey("versions")) {
      versions = readVersions(patch.getJsonObject("versions"));
    }
    if (patch.containsKey("plugins")) {
      plugins.clear();
      plugins.addAll(readPlugins(patch.getJsonArray("plugins")));
    }
    return save();
  }

  public JsonObject toJson() {
    JsonObject versionsJson = new JsonObject();
    versions.forEach(versionsJson::put);

    JsonArray pluginsJson = new JsonArray();
    for (PluginConfig plugin : plugins) {
      pluginsJson.add(plugin.toJson());
    }

    JsonObject json = new JsonObject()
      .put("id", id)
      .put("url", url)
      .put("version", version)
      .put("versions", versionsJson)
      .put("plugins", pluginsJson);
    if (key != null) {
      json.put("key", key);
    }
    if (timestamp != null) {
      json.put("timestamp", timestamp.toString());
    }
    return json;
  }

  public static Subscription fromJson(JsonObject json, SubscriptionStore store) {
    Objects.requireNonNull(json, "json");
    Subscription subscription = new Subscription(json.getString("id"), json.getString("url"), json.getString("key"), store);
    subscription.version = json.getLong("version", 0L);
    subscription.versions = readVersions(json.getJsonObject("versions"));
    subscription.plugins.addAll(readPlugins(json.getJsonArray("plugins")));
    String timestamp = json.getString("timestamp");
    subscription.timestamp = timestamp == null ? null : Instant.parse(timestamp);
    return subscription;
  }

  static Map<String, Long> readVersions(JsonObject json) {
    Map<String, Long> values = new LinkedHashMap<>();
    if (json == null) {
      return values;
    }
    for (String itemKey : json.fieldNames()) {
      Object value = json.getValue(itemKey);
      if (value instanceof Number) {
        values.put(itemKey, ((Number) value).longValue());
      }
    }
    return values;
  }

  private static List<PluginConfig> readPlugins(JsonArray json) {
    List<PluginConfig> values = new ArrayList<>();
    if (json == null) {
      return values;
    }
    for (int i = 0; i < json.size(); i++) {
      Object raw = json.getValue(i);
      if (raw instanceof JsonObject) {
        values.add(PluginConfig.fromJson((JsonObject) raw));
      } else if (raw instanceof String) {
        values.add(new PluginConfig((String) raw));
      }
    }
    return values;
  }

  @Override
  public String toString() {
    return "Subscription{id=" + id + ", url=" + url + ", version=" + version + "}";
  }
}
