package dev.henneberger.vertx.streamsync.core;

import io.vertx.core.Future;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One synchronization pass of a single subscription: fetches the remote item versions,
 * diffs them against the versions the subscription last committed and, unless skipped,
 * fetches the payload of every created or updated item.
 */
public class Session {

  static final int MAX_ITEM_KEYS_PER_REQUEST = 50;

  private final Subscription subscription;
  private final RemoteDataClient client;

  private long version;
  private Map<String, Long> versions = Collections.emptyMap();
  private ItemDelta delta = ItemDelta.empty();
  private List<JsonObject> items = Collections.emptyList();

  public Session(Subscription subscription, RemoteDataClient client) {
    this.subscription = Objects.requireNonNull(subscription, "subscription");
    this.client = Objects.requireNonNull(client, "client");
  }

  public Subscription subscription() {
    return subscription;
  }

  /**
   * Library version the remote reported for this pass.
   */
  public long version() {
    return version;
  }

  protected Session setVersion(long version) {
    this.version = version;
    return this;
  }

  /**
   * Item versions fetched in this pass.
   */
  public Map<String, Long> versions() {
    return versions;
  }

  public List<String> created() {
    return delta.created();
  }

  public List<String> updated() {
    return delta.updated();
  }

  public List<String> deleted() {
    return delta.deleted();
  }

  public ItemDelta delta() {
    return delta;
  }

  /**
   * Payloads of the created and updated items. Empty after a skipped pass.
   */
  public List<JsonObject> items() {
    return items;
  }

  public boolean isModified() {
    return !delta.isEmpty();
  }

  public Future<RemoteResponse> get(String path) {
    return client.get(resolve(subscription.url(), path), subscription.key());
  }

  public ItemDelta diff(Map<String, ?> newState, Map<String, ?> oldState) {
    delta = ItemDelta.between(newState, oldState);
    return delta;
  }

  /**
   * Runs the pass. A skipped pass only fetches the version listing.
   */
  public Future<Session> execute(boolean skip) {
    long since = subscription.version();

    return get("?format=versions").compose(response -> {
      Map<String, Long> fetched = Subscription.readVersions(response.bodyAsJsonObject());
      versions = Collections.unmodifiableMap(fetched);
      version = response.version() == RemoteResponse.NO_VERSION ? since : response.version();
      diff(fetched, subscription.versions());

      if (skip) {
        return Future.succeededFuture(this);
      }
      return fetchItems(since).map(this);
    });
  }

  private Future<Void> fetchItems(long since) {
    List<String> keys = new ArrayList<>(delta.created());
    keys.addAll(delta.updated());
    if (keys.isEmpty()) {
      return Future.succeededFuture();
    }

    List<Future<RemoteResponse>> batches = new ArrayList<>();
    for (int start = 0; start < keys.size(); start += MAX_ITEM_KEYS_PER_REQUEST) {
      List<String> batch = keys.subList(start, Math.min(keys.size(), start + MAX_ITEM_KEYS_PER_REQUEST));
      // the API pages at 25 results unless a limit is given
      batches.add(get("?format=json&itemKey=" + String.join(",", batch)
        + "&limit=" + batch.size() + "&since=" + since));
    }

    return Future.all(batches).map(all -> {
      Map<String, JsonObject> byKey = new LinkedHashMap<>();
      for (Future<RemoteResponse> batch : batches) {
        JsonArray array = batch.result().bodyAsJsonArray();
        for (int i = 0; i < array.size(); i++) {
          Object raw = array.getValue(i);
          if (raw instanceof JsonObject) {
            JsonObject item = (JsonObject) raw;
            byKey.put(item.getString("key", "#" + byKey.size()), item);
          }
        }
      }
      items = Collections.unmodifiableList(new ArrayList<>(byKey.values()));
      return null;
    });
  }

  static String resolve(String url, String path) {
    if (path == null || path.isEmpty()) {
      return url;
    }
    if (path.startsWith("?")) {
      return url.indexOf('?') >= 0 ? url + "&" + path.substring(1) : url + path;
    }
    if (url.endsWith("/") || path.startsWith("/")) {
      return url + path;
    }
    return url + "/" + path;
  }
}
