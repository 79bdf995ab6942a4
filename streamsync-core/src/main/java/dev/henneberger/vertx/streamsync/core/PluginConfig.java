package dev.henneberger.vertx.streamsync.core;

import io.vertx.core.json.JsonObject;
import java.util.Objects;

/**
 * A plugin enabled on a subscription, with the options the subscription configures for it.
 */
public final class PluginConfig {
  private final String name;
  private final JsonObject options;

  public PluginConfig(String name) {
    this(name, null);
  }

  public PluginConfig(String name, JsonObject options) {
    this.name = Objects.requireNonNull(name, "name");
    this.options = options == null ? new JsonObject() : options.copy();
  }

  public String name() {
    return name;
  }

  public JsonObject options() {
    return options.copy();
  }

  public JsonObject toJson() {
    return new JsonObject().put("name", name).put("options", options.copy());
  }

  public static PluginConfig fromJson(JsonObject json) {
    Objects.requireNonNull(json, "json");
    return new PluginConfig(json.getString("name"), json.getJsonObject("options"));
  }
}
