package dev.henneberger.vertx.streamsync.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class PluginRegistry {
  private final Map<String, Plugin> plugins = new ConcurrentHashMap<>();

  /**
   * Registers a plugin, replacing any plugin registered under the same name.
   */
  public PluginRegistry add(Plugin plugin) {
    Objects.requireNonNull(plugin, "plugin");
    plugins.put(Objects.requireNonNull(plugin.name(), "name"), plugin);
    return this;
  }

  public PluginRegistry add(String name, CallbackPlugin plugin) {
    return add(Plugin.fromCallback(name, plugin));
  }

  public Optional<Plugin> lookup(String name) {
    return name == null ? Optional.empty() : Optional.ofNullable(plugins.get(name));
  }

  public boolean remove(String name) {
    return plugins.remove(Objects.requireNonNull(name, "name")) != null;
  }

  public List<String> names() {
    return new ArrayList<>(plugins.keySet());
  }

  public void reset() {
    plugins.clear();
  }
}
