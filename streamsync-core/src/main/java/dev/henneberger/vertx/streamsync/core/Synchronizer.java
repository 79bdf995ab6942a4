package dev.henneberger.vertx.streamsync.core;

import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs synchronization sessions for subscriptions and dispatches their changes to the
 * plugins each subscription is configured with.
 */
public class Synchronizer {

  private static final Logger LOG = LoggerFactory.getLogger(Synchronizer.class);

  private final PluginRegistry plugins;
  private final RemoteDataClient client;

  public Synchronizer(PluginRegistry plugins, RemoteDataClient client) {
    this.plugins = Objects.requireNonNull(plugins, "plugins");
    this.client = Objects.requireNonNull(client, "client");
  }

  public PluginRegistry plugins() {
    return plugins;
  }

  public RemoteDataClient client() {
    return client;
  }

  public Future<Session> synchronize(Subscription subscription) {
    return synchronize(subscription, false);
  }

  /**
   * Synchronizes the subscription. The subscription is touched and saved before the session
   * runs. New versions are committed and the session dispatched only when the session found
   * changes and {@code skip} is {@code false}.
   */
  public Future<Session> synchronize(Subscription subscription, boolean skip) {
    Objects.requireNonNull(subscription, "subscription");

    subscription.touch();
    return subscription.save()
      .compose(v -> newSession(subscription).execute(skip))
      .compose(session -> {
        if (skip || !session.isModified()) {
          LOG.debug("[{}] synchronized without dispatch (skip={}, modified={})",
            subscription.id(), skip, session.isModified());
          return Future.succeededFuture(session);
        }

        JsonObject patch = new JsonObject()
          .put("version", session.version())
          .put("versions", toJson(session));
        return subscription.update(patch)
          .compose(v -> dispatch(session))
          .map(v -> session);
      });
  }

  /**
   * Synchronizes the subscription without committing versions or dispatching.
   */
  public Future<Session> update(Subscription subscription) {
    return synchronize(subscription, true);
  }

  /**
   * Hands the session to every registered plugin named by its subscription. Unknown names
   * are skipped and plugin failures are logged; the returned future always succeeds once
   * every invoked plugin has completed.
   */
  public Future<Void> dispatch(Session session) {
    Objects.requireNonNull(session, "session");

    List<Future<Void>> results = new ArrayList<>();
    for (PluginConfig config : session.subscription().plugins()) {
      Optional<Plugin> plugin = plugins.lookup(config.name());
      if (plugin.isEmpty()) {
        LOG.debug("[{}] plugin {} not available, skipping", session.subscription().id(), config.name());
        continue;
      }
      results.add(invoke(plugin.get(), session));
    }

    if (results.isEmpty()) {
      return Future.succeededFuture();
    }
    return Future.join(results).transform(ar -> Future.succeededFuture());
  }

  protected Session newSession(Subscription subscription) {
    return new Session(subscription, client);
  }

  private static Future<Void> invoke(Plugin plugin, Session session) {
    Future<Void> result;
    try {
      result = plugin.process(session);
      if (result == null) {
        result = Future.succeededFuture();
      }
    } catch (Throwable err) {
      result = Future.failedFuture(err);
    }
    return result.onFailure(err -> LOG.warn("[{}] plugin {} failed",
      session.subscription().id(), plugin.name(), err));
  }

  private static JsonObject toJson(Session session) {
    JsonObject json = new JsonObject();
    session.versions().forEach(json::put);
    return json;
  }
}
