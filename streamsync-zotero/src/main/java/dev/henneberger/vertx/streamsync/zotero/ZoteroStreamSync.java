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

import dev.henneberger.vertx.streamsync.core.FileSubscriptionStore;
import dev.henneberger.vertx.streamsync.core.HandlerRegistration;
import dev.henneberger.vertx.streamsync.core.InMemorySubscriptionStore;
import dev.henneberger.vertx.streamsync.core.PluginRegistry;
import dev.henneberger.vertx.streamsync.core.StreamListener;
import dev.henneberger.vertx.streamsync.core.StreamSubscription;
import dev.henneberger.vertx.streamsync.core.StreamSyncService;
import dev.henneberger.vertx.streamsync.core.SubscriptionStore;
import dev.henneberger.vertx.streamsync.core.Synchronizer;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A stream sync service wired to the Zotero streaming and Web APIs.
 */
public final class ZoteroStreamSync {

  private static final Logger LOG = LoggerFactory.getLogger(ZoteroStreamSync.class);

  private final StreamSyncService service;
  private final ZoteroClient client;
  private final HandlerRegistration logging;
  private final long shutdownTimeoutMs;

  private ZoteroStreamSync(StreamSyncService service,
                           ZoteroClient client,
                           HandlerRegistration logging,
                           long shutdownTimeoutMs) {
    this.service = service;
    this.client = client;
    this.logging = logging;
    this.shutdownTimeoutMs = shutdownTimeoutMs;
  }

  public static ZoteroStreamSync create(Vertx vertx, StreamSyncAppConfig config, PluginRegistry plugins) {
    Objects.requireNonNull(vertx, "vertx");
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(plugins, "plugins");

    StreamListener listener = new StreamListener(vertx, new ZoteroStreamConnector(vertx, config.toStreamOptions()));
    ZoteroClient client = new ZoteroClient(vertx, config.toClientOptions());
    Path file = config.subscriptionsFile();
    SubscriptionStore store = file == null ? new InMemorySubscriptionStore() : new FileSubscriptionStore(vertx, file);
    StreamSyncService service = new StreamSyncService(listener, new Synchronizer(plugins, client), store);

    HandlerRegistration logging = StreamSyncLogging.attachDefaultLogging(listener, LOG, config.streamHost());
    return new ZoteroStreamSync(service, client, logging, config.shutdownTimeoutMs());
  }

  public StreamSyncService service() {
    return service;
  }

  public Future<List<StreamSubscription>> start() {
    return service.start();
  }

  /**
   * Stops the service and closes the Web API client, also when the stream failed to
   * acknowledge the shutdown in time.
   */
  public Future<Void> stop() {
    return service.stop(shutdownTimeoutMs).transform(stopped -> client.close().transform(closed -> {
      logging.cancel();
      if (closed.failed()) {
        LOG.debug("web api client close failed: {}", closed.cause().toString());
      }
      return stopped.succeeded() ? Future.<Void>succeededFuture() : Future.<Void>failedFuture(stopped.cause());
    }));
  }
}
