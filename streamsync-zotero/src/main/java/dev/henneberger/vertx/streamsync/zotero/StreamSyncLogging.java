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

import dev.henneberger.vertx.streamsync.core.HandlerRegistration;
import dev.henneberger.vertx.streamsync.core.StreamListener;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;

public final class StreamSyncLogging {

  private StreamSyncLogging() {
  }

  public static HandlerRegistration attachDefaultLogging(StreamListener listener, Logger logger, String streamName) {
    Objects.requireNonNull(listener, "listener");
    Objects.requireNonNull(logger, "logger");
    String name = streamName == null || streamName.isBlank() ? "stream" : streamName;

    List<HandlerRegistration> registrations = List.of(
      listener.onConnected(v -> logger.info("stream={} connected", name)),
      listener.onAdded(sub -> logger.info("stream={} subscription={} topic={} added", name, sub.id(), sub.topic())),
      listener.onUpdated(sub -> logger.debug("stream={} subscription={} topic={} updated", name, sub.id(), sub.topic())),
      listener.onError(err -> logger.warn("stream={} error={}", name, err.toString())));

    return () -> registrations.forEach(HandlerRegistration::cancel);
  }
}
