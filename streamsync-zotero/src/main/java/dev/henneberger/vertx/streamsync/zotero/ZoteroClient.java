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

import dev.henneberger.vertx.streamsync.core.RemoteDataClient;
import dev.henneberger.vertx.streamsync.core.RemoteRequestException;
import dev.henneberger.vertx.streamsync.core.RemoteResponse;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpClient;
import io.vertx.core.http.HttpClientOptions;
import io.vertx.core.http.HttpClientResponse;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.RequestOptions;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads library data from the Zotero Web API.
 */
public final class ZoteroClient implements RemoteDataClient {

  public static final String API_VERSION_HEADER = "Zotero-API-Version";
  public static final String API_KEY_HEADER = "Zotero-API-Key";
  public static final String VERSION_HEADER = "Last-Modified-Version";

  private static final Logger LOG = LoggerFactory.getLogger(ZoteroClient.class);

  private final ZoteroClientOptions options;
  private final HttpClient client;

  public ZoteroClient(Vertx vertx, ZoteroClientOptions options) {
    Objects.requireNonNull(vertx, "vertx");
    this.options = new ZoteroClientOptions(Objects.requireNonNull(options, "options"));
    this.options.validate();
    this.client = vertx.createHttpClient(new HttpClientOptions()
      .setDefaultHost(this.options.getHost())
      .setDefaultPort(this.options.getPort())
      .setSsl(this.options.getSsl()));
  }

  /**
   * Issues a GET for a path relative to the API root. Non-2xx responses fail with
   * {@link RemoteRequestException}.
   */
  @Override
  public Future<RemoteResponse> get(String path, String apiKey) {
    Objects.requireNonNull(path, "path");
    String uri = path.startsWith("/") ? path : "/" + path;

    RequestOptions request = new RequestOptions()
      .setMethod(HttpMethod.GET)
      .setHost(options.getHost())
      .setPort(options.getPort())
      .setSsl(options.getSsl())
      .setURI(uri)
      .putHeader(API_VERSION_HEADER, String.valueOf(options.getApiVersion()));
    if (options.getUserAgent() != null) {
      request.putHeader("User-Agent", options.getUserAgent());
    }
    if (apiKey != null) {
      request.putHeader(API_KEY_HEADER, apiKey);
    }

    LOG.debug("GET {}", uri);
    return client.request(request)
      .compose(req -> req.send())
      .compose(response -> response.body().compose(body -> toResponse(uri, response, body)));
  }

  public Future<Void> close() {
    return client.close();
  }

  private static Future<RemoteResponse> toResponse(String uri, HttpClientResponse response, Buffer body) {
    int status = response.statusCode();
    if (status < 200 || status >= 300) {
      LOG.debug("GET {} failed with status {}", uri, status);
      return Future.failedFuture(new RemoteRequestException(status, uri, response.statusMessage()));
    }
    return Future.succeededFuture(new RemoteResponse(status, version(response.getHeader(VERSION_HEADER)), body));
  }

  static long version(String header) {
    if (header == null || header.isBlank()) {
      return RemoteResponse.NO_VERSION;
    }
    try {
      return Long.parseLong(header.trim());
    } catch (NumberFormatException e) {
      LOG.debug("ignoring malformed {} header: {}", VERSION_HEADER, header);
      return RemoteResponse.NO_VERSION;
    }
  }
}
