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

import static dev.henneberger.vertx.streamsync.core.StreamSyncContractKit.awaitFailure;
import static dev.henneberger.vertx.streamsync.core.StreamSyncContractKit.awaitResult;
import static dev.henneberger.vertx.streamsync.zotero.FakeZoteroServer.TIMEOUT;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

import dev.henneberger.vertx.streamsync.core.RemoteRequestException;
import dev.henneberger.vertx.streamsync.core.RemoteResponse;
import io.vertx.core.MultiMap;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ZoteroClientTest {

  private Vertx vertx;
  private FakeZoteroServer server;
  private ZoteroClient client;

  @BeforeEach
  void setUp() {
    vertx = Vertx.vertx();
    server = new FakeZoteroServer(vertx).start();
    client = new ZoteroClient(vertx, new ZoteroClientOptions()
      .setHost("localhost")
      .setPort(server.port())
      .setSsl(false)
      .setUserAgent("sync-test"));
  }

  @AfterEach
  void tearDown() {
    awaitResult(client.close(), TIMEOUT);
    server.close();
    awaitResult(vertx.close(), TIMEOUT);
  }

  @Test
  void sendsApiHeadersAndReadsLibraryVersion() {
    server.versions = new JsonObject().put("AAAA", 4);
    server.libraryVersion = 42L;

    RemoteResponse response = awaitResult(client.get("/users/1/items?format=versions", "secret"), TIMEOUT);

    assertEquals(200, response.statusCode());
    assertEquals(42L, response.version());
    assertEquals(4, response.bodyAsJsonObject().getInteger("AAAA"));
    assertEquals("/users/1/items?format=versions", server.requestUris.get(0));
    MultiMap headers = server.requestHeaders.get(0);
    assertEquals("3", headers.get(ZoteroClient.API_VERSION_HEADER));
    assertEquals("secret", headers.get(ZoteroClient.API_KEY_HEADER));
    assertEquals("sync-test", headers.get("User-Agent"));
  }

  @Test
  void omitsKeyHeaderWithoutKey() {
    awaitResult(client.get("users/1/items?format=versions", null), TIMEOUT);

    assertEquals("/users/1/items?format=versions", server.requestUris.get(0));
    assertFalse(server.requestHeaders.get(0).contains(ZoteroClient.API_KEY_HEADER));
  }

  @Test
  void missingVersionHeaderYieldsNoVersion() {
    server.sendVersionHeader = false;

    RemoteResponse response = awaitResult(client.get("/users/1/items?format=versions", null), TIMEOUT);

    assertEquals(RemoteResponse.NO_VERSION, response.version());
  }

  @Test
  void failsOnErrorStatus() {
    server.failStatus = 403;

    Throwable failure = awaitFailure(client.get("/users/1/items?format=versions", "wrong"), TIMEOUT);

    assertInstanceOf(RemoteRequestException.class, failure);
    assertEquals(403, ((RemoteRequestException) failure).statusCode());
    assertEquals("/users/1/items?format=versions", ((RemoteRequestException) failure).path());
  }

  @Test
  void parsesVersionHeader() {
    assertEquals(17L, ZoteroClient.version(" 17 "));
    assertEquals(RemoteResponse.NO_VERSION, ZoteroClient.version("abc"));
    assertEquals(RemoteResponse.NO_VERSION, ZoteroClient.version(null));
  }
}
