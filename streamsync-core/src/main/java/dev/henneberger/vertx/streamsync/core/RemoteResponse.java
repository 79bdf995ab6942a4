package dev.henneberger.vertx.streamsync.core;

import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.Objects;

public final class RemoteResponse {
  public static final long NO_VERSION = -1L;

  private final int statusCode;
  private final long version;
  private final Buffer body;

  public RemoteResponse(int statusCode, long version, Buffer body) {
    this.statusCode = statusCode;
    this.version = version;
    this.body = Objects.requireNonNull(body, "body");
  }

  public int statusCode() {
    return statusCode;
  }

  /**
   * Library version reported by the remote, or {@link #NO_VERSION}.
   */
  public long version() {
    return version;
  }

  public Buffer body() {
    return body;
  }

  public JsonObject bodyAsJsonObject() {
    return body.length() == 0 ? new JsonObject() : body.toJsonObject();
  }

  public JsonArray bodyAsJsonArray() {
    return body.length() == 0 ? new JsonArray() : body.toJsonArray();
  }
}
