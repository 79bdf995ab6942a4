package dev.henneberger.vertx.streamsync.core;

public final class RemoteRequestException extends RuntimeException {

  private final int statusCode;
  private final String path;

  public RemoteRequestException(int statusCode, String path, String message) {
    super("GET " + path + " failed with status " + statusCode
      + (message == null || message.isBlank() ? "" : ": " + message));
    this.statusCode = statusCode;
    this.path = path;
  }

  public int statusCode() {
    return statusCode;
  }

  public String path() {
    return path;
  }
}
