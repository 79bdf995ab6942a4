package dev.henneberger.vertx.streamsync.core;

import io.vertx.core.Future;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs the outcome of every session dispatched to it.
 */
public final class LoggingPlugin implements Plugin {

  public static final String NAME = "logger";

  private final Logger logger;

  public LoggingPlugin() {
    this(LoggerFactory.getLogger(LoggingPlugin.class));
  }

  public LoggingPlugin(Logger logger) {
    this.logger = Objects.requireNonNull(logger, "logger");
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public Future<Void> process(Session session) {
    Subscription subscription = session.subscription();
    logger.info("subscription={} version={} created={} updated={} deleted={}",
      subscription.id(),
      session.version(),
      session.created().size(),
      session.updated().size(),
      session.deleted().size());
    return Future.succeededFuture();
  }
}
