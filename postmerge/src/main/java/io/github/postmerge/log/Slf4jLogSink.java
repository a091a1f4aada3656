package io.github.postmerge.log;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Log sink that forwards progress messages to SLF4J.
 */
public class Slf4jLogSink implements LogSink {

  private final Logger logger;

  /**
   * Sink writing to the {@code io.github.postmerge.progress} logger.
   */
  public Slf4jLogSink() {
    this(LoggerFactory.getLogger("io.github.postmerge.progress"));
  }

  /**
   * Sink writing to the given logger.
   *
   * @param logger the logger
   */
  public Slf4jLogSink(final Logger logger) {
    this.logger = logger;
  }

  @Override
  public void emit(final String message) {
    logger.info(message);
  }

  @Override
  public void emit(final String message, final Throwable cause) {
    logger.error(message, cause);
  }
}
