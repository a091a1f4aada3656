package io.github.postmerge.log;

/**
 * Receiver for the progress messages of a merge run.
 *
 * <p>Invoked synchronously on the worker thread, possibly many times per input file. Implementations
 * must be safe to call from that thread.
 */
@FunctionalInterface
public interface LogSink {

  /**
   * Emit one message.
   *
   * @param message the message
   */
  void emit(String message);

  /**
   * Emit a failure message followed by the stack trace of the cause.
   *
   * @param message the message
   * @param cause   the failure
   */
  default void emit(final String message, final Throwable cause) {
    emit(message);
    emit(StackTraces.format(cause));
  }
}
