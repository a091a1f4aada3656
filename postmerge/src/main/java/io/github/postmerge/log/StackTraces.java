package io.github.postmerge.log;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Renders throwables for the log sink.
 */
public final class StackTraces {

  private StackTraces() {
  }

  /**
   * Full stack trace of the throwable, causes included.
   *
   * @param throwable the throwable
   * @return the stack trace text
   */
  public static String format(final Throwable throwable) {
    final StringWriter writer = new StringWriter();
    throwable.printStackTrace(new PrintWriter(writer));
    return writer.toString().stripTrailing();
  }
}
