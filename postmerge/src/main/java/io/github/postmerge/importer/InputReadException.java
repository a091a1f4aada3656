package io.github.postmerge.importer;

import java.nio.file.Path;

/**
 * An input file could not be read.
 */
public class InputReadException extends Exception {

  private final Path file;

  /**
   * Constructor.
   *
   * @param file    the file
   * @param message what went wrong
   * @param cause   the underlying failure, may be null
   */
  public InputReadException(final Path file, final String message, final Throwable cause) {
    super(message + ": " + file, cause);
    this.file = file;
  }

  public Path getFile() {
    return file;
  }
}
