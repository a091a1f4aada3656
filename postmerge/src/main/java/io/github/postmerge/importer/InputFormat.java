package io.github.postmerge.importer;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Input file formats, recognised by extension.
 */
public enum InputFormat {
  /**
   * Tab-delimited text ({@code .txt}, {@code .csv}).
   */
  DELIMITED_TEXT(List.of(".txt", ".csv")),

  /**
   * Excel 97-2003 workbook.
   */
  LEGACY_WORKBOOK(List.of(".xls")),

  /**
   * Office Open XML workbook.
   */
  WORKBOOK(List.of(".xlsx"));

  private final List<String> extensions;

  InputFormat(final List<String> extensions) {
    this.extensions = extensions;
  }

  public List<String> extensions() {
    return extensions;
  }

  /**
   * Whether the format is read by the workbook importer.
   *
   * @return true for workbooks
   */
  public boolean isWorkbook() {
    return this != DELIMITED_TEXT;
  }

  /**
   * Format of a file, by extension, ignoring case.
   *
   * @param file the file
   * @return the format, empty for unsupported files
   */
  public static Optional<InputFormat> of(final Path file) {
    final String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
    for (final InputFormat format : values()) {
      for (final String extension : format.extensions) {
        if (name.endsWith(extension)) {
          return Optional.of(format);
        }
      }
    }
    return Optional.empty();
  }
}
