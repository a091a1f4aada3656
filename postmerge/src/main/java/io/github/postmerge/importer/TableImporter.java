package io.github.postmerge.importer;

import java.nio.file.Path;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Reads an input file with the importer for its format.
 */
@Singleton
public class TableImporter {

  private final WorkbookImporter workbookImporter;
  private final DelimitedTextImporter delimitedTextImporter;

  /**
   * Constructor.
   */
  @Inject
  public TableImporter(
      final WorkbookImporter workbookImporter,
      final DelimitedTextImporter delimitedTextImporter) {
    this.workbookImporter = workbookImporter;
    this.delimitedTextImporter = delimitedTextImporter;
  }

  /**
   * Import a table.
   *
   * @param file   the input file
   * @param format its format
   * @return the table
   * @throws InputReadException if the file cannot be read
   */
  public ImportedTable importTable(final Path file, final InputFormat format)
      throws InputReadException {
    switch (format) {
      case WORKBOOK:
      case LEGACY_WORKBOOK:
        return workbookImporter.readFirstSheet(file);
      case DELIMITED_TEXT:
        return delimitedTextImporter.read(file);
      default:
        throw new IllegalArgumentException("Unsupported format: " + format);
    }
  }
}
