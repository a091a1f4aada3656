package io.github.postmerge.reference;

import io.github.postmerge.importer.ImportedTable;
import io.github.postmerge.importer.InputReadException;
import io.github.postmerge.importer.WorkbookImporter;
import io.github.postmerge.log.LogSink;
import io.github.postmerge.model.ImmutableReferenceEntry;
import io.github.postmerge.model.MergeConfiguration;
import io.github.postmerge.model.RawTable;
import io.github.postmerge.model.ReferenceEntry;
import io.github.postmerge.model.ReferenceTable;
import io.github.postmerge.pincode.PincodeNormalizer;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Loads the pincode to city reference workbook.
 *
 * <p>Failures never throw: the result is an empty table and the reason goes to the log sink. An
 * empty table stops the merge run.
 */
@Singleton
public class ReferenceTableLoader {

  private final WorkbookImporter workbookImporter;
  private final PincodeNormalizer pincodeNormalizer;
  private final MergeConfiguration configuration;

  /**
   * Constructor.
   */
  @Inject
  public ReferenceTableLoader(
      final WorkbookImporter workbookImporter,
      final PincodeNormalizer pincodeNormalizer,
      final MergeConfiguration configuration) {
    this.workbookImporter = workbookImporter;
    this.pincodeNormalizer = pincodeNormalizer;
    this.configuration = configuration;
  }

  /**
   * Load the reference table.
   *
   * @param file the reference workbook
   * @param sink the log sink
   * @return valid entries in sheet order, possibly none
   */
  public ReferenceTable load(final Path file, final LogSink sink) {
    sink.emit("Loading PIN database from: " + file);
    final Optional<ImportedTable> imported = readSheet(file, sink);
    if (imported.isEmpty()) {
      return ReferenceTable.empty();
    }

    final RawTable table = imported.get().table();
    sink.emit("Found columns in PIN file: " + String.join(", ", table.headers()));

    final Optional<ReferenceColumns> columns = ReferenceColumns.infer(table.headers());
    if (columns.isEmpty()) {
      sink.emit("Error: Could not identify pincode and city columns in PIN file. "
          + "Check " + file.getFileName() + " file structure.");
      return ReferenceTable.empty();
    }
    describe(columns.get(), sink);

    final List<String> pincodes = table.column(columns.get().pincodeColumn());
    final List<String> cities = table.column(columns.get().cityColumn());
    final List<ReferenceEntry> entries = new ArrayList<>();
    for (int row = 0; row < table.rowCount(); row++) {
      final String pincode = pincodeNormalizer.clean(pincodes.get(row));
      if (pincode.length() == 6) {
        entries.add(ImmutableReferenceEntry.builder()
            .pincode(pincode)
            .city(cities.get(row).trim().toUpperCase(Locale.ROOT))
            .build());
      }
    }

    sink.emit("Loaded " + entries.size() + " valid pincodes from PIN database");
    return ReferenceTable.of(entries);
  }

  private Optional<ImportedTable> readSheet(final Path file, final LogSink sink) {
    final String sheetName = configuration.referenceSheetName();
    try {
      final ImportedTable table = workbookImporter.readSheet(file, sheetName);
      sink.emit("Successfully loaded " + sheetName + " sheet from " + file.getFileName());
      return Optional.of(table);
    } catch (InputReadException e) {
      sink.emit(sheetName + " sheet not found: " + e.getMessage());
      sink.emit("Trying to read the first sheet instead...");
    }
    try {
      final ImportedTable table = workbookImporter.readFirstSheet(file);
      sink.emit("Using sheet: " + table.sheetName());
      return Optional.of(table);
    } catch (InputReadException e) {
      sink.emit("Error loading PIN database: " + e.getMessage(), e);
      return Optional.empty();
    }
  }

  private static void describe(final ReferenceColumns columns, final LogSink sink) {
    switch (columns.strategy()) {
      case PARTIAL:
        sink.emit("Using '" + columns.pincodeColumn() + "' as pincode column and '"
            + columns.cityColumn() + "' as city column");
        break;
      case POSITIONAL:
        sink.emit("Using first column '" + columns.pincodeColumn()
            + "' as pincode and second column '" + columns.cityColumn() + "' as city");
        break;
      default:
        break;
    }
  }
}
