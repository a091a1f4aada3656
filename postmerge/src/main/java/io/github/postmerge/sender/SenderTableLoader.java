package io.github.postmerge.sender;

import io.github.postmerge.importer.InputReadException;
import io.github.postmerge.importer.WorkbookImporter;
import io.github.postmerge.log.LogSink;
import io.github.postmerge.model.ImmutableSenderProfile;
import io.github.postmerge.model.RawTable;
import io.github.postmerge.model.SenderProfile;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Loads the sender details workbook. A missing or unreadable workbook gives no senders.
 */
@Singleton
public class SenderTableLoader {

  /**
   * Header of the file name key column.
   */
  public static final String FILE_NAME_KEY_COLUMN = "File Name Contain";

  private final WorkbookImporter workbookImporter;

  /**
   * Constructor.
   */
  @Inject
  public SenderTableLoader(final WorkbookImporter workbookImporter) {
    this.workbookImporter = workbookImporter;
  }

  /**
   * Load the senders from the first sheet.
   *
   * @param file the sender workbook
   * @param sink the log sink
   * @return the senders in sheet order
   */
  public List<SenderProfile> load(final Path file, final LogSink sink) {
    if (!Files.isRegularFile(file)) {
      sink.emit("Sender details file not found: " + file);
      return List.of();
    }

    final RawTable table;
    try {
      table = workbookImporter.readFirstSheet(file).table();
    } catch (InputReadException e) {
      sink.emit("Error loading sender details: " + e.getMessage(), e);
      return List.of();
    }

    final List<SenderProfile> senders = new ArrayList<>(table.rowCount());
    for (int row = 0; row < table.rowCount(); row++) {
      senders.add(ImmutableSenderProfile.builder()
          .fileNameKey(table.value(row, FILE_NAME_KEY_COLUMN))
          .senderCity(table.value(row, "SenderCity"))
          .senderPincode(table.value(row, "SenderPincode"))
          .senderName(table.value(row, "SenderName"))
          .senderAdd1(table.value(row, "SenderADD1"))
          .senderAdd2(table.value(row, "SenderADD2"))
          .senderAdd3(table.value(row, "SenderADD3"))
          .build());
    }
    sink.emit("Successfully loaded sender details with " + senders.size() + " records");
    return senders;
  }
}
