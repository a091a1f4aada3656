package io.github.postmerge.enrich;

import io.github.postmerge.log.LogSink;
import io.github.postmerge.mapping.SchemaMapper;
import io.github.postmerge.model.CanonicalField;
import io.github.postmerge.model.CanonicalRecord;
import io.github.postmerge.model.RawTable;
import io.github.postmerge.model.SenderProfile;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Turns the table of one input file into canonical records.
 */
@Singleton
public class RecordEnricher {

  private final SchemaMapper schemaMapper;

  /**
   * Constructor.
   */
  @Inject
  public RecordEnricher(final SchemaMapper schemaMapper) {
    this.schemaMapper = schemaMapper;
  }

  /**
   * Rename the mapped columns, combine the address columns, then build one record per row with
   * the sender fields, a 1-based {@code SL} and the file and sheet names. Columns outside the
   * canonical schema are dropped.
   *
   * @param table     the input table; renamed in place
   * @param sender    the sender of the file
   * @param fileName  the input file name
   * @param sheetName the sheet name, empty for delimited text
   * @param sink      the log sink
   * @return the records in row order
   */
  public List<CanonicalRecord> enrich(
      final RawTable table,
      final SenderProfile sender,
      final String fileName,
      final String sheetName,
      final LogSink sink) {
    schemaMapper.rename(table, sink);
    schemaMapper.combineAddress(table, sink);

    final Map<CanonicalField, String> senderFields = senderFields(sender);
    final List<CanonicalRecord> records = new ArrayList<>(table.rowCount());
    for (int row = 0; row < table.rowCount(); row++) {
      final Map<CanonicalField, String> values = new EnumMap<>(CanonicalField.class);
      for (final CanonicalField field : CanonicalField.values()) {
        values.put(field, table.value(row, field.header()));
      }
      values.putAll(senderFields);
      values.put(CanonicalField.SL, String.valueOf(row + 1));
      values.put(CanonicalField.INPUT_FILE_NAME, fileName);
      values.put(CanonicalField.SHEET_NAME, sheetName);
      records.add(CanonicalRecord.of(values));
    }
    return records;
  }

  private static Map<CanonicalField, String> senderFields(final SenderProfile sender) {
    final Map<CanonicalField, String> fields = new EnumMap<>(CanonicalField.class);
    fields.put(CanonicalField.SENDER_CITY, sender.senderCity());
    fields.put(CanonicalField.SENDER_PINCODE, sender.senderPincode());
    fields.put(CanonicalField.SENDER_NAME, sender.senderName());
    fields.put(CanonicalField.SENDER_ADD1, sender.senderAdd1());
    fields.put(CanonicalField.SENDER_ADD2, sender.senderAdd2());
    fields.put(CanonicalField.SENDER_ADD3, sender.senderAdd3());
    return fields;
  }
}
