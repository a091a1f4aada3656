package io.github.postmerge.exporter;

import io.github.postmerge.model.CanonicalField;
import io.github.postmerge.model.CanonicalRecord;
import io.github.postmerge.model.MergedBatch;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the merged batch as an {@code .xlsx} workbook with one header row followed by the records.
 */
@Singleton
public class WorkbookExporter {

  private static final Logger log = LoggerFactory.getLogger(WorkbookExporter.class);

  /**
   * Name of the output sheet.
   */
  public static final String SHEET_NAME = "Sheet1";

  /**
   * Constructor.
   */
  @Inject
  public WorkbookExporter() {
  }

  /**
   * Write the batch.
   *
   * @param batch      the records
   * @param outputFile the file to create or replace; left untouched when a record cannot be written
   * @throws IOException if the file cannot be written
   */
  public void export(final MergedBatch batch, final Path outputFile) throws IOException {
    log.info("Writing {} records to {}", batch.size(), outputFile);

    try (final XSSFWorkbook workbook = new XSSFWorkbook()) {
      final Sheet sheet = workbook.createSheet(SHEET_NAME);
      final CanonicalField[] fields = CanonicalField.values();

      final Row header = sheet.createRow(0);
      for (int col = 0; col < fields.length; col++) {
        header.createCell(col).setCellValue(fields[col].header());
      }

      int rowIndex = 1;
      for (final CanonicalRecord record : batch.records()) {
        final Row row = sheet.createRow(rowIndex++);
        for (int col = 0; col < fields.length; col++) {
          final String value = record.get(fields[col]);
          if (fields[col] == CanonicalField.SL && value.matches("\\d+")) {
            row.createCell(col).setCellValue(Long.parseLong(value));
          } else {
            row.createCell(col).setCellValue(value);
          }
        }
      }
      // the file is only opened once every cell is in place
      try (final OutputStream out = Files.newOutputStream(outputFile)) {
        workbook.write(out);
      }
    }
  }
}
