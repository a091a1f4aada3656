package io.github.postmerge.importer;

import io.github.postmerge.model.RawTable;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.apache.poi.ss.usermodel.BuiltinFormats;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.apache.poi.ss.util.NumberToTextConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads {@code .xls} and {@code .xlsx} sheets as text. Numbers in General-format cells keep every
 * digit, so long barcodes and mobile numbers never turn into scientific notation; dates and
 * explicitly formatted cells read as Excel displays them.
 */
@Singleton
public class WorkbookImporter {

  private static final Logger log = LoggerFactory.getLogger(WorkbookImporter.class);

  private final DataFormatter dataFormatter;

  /**
   * Constructor.
   *
   * @param dataFormatter the cell formatter
   */
  @Inject
  public WorkbookImporter(final DataFormatter dataFormatter) {
    this.dataFormatter = dataFormatter;
  }

  /**
   * Read the first sheet.
   *
   * @param file the workbook
   * @return the table
   * @throws InputReadException if the workbook cannot be read
   */
  public ImportedTable readFirstSheet(final Path file) throws InputReadException {
    return read(file, null);
  }

  /**
   * Read a named sheet.
   *
   * @param file      the workbook
   * @param sheetName the sheet
   * @return the table
   * @throws InputReadException if the workbook cannot be read or has no such sheet
   */
  public ImportedTable readSheet(final Path file, final String sheetName)
      throws InputReadException {
    return read(file, sheetName);
  }

  private ImportedTable read(final Path file, final String sheetName) throws InputReadException {
    if (!Files.isRegularFile(file)) {
      throw new InputReadException(file, "Workbook not found", null);
    }
    try (final Workbook workbook = WorkbookFactory.create(file.toFile(), null, true)) {
      if (workbook.getNumberOfSheets() == 0) {
        throw new InputReadException(file, "Workbook has no sheets", null);
      }
      final Sheet sheet = sheetName == null ? workbook.getSheetAt(0) : workbook.getSheet(sheetName);
      if (sheet == null) {
        throw new InputReadException(file, "Worksheet named '" + sheetName + "' not found", null);
      }
      final FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();
      final RawTable table = toTable(sheet, evaluator);
      log.debug("Read sheet '{}' of {}: {} rows", sheet.getSheetName(), file, table.rowCount());
      return ImmutableImportedTable.builder().table(table).sheetName(sheet.getSheetName()).build();
    } catch (InputReadException e) {
      throw e;
    } catch (Exception e) {
      throw new InputReadException(file, "Cannot read workbook (" + e.getMessage() + ")", e);
    }
  }

  private RawTable toTable(final Sheet sheet, final FormulaEvaluator evaluator) {
    int rowIndex = sheet.getFirstRowNum();
    Row headerRow = null;
    while (rowIndex >= 0 && rowIndex <= sheet.getLastRowNum() && headerRow == null) {
      final Row candidate = sheet.getRow(rowIndex++);
      if (candidate != null && !isBlank(cells(candidate, evaluator, candidate.getLastCellNum()))) {
        headerRow = candidate;
      }
    }
    if (headerRow == null) {
      return new RawTable(List.of(), List.of());
    }

    final List<String> headers = cells(headerRow, evaluator, headerRow.getLastCellNum());
    final List<List<String>> rows = new ArrayList<>();
    for (; rowIndex <= sheet.getLastRowNum(); rowIndex++) {
      final Row row = sheet.getRow(rowIndex);
      if (row == null) {
        continue;
      }
      final List<String> values = cells(row, evaluator, headers.size());
      if (!isBlank(values)) {
        rows.add(values);
      }
    }
    return new RawTable(headers, rows);
  }

  private List<String> cells(final Row row, final FormulaEvaluator evaluator, final int width) {
    final List<String> values = new ArrayList<>(Math.max(width, 0));
    for (int i = 0; i < width; i++) {
      final Cell cell = row.getCell(i, Row.MissingCellPolicy.RETURN_BLANK_AS_NULL);
      values.add(cell == null ? "" : text(cell, evaluator).trim());
    }
    return values;
  }

  private String text(final Cell cell, final FormulaEvaluator evaluator) {
    if (cell.getCellType() == CellType.NUMERIC
        && !DateUtil.isCellDateFormatted(cell)
        && BuiltinFormats.getBuiltinFormat(0).equals(cell.getCellStyle().getDataFormatString())) {
      return NumberToTextConverter.toText(cell.getNumericCellValue());
    }
    return dataFormatter.formatCellValue(cell, evaluator);
  }

  private static boolean isBlank(final List<String> values) {
    return values.stream().allMatch(String::isEmpty);
  }
}
