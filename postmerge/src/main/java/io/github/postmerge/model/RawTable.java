package io.github.postmerge.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A table read from an input file: a header row plus string cells. Column names are whatever the
 * file contains, duplicates included.
 */
public final class RawTable {

  private final List<String> headers;
  private final List<List<String>> rows;

  /**
   * Constructor. Rows shorter than the header are padded with empty strings, longer rows are cut.
   *
   * @param headers the header names
   * @param rows    the rows
   */
  public RawTable(final List<String> headers, final List<List<String>> rows) {
    this.headers = new ArrayList<>(headers);
    this.rows = new ArrayList<>(rows.size());
    for (final List<String> row : rows) {
      final List<String> cells = new ArrayList<>(headers.size());
      for (int i = 0; i < headers.size(); i++) {
        final String cell = i < row.size() ? row.get(i) : null;
        cells.add(cell == null ? "" : cell);
      }
      this.rows.add(cells);
    }
  }

  public List<String> headers() {
    return Collections.unmodifiableList(headers);
  }

  public int rowCount() {
    return rows.size();
  }

  public int columnCount() {
    return headers.size();
  }

  /**
   * Index of the first column with exactly this name, or -1.
   *
   * @param column the column name
   * @return the index
   */
  public int indexOf(final String column) {
    return headers.indexOf(column);
  }

  /**
   * Cell value; empty string when the column does not exist.
   *
   * @param row    the row index
   * @param column the column name
   * @return the value
   */
  public String value(final int row, final String column) {
    final int index = indexOf(column);
    return index < 0 ? "" : rows.get(row).get(index);
  }

  public String value(final int row, final int column) {
    return rows.get(row).get(column);
  }

  /**
   * Values of one column, empty strings when the column does not exist.
   *
   * @param column the column name
   * @return the values
   */
  public List<String> column(final String column) {
    final List<String> values = new ArrayList<>(rows.size());
    for (int row = 0; row < rows.size(); row++) {
      values.add(value(row, column));
    }
    return values;
  }

  /**
   * Rename columns in place. Every column whose current name is a key of the mapping takes the
   * mapped name.
   *
   * @param mapping source name to new name
   */
  public void rename(final Map<String, String> mapping) {
    for (int i = 0; i < headers.size(); i++) {
      final String target = mapping.get(headers.get(i));
      if (target != null) {
        headers.set(i, target);
      }
    }
  }

  /**
   * Set a column to the given values, adding it at the end when absent.
   *
   * @param column the column name
   * @param values one value per row
   */
  public void put(final String column, final List<String> values) {
    if (values.size() != rows.size()) {
      throw new IllegalArgumentException(
          "Column '" + column + "' has " + values.size() + " values for " + rows.size() + " rows");
    }
    int index = indexOf(column);
    if (index < 0) {
      headers.add(column);
      rows.forEach(row -> row.add(""));
      index = headers.size() - 1;
    }
    for (int row = 0; row < rows.size(); row++) {
      final String value = values.get(row);
      rows.get(row).set(index, value == null ? "" : value);
    }
  }
}
