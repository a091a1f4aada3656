package io.github.postmerge.importer;

import io.github.postmerge.model.RawTable;
import org.immutables.value.Value;

/**
 * A table read from an input file, with the sheet it came from.
 */
@Value.Immutable
public interface ImportedTable {

  RawTable table();

  /**
   * Sheet name; empty for delimited text.
   */
  @Value.Default
  default String sheetName() {
    return "";
  }
}
