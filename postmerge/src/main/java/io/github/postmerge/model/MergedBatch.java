package io.github.postmerge.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Records of all processed input files, in processing order and row order within a file.
 */
public final class MergedBatch {

  private final List<CanonicalRecord> records;

  private MergedBatch(final List<CanonicalRecord> records) {
    this.records = List.copyOf(records);
  }

  /**
   * Batch over the given records.
   *
   * @param records the records
   * @return the batch
   */
  public static MergedBatch of(final List<CanonicalRecord> records) {
    return new MergedBatch(records);
  }

  /**
   * Concatenate per-file record lists in the given order.
   *
   * @param perFile the records of each file
   * @return the batch
   */
  public static MergedBatch concat(final List<List<CanonicalRecord>> perFile) {
    final List<CanonicalRecord> all = new ArrayList<>();
    perFile.forEach(all::addAll);
    return new MergedBatch(all);
  }

  public List<CanonicalRecord> records() {
    return records;
  }

  public int size() {
    return records.size();
  }

  public boolean isEmpty() {
    return records.isEmpty();
  }
}
