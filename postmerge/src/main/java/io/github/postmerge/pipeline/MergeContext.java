package io.github.postmerge.pipeline;

import io.github.postmerge.model.CanonicalRecord;
import io.github.postmerge.model.ImmutableMergeSummary;
import io.github.postmerge.model.MergeSummary;
import io.github.postmerge.model.MergedBatch;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Counters and accumulated records of one merge run.
 */
public class MergeContext {

  private final List<List<CanonicalRecord>> processed = new ArrayList<>();
  private int processedFiles;
  private int errorFiles;
  private int skippedFiles;

  /**
   * Add the records of a successfully processed file.
   *
   * @param records the records
   */
  public void addProcessed(final List<CanonicalRecord> records) {
    processed.add(List.copyOf(records));
    processedFiles++;
  }

  public void recordError() {
    errorFiles++;
  }

  public void recordSkipped() {
    skippedFiles++;
  }

  public int processedFiles() {
    return processedFiles;
  }

  public int errorFiles() {
    return errorFiles;
  }

  public int skippedFiles() {
    return skippedFiles;
  }

  /**
   * All records so far, in processing order.
   *
   * @return the batch
   */
  public MergedBatch batch() {
    return MergedBatch.concat(processed);
  }

  /**
   * Summary of the run so far.
   *
   * @param status       how the run ended
   * @param totalRecords records written
   * @param outputFile   the output file, null when nothing was written
   * @return the summary
   */
  public MergeSummary summary(
      final MergeSummary.Status status, final int totalRecords, final Path outputFile) {
    return ImmutableMergeSummary.builder()
        .status(status)
        .processedFiles(processedFiles)
        .errorFiles(errorFiles)
        .skippedFiles(skippedFiles)
        .totalRecords(totalRecords)
        .outputFile(Optional.ofNullable(outputFile))
        .build();
  }
}
