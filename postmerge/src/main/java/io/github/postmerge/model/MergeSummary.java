package io.github.postmerge.model;

import java.nio.file.Path;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Outcome of one merge run.
 */
@Value.Immutable
public interface MergeSummary {

  /**
   * How the run ended.
   */
  enum Status {
    /**
     * Output file written.
     */
    COMPLETED,

    /**
     * No file contributed records; nothing written.
     */
    NO_RECORDS,

    /**
     * Fatal error; nothing written.
     */
    ABORTED
  }

  Status status();

  /**
   * Files whose records were merged.
   */
  @Value.Default
  default int processedFiles() {
    return 0;
  }

  /**
   * Files that could not be read or processed.
   */
  @Value.Default
  default int errorFiles() {
    return 0;
  }

  /**
   * Files discarded because no sender matched their name.
   */
  @Value.Default
  default int skippedFiles() {
    return 0;
  }

  /**
   * Records written to the output file.
   */
  @Value.Default
  default int totalRecords() {
    return 0;
  }

  Optional<Path> outputFile();
}
