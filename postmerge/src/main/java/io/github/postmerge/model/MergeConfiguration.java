package io.github.postmerge.model;

import java.nio.file.Path;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * File layout and naming under the base directory of a run.
 */
@Value.Immutable
public interface MergeConfiguration {

  /**
   * Pincode reference workbook.
   */
  @Value.Default
  default String referenceFileName() {
    return "PIN.xlsx";
  }

  /**
   * Preferred sheet of the reference workbook; the first sheet is used when it is missing.
   */
  @Value.Default
  default String referenceSheetName() {
    return "TBLPINCITY";
  }

  /**
   * Sender details workbook.
   */
  @Value.Default
  default String senderFileName() {
    return "Sender Address.xlsx";
  }

  @Value.Default
  default String inputDirectoryName() {
    return "Input";
  }

  @Value.Default
  default String outputDirectoryName() {
    return "Output";
  }

  @Value.Default
  default String outputFilePrefix() {
    return "Output-Post_File_";
  }

  /**
   * Date pattern appended to the output file prefix.
   */
  @Value.Default
  default String outputDatePattern() {
    return "ddMMyyyy";
  }

  /**
   * Column alias definition to use instead of the bundled one.
   */
  Optional<Path> aliasFile();
}
