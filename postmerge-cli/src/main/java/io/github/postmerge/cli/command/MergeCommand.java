package io.github.postmerge.cli.command;

import io.github.postmerge.dagger.PostMergeComponent;
import io.github.postmerge.log.LogSink;
import io.github.postmerge.log.Slf4jLogSink;
import io.github.postmerge.model.ImmutableMergeConfiguration;
import io.github.postmerge.model.MergeConfiguration;
import io.github.postmerge.model.MergeSummary;
import io.github.postmerge.pipeline.MergeRunner;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Merge command: runs one merge over a base directory.
 */
@Command(
    name = "merge",
    description = "Merge the files of <base-dir>/Input into <base-dir>/Output")
public class MergeCommand implements Callable<Integer> {

  private static final Logger log = LoggerFactory.getLogger(MergeCommand.class);

  @Option(
      names = {"--base-dir", "-d"},
      description = "Base directory holding PIN.xlsx, Sender Address.xlsx and the Input folder",
      required = true)
  private Path baseDirectory;

  @Option(
      names = {"--reference-sheet"},
      description = "Preferred sheet of the pincode workbook (default: ${DEFAULT-VALUE})",
      defaultValue = "TBLPINCITY")
  private String referenceSheet;

  @Option(
      names = {"--reference-file"},
      description = "Pincode workbook under the base directory (default: ${DEFAULT-VALUE})",
      defaultValue = "PIN.xlsx")
  private String referenceFile;

  @Option(
      names = {"--sender-file"},
      description = "Sender details workbook under the base directory (default: ${DEFAULT-VALUE})",
      defaultValue = "Sender Address.xlsx")
  private String senderFile;

  @Option(
      names = {"--aliases", "-a"},
      description = "JSON file with column aliases (default: bundled definition)")
  private Path aliasFile;

  private final LogSink sink;

  /**
   * Command logging progress through SLF4J.
   */
  public MergeCommand() {
    this(new Slf4jLogSink());
  }

  /**
   * Command logging progress to the given sink.
   *
   * @param sink the log sink
   */
  public MergeCommand(final LogSink sink) {
    this.sink = sink;
  }

  @Override
  public Integer call() throws Exception {
    log.info("Merging files under {}", baseDirectory);

    if (!Files.isDirectory(baseDirectory)) {
      log.error("Invalid base directory path: {}", baseDirectory);
      return 1;
    }
    if (aliasFile != null && !Files.isRegularFile(aliasFile)) {
      log.error("Alias file not found: {}", aliasFile);
      return 1;
    }

    final MergeConfiguration configuration =
        ImmutableMergeConfiguration.builder()
            .referenceFileName(referenceFile)
            .referenceSheetName(referenceSheet)
            .senderFileName(senderFile)
            .aliasFile(Optional.ofNullable(aliasFile))
            .build();

    final PostMergeComponent component = PostMergeComponent.instance(configuration);
    final MergeSummary summary;
    try (final MergeRunner runner = component.mergeRunner()) {
      summary = runner.runAndWait(baseDirectory.toAbsolutePath(), sink);
    }

    log.info("Merge finished with status {}: {} processed, {} errors, {} skipped, {} records",
        summary.status(), summary.processedFiles(), summary.errorFiles(),
        summary.skippedFiles(), summary.totalRecords());
    return exitCode(summary.status());
  }

  static int exitCode(final MergeSummary.Status status) {
    switch (status) {
      case COMPLETED:
        return 0;
      case NO_RECORDS:
        return 2;
      default:
        return 1;
    }
  }
}
