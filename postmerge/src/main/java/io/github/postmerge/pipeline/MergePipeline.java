package io.github.postmerge.pipeline;

import io.github.postmerge.enrich.PincodeBackfill;
import io.github.postmerge.enrich.RecordEnricher;
import io.github.postmerge.exporter.WorkbookExporter;
import io.github.postmerge.importer.ImportedTable;
import io.github.postmerge.importer.InputFormat;
import io.github.postmerge.importer.InputReadException;
import io.github.postmerge.importer.TableImporter;
import io.github.postmerge.log.LogSink;
import io.github.postmerge.model.CanonicalRecord;
import io.github.postmerge.model.MergeConfiguration;
import io.github.postmerge.model.MergeSummary;
import io.github.postmerge.model.MergedBatch;
import io.github.postmerge.model.RawTable;
import io.github.postmerge.model.ReferenceTable;
import io.github.postmerge.model.SenderProfile;
import io.github.postmerge.reference.ReferenceTableLoader;
import io.github.postmerge.sender.SenderResolver;
import io.github.postmerge.sender.SenderTableLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges the input files under a base directory into one post file.
 *
 * <p>Expected layout of the base directory (names come from {@link MergeConfiguration}):
 * <pre>
 *   PIN.xlsx              pincode to city reference
 *   Sender Address.xlsx   sender details, matched by input file name
 *   Input/                .txt, .csv (tab-delimited), .xls and .xlsx files
 *   Output/               created when missing; receives Output-Post_File_ddMMyyyy.xlsx
 * </pre>
 */
@Singleton
public class MergePipeline {

  private static final Logger log = LoggerFactory.getLogger(MergePipeline.class);

  private final MergeConfiguration configuration;
  private final ReferenceTableLoader referenceTableLoader;
  private final SenderTableLoader senderTableLoader;
  private final SenderResolver senderResolver;
  private final TableImporter tableImporter;
  private final RecordEnricher recordEnricher;
  private final PincodeBackfill pincodeBackfill;
  private final WorkbookExporter workbookExporter;
  private final Clock clock;

  /**
   * Constructor.
   */
  @Inject
  public MergePipeline(
      final MergeConfiguration configuration,
      final ReferenceTableLoader referenceTableLoader,
      final SenderTableLoader senderTableLoader,
      final SenderResolver senderResolver,
      final TableImporter tableImporter,
      final RecordEnricher recordEnricher,
      final PincodeBackfill pincodeBackfill,
      final WorkbookExporter workbookExporter,
      final Clock clock) {
    this.configuration = configuration;
    this.referenceTableLoader = referenceTableLoader;
    this.senderTableLoader = senderTableLoader;
    this.senderResolver = senderResolver;
    this.tableImporter = tableImporter;
    this.recordEnricher = recordEnricher;
    this.pincodeBackfill = pincodeBackfill;
    this.workbookExporter = workbookExporter;
    this.clock = clock;
  }

  /**
   * Run one merge. Never throws; failures are reported through the sink and the summary.
   *
   * @param baseDirectory the base directory
   * @param sink          the log sink
   * @return the run summary
   */
  public MergeSummary run(final Path baseDirectory, final LogSink sink) {
    final MergeContext context = new MergeContext();
    try {
      return run(baseDirectory, sink, context);
    } catch (Exception e) {
      log.error("Merge of {} failed", baseDirectory, e);
      sink.emit("Unexpected error: " + e.getMessage(), e);
      return context.summary(MergeSummary.Status.ABORTED, 0, null);
    }
  }

  private MergeSummary run(final Path baseDirectory, final LogSink sink, final MergeContext context)
      throws IOException {
    final Path referenceFile = baseDirectory.resolve(configuration.referenceFileName());
    final Path senderFile = baseDirectory.resolve(configuration.senderFileName());
    final Path inputDirectory = baseDirectory.resolve(configuration.inputDirectoryName());
    final Path outputDirectory = baseDirectory.resolve(configuration.outputDirectoryName());

    sink.emit("Base directory: " + baseDirectory);
    sink.emit("Looking for PIN file at: " + referenceFile);
    sink.emit("Looking for sender details at: " + senderFile);
    sink.emit("Reading input files from: " + inputDirectory);
    sink.emit("Output will be saved to: " + outputDirectory);

    sink.emit("Loading PIN database...");
    final ReferenceTable reference = referenceTableLoader.load(referenceFile, sink);
    if (reference.isEmpty()) {
      sink.emit("Error: PIN database not loaded. Processing stopped.");
      return context.summary(MergeSummary.Status.ABORTED, 0, null);
    }

    final List<SenderProfile> senders = senderTableLoader.load(senderFile, sink);

    if (!Files.isDirectory(inputDirectory)) {
      sink.emit("Input directory not found: " + inputDirectory);
      return context.summary(MergeSummary.Status.ABORTED, 0, null);
    }

    final List<Path> inputFiles = listInputFiles(inputDirectory);
    sink.emit("Found " + inputFiles.size() + " input files to process");
    for (final Path file : inputFiles) {
      processFile(file, senders, sink, context);
    }

    final MergedBatch merged = context.batch();
    if (merged.isEmpty()) {
      sink.emit("No files were successfully processed.");
      return context.summary(MergeSummary.Status.NO_RECORDS, 0, null);
    }

    final MergedBatch backfilled = pincodeBackfill.apply(merged, reference, sink);

    Files.createDirectories(outputDirectory);
    final Path outputFile = outputDirectory.resolve(outputFileName());
    sink.emit("Saving output file with " + backfilled.size() + " total records...");
    workbookExporter.export(backfilled, outputFile);
    sink.emit("Output saved to: " + outputFile);

    sink.emit("Processing summary:");
    sink.emit("Total files processed successfully: " + context.processedFiles());
    sink.emit("Total files with errors: " + context.errorFiles());
    return context.summary(MergeSummary.Status.COMPLETED, backfilled.size(), outputFile);
  }

  /**
   * Process one input file into the context. Any failure counts the file as an error and leaves
   * the accumulated records untouched.
   *
   * @param file    the input file
   * @param senders the sender table
   * @param sink    the log sink
   * @param context the run context
   */
  void processFile(
      final Path file,
      final List<SenderProfile> senders,
      final LogSink sink,
      final MergeContext context) {
    final String fileName = file.getFileName().toString();
    sink.emit("Processing file: " + fileName);
    try {
      final InputFormat format = InputFormat.of(file)
          .orElseThrow(() -> new IllegalArgumentException("Unsupported input file: " + file));
      final ImportedTable imported = tableImporter.importTable(file, format);
      final RawTable table = imported.table();
      sink.emit("Successfully read file with " + table.rowCount() + " rows and "
          + table.columnCount() + " columns");
      sink.emit("Columns found: " + describeColumns(table.headers()));

      final Optional<SenderProfile> sender = senderResolver.find(senders, fileName);
      final String key = senderResolver.lookupKey(fileName);
      if (sender.isEmpty()) {
        sink.emit("No sender details found for '" + key + "', skipping " + fileName);
        context.recordSkipped();
        return;
      }
      sink.emit("Found matching sender details for '" + key + "'");

      final List<CanonicalRecord> records =
          recordEnricher.enrich(table, sender.get(), fileName, imported.sheetName(), sink);
      context.addProcessed(records);
      sink.emit("Successfully processed: " + fileName);
    } catch (InputReadException e) {
      context.recordError();
      sink.emit("Error reading file " + fileName + ": " + e.getMessage(), e);
    } catch (Exception e) {
      context.recordError();
      sink.emit("Error processing " + fileName + ": " + e.getMessage(), e);
    }
  }

  private List<Path> listInputFiles(final Path inputDirectory) throws IOException {
    try (final Stream<Path> entries = Files.list(inputDirectory)) {
      return entries
          .filter(Files::isRegularFile)
          .filter(path -> InputFormat.of(path).isPresent())
          .sorted()
          .collect(Collectors.toList());
    }
  }

  private String outputFileName() {
    final String date = LocalDate.now(clock)
        .format(DateTimeFormatter.ofPattern(configuration.outputDatePattern()));
    return configuration.outputFilePrefix() + date + ".xlsx";
  }

  private static String describeColumns(final List<String> headers) {
    final String shown = String.join(", ", headers.subList(0, Math.min(5, headers.size())));
    return headers.size() > 5 ? shown + "..." : shown;
  }
}
