package io.github.postmerge.importer;

import io.github.postmerge.model.RawTable;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.io.input.BOMInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads tab-delimited UTF-8 text. A leading byte order mark is dropped. The first record is the
 * header; every value stays a string.
 */
@Singleton
public class DelimitedTextImporter {

  private static final Logger log = LoggerFactory.getLogger(DelimitedTextImporter.class);

  private static final CSVFormat FORMAT =
      CSVFormat.TDF.builder().setIgnoreEmptyLines(true).setTrim(true).build();

  /**
   * Constructor.
   */
  @Inject
  public DelimitedTextImporter() {
  }

  /**
   * Read a tab-delimited file.
   *
   * @param file the file
   * @return the table, with an empty sheet name
   * @throws InputReadException if the file cannot be read or decoded
   */
  public ImportedTable read(final Path file) throws InputReadException {
    final List<String> headers = new ArrayList<>();
    final List<List<String>> rows = new ArrayList<>();

    try (final Reader reader = new InputStreamReader(
            BOMInputStream.builder().setInputStream(Files.newInputStream(file)).get(),
            StandardCharsets.UTF_8.newDecoder());
        final CSVParser parser = new CSVParser(reader, FORMAT)) {
      for (final CSVRecord record : parser) {
        final List<String> values = new ArrayList<>(record.size());
        record.forEach(values::add);
        if (headers.isEmpty()) {
          headers.addAll(values);
        } else {
          rows.add(values);
        }
      }
    } catch (Exception e) {
      throw new InputReadException(file, "Cannot read delimited text (" + e.getMessage() + ")", e);
    }

    if (headers.isEmpty()) {
      throw new InputReadException(file, "No columns to parse", null);
    }
    log.debug("Read {}: {} rows, {} columns", file, rows.size(), headers.size());
    return ImmutableImportedTable.builder().table(new RawTable(headers, rows)).build();
  }
}
