package io.github.postmerge.mapping;

import io.github.postmerge.log.LogSink;
import io.github.postmerge.model.CanonicalField;
import io.github.postmerge.model.ColumnAliases;
import io.github.postmerge.model.RawTable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Maps input headers onto the canonical schema with the configured alias lists.
 *
 * <p>Alias matching is exact after trimming and ignoring case.
 */
@Singleton
public class SchemaMapper {

  private static final String ADDRESS_SEPARATOR = ", ";

  private final Map<CanonicalField, AliasList> fieldAliases;
  private final AliasList addressAliases;

  /**
   * Constructor.
   *
   * @param columnAliases the alias definition
   */
  @Inject
  public SchemaMapper(final ColumnAliases columnAliases) {
    this.fieldAliases = new LinkedHashMap<>();
    columnAliases.fields().forEach((header, aliases) -> fieldAliases.put(
        CanonicalField.fromHeader(header).orElseThrow(), AliasList.parse(aliases)));
    this.addressAliases = AliasList.parse(columnAliases.address());
  }

  /**
   * First header equal to one of the aliases. Aliases are tried in order, so an earlier alias
   * wins over an earlier column.
   *
   * @param headers the headers
   * @param aliases the aliases
   * @return the matching header
   */
  public static Optional<String> matchSingle(final List<String> headers, final AliasList aliases) {
    for (final String alias : aliases.aliases()) {
      for (final String header : headers) {
        if (AliasList.normalize(header).equals(alias)) {
          return Optional.of(header);
        }
      }
    }
    return Optional.empty();
  }

  /**
   * Every header equal to one of the aliases, in column order.
   *
   * @param headers the headers
   * @param aliases the aliases
   * @return the matching headers
   */
  public static List<String> matchAll(final List<String> headers, final AliasList aliases) {
    final List<String> matches = new ArrayList<>();
    for (final String header : headers) {
      if (aliases.matches(header) && !matches.contains(header)) {
        matches.add(header);
      }
    }
    return matches;
  }

  /**
   * Source header to canonical header for every field that has a match. A header claimed by an
   * earlier field is not claimed again.
   *
   * @param headers the input headers
   * @param sink    the log sink
   * @return the rename mapping, in field order
   */
  public Map<String, String> mapColumns(final List<String> headers, final LogSink sink) {
    final Map<String, String> mapping = new LinkedHashMap<>();
    for (final Map.Entry<CanonicalField, AliasList> entry : fieldAliases.entrySet()) {
      final String target = entry.getKey().header();
      final Optional<String> source = matchSingle(headers, entry.getValue());
      if (source.isEmpty()) {
        continue;
      }
      if (mapping.containsKey(source.get())) {
        sink.emit("Column '" + source.get() + "' already mapped to '" + mapping.get(source.get())
            + "', not mapping it to '" + target + "'");
        continue;
      }
      mapping.put(source.get(), target);
      sink.emit("Mapped '" + source.get() + "' to '" + target + "'");
    }
    return mapping;
  }

  /**
   * Rename the matched columns of the table in place.
   *
   * @param table the table
   * @param sink  the log sink
   */
  public void rename(final RawTable table, final LogSink sink) {
    final Map<String, String> mapping = mapColumns(table.headers(), sink);
    if (!mapping.isEmpty()) {
      table.rename(mapping);
    }
  }

  /**
   * Address columns of the table.
   *
   * @param headers the headers
   * @return matching headers in column order
   */
  public List<String> addressColumns(final List<String> headers) {
    return matchAll(headers, addressAliases);
  }

  /**
   * Join the non-empty address values of every row with {@code ", "} into {@code AddreADD1}.
   * Leaves the table untouched when it has no address columns.
   *
   * @param table the table
   * @param sink  the log sink
   */
  public void combineAddress(final RawTable table, final LogSink sink) {
    final List<String> columns = addressColumns(table.headers());
    if (columns.isEmpty()) {
      sink.emit("No address columns found");
      return;
    }
    sink.emit("Found address columns: " + String.join(", ", columns));

    final List<Integer> indexes = new ArrayList<>();
    for (int i = 0; i < table.headers().size(); i++) {
      if (columns.contains(table.headers().get(i))) {
        indexes.add(i);
      }
    }
    final List<String> combined = new ArrayList<>(table.rowCount());
    for (int row = 0; row < table.rowCount(); row++) {
      final StringJoiner joiner = new StringJoiner(ADDRESS_SEPARATOR);
      for (final int index : indexes) {
        final String value = table.value(row, index);
        if (!value.isEmpty()) {
          joiner.add(value);
        }
      }
      combined.add(joiner.toString().trim());
    }
    table.put(CanonicalField.ADDRE_ADD1.header(), combined);
  }
}
