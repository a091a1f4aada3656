package io.github.postmerge.reference;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Pincode and city columns of a reference sheet.
 */
@Value.Immutable
public interface ReferenceColumns {

  String pincodeColumn();

  String cityColumn();

  /**
   * How the columns were found.
   */
  Strategy strategy();

  /**
   * Column identification strategies, in the order they are tried.
   */
  enum Strategy {
    EXACT,
    PARTIAL,
    POSITIONAL
  }

  /**
   * Identify the columns from the header names. Exact names ({@code PINCODE}, {@code CITY}) are
   * tried first, then names containing {@code PIN} / {@code CITY}; if either is still missing the
   * first two columns are used.
   *
   * @param headers the header names
   * @return the columns, empty when fewer than two columns exist and a name is missing
   */
  static Optional<ReferenceColumns> infer(final List<String> headers) {
    String pincode = null;
    String city = null;
    for (final String header : headers) {
      final String normalized = header.trim().toUpperCase(Locale.ROOT);
      if (normalized.equals("PINCODE")) {
        pincode = header;
      } else if (normalized.equals("CITY")) {
        city = header;
      }
    }
    if (pincode != null && city != null) {
      return Optional.of(of(pincode, city, Strategy.EXACT));
    }

    if (pincode == null) {
      pincode = firstContaining(headers, "PIN");
    }
    if (city == null) {
      city = firstContaining(headers, "CITY");
    }
    if (pincode != null && city != null) {
      return Optional.of(of(pincode, city, Strategy.PARTIAL));
    }

    if (headers.size() >= 2) {
      return Optional.of(of(headers.get(0), headers.get(1), Strategy.POSITIONAL));
    }
    return Optional.empty();
  }

  private static String firstContaining(final List<String> headers, final String token) {
    return headers.stream()
        .filter(h -> h.toUpperCase(Locale.ROOT).contains(token))
        .findFirst()
        .orElse(null);
  }

  private static ReferenceColumns of(
      final String pincode, final String city, final Strategy strategy) {
    return ImmutableReferenceColumns.builder()
        .pincodeColumn(pincode)
        .cityColumn(city)
        .strategy(strategy)
        .build();
  }
}
