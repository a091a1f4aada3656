package io.github.postmerge.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.Map;
import org.immutables.value.Value;

/**
 * Header aliases of the input files. Each value lists acceptable headers separated by the word
 * {@code Or}, e.g. {@code "SL Or sr Or srno"}.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableColumnAliases.class)
@JsonDeserialize(as = ImmutableColumnAliases.class)
public interface ColumnAliases {

  /**
   * Canonical header to its aliases, in matching order.
   */
  Map<String, String> fields();

  /**
   * Aliases of the address columns that are joined into {@code AddreADD1}.
   */
  String address();

  /**
   * Every key of {@link #fields()} must be an output header.
   */
  @Value.Check
  default void check() {
    for (final String field : fields().keySet()) {
      if (CanonicalField.fromHeader(field).isEmpty()) {
        throw new IllegalStateException("Unknown canonical field in aliases: " + field);
      }
    }
  }
}
