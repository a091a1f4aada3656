package io.github.postmerge.mapping;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Ordered header aliases parsed from text such as {@code "SL Or sr Or srno"}. Aliases are
 * trimmed and lowercased; blank ones are dropped.
 */
public final class AliasList {

  private static final Pattern SEPARATOR = Pattern.compile("\\bOr\\b");

  private final List<String> aliases;

  private AliasList(final List<String> aliases) {
    this.aliases = List.copyOf(aliases);
  }

  /**
   * Parse an {@code Or}-separated alias list.
   *
   * @param text the aliases
   * @return the list
   */
  public static AliasList parse(final String text) {
    return new AliasList(Arrays.stream(SEPARATOR.split(text == null ? "" : text))
        .map(AliasList::normalize)
        .filter(alias -> !alias.isEmpty())
        .distinct()
        .collect(Collectors.toList()));
  }

  /**
   * Header text as compared against aliases.
   *
   * @param header the header
   * @return trimmed, lowercased header
   */
  static String normalize(final String header) {
    return header.trim().toLowerCase(Locale.ROOT);
  }

  public List<String> aliases() {
    return aliases;
  }

  /**
   * Whether a header equals one of the aliases.
   *
   * @param header the header
   * @return true on a match
   */
  public boolean matches(final String header) {
    return aliases.contains(normalize(header));
  }

  @Override
  public boolean equals(final Object o) {
    return o instanceof AliasList && aliases.equals(((AliasList) o).aliases);
  }

  @Override
  public int hashCode() {
    return Objects.hash(aliases);
  }

  @Override
  public String toString() {
    return String.join(" Or ", aliases);
  }
}
