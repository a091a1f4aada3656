package io.github.postmerge.sender;

import io.github.postmerge.model.SenderProfile;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Finds the sender of an input file by its name.
 */
@Singleton
public class SenderResolver {

  /**
   * Constructor.
   */
  @Inject
  public SenderResolver() {
  }

  /**
   * Part of the file name used for the lookup: everything before the first {@code -}, then
   * everything before the first {@code .}, trimmed. {@code "ACME-June.xlsx"} gives {@code "ACME"}.
   *
   * @param fileName the input file name
   * @return the lookup key
   */
  public String lookupKey(final String fileName) {
    String key = fileName;
    final int dash = key.indexOf('-');
    if (dash >= 0) {
      key = key.substring(0, dash);
    }
    final int dot = key.indexOf('.');
    if (dot >= 0) {
      key = key.substring(0, dot);
    }
    return key.trim();
  }

  /**
   * First sender whose file name key contains the lookup key of the file, ignoring case.
   *
   * @param senders  the sender table
   * @param fileName the input file name
   * @return the sender, empty when none matches or the key is empty
   */
  public Optional<SenderProfile> find(final List<SenderProfile> senders, final String fileName) {
    final String key = lookupKey(fileName).toLowerCase(Locale.ROOT);
    if (key.isEmpty()) {
      return Optional.empty();
    }
    return senders.stream()
        .filter(sender -> !sender.fileNameKey().isBlank())
        .filter(sender -> sender.fileNameKey().toLowerCase(Locale.ROOT).contains(key))
        .findFirst();
  }
}
