package io.github.postmerge.pincode;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Cleans and extracts six digit pincodes. Pincodes stay strings so leading zeros survive.
 */
@Singleton
public class PincodeNormalizer {

  private static final Pattern NON_DIGIT = Pattern.compile("\\D");
  private static final Pattern SIX_DIGITS = Pattern.compile("\\b\\d{6}\\b");
  private static final Pattern SPLIT_SIX_DIGITS = Pattern.compile("\\b(\\d{3})[\\s-]?(\\d{3})\\b");

  /**
   * Constructor.
   */
  @Inject
  public PincodeNormalizer() {
  }

  /**
   * Strip everything but digits and keep the result only if it has exactly six of them.
   *
   * @param raw any text, may be null
   * @return the pincode, or an empty string
   */
  public String clean(final String raw) {
    if (raw == null) {
      return "";
    }
    final String digits = NON_DIGIT.matcher(raw).replaceAll("");
    return digits.length() == 6 ? digits : "";
  }

  /**
   * Find a pincode in free text. A standalone six digit run wins over a {@code 3+3} digit form
   * split by a space or hyphen, e.g. {@code 110 001}.
   *
   * @param text any text, may be null
   * @return the pincode, or an empty string
   */
  public String extractFromText(final String text) {
    if (text == null) {
      return "";
    }
    final Matcher standalone = SIX_DIGITS.matcher(text);
    if (standalone.find()) {
      return standalone.group();
    }
    final Matcher split = SPLIT_SIX_DIGITS.matcher(text);
    if (split.find()) {
      return split.group(1) + split.group(2);
    }
    return "";
  }
}
