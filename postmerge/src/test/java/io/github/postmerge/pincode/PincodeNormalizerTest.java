package io.github.postmerge.pincode;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class PincodeNormalizerTest {

  private final PincodeNormalizer normalizer = new PincodeNormalizer();

  @Test
  void clean_withSeparators_keepsSixDigits() {
    assertThat(normalizer.clean("110-001")).isEqualTo("110001");
    assertThat(normalizer.clean(" 400 001 ")).isEqualTo("400001");
    assertThat(normalizer.clean("PIN: 560034.")).isEqualTo("560034");
  }

  @Test
  void clean_preservesLeadingZeros() {
    assertThat(normalizer.clean("012345")).isEqualTo("012345");
  }

  @Test
  void clean_withWrongDigitCount_returnsEmpty() {
    assertThat(normalizer.clean("11 001")).isEmpty();
    assertThat(normalizer.clean("1100012")).isEmpty();
    assertThat(normalizer.clean("400001.0")).isEmpty();
    assertThat(normalizer.clean("no digits")).isEmpty();
    assertThat(normalizer.clean("")).isEmpty();
  }

  @Test
  void clean_withNull_returnsEmpty() {
    assertThat(normalizer.clean(null)).isEmpty();
  }

  @ParameterizedTest
  @ValueSource(strings = {"110-001", "11 001", "abc", "560 034 Bangalore", "1234567", "", "0-0-0-0-0-1"})
  void clean_isIdempotent(final String raw) {
    final String once = normalizer.clean(raw);
    assertThat(normalizer.clean(once)).isEqualTo(once);
  }

  @Test
  void extractFromText_withStandaloneRun_returnsIt() {
    assertThat(normalizer.extractFromText("Flat 4, MG Road, Pune 411001 MH")).isEqualTo("411001");
  }

  @Test
  void extractFromText_withSpaceSeparatedForm_collapsesSeparator() {
    assertThat(normalizer.extractFromText("Address near 110 001 Delhi")).isEqualTo("110001");
  }

  @Test
  void extractFromText_withHyphenSeparatedForm_collapsesSeparator() {
    assertThat(normalizer.extractFromText("Sector 5, Noida-201-301")).isEqualTo("201301");
  }

  @Test
  void extractFromText_prefersStandaloneRunOverSplitForm() {
    assertThat(normalizer.extractFromText("Plot 123 456, Pune 411002")).isEqualTo("411002");
  }

  @Test
  void extractFromText_ignoresDigitsInsideLongerRuns() {
    assertThat(normalizer.extractFromText("Phone 9876543210")).isEmpty();
    assertThat(normalizer.extractFromText("Order A1100012")).isEmpty();
  }

  @Test
  void extractFromText_withoutPincode_returnsEmpty() {
    assertThat(normalizer.extractFromText("House 12, Street 34")).isEmpty();
    assertThat(normalizer.extractFromText("")).isEmpty();
    assertThat(normalizer.extractFromText(null)).isEmpty();
  }
}
