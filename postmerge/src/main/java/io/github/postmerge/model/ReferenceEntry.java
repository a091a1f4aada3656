package io.github.postmerge.model;

import org.immutables.value.Value;

/**
 * One row of the pincode reference table.
 */
@Value.Immutable
public interface ReferenceEntry {

  /**
   * Six digit pincode.
   */
  String pincode();

  /**
   * Trimmed, uppercased city name.
   */
  String city();

  /**
   * Pincode must be exactly six digits.
   */
  @Value.Check
  default void check() {
    if (!pincode().matches("\\d{6}")) {
      throw new IllegalStateException("Pincode must have exactly 6 digits: '" + pincode() + "'");
    }
  }
}
