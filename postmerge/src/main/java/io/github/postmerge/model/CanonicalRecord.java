package io.github.postmerge.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * One row of the merged post file. Every canonical field is present; absent values are empty
 * strings.
 */
public final class CanonicalRecord {

  private final EnumMap<CanonicalField, String> values;

  private CanonicalRecord(final EnumMap<CanonicalField, String> values) {
    this.values = values;
  }

  /**
   * Record with every field empty.
   *
   * @return the record
   */
  public static CanonicalRecord empty() {
    final EnumMap<CanonicalField, String> values = new EnumMap<>(CanonicalField.class);
    for (final CanonicalField field : CanonicalField.values()) {
      values.put(field, "");
    }
    return new CanonicalRecord(values);
  }

  /**
   * Record built from the given values; fields not in the map are empty.
   *
   * @param values the values
   * @return the record
   */
  public static CanonicalRecord of(final Map<CanonicalField, String> values) {
    CanonicalRecord record = empty();
    for (final Map.Entry<CanonicalField, String> entry : values.entrySet()) {
      record = record.with(entry.getKey(), entry.getValue());
    }
    return record;
  }

  public String get(final CanonicalField field) {
    return values.get(field);
  }

  /**
   * Copy of this record with one field replaced. Null is stored as the empty string.
   *
   * @param field the field
   * @param value the new value
   * @return the copy
   */
  public CanonicalRecord with(final CanonicalField field, final String value) {
    final EnumMap<CanonicalField, String> copy = new EnumMap<>(values);
    copy.put(field, value == null ? "" : value);
    return new CanonicalRecord(copy);
  }

  public Map<CanonicalField, String> asMap() {
    return Collections.unmodifiableMap(values);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CanonicalRecord)) {
      return false;
    }
    return values.equals(((CanonicalRecord) o).values);
  }

  @Override
  public int hashCode() {
    return Objects.hash(values);
  }

  @Override
  public String toString() {
    return "CanonicalRecord" + values;
  }
}
