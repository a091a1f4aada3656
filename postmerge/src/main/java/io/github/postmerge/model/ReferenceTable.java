package io.github.postmerge.model;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Pincode to city lookup. Duplicate pincodes are kept; lookups return the first entry.
 */
public final class ReferenceTable {

  private static final ReferenceTable EMPTY = new ReferenceTable(List.of());

  private final List<ReferenceEntry> entries;
  private final Map<String, String> firstCityByPincode;

  private ReferenceTable(final List<ReferenceEntry> entries) {
    this.entries = List.copyOf(entries);
    this.firstCityByPincode = new HashMap<>();
    for (final ReferenceEntry entry : this.entries) {
      firstCityByPincode.putIfAbsent(entry.pincode(), entry.city());
    }
  }

  public static ReferenceTable of(final List<ReferenceEntry> entries) {
    return new ReferenceTable(entries);
  }

  public static ReferenceTable empty() {
    return EMPTY;
  }

  public List<ReferenceEntry> entries() {
    return entries;
  }

  public int size() {
    return entries.size();
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  /**
   * City of the first entry with this pincode.
   *
   * @param pincode the pincode
   * @return the city, if any
   */
  public Optional<String> cityFor(final String pincode) {
    return Optional.ofNullable(firstCityByPincode.get(pincode));
  }
}
