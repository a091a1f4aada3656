package io.github.postmerge.enrich;

import static org.assertj.core.api.Assertions.assertThat;

import io.github.postmerge.log.LogSink;
import io.github.postmerge.model.CanonicalField;
import io.github.postmerge.model.CanonicalRecord;
import io.github.postmerge.model.ImmutableReferenceEntry;
import io.github.postmerge.model.MergedBatch;
import io.github.postmerge.model.ReferenceTable;
import io.github.postmerge.pincode.PincodeNormalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PincodeBackfillTest {

  private final List<String> messages = new ArrayList<>();
  private final LogSink sink = messages::add;
  private final PincodeBackfill backfill = new PincodeBackfill(new PincodeNormalizer());

  private final ReferenceTable reference = ReferenceTable.of(List.of(
      ImmutableReferenceEntry.builder().pincode("110001").city("NEW DELHI").build(),
      ImmutableReferenceEntry.builder().pincode("560001").city("BANGALORE").build(),
      ImmutableReferenceEntry.builder().pincode("560001").city("BENGALURU").build()));

  @Test
  void apply_extractsPincodeFromAddressAndResolvesCity() {
    // Given
    final MergedBatch batch = MergedBatch.of(List.of(record(Map.of(
        CanonicalField.ADDRE_ADD1, "12 Janpath, Near 110 001, Delhi"))));

    // When
    final MergedBatch result = backfill.apply(batch, reference, sink);

    // Then
    final CanonicalRecord record = result.records().get(0);
    assertThat(record.get(CanonicalField.ADDRE_PINCODE)).isEqualTo("110001");
    assertThat(record.get(CanonicalField.ADDRE_CITY)).isEqualTo("NEW DELHI");
    assertThat(messages).contains(
        "Extracted 1 pincodes from address fields", "Mapped 1 cities from pincodes");
  }

  @Test
  void apply_scansAddressFieldsInOrderAndStopsAtFirstHit() {
    // Given
    final MergedBatch batch = MergedBatch.of(List.of(record(Map.of(
        CanonicalField.ADDRE_ADD1, "No code here",
        CanonicalField.ADDRE_ADD2, "Bangalore 560001",
        CanonicalField.ADDRE_ADD3, "Delhi 110001"))));

    // When
    final CanonicalRecord record = backfill.apply(batch, reference, sink).records().get(0);

    // Then
    assertThat(record.get(CanonicalField.ADDRE_PINCODE)).isEqualTo("560001");
    assertThat(record.get(CanonicalField.ADDRE_CITY)).isEqualTo("BANGALORE");
  }

  @Test
  void apply_cleansExistingPincode() {
    // Given
    final MergedBatch batch = MergedBatch.of(List.of(
        record(Map.of(CanonicalField.ADDRE_PINCODE, "560-001")),
        record(Map.of(CanonicalField.ADDRE_PINCODE, "5600", CanonicalField.ADDRE_ADD1, "Delhi"))));

    // When
    final List<CanonicalRecord> records = backfill.apply(batch, reference, sink).records();

    // Then
    assertThat(records.get(0).get(CanonicalField.ADDRE_PINCODE)).isEqualTo("560001");
    assertThat(records.get(1).get(CanonicalField.ADDRE_PINCODE)).isEmpty();
    assertThat(records.get(1).get(CanonicalField.ADDRE_CITY)).isEmpty();
  }

  @Test
  void apply_keepsExistingCity() {
    // Given
    final MergedBatch batch = MergedBatch.of(List.of(record(Map.of(
        CanonicalField.ADDRE_PINCODE, "110001",
        CanonicalField.ADDRE_CITY, "  Delhi Cantt "))));

    // When
    final CanonicalRecord record = backfill.apply(batch, reference, sink).records().get(0);

    // Then
    assertThat(record.get(CanonicalField.ADDRE_CITY)).isEqualTo("Delhi Cantt");
  }

  @Test
  void apply_withUnknownPincode_logsAndLeavesCityEmpty() {
    // Given
    final MergedBatch batch =
        MergedBatch.of(List.of(record(Map.of(CanonicalField.ADDRE_PINCODE, "999999"))));

    // When
    final CanonicalRecord record = backfill.apply(batch, reference, sink).records().get(0);

    // Then
    assertThat(record.get(CanonicalField.ADDRE_CITY)).isEmpty();
    assertThat(messages).contains("Pincode 999999 not found in PIN database.");
  }

  @Test
  void apply_doesNotModifyInputBatch() {
    // Given
    final CanonicalRecord original = record(Map.of(CanonicalField.ADDRE_ADD1, "Delhi 110001"));
    final MergedBatch batch = MergedBatch.of(List.of(original));

    // When
    final MergedBatch result = backfill.apply(batch, reference, sink);

    // Then
    assertThat(batch.records()).containsExactly(original);
    assertThat(batch.records().get(0).get(CanonicalField.ADDRE_PINCODE)).isEmpty();
    assertThat(result.records().get(0).get(CanonicalField.ADDRE_PINCODE)).isEqualTo("110001");
  }

  private static CanonicalRecord record(final Map<CanonicalField, String> values) {
    return CanonicalRecord.of(values);
  }
}
