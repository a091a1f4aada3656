package io.github.postmerge.enrich;

import io.github.postmerge.log.LogSink;
import io.github.postmerge.model.CanonicalField;
import io.github.postmerge.model.CanonicalRecord;
import io.github.postmerge.model.MergedBatch;
import io.github.postmerge.model.ReferenceTable;
import io.github.postmerge.pincode.PincodeNormalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Fills missing pincodes from the address fields and missing cities from the reference table,
 * over the whole merged batch.
 */
@Singleton
public class PincodeBackfill {

  private static final List<CanonicalField> ADDRESS_FIELDS =
      List.of(CanonicalField.ADDRE_ADD1, CanonicalField.ADDRE_ADD2, CanonicalField.ADDRE_ADD3);

  private final PincodeNormalizer pincodeNormalizer;

  /**
   * Constructor.
   */
  @Inject
  public PincodeBackfill(final PincodeNormalizer pincodeNormalizer) {
    this.pincodeNormalizer = pincodeNormalizer;
  }

  /**
   * Backfill the batch. The input batch is not modified.
   *
   * @param batch     the merged records
   * @param reference the pincode reference table
   * @param sink      the log sink
   * @return a new batch with cleaned pincodes and resolved cities
   */
  public MergedBatch apply(
      final MergedBatch batch, final ReferenceTable reference, final LogSink sink) {
    sink.emit("Processing pincodes and cities for the merged records...");

    int pincodesExtracted = 0;
    int citiesMapped = 0;
    final List<CanonicalRecord> result = new ArrayList<>(batch.size());
    for (final CanonicalRecord original : batch.records()) {
      CanonicalRecord record = original;

      String pincode = pincodeNormalizer.clean(record.get(CanonicalField.ADDRE_PINCODE));
      if (pincode.isEmpty()) {
        pincode = extractFromAddress(record);
        if (!pincode.isEmpty()) {
          pincodesExtracted++;
        }
      }
      record = record.with(CanonicalField.ADDRE_PINCODE, pincode);

      final String city = record.get(CanonicalField.ADDRE_CITY).trim();
      record = record.with(CanonicalField.ADDRE_CITY, city);
      if (city.isEmpty() && !pincode.isEmpty()) {
        final Optional<String> resolved = reference.cityFor(pincode);
        if (resolved.isPresent()) {
          record = record.with(CanonicalField.ADDRE_CITY, resolved.get());
          citiesMapped++;
        } else {
          sink.emit("Pincode " + pincode + " not found in PIN database.");
        }
      }
      result.add(record);
    }

    sink.emit("Extracted " + pincodesExtracted + " pincodes from address fields");
    sink.emit("Mapped " + citiesMapped + " cities from pincodes");
    return MergedBatch.of(result);
  }

  private String extractFromAddress(final CanonicalRecord record) {
    for (final CanonicalField field : ADDRESS_FIELDS) {
      final String pincode = pincodeNormalizer.extractFromText(record.get(field));
      if (!pincode.isEmpty()) {
        return pincode;
      }
    }
    return "";
  }
}
