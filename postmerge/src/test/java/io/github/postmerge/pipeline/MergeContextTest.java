package io.github.postmerge.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import io.github.postmerge.model.CanonicalField;
import io.github.postmerge.model.CanonicalRecord;
import io.github.postmerge.model.MergeSummary;
import java.util.List;
import org.junit.jupiter.api.Test;

class MergeContextTest {

  @Test
  void batch_concatenatesInProcessingOrder() {
    // Given
    final MergeContext context = new MergeContext();
    context.addProcessed(List.of(record("A1"), record("A2")));
    context.recordError();
    context.addProcessed(List.of(record("B1")));
    context.recordSkipped();

    // When
    final List<CanonicalRecord> records = context.batch().records();

    // Then
    assertThat(records).extracting(r -> r.get(CanonicalField.BARCODE))
        .containsExactly("A1", "A2", "B1");
    final MergeSummary summary = context.summary(MergeSummary.Status.COMPLETED, 3, null);
    assertThat(summary.processedFiles()).isEqualTo(2);
    assertThat(summary.errorFiles()).isEqualTo(1);
    assertThat(summary.skippedFiles()).isEqualTo(1);
    assertThat(summary.outputFile()).isEmpty();
  }

  private static CanonicalRecord record(final String barcode) {
    return CanonicalRecord.empty().with(CanonicalField.BARCODE, barcode);
  }
}
