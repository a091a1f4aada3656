package io.github.postmerge.importer;

import static io.github.postmerge.WorkbookFixtures.row;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.postmerge.WorkbookFixtures;
import io.github.postmerge.model.RawTable;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class WorkbookImporterTest {

  @TempDir Path tempDir;

  private final WorkbookImporter importer = new WorkbookImporter(new DataFormatter());

  @Test
  void readFirstSheet_withXlsx_readsCellsAsDisplayedText() throws Exception {
    // Given
    final Path file = WorkbookFixtures.write(tempDir.resolve("ACME.xlsx"), "Data", List.of(
        row("AWB", "Pincode", "Weight"),
        row("EA001", 110001, 12.5),
        row(null, null, null),
        row("EA002", "012345", null)));

    // When
    final ImportedTable imported = importer.readFirstSheet(file);

    // Then
    final RawTable table = imported.table();
    assertThat(imported.sheetName()).isEqualTo("Data");
    assertThat(table.headers()).containsExactly("AWB", "Pincode", "Weight");
    assertThat(table.rowCount()).isEqualTo(2);
    assertThat(table.value(0, "Pincode")).isEqualTo("110001");
    assertThat(table.value(0, "Weight")).isEqualTo("12.5");
    assertThat(table.value(1, "Pincode")).isEqualTo("012345");
    assertThat(table.value(1, "Weight")).isEmpty();
  }

  @Test
  void readFirstSheet_withLongNumericCodes_keepsEveryDigit() throws Exception {
    // Given
    final Path file = WorkbookFixtures.write(tempDir.resolve("ACME.xlsx"), "Data", List.of(
        row("AWB", "Mobile", "SL"),
        row(123456789012L, 919876543210L, 7)));

    // When
    final RawTable table = importer.readFirstSheet(file).table();

    // Then
    assertThat(table.value(0, "AWB")).isEqualTo("123456789012");
    assertThat(table.value(0, "Mobile")).isEqualTo("919876543210");
    assertThat(table.value(0, "SL")).isEqualTo("7");
  }

  @Test
  void readFirstSheet_withLegacyXls_readsRows() throws Exception {
    // Given
    final Path file = WorkbookFixtures.write(tempDir.resolve("ZENITH.xls"), "Legacy", List.of(
        row("Name", "City"),
        row("Asha", "Pune")));

    // When
    final RawTable table = importer.readFirstSheet(file).table();

    // Then
    assertThat(table.value(0, "City")).isEqualTo("Pune");
  }

  @Test
  void readSheet_withMissingSheet_throwsInputReadException() throws Exception {
    // Given
    final Path file = WorkbookFixtures.write(tempDir.resolve("PIN.xlsx"), "Other", List.of(
        row("Pincode", "City")));

    // When/Then
    assertThatThrownBy(() -> importer.readSheet(file, "TBLPINCITY"))
        .isInstanceOf(InputReadException.class)
        .hasMessageContaining("TBLPINCITY");
  }

  @Test
  void readFirstSheet_withCorruptFile_throwsInputReadException() throws Exception {
    // Given
    final Path file = Files.writeString(tempDir.resolve("corrupt.xlsx"), "this is not excel");

    // When/Then
    assertThatThrownBy(() -> importer.readFirstSheet(file))
        .isInstanceOf(InputReadException.class)
        .hasMessageContaining("corrupt.xlsx");
  }
}
