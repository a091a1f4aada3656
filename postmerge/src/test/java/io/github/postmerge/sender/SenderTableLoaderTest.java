package io.github.postmerge.sender;

import static io.github.postmerge.WorkbookFixtures.row;
import static org.assertj.core.api.Assertions.assertThat;

import io.github.postmerge.WorkbookFixtures;
import io.github.postmerge.importer.WorkbookImporter;
import io.github.postmerge.log.LogSink;
import io.github.postmerge.model.SenderProfile;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SenderTableLoaderTest {

  @TempDir Path tempDir;

  private final List<String> messages = new ArrayList<>();
  private final LogSink sink = messages::add;
  private final SenderTableLoader loader =
      new SenderTableLoader(new WorkbookImporter(new DataFormatter()));

  @Test
  void load_readsSenderFields() throws Exception {
    // Given
    final Path file = WorkbookFixtures.write(tempDir.resolve("Sender Address.xlsx"), "Sheet1",
        List.of(
            row("File Name Contain", "SenderCity", "SenderPincode", "SenderName", "SenderADD1",
                "SenderADD2", "SenderADD3"),
            row("ACME", "MUMBAI", 400001, "Acme Finance", "Nariman Point", null, "Floor 3")));

    // When
    final List<SenderProfile> senders = loader.load(file, sink);

    // Then
    assertThat(senders).hasSize(1);
    final SenderProfile sender = senders.get(0);
    assertThat(sender.fileNameKey()).isEqualTo("ACME");
    assertThat(sender.senderCity()).isEqualTo("MUMBAI");
    assertThat(sender.senderPincode()).isEqualTo("400001");
    assertThat(sender.senderName()).isEqualTo("Acme Finance");
    assertThat(sender.senderAdd1()).isEqualTo("Nariman Point");
    assertThat(sender.senderAdd2()).isEmpty();
    assertThat(sender.senderAdd3()).isEqualTo("Floor 3");
    assertThat(messages).contains("Successfully loaded sender details with 1 records");
  }

  @Test
  void load_withMissingColumns_defaultsToEmpty() throws Exception {
    // Given
    final Path file = WorkbookFixtures.write(tempDir.resolve("Sender Address.xlsx"), "Sheet1",
        List.of(row("File Name Contain", "SenderName"), row("ZENITH", "Zenith Bank")));

    // When
    final List<SenderProfile> senders = loader.load(file, sink);

    // Then
    assertThat(senders).singleElement().satisfies(sender -> {
      assertThat(sender.senderName()).isEqualTo("Zenith Bank");
      assertThat(sender.senderCity()).isEmpty();
    });
  }

  @Test
  void load_withMissingFile_returnsNoSenders() {
    assertThat(loader.load(tempDir.resolve("Sender Address.xlsx"), sink)).isEmpty();
    assertThat(messages).anyMatch(m -> m.startsWith("Sender details file not found"));
  }

  @Test
  void load_withCorruptFile_returnsNoSenders() throws Exception {
    final Path file = Files.writeString(tempDir.resolve("Sender Address.xlsx"), "garbage");

    assertThat(loader.load(file, sink)).isEmpty();
    assertThat(messages).anyMatch(m -> m.startsWith("Error loading sender details"));
  }
}
