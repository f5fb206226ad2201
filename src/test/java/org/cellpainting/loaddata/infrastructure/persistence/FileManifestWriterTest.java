package org.cellpainting.loaddata.infrastructure.persistence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileManifestWriterTest {

  @TempDir
  Path tempDir;

  private final FileManifestWriter writer = new FileManifestWriter();

  @Test
  void writesGroupManifestAndReplacesExistingFile() throws IOException {
    Path first = writer.write("B1_P1", "A\n\"1\"\n", tempDir);
    Path second = writer.write("B1_P1", "A\n\"2\"\n", tempDir);

    assertEquals(first, second);
    assertEquals(tempDir.resolve("B1_P1.csv").toAbsolutePath().normalize(), second);
    assertEquals("A\n\"2\"\n", Files.readString(second, StandardCharsets.UTF_8));
    assertEquals(List.of("B1_P1.csv"), listNames());
  }

  @Test
  void createsMissingDestinationDirectory() throws IOException {
    Path nested = tempDir.resolve("out/plates");

    Path written = writer.write("P1", "A\n", nested);

    assertEquals("A\n", Files.readString(written, StandardCharsets.UTF_8));
  }

  @Test
  void sanitizesUnsafeIdentifiers() {
    assertEquals("B1_P_1.csv", FileManifestWriter.fileName("B1_P/1"));
    assertEquals("a.b-c_d.csv", FileManifestWriter.fileName("a.b-c d"));
    assertEquals("x.csv", FileManifestWriter.fileName(""));
  }

  @Test
  void targetNameIsTheFileTheManifestLandsIn() throws IOException {
    Path written = writer.write("P 1", "A\n", tempDir);

    assertEquals(written.getFileName().toString(), writer.targetName("P 1"));
    assertEquals(writer.targetName("P 1"), writer.targetName("P_1"));
    assertNotEquals(writer.targetName("P 1"), writer.targetName("P1"));
  }

  @Test
  void readerReturnsWrittenContent() throws IOException {
    Path written = writer.write("P1", "Metadata_Well\n\"A1\"\n", tempDir);

    assertEquals("Metadata_Well\n\"A1\"\n", new FileManifestReader().read(written));
  }

  private List<String> listNames() throws IOException {
    try (Stream<Path> files = Files.list(tempDir)) {
      return files.map(path -> path.getFileName().toString()).sorted().toList();
    }
  }
}
