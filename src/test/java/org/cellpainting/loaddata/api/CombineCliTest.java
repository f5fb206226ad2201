package org.cellpainting.loaddata.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CombineCliTest {
  private static final String EXPORTER_PROPERTY = "otel.metrics.exporter";
  private static final String HEADER = "Metadata_Plate,Metadata_Well,FileName_OrigDNA";

  @TempDir Path tempDir;

  private String originalExporter;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    originalExporter = System.getProperty(EXPORTER_PROPERTY);
    buffer = new StringWriter();
    Console.setWriterForTesting(new PrintWriter(buffer, true));
  }

  @AfterEach
  void tearDown() {
    Console.clearTestWriter();
    if (originalExporter == null) {
      System.clearProperty(EXPORTER_PROPERTY);
    } else {
      System.setProperty(EXPORTER_PROPERTY, originalExporter);
    }
  }

  @Test
  void combinesManifestsPerBatch() throws IOException {
    Path handoff = writeHandoff(HEADER + "\n\"P1\",\"A1\",\"a\"\n", HEADER + "\n\"P2\",\"A1\",\"b\"\n");
    Path out = tempDir.resolve("combined");

    ExitCode code = CombineCli.run(new String[] {
        "handoff=" + handoff, "out=" + out, "keys=batch", "prefix=screen", "metricsExporter=none"});

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals(
        HEADER + "\n\"P1\",\"A1\",\"a\"\n\"P2\",\"A1\",\"b\"\n",
        Files.readString(out.resolve("screen.B1_combined_load_data.csv"), StandardCharsets.UTF_8));
    assertTrue(buffer.toString().contains("Combine summary:"));
  }

  @Test
  void headerMismatchReturnsGroupFailures() throws IOException {
    Path handoff = writeHandoff(HEADER + "\n\"P1\",\"A1\",\"a\"\n", "Metadata_Well\n\"A1\"\n");

    ExitCode code = CombineCli.run(new String[] {
        "handoff=" + handoff, "out=" + tempDir.resolve("combined"), "keys=batch", "metricsExporter=none"});

    assertEquals(ExitCode.GROUP_FAILURES, code);
    assertTrue(buffer.toString().contains("failed loaddata.B1_combined_load_data"));
  }

  @Test
  void missingHandoffReturnsInvalidArgs() {
    ExitCode code = CombineCli.run(new String[] {
        "handoff=" + tempDir.resolve("absent.ndjson"), "out=" + tempDir.resolve("combined")});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: combine"));
  }

  @Test
  void invalidPrefixReturnsInvalidArgs() throws IOException {
    Path handoff = writeHandoff(HEADER + "\n", HEADER + "\n");

    ExitCode code = CombineCli.run(new String[] {
        "handoff=" + handoff, "out=" + tempDir.resolve("combined"), "prefix=a/b", "metricsExporter=none"});

    assertEquals(ExitCode.INVALID_ARGS, code);
  }

  @Test
  void dryRunDoesNotCreateOutput() throws IOException {
    Path handoff = writeHandoff(HEADER + "\n", HEADER + "\n");
    Path out = tempDir.resolve("combined");

    ExitCode code = CombineCli.run(new String[] {
        "handoff=" + handoff, "out=" + out, "--dry-run", "metricsExporter=none"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("Combine dry-run: no files will be produced."));
    assertFalse(Files.exists(out));
  }

  @Test
  void unknownCombineKeyReturnsConfigError() throws IOException {
    Path handoff = writeHandoff(HEADER + "\n", HEADER + "\n");

    ExitCode code = CombineCli.run(new String[] {
        "handoff=" + handoff, "out=" + tempDir.resolve("combined"), "keys=cycle", "metricsExporter=none"});

    assertEquals(ExitCode.CONFIG_ERROR, code);
  }

  private Path writeHandoff(String firstCsv, String secondCsv) throws IOException {
    Path bindOut = Files.createDirectories(tempDir.resolve("load_data"));
    Files.writeString(bindOut.resolve("B1_P1.csv"), firstCsv, StandardCharsets.UTF_8);
    Files.writeString(bindOut.resolve("B1_P2.csv"), secondCsv, StandardCharsets.UTF_8);
    Path handoff = bindOut.resolve("handoff.ndjson");
    Files.writeString(handoff, String.join("\n",
        "{\"group\": {\"batch\": \"B1\", \"plate\": \"P1\"}, \"groupId\": \"B1_P1\", \"images\": [],"
            + " \"corrections\": [], \"manifest\": \"B1_P1.csv\"}",
        "{\"group\": {\"batch\": \"B1\", \"plate\": \"P2\"}, \"groupId\": \"B1_P2\", \"images\": [],"
            + " \"corrections\": [], \"manifest\": \"B1_P2.csv\"}",
        ""), StandardCharsets.UTF_8);
    return handoff;
  }
}
