package org.cellpainting.loaddata.infrastructure.persistence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.cellpainting.loaddata.application.port.HandoffUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class NdjsonHandoffTest {

  @TempDir
  Path tempDir;

  @Test
  void publishedUnitsReadBackInOrder() throws IOException {
    Path handoff = tempDir.resolve("handoff.ndjson");
    HandoffUnit first = unit("B1", "P1");
    HandoffUnit second = unit("B1", "P2");

    new NdjsonHandoffWriter(handoff).publish(List.of(first, second));
    List<HandoffUnit> read = new NdjsonHandoffReader(handoff).units();

    assertEquals(List.of(first, second), read);
    assertEquals(List.of("batch", "plate"), List.copyOf(read.get(0).group().keySet()));
    assertEquals(2, Files.readAllLines(handoff, StandardCharsets.UTF_8).size());
  }

  @Test
  void relativeManifestPathsResolveAgainstHandoffDirectory() throws IOException {
    Path handoff = tempDir.resolve("handoff.ndjson");
    Files.writeString(handoff,
        "{\"group\": {\"plate\": \"P1\"}, \"groupId\": \"P1\", \"images\": [\"a.tif\"], \"manifest\": \"P1.csv\"}\n",
        StandardCharsets.UTF_8);

    HandoffUnit unit = new NdjsonHandoffReader(handoff).units().get(0);

    assertEquals(tempDir.resolve("P1.csv").toAbsolutePath().normalize(), unit.manifest());
    assertEquals(List.of(tempDir.resolve("a.tif").toAbsolutePath().normalize()), unit.images());
    assertTrue(unit.corrections().isEmpty());
  }

  @Test
  void missingGroupIdFailsWithLineNumber() throws IOException {
    Path handoff = tempDir.resolve("handoff.ndjson");
    Files.writeString(handoff, "# header\n{\"group\": {}, \"manifest\": \"x.csv\"}\n", StandardCharsets.UTF_8);

    IOException ex = assertThrows(IOException.class, () -> new NdjsonHandoffReader(handoff).units());

    assertTrue(ex.getMessage().contains("handoff.ndjson:2"), ex.getMessage());
  }

  private HandoffUnit unit(String batch, String plate) {
    Map<String, String> group = new LinkedHashMap<>();
    group.put("batch", batch);
    group.put("plate", plate);
    Path abs = tempDir.toAbsolutePath().normalize();
    return new HandoffUnit(
        group,
        batch + "_" + plate,
        List.of(abs.resolve(plate + "_a.tif"), abs.resolve(plate + "_b.tif")),
        List.of(abs.resolve(plate + "_IllumDAPI.npy")),
        abs.resolve(batch + "_" + plate + ".csv"));
  }
}
