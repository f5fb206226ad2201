package org.cellpainting.loaddata.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CombineConfigTest {

  @Test
  void fromMapAppliesDefaults() {
    CombineConfig config = CombineConfig.fromMap(Map.of("handoff", "load_data/handoff.ndjson", "out", "combined"));

    assertEquals(Path.of("combined").toAbsolutePath().normalize(), config.outputDirectory());
    assertEquals(List.of("batch", "plate"), config.keys());
    assertEquals("loaddata", config.prefix());
  }

  @Test
  void combinedNameJoinsValuesWithDashes() {
    Map<String, String> options = new HashMap<>();
    options.put("handoff", "h.ndjson");
    options.put("out", "o");
    options.put("keys", "batch,plate");
    options.put("prefix", "screen-7");

    CombineConfig config = CombineConfig.fromMap(options);

    assertEquals("screen-7.B1-P1_combined_load_data", config.combinedName(List.of("B1", "P1")));
  }

  @Test
  void prefixMustBeAnIdentifier() {
    Map<String, String> options = new HashMap<>();
    options.put("handoff", "h.ndjson");
    options.put("out", "o");
    options.put("prefix", "../escape");

    assertThrows(IllegalArgumentException.class, () -> CombineConfig.fromMap(options));
  }

  @Test
  void handoffIsRequired() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> CombineConfig.fromMap(Map.of("out", "o")));
    assertEquals("handoff is required", ex.getMessage());
  }
}
