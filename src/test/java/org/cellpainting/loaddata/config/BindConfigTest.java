package org.cellpainting.loaddata.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class BindConfigTest {

  @Test
  void fromMapAppliesDefaults() {
    BindConfig config = BindConfig.fromMap(required());

    assertEquals(Path.of("images.ndjson").toAbsolutePath().normalize(), config.imagesFile());
    assertEquals(List.of("batch", "plate"), config.groupKeys());
    assertEquals(List.of("batch", "plate"), config.joinKeys());
    assertEquals(List.of("batch", "plate", "well", "site"), config.metadataColumns());
    assertFalse(config.frameColumns());
    assertFalse(config.failOnUnmatched());
    assertEquals(BindConfig.defaultWorkers(), config.workers());
    assertEquals(Optional.of(config.outputDirectory().resolve("handoff.ndjson")), config.handoffFile());
  }

  @Test
  void fromMapParsesOverrides() {
    Map<String, String> options = required();
    options.put("groupKeys", " batch , plate, cycle ");
    options.put("joinKeys", "plate");
    options.put("metadataColumns", "plate,well,site,cycle");
    options.put("frameColumns", "true");
    options.put("workers", "3");
    options.put("failOnUnmatched", "TRUE");
    options.put("handoff", "work/units.ndjson");

    BindConfig config = BindConfig.fromMap(options);

    assertEquals(List.of("batch", "plate", "cycle"), config.groupKeys());
    assertEquals(List.of("plate"), config.joinKeys());
    assertEquals(List.of("plate", "well", "site", "cycle"), config.metadataColumns());
    assertTrue(config.frameColumns());
    assertEquals(3, config.workers());
    assertTrue(config.failOnUnmatched());
    assertEquals(Optional.of(Path.of("work/units.ndjson").toAbsolutePath().normalize()), config.handoffFile());
  }

  @Test
  void handoffNoneDisablesHandoff() {
    Map<String, String> options = required();
    options.put("handoff", "None");

    assertEquals(Optional.empty(), BindConfig.fromMap(options).handoffFile());
  }

  @Test
  void missingRequiredPathFails() {
    Map<String, String> options = required();
    options.remove("corrections");

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> BindConfig.fromMap(options));
    assertEquals("corrections is required", ex.getMessage());
  }

  @Test
  void invalidWorkersFail() {
    Map<String, String> options = required();
    options.put("workers", "many");
    assertThrows(IllegalArgumentException.class, () -> BindConfig.fromMap(options));

    options.put("workers", "0");
    assertThrows(IllegalArgumentException.class, () -> BindConfig.fromMap(options));
  }

  @Test
  void duplicateKeysFail() {
    Map<String, String> options = required();
    options.put("groupKeys", "plate,plate");

    assertThrows(IllegalArgumentException.class, () -> BindConfig.fromMap(options));
  }

  private static Map<String, String> required() {
    Map<String, String> options = new HashMap<>();
    options.put("images", "images.ndjson");
    options.put("corrections", "illum.ndjson");
    options.put("out", "load_data");
    return options;
  }
}
