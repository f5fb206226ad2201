package org.cellpainting.loaddata.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void bindDefaultsIncludeCommonAndBindKeys() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("bind");

    assertEquals("otlp", defaults.get("metricsExporter"));
    assertEquals("batch,plate", defaults.get("groupKeys"));
    assertEquals("batch,plate,well,site", defaults.get("metadataColumns"));
    assertEquals("false", defaults.get("failOnUnmatched"));
    assertFalse(defaults.containsKey("prefix"));
  }

  @Test
  void combineDefaultsAreCaseInsensitiveOnMode() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap(" Combine ");

    assertEquals("batch,plate", defaults.get("keys"));
    assertEquals("loaddata", defaults.get("prefix"));
    assertFalse(defaults.containsKey("groupKeys"));
  }

  @Test
  void unknownModeFails() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("analyze"));
  }
}
