package org.cellpainting.loaddata.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlWhichOverridesDefaults() {
    List<String> warnings = new ArrayList<>();
    Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
        "bind",
        Optional.of(Map.of("workers", "2", "joinKeys", "plate")),
        Map.of("workers", "8"),
        DefaultsForMode.asFlatMap("bind"),
        warnings::add);

    assertEquals("8", effective.get("workers"));
    assertEquals("plate", effective.get("joinKeys"));
    assertEquals("batch,plate", effective.get("groupKeys"));
    assertEquals(List.of("CLI overrides YAML for key: workers"), warnings);
  }

  @Test
  void blankKeyListIsRejected() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "bind", Optional.empty(), Map.of("groupKeys", " , "), DefaultsForMode.asFlatMap("bind"), null));
    assertEquals("groupKeys must list at least one key", ex.getMessage());
  }

  @Test
  void nonPositiveWorkersAreRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "bind", Optional.empty(), Map.of("workers", "-1"), DefaultsForMode.asFlatMap("bind"), null));
    assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "bind", Optional.empty(), Map.of("workers", "x"), DefaultsForMode.asFlatMap("bind"), null));
  }

  @Test
  void combineRequiresKeys() {
    assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "combine", Optional.of(Map.of("keys", "")), Map.of(), DefaultsForMode.asFlatMap("combine"), null));
  }
}
