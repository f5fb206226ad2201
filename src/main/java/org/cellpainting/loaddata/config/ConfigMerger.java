package org.cellpainting.loaddata.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources while enforcing precedence and invariants.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI > YAML > defaults.
   *
   * @param mode active pipeline mode
   * @param yaml optional YAML-derived settings for the mode
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the mode
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    merged.putAll(yamlCopy);
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null) {
        continue;
      }
      String value = entry.getValue();
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      if (value != null) {
        merged.put(key, value);
      }
    }

    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective) {
    if ("bind".equalsIgnoreCase(mode)) {
      requireKeyList("groupKeys", effective);
      requireKeyList("joinKeys", effective);
      String workers = trim(effective.get("workers"));
      if (!workers.isEmpty()) {
        int parsed;
        try {
          parsed = Integer.parseInt(workers);
        } catch (NumberFormatException ex) {
          throw new IllegalArgumentException("workers must be an integer: " + workers, ex);
        }
        if (parsed <= 0) {
          throw new IllegalArgumentException("workers must be positive");
        }
      }
    } else if ("combine".equalsIgnoreCase(mode)) {
      requireKeyList("keys", effective);
    }
  }

  private static void requireKeyList(String key, Map<String, String> effective) {
    if (effective.containsKey(key) && trim(effective.get(key)).replace(",", "").isBlank()) {
      throw new IllegalArgumentException(key + " must list at least one key");
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
