package org.cellpainting.loaddata.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each CLI mode.
 *
 * <p>The defaults remain the single source of truth for optional YAML keys. Blank values mean "computed at
 * run time" ({@code workers}, {@code handoff}).</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested mode merged with common defaults.
   *
   * @param mode target CLI mode (bind, combine)
   * @return unmodifiable map of default key/value pairs as strings
   * @throws IllegalArgumentException when the mode is unknown
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "bind" -> buildBindDefaults();
      case "combine" -> buildCombineDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "otlp");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    map.put("allowOverwrite", "false");
    map.put("dryRun", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildBindDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("groupKeys", String.join(",", BindConfig.DEFAULT_GROUP_KEYS));
    map.put("joinKeys", String.join(",", BindConfig.DEFAULT_JOIN_KEYS));
    map.put("metadataColumns", String.join(",", BindConfig.DEFAULT_METADATA_COLUMNS));
    map.put("frameColumns", "false");
    map.put("workers", "");
    map.put("handoff", "");
    map.put("failOnUnmatched", "false");
    return map;
  }

  private static Map<String, String> buildCombineDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("keys", String.join(",", CombineConfig.DEFAULT_KEYS));
    map.put("prefix", CombineConfig.DEFAULT_PREFIX);
    return map;
  }
}
