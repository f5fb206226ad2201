package org.cellpainting.loaddata.config;

import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.cellpainting.loaddata.validation.Strings;

/**
 * Configuration for the combine pipeline that concatenates per-group manifests listed in a handoff file.
 *
 * @param handoffFile handoff NDJSON produced by a bind run
 * @param outputDirectory directory receiving combined manifests
 * @param keys ordered keys that define a combined group, e.g. {@code [batch, plate]}
 * @param prefix file-name prefix of combined manifests
 * @since 0.1.0
 */
public record CombineConfig(Path handoffFile, Path outputDirectory, List<String> keys, String prefix) {
  static final List<String> DEFAULT_KEYS = List.of("batch", "plate");
  static final String DEFAULT_PREFIX = "loaddata";

  public CombineConfig {
    handoffFile = BindConfig.normalizePath("handoff", handoffFile);
    outputDirectory = BindConfig.normalizePath("out", outputDirectory);
    keys = List.copyOf(Objects.requireNonNull(keys, "keys"));
    if (keys.isEmpty()) {
      throw new IllegalArgumentException("keys must not be empty");
    }
    if (new LinkedHashSet<>(keys).size() != keys.size()) {
      throw new IllegalArgumentException("keys must not contain duplicates: " + keys);
    }
    prefix = Strings.requireIdentifier("prefix", Objects.requireNonNull(prefix, "prefix"));
  }

  /**
   * Builds a configuration from merged key/value settings.
   *
   * @param options merged CLI, YAML and default settings
   * @return populated configuration
   * @throws IllegalArgumentException when {@code handoff} or {@code out} is missing or a value is invalid
   */
  public static CombineConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    String handoff = options.get("handoff");
    if (handoff == null || handoff.isBlank()) {
      throw new IllegalArgumentException("handoff is required");
    }
    String out = options.get("out");
    if (out == null || out.isBlank()) {
      throw new IllegalArgumentException("out is required");
    }
    String prefix = options.get("prefix");
    return new CombineConfig(
        BindConfig.parsePath("handoff", handoff),
        BindConfig.parsePath("out", out),
        BindConfig.parseList(options.get("keys"), DEFAULT_KEYS),
        prefix == null || prefix.isBlank() ? DEFAULT_PREFIX : prefix.trim());
  }

  /**
   * Returns the combined manifest base name for the given key values, e.g.
   * {@code loaddata.B1-P1_combined_load_data}.
   *
   * @param values ordered key values of one combined group
   * @return base name without extension
   */
  public String combinedName(List<String> values) {
    return prefix + "." + String.join("-", values) + "_combined_load_data";
  }
}
