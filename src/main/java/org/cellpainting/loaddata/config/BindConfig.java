package org.cellpainting.loaddata.config;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.cellpainting.loaddata.validation.Strings;

/**
 * <strong>What:</strong> Configuration for the bind pipeline that joins images with correction artifacts
 * and writes one manifest per group.
 * <p><strong>Why:</strong> Consolidates CLI flags, YAML settings and defaults so bind runs are reproducible.</p>
 * <p><strong>Role:</strong> Configuration aggregate consumed by {@code BindUseCase} and {@code BindCli}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe for concurrent reads.</p>
 *
 * @param imagesFile NDJSON image stream
 * @param correctionsFile NDJSON correction stream
 * @param outputDirectory directory receiving {@code <groupId>.csv} manifests
 * @param groupKeys ordered grouping keys, e.g. {@code [batch, plate]}
 * @param joinKeys ordered candidate join keys
 * @param metadataColumns metadata keys rendered as {@code Metadata_*} columns
 * @param frameColumns whether to emit {@code Frame_Orig<Ch>} columns
 * @param workers size of the per-group worker pool
 * @param handoffFile handoff NDJSON destination; empty when handoff output is disabled
 * @param failOnUnmatched whether unmatched image groups fail the run
 * @since 0.1.0
 */
public record BindConfig(
    Path imagesFile,
    Path correctionsFile,
    Path outputDirectory,
    List<String> groupKeys,
    List<String> joinKeys,
    List<String> metadataColumns,
    boolean frameColumns,
    int workers,
    Optional<Path> handoffFile,
    boolean failOnUnmatched) {

  static final List<String> DEFAULT_GROUP_KEYS = List.of("batch", "plate");
  static final List<String> DEFAULT_JOIN_KEYS = List.of("batch", "plate");
  static final List<String> DEFAULT_METADATA_COLUMNS = List.of("batch", "plate", "well", "site");
  static final String HANDOFF_FILE_NAME = "handoff.ndjson";
  static final String HANDOFF_DISABLED = "none";

  /**
   * Normalizes paths and key lists and enforces invariants.
   *
   * @throws IllegalArgumentException if a key list is empty or contains duplicates, or {@code workers} is not positive
   */
  public BindConfig {
    imagesFile = normalizePath("images", imagesFile);
    correctionsFile = normalizePath("corrections", correctionsFile);
    outputDirectory = normalizePath("out", outputDirectory);
    groupKeys = requireKeys("groupKeys", groupKeys);
    joinKeys = requireKeys("joinKeys", joinKeys);
    metadataColumns = List.copyOf(Objects.requireNonNull(metadataColumns, "metadataColumns"));
    if (workers <= 0) {
      throw new IllegalArgumentException("workers must be positive");
    }
    handoffFile = Objects.requireNonNullElse(handoffFile, Optional.<Path>empty())
        .map(path -> normalizePath("handoff", path));
  }

  /**
   * Builds a configuration from merged key/value settings.
   *
   * @param options merged CLI, YAML and default settings
   * @return populated configuration
   * @throws IllegalArgumentException when required settings are missing or values are invalid
   */
  public static BindConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    Path images = parsePath("images", required(options, "images"));
    Path corrections = parsePath("corrections", required(options, "corrections"));
    Path out = parsePath("out", required(options, "out"));

    List<String> groupKeys = parseList(options.get("groupKeys"), DEFAULT_GROUP_KEYS);
    List<String> joinKeys = parseList(options.get("joinKeys"), DEFAULT_JOIN_KEYS);
    List<String> metadataColumns = parseList(options.get("metadataColumns"), DEFAULT_METADATA_COLUMNS);
    boolean frameColumns = parseBoolean(options.get("frameColumns"), false);
    int workers = parseWorkers(options.get("workers"));
    boolean failOnUnmatched = parseBoolean(options.get("failOnUnmatched"), false);

    Optional<Path> handoff;
    String rawHandoff = options.get("handoff");
    if (rawHandoff == null || rawHandoff.isBlank()) {
      handoff = Optional.of(out.resolve(HANDOFF_FILE_NAME));
    } else if (rawHandoff.trim().toLowerCase(Locale.ROOT).equals(HANDOFF_DISABLED)) {
      handoff = Optional.empty();
    } else {
      handoff = Optional.of(parsePath("handoff", rawHandoff));
    }

    return new BindConfig(
        images, corrections, out, groupKeys, joinKeys, metadataColumns, frameColumns, workers, handoff,
        failOnUnmatched);
  }

  /**
   * Splits a comma-separated key list, trimming entries and dropping blanks.
   *
   * @param raw raw value; {@code null} or blank yields {@code fallback}
   * @param fallback default list
   * @return parsed list
   */
  static List<String> parseList(String raw, List<String> fallback) {
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    List<String> values = new ArrayList<>();
    for (String token : raw.split(",")) {
      String trimmed = token.trim();
      if (!trimmed.isEmpty()) {
        values.add(trimmed);
      }
    }
    return values.isEmpty() ? fallback : values;
  }

  static int defaultWorkers() {
    return Math.max(1, Runtime.getRuntime().availableProcessors());
  }

  private static int parseWorkers(String raw) {
    if (raw == null || raw.isBlank()) {
      return defaultWorkers();
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("workers must be an integer: " + raw, ex);
    }
  }

  private static List<String> requireKeys(String name, List<String> keys) {
    Objects.requireNonNull(keys, name);
    if (keys.isEmpty()) {
      throw new IllegalArgumentException(name + " must not be empty");
    }
    if (new LinkedHashSet<>(keys).size() != keys.size()) {
      throw new IllegalArgumentException(name + " must not contain duplicates: " + keys);
    }
    return List.copyOf(keys);
  }

  private static String required(Map<String, String> options, String key) {
    String value = options.get(key);
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(key + " is required");
    }
    return value;
  }

  private static boolean parseBoolean(String value, boolean defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }

  static Path parsePath(String name, String value) {
    try {
      return Path.of(Strings.requireNonBlank(name, value)).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
  }

  static Path normalizePath(String name, Path path) {
    Objects.requireNonNull(path, name + " must not be null");
    if (path.toString().indexOf('\0') >= 0) {
      throw new IllegalArgumentException(name + " must not contain null bytes");
    }
    return path.toAbsolutePath().normalize();
  }
}
