package org.cellpainting.loaddata.infrastructure.persistence;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.cellpainting.loaddata.application.port.HandoffSource;
import org.cellpainting.loaddata.application.port.HandoffUnit;
import org.cellpainting.loaddata.infrastructure.json.JsonSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads handoff units written by {@link NdjsonHandoffWriter}. Relative paths resolve against the handoff
 * file's directory; blank and {@code #} lines are skipped.
 *
 * @since 0.1.0
 */
public final class NdjsonHandoffReader implements HandoffSource {
  private static final Logger log = LoggerFactory.getLogger(NdjsonHandoffReader.class);

  private final Path source;
  private final JsonSupport json;

  public NdjsonHandoffReader(Path source) {
    this(source, new JsonSupport());
  }

  NdjsonHandoffReader(Path source, JsonSupport json) {
    this.source = Objects.requireNonNull(source, "source");
    this.json = Objects.requireNonNull(json, "json");
  }

  @Override
  public List<HandoffUnit> units() throws IOException {
    Path baseDir = source.toAbsolutePath().getParent();
    List<HandoffUnit> units = new ArrayList<>();
    try (BufferedReader reader = Files.newBufferedReader(source, StandardCharsets.UTF_8)) {
      String line;
      int lineNumber = 0;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        String trimmed = line.strip();
        if (trimmed.isEmpty() || trimmed.startsWith("#")) {
          continue;
        }
        try {
          units.add(toUnit(json.parseObject(trimmed), baseDir));
        } catch (IllegalArgumentException ex) {
          throw new IOException(source + ":" + lineNumber + ": " + ex.getMessage(), ex);
        }
      }
    }
    log.info("Read {} handoff units from {}", units.size(), source);
    return units;
  }

  private static HandoffUnit toUnit(Map<String, Object> object, Path baseDir) {
    if (!(object.get(NdjsonHandoffWriter.GROUP) instanceof Map<?, ?> rawGroup)) {
      throw new IllegalArgumentException("'group' must be a JSON object");
    }
    Map<String, String> group = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : rawGroup.entrySet()) {
      if (entry.getValue() instanceof Map<?, ?> || entry.getValue() instanceof List<?>) {
        throw new IllegalArgumentException("group value for '" + entry.getKey() + "' must be a scalar");
      }
      if (entry.getValue() != null) {
        group.put(String.valueOf(entry.getKey()), String.valueOf(entry.getValue()));
      }
    }
    String groupId = text(object, NdjsonHandoffWriter.GROUP_ID);
    List<Path> images = paths(object, NdjsonHandoffWriter.IMAGES, baseDir);
    List<Path> corrections = paths(object, NdjsonHandoffWriter.CORRECTIONS, baseDir);
    Path manifest = resolve(baseDir, text(object, NdjsonHandoffWriter.MANIFEST));
    return new HandoffUnit(group, groupId, images, corrections, manifest);
  }

  private static String text(Map<String, Object> object, String field) {
    if (!(object.get(field) instanceof String value) || value.isBlank()) {
      throw new IllegalArgumentException("'" + field + "' must be a non-blank string");
    }
    return value;
  }

  private static List<Path> paths(Map<String, Object> object, String field, Path baseDir) {
    Object raw = object.get(field);
    if (raw == null) {
      return List.of();
    }
    if (!(raw instanceof List<?> list)) {
      throw new IllegalArgumentException("'" + field + "' must be an array of strings");
    }
    List<Path> paths = new ArrayList<>(list.size());
    for (Object item : list) {
      if (!(item instanceof String value)) {
        throw new IllegalArgumentException("'" + field + "' must be an array of strings");
      }
      paths.add(resolve(baseDir, value));
    }
    return paths;
  }

  private static Path resolve(Path baseDir, String raw) {
    Path path = Path.of(raw);
    if (path.isAbsolute() || baseDir == null) {
      return path.normalize();
    }
    return baseDir.resolve(path).normalize();
  }
}
