package org.cellpainting.loaddata.infrastructure.source;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.cellpainting.loaddata.application.port.RecordSource;
import org.cellpainting.loaddata.domain.image.CorrectionArtifact;
import org.cellpainting.loaddata.domain.image.ImageRecord;
import org.cellpainting.loaddata.domain.meta.MetadataRecord;
import org.cellpainting.loaddata.infrastructure.json.JsonSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Reads image and correction streams from NDJSON files.
 * <p><strong>Format:</strong> One object per line, {@code {"meta": {...}, "file": "path"}}. Blank lines and
 * lines starting with {@code #} are skipped. Relative {@code file} paths resolve against the NDJSON file's
 * directory.</p>
 * <p><strong>Failure:</strong> A malformed line fails the whole read with its file and line number.</p>
 * <p><strong>Thread-safety:</strong> Stateless between calls; each call opens its own reader.</p>
 *
 * @since 0.1.0
 */
public final class NdjsonRecordSource implements RecordSource {
  private static final Logger log = LoggerFactory.getLogger(NdjsonRecordSource.class);
  static final String META_FIELD = "meta";
  static final String FILE_FIELD = "file";

  private final Path imagesFile;
  private final Path correctionsFile;
  private final JsonSupport json;

  public NdjsonRecordSource(Path imagesFile, Path correctionsFile) {
    this(imagesFile, correctionsFile, new JsonSupport());
  }

  NdjsonRecordSource(Path imagesFile, Path correctionsFile, JsonSupport json) {
    this.imagesFile = Objects.requireNonNull(imagesFile, "imagesFile");
    this.correctionsFile = Objects.requireNonNull(correctionsFile, "correctionsFile");
    this.json = Objects.requireNonNull(json, "json");
  }

  @Override
  public List<ImageRecord> images() throws IOException {
    List<ImageRecord> records = read(imagesFile, ImageRecord::new);
    log.info("Read {} image records from {}", records.size(), imagesFile);
    return records;
  }

  @Override
  public List<CorrectionArtifact> corrections() throws IOException {
    List<CorrectionArtifact> records = read(correctionsFile, CorrectionArtifact::new);
    log.info("Read {} correction artifacts from {}", records.size(), correctionsFile);
    return records;
  }

  private <T> List<T> read(Path source, RecordFactory<T> factory) throws IOException {
    Path baseDir = source.toAbsolutePath().getParent();
    List<T> records = new ArrayList<>();
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
          records.add(parseLine(trimmed, baseDir, factory));
        } catch (IllegalArgumentException ex) {
          throw new IOException(source + ":" + lineNumber + ": " + ex.getMessage(), ex);
        }
      }
    }
    return records;
  }

  private <T> T parseLine(String line, Path baseDir, RecordFactory<T> factory) {
    Map<String, Object> object = json.parseObject(line);
    Object meta = object.get(META_FIELD);
    if (!(meta instanceof Map<?, ?> metaMap)) {
      throw new IllegalArgumentException("'" + META_FIELD + "' must be a JSON object");
    }
    Object file = object.get(FILE_FIELD);
    if (!(file instanceof String fileText) || fileText.isBlank()) {
      throw new IllegalArgumentException("'" + FILE_FIELD + "' must be a non-blank string");
    }
    return factory.create(toMetadata(metaMap), resolve(baseDir, fileText.trim()));
  }

  private static MetadataRecord toMetadata(Map<?, ?> raw) {
    Map<String, Object> values = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      values.put(String.valueOf(entry.getKey()), entry.getValue());
    }
    return MetadataRecord.of(values);
  }

  private static Path resolve(Path baseDir, String raw) {
    try {
      Path path = Path.of(raw);
      if (path.isAbsolute() || baseDir == null) {
        return path.normalize();
      }
      return baseDir.resolve(path).normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException("'" + FILE_FIELD + "' is not a valid path: " + raw, ex);
    }
  }

  @FunctionalInterface
  private interface RecordFactory<T> {
    T create(MetadataRecord metadata, Path file);
  }
}
