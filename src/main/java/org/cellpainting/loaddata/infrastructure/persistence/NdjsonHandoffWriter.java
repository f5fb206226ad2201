package org.cellpainting.loaddata.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.cellpainting.loaddata.application.port.HandoffSink;
import org.cellpainting.loaddata.application.port.HandoffUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes handoff units as NDJSON, one object per line:
 * {@code {"group": {...}, "groupId": "...", "images": [...], "corrections": [...], "manifest": "..."}}.
 *
 * <p>The whole file is replaced atomically on every publish.</p>
 *
 * @since 0.1.0
 */
public final class NdjsonHandoffWriter implements HandoffSink {
  private static final Logger log = LoggerFactory.getLogger(NdjsonHandoffWriter.class);
  static final String GROUP = "group";
  static final String GROUP_ID = "groupId";
  static final String IMAGES = "images";
  static final String CORRECTIONS = "corrections";
  static final String MANIFEST = "manifest";

  private final Path target;
  private final JsonFactory jsonFactory;

  public NdjsonHandoffWriter(Path target) {
    this(target, new JsonFactory());
  }

  NdjsonHandoffWriter(Path target, JsonFactory jsonFactory) {
    this.target = Objects.requireNonNull(target, "target");
    this.jsonFactory = Objects.requireNonNull(jsonFactory, "jsonFactory");
  }

  @Override
  public void publish(List<HandoffUnit> units) throws IOException {
    Objects.requireNonNull(units, "units");
    StringWriter out = new StringWriter();
    for (HandoffUnit unit : units) {
      try (JsonGenerator gen = jsonFactory.createGenerator(out)) {
        gen.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        writeUnit(gen, unit);
      }
      out.write('\n');
    }
    AtomicFiles.writeString(target, out.toString());
    log.info("Published {} handoff units to {}", units.size(), target);
  }

  private static void writeUnit(JsonGenerator gen, HandoffUnit unit) throws IOException {
    gen.writeStartObject();
    gen.writeObjectFieldStart(GROUP);
    for (Map.Entry<String, String> entry : unit.group().entrySet()) {
      gen.writeStringField(entry.getKey(), entry.getValue());
    }
    gen.writeEndObject();
    gen.writeStringField(GROUP_ID, unit.groupId());
    writePaths(gen, IMAGES, unit.images());
    writePaths(gen, CORRECTIONS, unit.corrections());
    gen.writeStringField(MANIFEST, unit.manifest().toString());
    gen.writeEndObject();
  }

  private static void writePaths(JsonGenerator gen, String field, List<Path> paths) throws IOException {
    gen.writeArrayFieldStart(field);
    for (Path path : paths) {
      gen.writeString(path.toString());
    }
    gen.writeEndArray();
  }
}
