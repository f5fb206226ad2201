package org.cellpainting.loaddata.application.pipeline;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.cellpainting.loaddata.application.port.HandoffSource;
import org.cellpainting.loaddata.application.port.HandoffUnit;
import org.cellpainting.loaddata.application.port.ManifestReader;
import org.cellpainting.loaddata.application.port.ManifestWriter;
import org.cellpainting.loaddata.application.port.MetricsPort;
import org.cellpainting.loaddata.config.CombineConfig;
import org.cellpainting.loaddata.domain.manifest.HeaderMismatchException;
import org.cellpainting.loaddata.domain.manifest.ManifestConcatenator;
import org.cellpainting.loaddata.domain.meta.GroupKey;
import org.cellpainting.loaddata.domain.meta.KeyDeriver;
import org.cellpainting.loaddata.domain.meta.MetadataRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Concatenates per-group manifests listed in a handoff file into one manifest per
 * coarser group, e.g. per plate.
 * <p><strong>Why:</strong> Downstream analysis jobs are often scheduled per plate rather than per bound
 * group.</p>
 * <p><strong>Failure:</strong> A header mismatch, an unreadable manifest or a combined name shared with another group fails
 * only that combined group; a
 * unit missing one of the combine keys fails the whole run.</p>
 *
 * @since 0.1.0
 */
public final class CombineUseCase {
  private static final Logger log = LoggerFactory.getLogger(CombineUseCase.class);
  static final String METRIC_MANIFESTS_WRITTEN = "combine.manifests.written";
  static final String METRIC_GROUPS_FAILED = "combine.groups.failed";

  private final CombineConfig config;
  private final HandoffSource source;
  private final ManifestReader reader;
  private final ManifestWriter writer;
  private final MetricsPort metrics;

  public CombineUseCase(
      CombineConfig config,
      HandoffSource source,
      ManifestReader reader,
      ManifestWriter writer,
      MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.source = Objects.requireNonNull(source, "source");
    this.reader = Objects.requireNonNull(reader, "reader");
    this.writer = Objects.requireNonNull(writer, "writer");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Runs the combine pipeline.
   *
   * @return run summary
   * @throws IOException when the handoff file cannot be read
   * @throws org.cellpainting.loaddata.domain.meta.MissingKeyException when a unit lacks a combine key
   */
  public CombineSummary run() throws IOException {
    List<HandoffUnit> units = source.units();
    Map<GroupKey, List<HandoffUnit>> groups = new LinkedHashMap<>();
    for (HandoffUnit unit : units) {
      GroupKey key = KeyDeriver.derive(MetadataRecord.of(unit.group()), config.keys());
      groups.computeIfAbsent(key, k -> new ArrayList<>()).add(unit);
    }
    log.info("Combining {} handoff units into {} groups", units.size(), groups.size());

    List<String> names = new ArrayList<>(groups.size());
    groups.keySet().forEach(key -> names.add(config.combinedName(key.values())));
    Map<String, List<String>> clashes = ManifestNameCollisionException.clashes(names, writer::targetName);

    List<CombinedGroup> written = new ArrayList<>();
    List<GroupFailure> failures = new ArrayList<>();
    for (Map.Entry<GroupKey, List<HandoffUnit>> entry : groups.entrySet()) {
      String name = config.combinedName(entry.getKey().values());
      List<String> sharing = clashes.get(writer.targetName(name));
      if (sharing != null) {
        ManifestNameCollisionException ex = new ManifestNameCollisionException(writer.targetName(name), sharing);
        metrics.increment(METRIC_GROUPS_FAILED);
        log.error("Skipping combined group {}: {}", name, ex.getMessage());
        failures.add(new GroupFailure(name, ex));
        continue;
      }
      String previous = MDC.get(BindUseCase.MDC_GROUP_ID);
      try {
        MDC.put(BindUseCase.MDC_GROUP_ID, name);
        written.add(combine(name, entry.getValue()));
        metrics.increment(METRIC_MANIFESTS_WRITTEN);
      } catch (IOException | HeaderMismatchException ex) {
        metrics.increment(METRIC_GROUPS_FAILED);
        log.error("Combined group {} failed", name, ex);
        failures.add(new GroupFailure(name, ex));
      } finally {
        if (previous == null) {
          MDC.remove(BindUseCase.MDC_GROUP_ID);
        } else {
          MDC.put(BindUseCase.MDC_GROUP_ID, previous);
        }
      }
    }
    log.info("Combine completed: {} manifests written, {} groups failed", written.size(), failures.size());
    return new CombineSummary(units.size(), written, failures);
  }

  private CombinedGroup combine(String name, List<HandoffUnit> members) throws IOException {
    List<String> manifests = new ArrayList<>(members.size());
    List<Path> sources = new ArrayList<>(members.size());
    for (HandoffUnit unit : members) {
      manifests.add(reader.read(unit.manifest()));
      sources.add(unit.manifest());
    }
    String csv = ManifestConcatenator.concatenate(manifests);
    Path target = writer.write(name, csv, config.outputDirectory());
    log.info("Wrote combined manifest {} from {} manifests", target, sources.size());
    return new CombinedGroup(name, sources, target);
  }
}
