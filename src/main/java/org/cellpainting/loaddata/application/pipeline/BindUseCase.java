package org.cellpainting.loaddata.application.pipeline;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.cellpainting.loaddata.application.port.HandoffSink;
import org.cellpainting.loaddata.application.port.HandoffUnit;
import org.cellpainting.loaddata.application.port.ManifestWriter;
import org.cellpainting.loaddata.application.port.MetricsPort;
import org.cellpainting.loaddata.application.port.RecordSource;
import org.cellpainting.loaddata.config.BindConfig;
import org.cellpainting.loaddata.domain.group.AmbiguousJoinException;
import org.cellpainting.loaddata.domain.group.GroupAggregator;
import org.cellpainting.loaddata.domain.group.GroupJoiner;
import org.cellpainting.loaddata.domain.group.JoinResult;
import org.cellpainting.loaddata.domain.group.JoinedGroup;
import org.cellpainting.loaddata.domain.group.RecordGroup;
import org.cellpainting.loaddata.domain.group.UnmatchedGroup;
import org.cellpainting.loaddata.domain.image.CorrectionArtifact;
import org.cellpainting.loaddata.domain.image.ImageRecord;
import org.cellpainting.loaddata.domain.manifest.DisplacedImage;
import org.cellpainting.loaddata.domain.manifest.ManifestLayout;
import org.cellpainting.loaddata.domain.manifest.ManifestSynthesizer;
import org.cellpainting.loaddata.domain.manifest.SynthesizedManifest;
import org.cellpainting.loaddata.domain.manifest.UnresolvedChannel;
import org.cellpainting.loaddata.domain.meta.GroupKey;
import org.cellpainting.loaddata.infrastructure.exec.ExecutorFactories;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Binds every image group to its correction group and writes one load-data manifest
 * per group.
 * <p><strong>Why:</strong> The downstream image-processing stage consumes images and illumination functions
 * together through these manifests.</p>
 * <p><strong>Role:</strong> Application-layer use case orchestrating the domain functions.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Read both streams to completion, then group and join them.</li>
 *   <li>Fail groups whose manifests would share a file name instead of letting one overwrite another.</li>
 *   <li>Synthesize and write manifests in parallel, isolating per-group failures.</li>
 *   <li>Publish handoff units in image-group order once every group has finished.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe for concurrent {@link #run()} invocations.</p>
 * <p><strong>Observability:</strong> Emits {@code bind.*} metrics and tags per-group log lines with the
 * {@code groupId} MDC key.</p>
 *
 * @since 0.1.0
 */
public final class BindUseCase {
  private static final Logger log = LoggerFactory.getLogger(BindUseCase.class);
  static final String MDC_GROUP_ID = "groupId";
  static final String METRIC_IMAGES_READ = "bind.images.read";
  static final String METRIC_CORRECTIONS_READ = "bind.corrections.read";
  static final String METRIC_GROUPS_JOINED = "bind.groups.joined";
  static final String METRIC_GROUPS_UNMATCHED = "bind.groups.unmatched";
  static final String METRIC_GROUPS_AMBIGUOUS = "bind.groups.ambiguous";
  static final String METRIC_GROUPS_FAILED = "bind.groups.failed";
  static final String METRIC_MANIFESTS_WRITTEN = "bind.manifests.written";
  static final String METRIC_CHANNELS_UNRESOLVED = "bind.channels.unresolved";
  static final String METRIC_IMAGES_DISPLACED = "bind.images.displaced";
  static final String METRIC_MANIFEST_ROWS = "bind.manifest.rows";

  private final BindConfig config;
  private final RecordSource source;
  private final ManifestWriter writer;
  private final HandoffSink handoff;
  private final MetricsPort metrics;
  private final GroupJoiner joiner;
  private final ManifestSynthesizer synthesizer;

  /**
   * Creates a bind use case.
   *
   * @param config bind configuration; must not be {@code null}
   * @param source image and correction streams
   * @param writer manifest destination
   * @param handoff sink receiving handoff units after all groups finish
   * @param metrics metrics port
   */
  public BindUseCase(
      BindConfig config,
      RecordSource source,
      ManifestWriter writer,
      HandoffSink handoff,
      MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.source = Objects.requireNonNull(source, "source");
    this.writer = Objects.requireNonNull(writer, "writer");
    this.handoff = Objects.requireNonNull(handoff, "handoff");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.joiner = new GroupJoiner(config.joinKeys());
    this.synthesizer = new ManifestSynthesizer(new ManifestLayout(config.metadataColumns(), config.frameColumns()));
  }

  /**
   * Runs the bind pipeline.
   *
   * @return run summary listing written, unmatched and failed groups
   * @throws IOException when an input stream cannot be read or handoff units cannot be published
   * @throws InterruptedException when the worker pool is interrupted
   * @throws IllegalStateException when the image stream is empty
   * @throws org.cellpainting.loaddata.domain.meta.MissingKeyException when an image record lacks a grouping key
   */
  public BindSummary run() throws IOException, InterruptedException {
    List<ImageRecord> images = source.images();
    images.forEach(image -> metrics.increment(METRIC_IMAGES_READ));
    if (images.isEmpty()) {
      throw new IllegalStateException("image stream is empty; nothing to bind");
    }
    List<CorrectionArtifact> corrections = source.corrections();
    corrections.forEach(correction -> metrics.increment(METRIC_CORRECTIONS_READ));

    Map<GroupKey, RecordGroup<ImageRecord>> imageGroups = GroupAggregator.aggregate(images, config.groupKeys());
    Map<GroupKey, RecordGroup<CorrectionArtifact>> correctionGroups =
        GroupAggregator.aggregateAvailable(corrections, config.groupKeys());
    log.info(
        "Grouped {} images into {} groups and {} corrections into {} groups",
        images.size(), imageGroups.size(), corrections.size(), correctionGroups.size());

    JoinResult join = joiner.join(imageGroups.values(), correctionGroups.values());
    for (UnmatchedGroup unmatched : join.unmatched()) {
      metrics.increment(METRIC_GROUPS_UNMATCHED);
      log.warn(
          "No correction group matches image group {} (join key {}); {} images skipped",
          unmatched.imageGroup(), unmatched.joinKey(), unmatched.imageCount());
    }

    Map<GroupKey, List<JoinedGroup>> pairsByGroup = new LinkedHashMap<>();
    for (JoinedGroup pair : join.joined()) {
      pairsByGroup.computeIfAbsent(pair.key(), k -> new ArrayList<>()).add(pair);
    }

    List<GroupFailure> failures = new ArrayList<>();
    List<JoinedGroup> matched = new ArrayList<>();
    for (Map.Entry<GroupKey, List<JoinedGroup>> entry : pairsByGroup.entrySet()) {
      List<JoinedGroup> pairs = entry.getValue();
      if (pairs.size() > 1) {
        List<GroupKey> candidates = new ArrayList<>(pairs.size());
        pairs.forEach(pair -> candidates.add(pair.corrections().key()));
        AmbiguousJoinException ex = new AmbiguousJoinException(entry.getKey(), candidates);
        metrics.increment(METRIC_GROUPS_AMBIGUOUS);
        metrics.increment(METRIC_GROUPS_FAILED);
        log.error("Skipping group {}: {}", entry.getKey(), ex.getMessage());
        failures.add(new GroupFailure(entry.getKey().id(), ex));
        continue;
      }
      metrics.increment(METRIC_GROUPS_JOINED);
      matched.add(pairs.get(0));
    }

    List<String> matchedIds = new ArrayList<>(matched.size());
    matched.forEach(pair -> matchedIds.add(pair.key().id()));
    Map<String, List<String>> clashes = ManifestNameCollisionException.clashes(matchedIds, writer::targetName);
    List<Callable<GroupOutcome>> tasks = new ArrayList<>();
    for (JoinedGroup pair : matched) {
      String groupId = pair.key().id();
      String target = writer.targetName(groupId);
      List<String> sharing = clashes.get(target);
      if (sharing != null) {
        ManifestNameCollisionException ex = new ManifestNameCollisionException(target, sharing);
        metrics.increment(METRIC_GROUPS_FAILED);
        log.error("Skipping group {}: {}", groupId, ex.getMessage());
        failures.add(new GroupFailure(groupId, ex));
        continue;
      }
      tasks.add(() -> processGroup(pair));
    }

    List<HandoffUnit> written = new ArrayList<>();
    for (GroupOutcome outcome : execute(tasks)) {
      if (outcome.unit() != null) {
        written.add(outcome.unit());
      } else {
        failures.add(outcome.failure());
      }
    }

    if (!written.isEmpty()) {
      handoff.publish(written);
    }
    BindSummary summary = new BindSummary(
        images.size(), corrections.size(), imageGroups.size(), written, join.unmatched(), failures);
    log.info(
        "Bind completed: {} manifests written, {} groups unmatched, {} groups failed",
        written.size(), summary.unmatched().size(), failures.size());
    return summary;
  }

  private GroupOutcome processGroup(JoinedGroup pair) {
    String groupId = pair.key().id();
    String previous = MDC.get(MDC_GROUP_ID);
    try {
      MDC.put(MDC_GROUP_ID, groupId);
      SynthesizedManifest synthesized = synthesizer.synthesize(pair.images(), pair.corrections());
      for (UnresolvedChannel unresolved : synthesized.unresolved()) {
        metrics.increment(METRIC_CHANNELS_UNRESOLVED);
        if (unresolved.cycle().isPresent()) {
          log.warn(
              "No image for channel {} cycle {} at well {} site {}; cell left empty",
              unresolved.channel(), unresolved.cycle().getAsInt(), unresolved.well(), unresolved.site());
        } else {
          log.warn(
              "No image for channel {} at well {} site {}; cell left empty",
              unresolved.channel(), unresolved.well(), unresolved.site());
        }
      }
      for (DisplacedImage displaced : synthesized.displaced()) {
        metrics.increment(METRIC_IMAGES_DISPLACED);
        log.warn(
            "Image {} left out of well {} site {}: channels {} already filled by {}",
            displaced.fileName(), displaced.well(), displaced.site(), displaced.channels(), displaced.keptFileName());
      }
      Path manifest = writer.write(groupId, synthesized.csv(), config.outputDirectory());
      metrics.increment(METRIC_MANIFESTS_WRITTEN);
      metrics.observe(METRIC_MANIFEST_ROWS, synthesized.manifest().rows().size());
      log.info("Wrote manifest {} with {} rows", manifest, synthesized.manifest().rows().size());
      return GroupOutcome.success(new HandoffUnit(
          pair.key().asMap(), groupId, synthesized.imageFiles(), synthesized.correctionFiles(), manifest));
    } catch (IOException | RuntimeException ex) {
      metrics.increment(METRIC_GROUPS_FAILED);
      log.error("Group {} failed", groupId, ex);
      return GroupOutcome.failed(new GroupFailure(groupId, ex));
    } finally {
      if (previous == null) {
        MDC.remove(MDC_GROUP_ID);
      } else {
        MDC.put(MDC_GROUP_ID, previous);
      }
    }
  }

  private List<GroupOutcome> execute(List<Callable<GroupOutcome>> tasks) throws InterruptedException {
    if (tasks.isEmpty()) {
      return List.of();
    }
    int poolSize = Math.min(config.workers(), tasks.size());
    ExecutorService executor = ExecutorFactories.newGroupPool(
        poolSize, "loaddata-group", (thread, ex) -> log.error("Uncaught failure on {}", thread.getName(), ex));
    try {
      return collect(executor.invokeAll(tasks));
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Group workers interrupted; requesting shutdown");
      executor.shutdownNow();
      throw ex;
    } finally {
      executor.shutdown();
    }
  }

  private static List<GroupOutcome> collect(List<Future<GroupOutcome>> futures) throws InterruptedException {
    List<GroupOutcome> outcomes = new ArrayList<>(futures.size());
    for (Future<GroupOutcome> future : futures) {
      try {
        outcomes.add(future.get());
      } catch (ExecutionException ex) {
        Throwable cause = ex.getCause();
        if (cause instanceof Error error) {
          throw error;
        }
        throw new IllegalStateException("group task failed unexpectedly", cause);
      }
    }
    return outcomes;
  }

  private record GroupOutcome(HandoffUnit unit, GroupFailure failure) {
    static GroupOutcome success(HandoffUnit unit) {
      return new GroupOutcome(unit, null);
    }

    static GroupOutcome failed(GroupFailure failure) {
      return new GroupOutcome(null, failure);
    }
  }
}
