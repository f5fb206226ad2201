package org.cellpainting.loaddata.config;

import java.util.Objects;
import org.cellpainting.loaddata.application.pipeline.BindUseCase;
import org.cellpainting.loaddata.application.pipeline.CombineUseCase;
import org.cellpainting.loaddata.application.port.HandoffSink;
import org.cellpainting.loaddata.application.port.MetricsPort;
import org.cellpainting.loaddata.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import org.cellpainting.loaddata.infrastructure.persistence.FileManifestReader;
import org.cellpainting.loaddata.infrastructure.persistence.FileManifestWriter;
import org.cellpainting.loaddata.infrastructure.persistence.NdjsonHandoffReader;
import org.cellpainting.loaddata.infrastructure.persistence.NdjsonHandoffWriter;
import org.cellpainting.loaddata.infrastructure.source.NdjsonRecordSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Central composition root that wires the bind and combine use cases to concrete
 * adapters.
 * <p><strong>Why:</strong> Keeps the CLI free of adapter construction and gives tests one place to swap
 * the metrics port.</p>
 * <p><strong>Role:</strong> Adapter composition root for the NDJSON input, file output and OpenTelemetry
 * metrics adapters.</p>
 * <p><strong>Lifecycle:</strong> {@link #close()} flushes the metrics adapter when it owns exportable state.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final MetricsPort metrics;

  /** Creates a composition root backed by the OpenTelemetry metrics adapter. */
  public CompositionRoot() {
    this(new OpenTelemetryMetricsAdapter());
  }

  /**
   * Creates a composition root with an explicit metrics adapter.
   *
   * @param metricsPort metrics adapter used by constructed use cases; must not be {@code null}
   */
  public CompositionRoot(MetricsPort metricsPort) {
    this.metrics = Objects.requireNonNull(metricsPort, "metricsPort");
  }

  /**
   * Builds the bind use case reading NDJSON inputs and writing manifests plus the handoff file.
   *
   * @param config bind configuration
   * @return ready-to-run use case
   */
  public BindUseCase bindUseCase(BindConfig config) {
    Objects.requireNonNull(config, "config");
    HandoffSink handoff = config.handoffFile()
        .<HandoffSink>map(NdjsonHandoffWriter::new)
        .orElse(HandoffSink.NONE);
    return new BindUseCase(
        config,
        new NdjsonRecordSource(config.imagesFile(), config.correctionsFile()),
        new FileManifestWriter(),
        handoff,
        metrics);
  }

  /**
   * Builds the combine use case reading a handoff file and writing combined manifests.
   *
   * @param config combine configuration
   * @return ready-to-run use case
   */
  public CombineUseCase combineUseCase(CombineConfig config) {
    Objects.requireNonNull(config, "config");
    return new CombineUseCase(
        config,
        new NdjsonHandoffReader(config.handoffFile()),
        new FileManifestReader(),
        new FileManifestWriter(),
        metrics);
  }

  public MetricsPort metrics() {
    return metrics;
  }

  @Override
  public void close() {
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to flush metrics on shutdown", ex);
      }
    }
  }
}
