package org.cellpainting.loaddata.application.port;

/**
 * <strong>What:</strong> Port abstracting metrics emission for the bind and combine pipelines.
 * <p><strong>Why:</strong> Lets use cases count groups, manifests and unresolved cells without binding to a
 * vendor SDK.</p>
 * <p><strong>Role:</strong> Port implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent updates from group workers.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code bind.groups.unmatched}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code bind.manifests.written}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram-style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value (e.g., rows per manifest)
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
