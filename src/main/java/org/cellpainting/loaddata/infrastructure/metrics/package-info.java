/**
 * Metrics adapters bridging {@link org.cellpainting.loaddata.application.port.MetricsPort} to OpenTelemetry.
 * <p><strong>Metrics:</strong> Publishes under the {@code bind.*} and {@code combine.*} namespaces.</p>
 * <p><strong>Security:</strong> Only metric keys are exported; file names and metadata values never are.</p>
 */
package org.cellpainting.loaddata.infrastructure.metrics;
