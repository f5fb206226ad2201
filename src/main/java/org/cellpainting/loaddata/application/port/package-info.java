/**
 * Ports the bind and combine use cases depend on.
 * <p><strong>Role:</strong> Seams between the application layer and infrastructure adapters.</p>
 * <p><strong>Thread-safety:</strong> {@link org.cellpainting.loaddata.application.port.ManifestWriter} and
 * {@link org.cellpainting.loaddata.application.port.MetricsPort} are called from group workers concurrently.</p>
 */
package org.cellpainting.loaddata.application.port;
