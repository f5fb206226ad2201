/**
 * Bind and combine use cases plus their run summaries.
 * <p><strong>Failure model:</strong> Per-group problems become {@link
 * org.cellpainting.loaddata.application.pipeline.GroupFailure}s; input and configuration problems abort
 * the run.</p>
 */
package org.cellpainting.loaddata.application.pipeline;
