/**
 * Executor factories for the per-group worker pool.
 */
package org.cellpainting.loaddata.infrastructure.exec;
