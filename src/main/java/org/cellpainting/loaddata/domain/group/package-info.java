/**
 * Grouping of tagged files and the equality join between image and correction groups.
 * <p><strong>Concurrency:</strong> All operations are pure and run after both input streams are fully read.</p>
 */
package org.cellpainting.loaddata.domain.group;
