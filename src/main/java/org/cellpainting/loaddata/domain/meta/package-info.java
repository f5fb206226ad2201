/**
 * Metadata records and the group keys derived from them.
 * <p><strong>Role:</strong> Domain layer; pure and free of I/O.</p>
 */
package org.cellpainting.loaddata.domain.meta;
