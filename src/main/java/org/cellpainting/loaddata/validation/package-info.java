/**
 * Input validation helpers shared by the CLI and configuration layers.
 * <p><strong>Thread-safety:</strong> Stateless utilities.</p>
 */
package org.cellpainting.loaddata.validation;
