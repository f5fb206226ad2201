/**
 * Configuration loading, merging and wiring for the bind and combine commands.
 * <p><strong>Precedence:</strong> CLI {@code key=value} over YAML over {@link
 * org.cellpainting.loaddata.config.DefaultsForMode}.</p>
 */
package org.cellpainting.loaddata.config;
