package org.cellpainting.loaddata.application.port;

import java.io.IOException;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Output port persisting one serialized manifest per group.
 * <p><strong>Why:</strong> Decouples synthesis from the destination so tests can capture manifests in memory.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent writes for distinct groups.</p>
 * <p><strong>Guarantees:</strong> A reader never observes a partially written manifest; rewriting a group
 * replaces the previous file.</p>
 *
 * @since 0.1.0
 */
public interface ManifestWriter {
  /**
   * Persists a manifest.
   *
   * @param groupId group identifier used to derive the file name
   * @param csv serialized manifest
   * @param destinationDir output directory
   * @return path of the written manifest
   * @throws IOException when the manifest cannot be written; no partial file is left behind
   */
  Path write(String groupId, String csv, Path destinationDir) throws IOException;

  /**
   * Returns the name {@link #write} stores a group under. Distinct groups mapping to the same name would
   * overwrite each other, so callers check this before writing.
   *
   * @param groupId group identifier
   * @return destination name for the group
   */
  default String targetName(String groupId) {
    return groupId;
  }
}
