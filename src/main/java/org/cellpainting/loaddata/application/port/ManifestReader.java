package org.cellpainting.loaddata.application.port;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Loads a previously written manifest as text.
 *
 * @since 0.1.0
 */
public interface ManifestReader {
  /**
   * Reads a manifest.
   *
   * @param manifest manifest file
   * @return serialized manifest
   * @throws IOException when the file cannot be read
   */
  String read(Path manifest) throws IOException;
}
