package org.cellpainting.loaddata.domain.meta;

import java.nio.file.Path;

/**
 * A physical file reference tagged with metadata.
 *
 * @since 0.1.0
 */
public interface TaggedFile {
  MetadataRecord metadata();

  Path file();

  /**
   * Returns the physical file name, which is what manifests reference.
   *
   * @return last path element of {@link #file()}
   */
  default String fileName() {
    Path name = file().getFileName();
    return name == null ? file().toString() : name.toString();
  }
}
