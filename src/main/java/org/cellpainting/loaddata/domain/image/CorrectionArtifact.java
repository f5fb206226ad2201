package org.cellpainting.loaddata.domain.image;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import org.cellpainting.loaddata.domain.meta.MetadataRecord;
import org.cellpainting.loaddata.domain.meta.TaggedFile;

/**
 * Precomputed per-group, per-channel illumination-correction file.
 *
 * @param metadata subset metadata (typically batch, plate, and optionally cycle)
 * @param file correction file named {@code <group-id>_Illum<Channel>.<ext>}
 * @since 0.1.0
 */
public record CorrectionArtifact(MetadataRecord metadata, Path file) implements TaggedFile {

  public CorrectionArtifact {
    Objects.requireNonNull(metadata, "metadata");
    Objects.requireNonNull(file, "file");
  }

  /**
   * Parses the file name against the illumination naming contract.
   *
   * @return parsed name, or empty when the file does not follow the contract
   */
  public Optional<IlluminationFileName> parsedName() {
    return IlluminationFileName.parse(fileName());
  }
}
