package org.cellpainting.loaddata.domain.manifest;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.cellpainting.loaddata.domain.image.ChannelLayout;
import org.cellpainting.loaddata.domain.meta.GroupKey;

/**
 * Result of synthesizing one joined group.
 *
 * @param groupKey image group key
 * @param layout resolved channel layout
 * @param imageFiles image files deduplicated by file name, first occurrence kept
 * @param correctionFiles correction files of the matched group, deduplicated the same way
 * @param manifest manifest content
 * @param unresolved cells left empty for lack of a source image
 * @param displaced images that lost their slot to an earlier image
 * @since 0.1.0
 */
public record SynthesizedManifest(
    GroupKey groupKey,
    ChannelLayout layout,
    List<Path> imageFiles,
    List<Path> correctionFiles,
    Manifest manifest,
    List<UnresolvedChannel> unresolved,
    List<DisplacedImage> displaced) {

  public SynthesizedManifest {
    Objects.requireNonNull(groupKey, "groupKey");
    Objects.requireNonNull(layout, "layout");
    imageFiles = List.copyOf(Objects.requireNonNull(imageFiles, "imageFiles"));
    correctionFiles = List.copyOf(Objects.requireNonNull(correctionFiles, "correctionFiles"));
    Objects.requireNonNull(manifest, "manifest");
    unresolved = List.copyOf(Objects.requireNonNull(unresolved, "unresolved"));
    displaced = List.copyOf(Objects.requireNonNull(displaced, "displaced"));
  }

  public String csv() {
    return manifest.toCsv();
  }
}
