package org.cellpainting.loaddata.application.port;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Output of one bound group, handed to the next pipeline stage.
 *
 * @param group group key as ordered name/value pairs
 * @param groupId group identifier
 * @param images image files referenced by the manifest, deduplicated
 * @param corrections correction files of the matched correction group
 * @param manifest written manifest file
 * @since 0.1.0
 */
public record HandoffUnit(
    Map<String, String> group, String groupId, List<Path> images, List<Path> corrections, Path manifest) {

  public HandoffUnit {
    group = Collections.unmodifiableMap(new LinkedHashMap<>(
        Objects.requireNonNull(group, "group")));
    if (groupId == null || groupId.isBlank()) {
      throw new IllegalArgumentException("groupId must not be blank");
    }
    images = List.copyOf(Objects.requireNonNull(images, "images"));
    corrections = List.copyOf(Objects.requireNonNull(corrections, "corrections"));
    Objects.requireNonNull(manifest, "manifest");
  }
}
