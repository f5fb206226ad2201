package org.cellpainting.loaddata.application.pipeline;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * One combined manifest written by {@link CombineUseCase}.
 *
 * @param name combined base name, e.g. {@code loaddata.B1-P1_combined_load_data}
 * @param sources per-group manifests concatenated, in handoff order
 * @param manifest written combined manifest
 * @since 0.1.0
 */
public record CombinedGroup(String name, List<Path> sources, Path manifest) {
  public CombinedGroup {
    Objects.requireNonNull(name, "name");
    sources = List.copyOf(Objects.requireNonNull(sources, "sources"));
    Objects.requireNonNull(manifest, "manifest");
  }
}
