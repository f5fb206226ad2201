package org.cellpainting.loaddata.domain.manifest;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * A (well, site, channel) cell for which no source image could be found; rendered as an empty cell.
 *
 * @param well well of the bucket
 * @param site site of the bucket
 * @param channel channel lacking a file
 * @param cycle cycle of the column, empty outside multi-cycle manifests
 * @since 0.1.0
 */
public record UnresolvedChannel(String well, String site, String channel, OptionalInt cycle) {

  public UnresolvedChannel {
    Objects.requireNonNull(cycle, "cycle");
  }

  public UnresolvedChannel(String well, String site, String channel) {
    this(well, site, channel, OptionalInt.empty());
  }
}
