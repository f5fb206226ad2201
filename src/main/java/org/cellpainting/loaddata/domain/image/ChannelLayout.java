package org.cellpainting.loaddata.domain.image;

import java.util.List;
import java.util.Objects;

/**
 * Canonical channel ordering for one image group.
 *
 * @param channels distinct channel names in ascending lexical order
 * @param preSplit {@code true} when the group holds single-channel records split out of multi-channel
 *     files, so each record maps to exactly one channel; {@code false} when a file may serve several
 *     channels at once
 * @since 0.1.0
 */
public record ChannelLayout(List<String> channels, boolean preSplit) {

  public ChannelLayout {
    channels = List.copyOf(Objects.requireNonNull(channels, "channels"));
  }
}
