package org.cellpainting.loaddata.domain.group;

import java.util.Objects;
import org.cellpainting.loaddata.domain.meta.GroupKey;

/**
 * An image group that no correction group matched; it produces no manifest.
 *
 * @param imageGroup key of the dropped image group
 * @param joinKey join key derived from the image group over the configured join keys it carries
 * @param imageCount number of image records dropped with the group
 * @since 0.1.0
 */
public record UnmatchedGroup(GroupKey imageGroup, GroupKey joinKey, int imageCount) {

  public UnmatchedGroup {
    Objects.requireNonNull(imageGroup, "imageGroup");
    Objects.requireNonNull(joinKey, "joinKey");
  }
}
