package org.cellpainting.loaddata.domain.group;

import java.util.List;
import org.cellpainting.loaddata.domain.meta.GroupKey;

/**
 * Raised for an image group matched by more than one correction group. No match is picked silently.
 *
 * @since 0.1.0
 */
public final class AmbiguousJoinException extends RuntimeException {
  private final GroupKey imageGroup;
  private final List<GroupKey> candidates;

  public AmbiguousJoinException(GroupKey imageGroup, List<GroupKey> candidates) {
    super("image group " + imageGroup + " matches " + candidates.size()
        + " correction groups " + candidates);
    this.imageGroup = imageGroup;
    this.candidates = List.copyOf(candidates);
  }

  public GroupKey imageGroup() {
    return imageGroup;
  }

  public List<GroupKey> candidates() {
    return candidates;
  }
}
