package org.cellpainting.loaddata.domain.group;

import java.util.List;
import java.util.Objects;
import org.cellpainting.loaddata.domain.meta.GroupKey;
import org.cellpainting.loaddata.domain.meta.MetadataRecord;
import org.cellpainting.loaddata.domain.meta.TaggedFile;

/**
 * Records sharing one {@link GroupKey}, in arrival order.
 *
 * @param key group key
 * @param members non-empty member list in first-seen order
 * @param <T> member type
 * @since 0.1.0
 */
public record RecordGroup<T extends TaggedFile>(GroupKey key, List<T> members) {

  public RecordGroup {
    Objects.requireNonNull(key, "key");
    members = List.copyOf(Objects.requireNonNull(members, "members"));
    if (members.isEmpty()) {
      throw new IllegalArgumentException("group " + key + " has no members");
    }
  }

  /**
   * Returns the metadata of the first member, which represents the group in joins.
   *
   * @return first member metadata
   */
  public MetadataRecord representative() {
    return members.get(0).metadata();
  }
}
