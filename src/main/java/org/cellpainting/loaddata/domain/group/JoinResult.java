package org.cellpainting.loaddata.domain.group;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.cellpainting.loaddata.domain.meta.GroupKey;

/**
 * Output of {@link GroupJoiner#join}.
 *
 * @param joined every matching (image group, correction group) pair, in image-group order
 * @param unmatched image groups with no matching correction group
 * @since 0.1.0
 */
public record JoinResult(List<JoinedGroup> joined, List<UnmatchedGroup> unmatched) {

  public JoinResult {
    joined = List.copyOf(Objects.requireNonNull(joined, "joined"));
    unmatched = List.copyOf(Objects.requireNonNull(unmatched, "unmatched"));
  }

  /**
   * Returns image groups matched by more than one correction group.
   *
   * @return ambiguous image group keys in first-seen order
   */
  public Set<GroupKey> ambiguous() {
    Map<GroupKey, Integer> counts = new LinkedHashMap<>();
    for (JoinedGroup pair : joined) {
      counts.merge(pair.key(), 1, Integer::sum);
    }
    Set<GroupKey> ambiguous = new LinkedHashSet<>();
    counts.forEach((key, count) -> {
      if (count > 1) {
        ambiguous.add(key);
      }
    });
    return ambiguous;
  }
}
