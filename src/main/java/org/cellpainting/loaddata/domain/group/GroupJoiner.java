package org.cellpainting.loaddata.domain.group;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import org.cellpainting.loaddata.domain.image.CorrectionArtifact;
import org.cellpainting.loaddata.domain.image.ImageRecord;
import org.cellpainting.loaddata.domain.meta.GroupKey;
import org.cellpainting.loaddata.domain.meta.KeyDeriver;
import org.cellpainting.loaddata.domain.meta.MetadataRecord;

/**
 * <strong>What:</strong> Equality join between image groups and correction groups on a derived join key.
 * <p><strong>Why:</strong> The two streams carry different key schemas; the join key is computed per pair
 * from the configured join keys both representatives actually carry, so the association holds even
 * when one side has fewer keys.</p>
 * <p><strong>Policy:</strong> An image group with no match is reported in {@link JoinResult#unmatched()}.
 * An image group with several matches has every pair emitted; callers decide how to surface the
 * ambiguity (see {@link JoinResult#ambiguous()}).</p>
 * <p><strong>Thread-safety:</strong> Immutable once constructed.</p>
 *
 * @since 0.1.0
 */
public final class GroupJoiner {
  private final List<String> joinKeys;

  /**
   * Creates a joiner over the configured join keys.
   *
   * @param joinKeys ordered candidate join keys, e.g. {@code [batch, plate]}
   */
  public GroupJoiner(List<String> joinKeys) {
    this.joinKeys = List.copyOf(Objects.requireNonNull(joinKeys, "joinKeys"));
    if (this.joinKeys.isEmpty()) {
      throw new IllegalArgumentException("joinKeys must not be empty");
    }
  }

  /**
   * Joins image groups with correction groups.
   *
   * @param imageGroups image groups in first-seen order
   * @param correctionGroups correction groups in first-seen order
   * @return joined pairs plus unmatched image groups
   */
  public JoinResult join(
      Collection<RecordGroup<ImageRecord>> imageGroups,
      Collection<RecordGroup<CorrectionArtifact>> correctionGroups) {
    Objects.requireNonNull(imageGroups, "imageGroups");
    Objects.requireNonNull(correctionGroups, "correctionGroups");
    List<JoinedGroup> joined = new ArrayList<>();
    List<UnmatchedGroup> unmatched = new ArrayList<>();

    for (RecordGroup<ImageRecord> images : imageGroups) {
      MetadataRecord imageMeta = images.representative();
      boolean matched = false;
      for (RecordGroup<CorrectionArtifact> corrections : correctionGroups) {
        List<String> common = commonKeys(imageMeta, corrections.representative());
        if (common.isEmpty()) {
          continue;
        }
        GroupKey imageJoinKey = KeyDeriver.derive(imageMeta, common);
        GroupKey correctionJoinKey = KeyDeriver.derive(corrections.representative(), common);
        if (imageJoinKey.equals(correctionJoinKey)) {
          joined.add(new JoinedGroup(images, corrections, imageJoinKey));
          matched = true;
        }
      }
      if (!matched) {
        GroupKey attempted = KeyDeriver.deriveAvailable(imageMeta, joinKeys);
        unmatched.add(new UnmatchedGroup(images.key(), attempted, images.members().size()));
      }
    }
    return new JoinResult(joined, unmatched);
  }

  /**
   * Returns the configured join keys present on both records, in configured order.
   *
   * @param image image-side metadata
   * @param correction correction-side metadata
   * @return common join keys; empty when the records share none
   */
  List<String> commonKeys(MetadataRecord image, MetadataRecord correction) {
    List<String> common = new ArrayList<>(joinKeys.size());
    for (String key : joinKeys) {
      if (image.has(key) && correction.has(key)) {
        common.add(key);
      }
    }
    return common;
  }

  public List<String> joinKeys() {
    return joinKeys;
  }
}
