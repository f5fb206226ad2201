package org.cellpainting.loaddata.domain.group;

import java.util.Objects;
import org.cellpainting.loaddata.domain.image.CorrectionArtifact;
import org.cellpainting.loaddata.domain.image.ImageRecord;
import org.cellpainting.loaddata.domain.meta.GroupKey;

/**
 * An image group associated with the correction group sharing its join key.
 *
 * @param images image group
 * @param corrections matching correction group
 * @param joinKey key the two groups were matched on
 * @since 0.1.0
 */
public record JoinedGroup(
    RecordGroup<ImageRecord> images, RecordGroup<CorrectionArtifact> corrections, GroupKey joinKey) {

  public JoinedGroup {
    Objects.requireNonNull(images, "images");
    Objects.requireNonNull(corrections, "corrections");
    Objects.requireNonNull(joinKey, "joinKey");
  }

  public GroupKey key() {
    return images.key();
  }
}
