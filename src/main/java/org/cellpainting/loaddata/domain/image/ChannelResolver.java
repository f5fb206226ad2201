package org.cellpainting.loaddata.domain.image;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Objects;
import java.util.TreeSet;

/**
 * <strong>What:</strong> Determines the ordered channel list of an image group and whether the group was
 * pre-split from multi-channel acquisitions.
 * <p><strong>Why:</strong> Pre-split records each own one channel; native multi-channel records share one
 * physical file across several channels. Confusing the two produces duplicate file references or
 * missing columns.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class ChannelResolver {

  private ChannelResolver() {}

  /**
   * Resolves the channel layout of a group.
   *
   * @param records image records of one group
   * @return sorted distinct channels plus the pre-split flag
   * @throws org.cellpainting.loaddata.domain.meta.MissingKeyException when a record has no {@code channels}
   */
  public static ChannelLayout resolve(Collection<ImageRecord> records) {
    Objects.requireNonNull(records, "records");
    boolean allSingle = true;
    boolean anySplitMarker = false;
    for (ImageRecord record : records) {
      if (record.rawChannels().contains(",")) {
        allSingle = false;
      }
      if (record.isSplitFromMultiChannel()) {
        anySplitMarker = true;
      }
    }
    boolean preSplit = allSingle && anySplitMarker;

    TreeSet<String> channels = new TreeSet<>();
    for (ImageRecord record : records) {
      if (preSplit) {
        channels.add(record.rawChannels().trim());
      } else {
        channels.addAll(record.channelList());
      }
    }
    return new ChannelLayout(new ArrayList<>(channels), preSplit);
  }
}
