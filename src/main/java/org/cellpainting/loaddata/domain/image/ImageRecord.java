package org.cellpainting.loaddata.domain.image;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.cellpainting.loaddata.domain.meta.MetadataRecord;
import org.cellpainting.loaddata.domain.meta.TaggedFile;

/**
 * <strong>What:</strong> Raw microscopy image file plus its acquisition metadata.
 * <p><strong>Role:</strong> Element of the image stream consumed by the bind pipeline.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param metadata acquisition metadata; {@code channels} holds one channel or a comma-joined list
 * @param file physical image file
 * @since 0.1.0
 */
public record ImageRecord(MetadataRecord metadata, Path file) implements TaggedFile {

  public ImageRecord {
    Objects.requireNonNull(metadata, "metadata");
    Objects.requireNonNull(file, "file");
  }

  /**
   * Returns the raw {@code channels} value.
   *
   * @return raw channel string
   * @throws org.cellpainting.loaddata.domain.meta.MissingKeyException when {@code channels} is absent
   */
  public String rawChannels() {
    return metadata.require(MetadataRecord.CHANNELS);
  }

  /**
   * Splits the {@code channels} value on commas, trimming each entry.
   *
   * @return channel names in acquisition order
   */
  public List<String> channelList() {
    return splitChannels(rawChannels());
  }

  /**
   * Returns whether this record was split out of a multi-channel record.
   *
   * @return {@code true} when {@code original_channels} is present
   */
  public boolean isSplitFromMultiChannel() {
    return metadata.has(MetadataRecord.ORIGINAL_CHANNELS);
  }

  static List<String> splitChannels(String raw) {
    List<String> channels = new ArrayList<>();
    for (String token : raw.split(",")) {
      String trimmed = token.trim();
      if (!trimmed.isEmpty()) {
        channels.add(trimmed);
      }
    }
    return channels;
  }
}
