package org.cellpainting.loaddata.domain.manifest;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.OptionalInt;
import org.cellpainting.loaddata.domain.meta.MetadataRecord;

/**
 * Column layout options for synthesized manifests.
 *
 * @param metadataColumns metadata keys rendered as leading {@code Metadata_*} columns, in order
 * @param frameColumns whether {@code Frame_Orig<Ch>} columns follow the original-file block
 * @since 0.1.0
 */
public record ManifestLayout(List<String> metadataColumns, boolean frameColumns) {
  static final String METADATA_PREFIX = "Metadata_";
  static final String ORIG_PREFIX = "FileName_Orig";
  static final String FRAME_PREFIX = "Frame_Orig";
  static final String ILLUM_PREFIX = "FileName_Illum";
  static final String ORIG_INFIX = "_Orig";
  static final String ILLUM_INFIX = "_Illum";

  public ManifestLayout {
    metadataColumns = List.copyOf(Objects.requireNonNull(metadataColumns, "metadataColumns"));
    for (String column : metadataColumns) {
      if (column == null || column.isBlank()) {
        throw new IllegalArgumentException("metadataColumns must not contain blank entries");
      }
    }
  }

  /**
   * Returns the default layout: batch, plate, well and site columns without frame columns.
   *
   * @return default layout
   */
  public static ManifestLayout defaults() {
    return new ManifestLayout(
        List.of(MetadataRecord.BATCH, MetadataRecord.PLATE, MetadataRecord.WELL, MetadataRecord.SITE), false);
  }

  /** {@code FileName_Orig<Ch>}, or {@code FileName_Cycle<NN>_Orig<Ch>} for a per-cycle column. */
  static String origHeader(OptionalInt cycle, String channel) {
    return cycle.isEmpty() ? ORIG_PREFIX + channel : "FileName_" + cycleLabel(cycle) + ORIG_INFIX + channel;
  }

  static String frameHeader(OptionalInt cycle, String channel) {
    return cycle.isEmpty() ? FRAME_PREFIX + channel : "Frame_" + cycleLabel(cycle) + ORIG_INFIX + channel;
  }

  static String illumHeader(OptionalInt cycle, String channel) {
    return cycle.isEmpty() ? ILLUM_PREFIX + channel : "FileName_" + cycleLabel(cycle) + ILLUM_INFIX + channel;
  }

  private static String cycleLabel(OptionalInt cycle) {
    return String.format(Locale.ROOT, "Cycle%02d", cycle.getAsInt());
  }

  /**
   * Maps a metadata key to its header name, e.g. {@code site -> Metadata_Site},
   * {@code well_value -> Metadata_WellValue}.
   *
   * @param key metadata key
   * @return header column name
   */
  public static String metadataHeader(String key) {
    StringBuilder sb = new StringBuilder(METADATA_PREFIX);
    for (String part : key.split("_")) {
      if (part.isEmpty()) {
        continue;
      }
      sb.append(Character.toUpperCase(part.charAt(0))).append(part, 1, part.length());
    }
    return sb.toString();
  }
}
