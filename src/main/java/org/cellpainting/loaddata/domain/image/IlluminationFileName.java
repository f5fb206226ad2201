package org.cellpainting.loaddata.domain.image;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Parsed form of an illumination-correction file name.
 * <p><strong>Why:</strong> Correction producers encode the channel (and optionally the cycle) in the file
 * name; this is the only place that naming protocol is interpreted.</p>
 * <p><strong>Accepted forms:</strong>
 * <ul>
 *   <li>{@code <prefix>_Illum<Channel>.<ext>}, e.g. {@code P1_IllumDAPI.npy}</li>
 *   <li>{@code <prefix>_Cycle<NN>_Illum<Channel>.<ext>}, e.g. {@code Plate1_Cycle01_IllumDNA.npy}</li>
 * </ul>
 *
 * @param prefix group identifier portion preceding the cycle/illum marker
 * @param cycle cycle number when the name carries one
 * @param channel channel name
 * @param extension file extension without the dot
 * @since 0.1.0
 */
public record IlluminationFileName(String prefix, OptionalInt cycle, String channel, String extension) {
  private static final Pattern PATTERN =
      Pattern.compile("^(?<prefix>.+?)(?:_Cycle(?<cycle>\\d+))?_Illum(?<channel>.+?)\\.(?<ext>[^.]+)$");

  public IlluminationFileName {
    Objects.requireNonNull(prefix, "prefix");
    Objects.requireNonNull(cycle, "cycle");
    Objects.requireNonNull(channel, "channel");
    Objects.requireNonNull(extension, "extension");
  }

  /**
   * Parses a file name.
   *
   * @param fileName bare file name (no directories)
   * @return parsed name, or empty when the name does not follow the contract
   */
  public static Optional<IlluminationFileName> parse(String fileName) {
    if (fileName == null || fileName.isEmpty()) {
      return Optional.empty();
    }
    Matcher matcher = PATTERN.matcher(fileName);
    if (!matcher.matches()) {
      return Optional.empty();
    }
    String rawCycle = matcher.group("cycle");
    OptionalInt cycle = rawCycle == null ? OptionalInt.empty() : OptionalInt.of(Integer.parseInt(rawCycle));
    return Optional.of(new IlluminationFileName(
        matcher.group("prefix"), cycle, matcher.group("channel"), matcher.group("ext")));
  }

  /**
   * Returns whether this artifact applies to an image group of the given cycle.
   *
   * @param groupCycle cycle shared by the image group, if any
   * @return {@code true} when either side has no cycle or both cycles are numerically equal
   */
  public boolean appliesToCycle(OptionalInt groupCycle) {
    if (cycle.isEmpty() || groupCycle.isEmpty()) {
      return true;
    }
    return cycle.getAsInt() == groupCycle.getAsInt();
  }
}
