package org.cellpainting.loaddata.domain.manifest;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeSet;
import org.cellpainting.loaddata.domain.group.RecordGroup;
import org.cellpainting.loaddata.domain.image.ChannelLayout;
import org.cellpainting.loaddata.domain.image.ChannelResolver;
import org.cellpainting.loaddata.domain.image.CorrectionArtifact;
import org.cellpainting.loaddata.domain.image.IlluminationFileName;
import org.cellpainting.loaddata.domain.image.ImageRecord;
import org.cellpainting.loaddata.domain.meta.MetadataRecord;
import org.cellpainting.loaddata.domain.meta.TaggedFile;

/**
 * <strong>What:</strong> Builds the load-data manifest for one joined (image group, correction group) pair.
 * <p><strong>Why:</strong> The consuming tool expects one row per field of view (well, site) with one
 * original-file column and one illumination-file column per channel, in a fixed column order.</p>
 * <p><strong>Cycles:</strong> A group spanning several numeric cycles gets one column block per cycle
 * ({@code FileName_Cycle01_OrigDNA}, ...), each with the correction artifacts of its own cycle.</p>
 * <p><strong>Determinism:</strong> Rows follow first-seen (well, site) order, cycle blocks ascend and channel
 * columns follow lexical order, so identical inputs serialize to identical bytes. An image whose slot is
 * already filled is reported as displaced rather than written.</p>
 * <p><strong>Thread-safety:</strong> Immutable; one instance may serve every group worker.</p>
 *
 * @since 0.1.0
 */
public final class ManifestSynthesizer {
  private static final String DEFAULT_SITE = "1";

  private final ManifestLayout layout;

  public ManifestSynthesizer(ManifestLayout layout) {
    this.layout = Objects.requireNonNull(layout, "layout");
  }

  /**
   * Synthesizes the manifest for a joined pair.
   *
   * @param images image group
   * @param corrections matching correction group
   * @return manifest plus the deduplicated file lists
   * @throws org.cellpainting.loaddata.domain.meta.MissingKeyException when an image lacks {@code channels}
   *     or {@code well}
   */
  public SynthesizedManifest synthesize(
      RecordGroup<ImageRecord> images, RecordGroup<CorrectionArtifact> corrections) {
    Objects.requireNonNull(images, "images");
    Objects.requireNonNull(corrections, "corrections");

    ChannelLayout channelLayout = ChannelResolver.resolve(images.members());
    List<CycleSlot> slots = cycleSlots(images.members(), corrections.members());
    boolean perCycle = slots.get(0).cycle().isPresent();
    List<DisplacedImage> displaced = new ArrayList<>();
    Map<FieldOfView, Map<SlotKey, ImageRecord>> buckets = bucket(images.members(), perCycle, displaced);

    List<String> header = header(channelLayout.channels(), slots);
    List<ManifestRow> rows = new ArrayList<>(buckets.size());
    List<UnresolvedChannel> unresolved = new ArrayList<>();

    for (Map.Entry<FieldOfView, Map<SlotKey, ImageRecord>> entry : buckets.entrySet()) {
      FieldOfView fov = entry.getKey();
      Map<SlotKey, ImageRecord> bySlot = entry.getValue();
      MetadataRecord first = bySlot.values().iterator().next().metadata();

      List<String> cells = new ArrayList<>(header.size());
      for (String column : layout.metadataColumns()) {
        cells.add(metadataCell(column, fov, first));
      }
      List<String> frames = new ArrayList<>();
      for (CycleSlot slot : slots) {
        Map<String, ImageRecord> byChannels = imagesOf(bySlot, slot.cycle());
        for (String channel : channelLayout.channels()) {
          Optional<ImageRecord> source = locate(channel, byChannels, channelLayout.preSplit());
          if (source.isPresent()) {
            cells.add(source.get().fileName());
            frames.add(Integer.toString(frameOf(channel, source.get(), channelLayout.preSplit())));
          } else {
            cells.add("");
            frames.add("");
            unresolved.add(new UnresolvedChannel(fov.well(), fov.site(), channel, slot.cycle()));
          }
        }
      }
      if (layout.frameColumns()) {
        cells.addAll(frames);
      }
      for (CycleSlot slot : slots) {
        for (String channel : channelLayout.channels()) {
          cells.add(slot.illumByChannel().getOrDefault(channel, ""));
        }
      }
      rows.add(new ManifestRow(cells));
    }

    return new SynthesizedManifest(
        images.key(),
        channelLayout,
        distinctFiles(images.members()),
        distinctFiles(corrections.members()),
        new Manifest(header, rows),
        unresolved,
        displaced);
  }

  List<String> header(List<String> channels, List<CycleSlot> slots) {
    List<String> header = new ArrayList<>();
    for (String column : layout.metadataColumns()) {
      header.add(ManifestLayout.metadataHeader(column));
    }
    for (CycleSlot slot : slots) {
      for (String channel : channels) {
        header.add(ManifestLayout.origHeader(slot.cycle(), channel));
      }
    }
    if (layout.frameColumns()) {
      for (CycleSlot slot : slots) {
        for (String channel : channels) {
          header.add(ManifestLayout.frameHeader(slot.cycle(), channel));
        }
      }
    }
    for (CycleSlot slot : slots) {
      for (String channel : channels) {
        header.add(ManifestLayout.illumHeader(slot.cycle(), channel));
      }
    }
    return header;
  }

  /**
   * One column block per cycle when the group spans several numeric cycles, otherwise a single block whose
   * corrections are filtered by the shared cycle, if any.
   */
  private static List<CycleSlot> cycleSlots(List<ImageRecord> images, List<CorrectionArtifact> corrections) {
    List<Integer> cycles = distinctCycles(images);
    if (cycles.isEmpty()) {
      return List.of(new CycleSlot(OptionalInt.empty(), correctionsByChannel(corrections, sharedCycle(images))));
    }
    List<CycleSlot> slots = new ArrayList<>(cycles.size());
    for (int cycle : cycles) {
      slots.add(new CycleSlot(OptionalInt.of(cycle), correctionsByChannel(corrections, OptionalInt.of(cycle))));
    }
    return slots;
  }

  /**
   * Returns the sorted cycles of a group spanning more than one; empty when fewer than two distinct cycles
   * exist or any record lacks a numeric cycle.
   */
  static List<Integer> distinctCycles(List<ImageRecord> records) {
    TreeSet<Integer> cycles = new TreeSet<>();
    for (ImageRecord record : records) {
      OptionalInt cycle = cycleOf(record);
      if (cycle.isEmpty()) {
        return List.of();
      }
      cycles.add(cycle.getAsInt());
    }
    return cycles.size() < 2 ? List.of() : List.copyOf(cycles);
  }

  /**
   * Maps each channel to its correction file name; the first matching artifact wins. Names outside the
   * illumination naming contract and artifacts for another cycle are ignored.
   */
  static Map<String, String> correctionsByChannel(List<CorrectionArtifact> artifacts, OptionalInt groupCycle) {
    Map<String, String> byChannel = new LinkedHashMap<>();
    for (CorrectionArtifact artifact : artifacts) {
      Optional<IlluminationFileName> parsed = artifact.parsedName();
      if (parsed.isEmpty() || !parsed.get().appliesToCycle(groupCycle)) {
        continue;
      }
      byChannel.putIfAbsent(parsed.get().channel(), artifact.fileName());
    }
    return byChannel;
  }

  /**
   * Returns the cycle shared by every record, or empty when records disagree, lack one, or carry a
   * non-numeric value.
   */
  static OptionalInt sharedCycle(List<ImageRecord> records) {
    String shared = null;
    for (ImageRecord record : records) {
      Optional<String> cycle = record.metadata().text(MetadataRecord.CYCLE);
      if (cycle.isEmpty()) {
        return OptionalInt.empty();
      }
      if (shared == null) {
        shared = cycle.get();
      } else if (!shared.equals(cycle.get())) {
        return OptionalInt.empty();
      }
    }
    if (shared == null) {
      return OptionalInt.empty();
    }
    try {
      return OptionalInt.of(Integer.parseInt(shared.trim()));
    } catch (NumberFormatException e) {
      return OptionalInt.empty();
    }
  }

  private static Map<FieldOfView, Map<SlotKey, ImageRecord>> bucket(
      List<ImageRecord> records, boolean perCycle, List<DisplacedImage> displaced) {
    Map<FieldOfView, Map<SlotKey, ImageRecord>> buckets = new LinkedHashMap<>();
    for (ImageRecord record : records) {
      MetadataRecord meta = record.metadata();
      FieldOfView fov = new FieldOfView(
          meta.require(MetadataRecord.WELL), meta.text(MetadataRecord.SITE).orElse(DEFAULT_SITE));
      SlotKey slot = new SlotKey(perCycle ? cycleOf(record) : OptionalInt.empty(), record.rawChannels().trim());
      ImageRecord kept = buckets.computeIfAbsent(fov, k -> new LinkedHashMap<>()).putIfAbsent(slot, record);
      if (kept != null && !kept.fileName().equals(record.fileName())) {
        displaced.add(new DisplacedImage(fov.well(), fov.site(), slot.channels(), record.fileName(), kept.fileName()));
      }
    }
    return buckets;
  }

  private static Map<String, ImageRecord> imagesOf(Map<SlotKey, ImageRecord> bySlot, OptionalInt cycle) {
    Map<String, ImageRecord> byChannels = new LinkedHashMap<>();
    for (Map.Entry<SlotKey, ImageRecord> entry : bySlot.entrySet()) {
      if (entry.getKey().cycle().equals(cycle)) {
        byChannels.put(entry.getKey().channels(), entry.getValue());
      }
    }
    return byChannels;
  }

  private static OptionalInt cycleOf(ImageRecord record) {
    Optional<String> raw = record.metadata().text(MetadataRecord.CYCLE);
    if (raw.isEmpty()) {
      return OptionalInt.empty();
    }
    try {
      return OptionalInt.of(Integer.parseInt(raw.get().trim()));
    } catch (NumberFormatException e) {
      return OptionalInt.empty();
    }
  }

  private static Optional<ImageRecord> locate(
      String channel, Map<String, ImageRecord> byChannels, boolean preSplit) {
    if (preSplit) {
      return Optional.ofNullable(byChannels.get(channel));
    }
    for (ImageRecord record : byChannels.values()) {
      if (record.channelList().contains(channel)) {
        return Optional.of(record);
      }
    }
    return Optional.empty();
  }

  private static int frameOf(String channel, ImageRecord source, boolean preSplit) {
    List<String> frames;
    if (preSplit) {
      Optional<String> original = source.metadata().text(MetadataRecord.ORIGINAL_CHANNELS);
      if (original.isEmpty()) {
        return 0;
      }
      frames = splitList(original.get());
    } else {
      frames = source.channelList();
    }
    int index = frames.indexOf(channel);
    return Math.max(index, 0);
  }

  private static List<String> splitList(String raw) {
    List<String> parts = new ArrayList<>();
    for (String token : raw.split(",")) {
      String trimmed = token.trim();
      if (!trimmed.isEmpty()) {
        parts.add(trimmed);
      }
    }
    return parts;
  }

  private static String metadataCell(String column, FieldOfView fov, MetadataRecord first) {
    if (MetadataRecord.WELL.equals(column)) {
      return fov.well();
    }
    if (MetadataRecord.SITE.equals(column)) {
      return fov.site();
    }
    return first.text(column).orElse("");
  }

  private static List<Path> distinctFiles(List<? extends TaggedFile> members) {
    Set<String> seen = new LinkedHashSet<>();
    List<Path> files = new ArrayList<>(members.size());
    for (TaggedFile member : members) {
      if (seen.add(member.fileName())) {
        files.add(member.file());
      }
    }
    return files;
  }

  private record FieldOfView(String well, String site) {
  }

  private record SlotKey(OptionalInt cycle, String channels) {
  }

  record CycleSlot(OptionalInt cycle, Map<String, String> illumByChannel) {
  }
}
