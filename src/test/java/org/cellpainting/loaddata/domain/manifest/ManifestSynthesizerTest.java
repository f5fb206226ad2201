package org.cellpainting.loaddata.domain.manifest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import org.cellpainting.loaddata.domain.group.RecordGroup;
import org.cellpainting.loaddata.domain.image.CorrectionArtifact;
import org.cellpainting.loaddata.domain.image.ImageRecord;
import org.cellpainting.loaddata.domain.meta.GroupKey;
import org.cellpainting.loaddata.domain.meta.MetadataRecord;
import org.cellpainting.loaddata.domain.meta.MissingKeyException;
import org.junit.jupiter.api.Test;

class ManifestSynthesizerTest {
  private static final GroupKey KEY = GroupKey.of(Map.of("plate", "P1"));

  @Test
  void singleChannelFilesProduceOneRowPerFieldOfView() {
    RecordGroup<ImageRecord> images = images(
        image("/data/file1", meta("B1", "P1", "A1", "1", "DAPI")),
        image("/data/file2", meta("B1", "P1", "A1", "1", "GFP")));
    RecordGroup<CorrectionArtifact> corrections = corrections("P1_IllumDAPI.npy", "P1_IllumGFP.npy");

    SynthesizedManifest result = new ManifestSynthesizer(ManifestLayout.defaults()).synthesize(images, corrections);

    assertEquals(
        "Metadata_Batch,Metadata_Plate,Metadata_Well,Metadata_Site,"
            + "FileName_OrigDAPI,FileName_OrigGFP,FileName_IllumDAPI,FileName_IllumGFP\n"
            + "\"B1\",\"P1\",\"A1\",\"1\",\"file1\",\"file2\",\"P1_IllumDAPI.npy\",\"P1_IllumGFP.npy\"\n",
        result.csv());
    assertEquals(List.of(Path.of("/data/file1"), Path.of("/data/file2")), result.imageFiles());
    assertEquals(2, result.correctionFiles().size());
    assertTrue(result.unresolved().isEmpty());
  }

  @Test
  void multiChannelFileIsReferencedOnceInFileListButInEveryChannelColumn() {
    RecordGroup<ImageRecord> images = images(
        image("/data/stack.tif", meta("B1", "P1", "A1", "1", "GFP,DAPI")),
        image("/data/stack.tif", meta("B1", "P1", "A1", "1", "GFP,DAPI")));
    RecordGroup<CorrectionArtifact> corrections = corrections("P1_IllumDAPI.npy", "P1_IllumGFP.npy");

    SynthesizedManifest result = new ManifestSynthesizer(ManifestLayout.defaults()).synthesize(images, corrections);

    assertEquals(1, result.manifest().rows().size());
    List<String> cells = result.manifest().rows().get(0).cells();
    assertEquals("stack.tif", cells.get(4));
    assertEquals("stack.tif", cells.get(5));
    assertEquals(List.of(Path.of("/data/stack.tif")), result.imageFiles());
    assertEquals(List.of("DAPI", "GFP"), result.layout().channels());
  }

  @Test
  void frameColumnsUseChannelIndexWithinTheFile() {
    RecordGroup<ImageRecord> images = images(image("/data/stack.tif", meta("B1", "P1", "A1", "1", "GFP,DAPI")));
    ManifestLayout layout = new ManifestLayout(List.of("well", "site"), true);

    SynthesizedManifest result = new ManifestSynthesizer(layout)
        .synthesize(images, corrections("P1_IllumDAPI.npy", "P1_IllumGFP.npy"));

    assertEquals(
        List.of("Metadata_Well", "Metadata_Site", "FileName_OrigDAPI", "FileName_OrigGFP",
            "Frame_OrigDAPI", "Frame_OrigGFP", "FileName_IllumDAPI", "FileName_IllumGFP"),
        result.manifest().header());
    assertEquals(
        List.of("A1", "1", "stack.tif", "stack.tif", "1", "0", "P1_IllumDAPI.npy", "P1_IllumGFP.npy"),
        result.manifest().rows().get(0).cells());
  }

  @Test
  void preSplitRecordsUseOriginalChannelOrderForFrames() {
    Map<String, Object> dna = meta("B1", "P1", "A1", "1", "DNA");
    dna.put("original_channels", "DNA,RNA");
    Map<String, Object> rna = meta("B1", "P1", "A1", "1", "RNA");
    rna.put("original_channels", "DNA,RNA");
    RecordGroup<ImageRecord> images = images(image("/data/a.tif", dna), image("/data/b.tif", rna));

    SynthesizedManifest result = new ManifestSynthesizer(new ManifestLayout(List.of("well"), true))
        .synthesize(images, corrections("P1_IllumDNA.npy", "P1_IllumRNA.npy"));

    assertTrue(result.layout().preSplit());
    assertEquals(
        List.of("A1", "a.tif", "b.tif", "0", "1", "P1_IllumDNA.npy", "P1_IllumRNA.npy"),
        result.manifest().rows().get(0).cells());
  }

  @Test
  void missingChannelLeavesEmptyCellAndIsReported() {
    RecordGroup<ImageRecord> images = images(
        image("/data/a1-dapi", meta("B1", "P1", "A1", "1", "DAPI")),
        image("/data/a1-gfp", meta("B1", "P1", "A1", "1", "GFP")),
        image("/data/a2-dapi", meta("B1", "P1", "A2", "1", "DAPI")));

    SynthesizedManifest result = new ManifestSynthesizer(ManifestLayout.defaults())
        .synthesize(images, corrections("P1_IllumDAPI.npy"));

    assertEquals(2, result.manifest().rows().size());
    List<String> second = result.manifest().rows().get(1).cells();
    assertEquals("A2", second.get(2));
    assertEquals("a2-dapi", second.get(4));
    assertEquals("", second.get(5));
    assertEquals("", second.get(7));
    assertEquals(List.of(new UnresolvedChannel("A2", "1", "GFP")), result.unresolved());
  }

  @Test
  void rowsFollowFirstSeenFieldOfViewOrder() {
    RecordGroup<ImageRecord> images = images(
        image("/data/b", meta("B1", "P1", "B02", "2", "DAPI")),
        image("/data/a", meta("B1", "P1", "A01", "1", "DAPI")),
        image("/data/c", meta("B1", "P1", "B02", "1", "DAPI")));

    SynthesizedManifest result = new ManifestSynthesizer(ManifestLayout.defaults())
        .synthesize(images, corrections("P1_IllumDAPI.npy"));

    List<String> wellsAndSites = new ArrayList<>();
    result.manifest().rows().forEach(row -> wellsAndSites.add(row.cells().get(2) + "/" + row.cells().get(3)));
    assertEquals(List.of("B02/2", "A01/1", "B02/1"), wellsAndSites);
  }

  @Test
  void siteDefaultsToOneWhenAbsent() {
    Map<String, Object> metadata = meta("B1", "P1", "A1", "1", "DAPI");
    metadata.remove("site");

    SynthesizedManifest result = new ManifestSynthesizer(ManifestLayout.defaults())
        .synthesize(images(image("/data/f", metadata)), corrections("P1_IllumDAPI.npy"));

    assertEquals("1", result.manifest().rows().get(0).cells().get(3));
  }

  @Test
  void customMetadataColumnsComeFromTheBucket() {
    Map<String, Object> metadata = meta("B1", "P1", "A1", "1", "DNA");
    metadata.put("cycle", "1");
    ManifestLayout layout = new ManifestLayout(List.of("plate", "well", "cycle", "tile_row"), false);

    SynthesizedManifest result = new ManifestSynthesizer(layout)
        .synthesize(images(image("/data/f", metadata)), corrections("P1_IllumDNA.npy"));

    assertEquals(
        List.of("Metadata_Plate", "Metadata_Well", "Metadata_Cycle", "Metadata_TileRow",
            "FileName_OrigDNA", "FileName_IllumDNA"),
        result.manifest().header());
    assertEquals(List.of("P1", "A1", "1", "", "f", "P1_IllumDNA.npy"), result.manifest().rows().get(0).cells());
  }

  @Test
  void correctionsForAnotherCycleAreIgnored() {
    Map<String, Object> metadata = meta("B1", "P1", "A1", "1", "DNA");
    metadata.put("cycle", "01");

    SynthesizedManifest result = new ManifestSynthesizer(ManifestLayout.defaults()).synthesize(
        images(image("/data/f", metadata)),
        corrections("P1_Cycle02_IllumDNA.npy", "P1_Cycle01_IllumDNA.npy"));

    assertEquals("P1_Cycle01_IllumDNA.npy", result.manifest().rows().get(0).cells().get(5));
  }

  @Test
  void groupSpanningCyclesGetsOneColumnBlockPerCycle() {
    Map<String, Object> first = meta("B1", "P1", "A1", "1", "A,DAPI");
    first.put("cycle", 1);
    Map<String, Object> second = meta("B1", "P1", "A1", "1", "A,DAPI");
    second.put("cycle", "2");

    SynthesizedManifest result = new ManifestSynthesizer(ManifestLayout.defaults()).synthesize(
        images(image("/data/c2.tif", second), image("/data/c1.tif", first)),
        corrections("P1_Cycle02_IllumDAPI.npy", "P1_Cycle01_IllumDAPI.npy"));

    assertEquals(
        List.of("Metadata_Batch", "Metadata_Plate", "Metadata_Well", "Metadata_Site",
            "FileName_Cycle01_OrigA", "FileName_Cycle01_OrigDAPI",
            "FileName_Cycle02_OrigA", "FileName_Cycle02_OrigDAPI",
            "FileName_Cycle01_IllumA", "FileName_Cycle01_IllumDAPI",
            "FileName_Cycle02_IllumA", "FileName_Cycle02_IllumDAPI"),
        result.manifest().header());
    assertEquals(
        List.of("B1", "P1", "A1", "1", "c1.tif", "c1.tif", "c2.tif", "c2.tif",
            "", "P1_Cycle01_IllumDAPI.npy", "", "P1_Cycle02_IllumDAPI.npy"),
        result.manifest().rows().get(0).cells());
    assertTrue(result.unresolved().isEmpty());
    assertTrue(result.displaced().isEmpty());
  }

  @Test
  void missingCycleImageIsReportedWithItsCycle() {
    Map<String, Object> a1First = meta("B1", "P1", "A1", "1", "DNA");
    a1First.put("cycle", "1");
    Map<String, Object> a1Second = meta("B1", "P1", "A1", "1", "DNA");
    a1Second.put("cycle", "2");
    Map<String, Object> b1First = meta("B1", "P1", "B1", "1", "DNA");
    b1First.put("cycle", "1");
    ManifestLayout layout = new ManifestLayout(List.of("well"), true);

    SynthesizedManifest result = new ManifestSynthesizer(layout).synthesize(
        images(image("/d/a1c1", a1First), image("/d/a1c2", a1Second), image("/d/b1c1", b1First)),
        corrections("P1_IllumDNA.npy"));

    assertEquals(
        List.of("Metadata_Well", "FileName_Cycle01_OrigDNA", "FileName_Cycle02_OrigDNA",
            "Frame_Cycle01_OrigDNA", "Frame_Cycle02_OrigDNA",
            "FileName_Cycle01_IllumDNA", "FileName_Cycle02_IllumDNA"),
        result.manifest().header());
    assertEquals(List.of("B1", "b1c1", "", "0", "", "P1_IllumDNA.npy", "P1_IllumDNA.npy"),
        result.manifest().rows().get(1).cells());
    assertEquals(List.of(new UnresolvedChannel("B1", "1", "DNA", OptionalInt.of(2))), result.unresolved());
  }

  @Test
  void secondImageForAFilledSlotIsReportedAsDisplaced() {
    SynthesizedManifest result = new ManifestSynthesizer(ManifestLayout.defaults()).synthesize(
        images(
            image("/data/first.tif", meta("B1", "P1", "A1", "1", "DNA")),
            image("/data/second.tif", meta("B1", "P1", "A1", "1", "DNA"))),
        corrections("P1_IllumDNA.npy"));

    assertEquals("first.tif", result.manifest().rows().get(0).cells().get(4));
    assertEquals(List.of(new DisplacedImage("A1", "1", "DNA", "second.tif", "first.tif")), result.displaced());
  }

  @Test
  void distinctCyclesNeedTwoNumericValues() {
    Map<String, Object> one = meta("B1", "P1", "A1", "1", "DNA");
    one.put("cycle", "1");
    Map<String, Object> two = meta("B1", "P1", "A1", "1", "DNA");
    two.put("cycle", "02");
    Map<String, Object> none = meta("B1", "P1", "A1", "1", "DNA");

    assertEquals(List.of(1, 2), ManifestSynthesizer.distinctCycles(List.of(image("/b", two), image("/a", one))));
    assertEquals(List.of(), ManifestSynthesizer.distinctCycles(List.of(image("/a", one), image("/c", one))));
    assertEquals(List.of(), ManifestSynthesizer.distinctCycles(List.of(image("/a", one), image("/n", none))));
  }

  @Test
  void firstCorrectionPerChannelWins() {
    Map<String, String> byChannel = ManifestSynthesizer.correctionsByChannel(
        corrections("first_IllumDNA.npy", "second_IllumDNA.npy", "notes.txt").members(), OptionalInt.empty());

    assertEquals(Map.of("DNA", "first_IllumDNA.npy"), byChannel);
  }

  @Test
  void sharedCycleRequiresAgreement() {
    Map<String, Object> one = meta("B1", "P1", "A1", "1", "DNA");
    one.put("cycle", "1");
    Map<String, Object> two = meta("B1", "P1", "A1", "1", "RNA");
    two.put("cycle", "2");

    assertEquals(OptionalInt.of(1), ManifestSynthesizer.sharedCycle(List.of(image("/a", one))));
    assertEquals(OptionalInt.empty(), ManifestSynthesizer.sharedCycle(List.of(image("/a", one), image("/b", two))));
  }

  @Test
  void missingWellFails() {
    Map<String, Object> metadata = meta("B1", "P1", "A1", "1", "DNA");
    metadata.remove("well");

    assertThrows(MissingKeyException.class, () -> new ManifestSynthesizer(ManifestLayout.defaults())
        .synthesize(images(image("/data/f", metadata)), corrections("P1_IllumDNA.npy")));
  }

  private static Map<String, Object> meta(String batch, String plate, String well, String site, String channels) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("batch", batch);
    map.put("plate", plate);
    map.put("well", well);
    map.put("site", site);
    map.put("channels", channels);
    return map;
  }

  private static ImageRecord image(String file, Map<String, ?> metadata) {
    return new ImageRecord(MetadataRecord.of(metadata), Path.of(file));
  }

  private static RecordGroup<ImageRecord> images(ImageRecord... records) {
    return new RecordGroup<>(KEY, List.of(records));
  }

  private static RecordGroup<CorrectionArtifact> corrections(String... names) {
    List<CorrectionArtifact> artifacts = new ArrayList<>();
    for (String name : names) {
      artifacts.add(new CorrectionArtifact(MetadataRecord.of(Map.of("plate", "P1")), Path.of("/illum", name)));
    }
    return new RecordGroup<>(KEY, artifacts);
  }
}
