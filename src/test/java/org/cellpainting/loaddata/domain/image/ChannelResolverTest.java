package org.cellpainting.loaddata.domain.image;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.cellpainting.loaddata.domain.meta.MetadataRecord;
import org.cellpainting.loaddata.domain.meta.MissingKeyException;
import org.junit.jupiter.api.Test;

class ChannelResolverTest {

  @Test
  void singleChannelRecordsWithoutMarkerAreNotPreSplit() {
    ChannelLayout layout = ChannelResolver.resolve(List.of(
        image("file2", Map.of("channels", "GFP")),
        image("file1", Map.of("channels", "DAPI"))));

    assertEquals(List.of("DAPI", "GFP"), layout.channels());
    assertFalse(layout.preSplit());
  }

  @Test
  void multiChannelRecordsContributeEveryChannel() {
    ChannelLayout layout = ChannelResolver.resolve(List.of(
        image("stack.tif", Map.of("channels", "RNA, DNA ,AGP"))));

    assertEquals(List.of("AGP", "DNA", "RNA"), layout.channels());
    assertFalse(layout.preSplit());
  }

  @Test
  void splitMarkerOnSingleChannelRecordsMeansPreSplit() {
    ChannelLayout layout = ChannelResolver.resolve(List.of(
        image("a.tif", Map.of("channels", "DNA", "original_channels", "DNA,RNA")),
        image("b.tif", Map.of("channels", "RNA", "original_channels", "DNA,RNA"))));

    assertEquals(List.of("DNA", "RNA"), layout.channels());
    assertTrue(layout.preSplit());
  }

  @Test
  void anyMultiChannelRecordDisablesPreSplit() {
    ChannelLayout layout = ChannelResolver.resolve(List.of(
        image("a.tif", Map.of("channels", "DNA", "original_channels", "DNA,RNA")),
        image("b.tif", Map.of("channels", "DNA,RNA"))));

    assertFalse(layout.preSplit());
  }

  @Test
  void missingChannelsFails() {
    assertThrows(MissingKeyException.class,
        () -> ChannelResolver.resolve(List.of(image("a.tif", Map.of("well", "A01")))));
  }

  static ImageRecord image(String file, Map<String, ?> metadata) {
    return new ImageRecord(MetadataRecord.of(metadata), Path.of(file));
  }
}
