package org.cellpainting.loaddata.domain.manifest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

class ManifestTest {

  @Test
  void cellsAreQuotedAndQuotesDoubled() {
    ManifestRow row = new ManifestRow(List.of("a", "say \"hi\"", ""));

    assertEquals("\"a\",\"say \"\"hi\"\"\",\"\"", row.toCsvLine());
  }

  @Test
  void rowWidthMustMatchHeader() {
    assertThrows(IllegalArgumentException.class,
        () -> new Manifest(List.of("A", "B"), List.of(new ManifestRow(List.of("1")))));
  }

  @Test
  void headerOnlyManifestSerializesOneLine() {
    assertEquals("A,B\n", new Manifest(List.of("A", "B"), List.of()).toCsv());
  }

  @Test
  void metadataHeaderIsCamelCased() {
    assertEquals("Metadata_Site", ManifestLayout.metadataHeader("site"));
    assertEquals("Metadata_TileRow", ManifestLayout.metadataHeader("tile_row"));
  }
}
