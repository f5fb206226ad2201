package org.cellpainting.loaddata.domain.manifest;

import java.util.List;
import java.util.Objects;

/**
 * One manifest data row: metadata cells, then per-channel file cells.
 *
 * @param cells ordered raw cell values (unquoted)
 * @since 0.1.0
 */
public record ManifestRow(List<String> cells) {

  public ManifestRow {
    cells = List.copyOf(Objects.requireNonNull(cells, "cells"));
  }

  /**
   * Renders the row as a CSV line without the terminator; every cell is double-quoted.
   *
   * @return CSV line
   */
  public String toCsvLine() {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < cells.size(); i++) {
      if (i > 0) {
        sb.append(',');
      }
      sb.append(quote(cells.get(i)));
    }
    return sb.toString();
  }

  static String quote(String cell) {
    return '"' + cell.replace("\"", "\"\"") + '"';
  }
}
