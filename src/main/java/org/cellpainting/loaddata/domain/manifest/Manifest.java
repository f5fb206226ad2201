package org.cellpainting.loaddata.domain.manifest;

import java.util.List;
import java.util.Objects;

/**
 * Header plus rows for one group's load-data manifest.
 *
 * @param header unquoted column names
 * @param rows data rows in bucket order
 * @since 0.1.0
 */
public record Manifest(List<String> header, List<ManifestRow> rows) {
  static final char LINE_END = '\n';

  public Manifest {
    header = List.copyOf(Objects.requireNonNull(header, "header"));
    rows = List.copyOf(Objects.requireNonNull(rows, "rows"));
    for (ManifestRow row : rows) {
      if (row.cells().size() != header.size()) {
        throw new IllegalArgumentException(
            "row has " + row.cells().size() + " cells but header has " + header.size());
      }
    }
  }

  public String headerLine() {
    return String.join(",", header);
  }

  /**
   * Serializes the manifest. The header is written as-is, data cells are quoted, and every line
   * ends with {@code \n}.
   *
   * @return CSV text
   */
  public String toCsv() {
    StringBuilder sb = new StringBuilder(headerLine()).append(LINE_END);
    for (ManifestRow row : rows) {
      sb.append(row.toCsvLine()).append(LINE_END);
    }
    return sb.toString();
  }
}
