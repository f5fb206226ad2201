package org.cellpainting.loaddata.domain.manifest;

import java.util.List;
import java.util.Objects;

/**
 * Concatenates serialized manifests that share one header.
 *
 * <p>The header of the first non-empty manifest is kept; the header line of every later manifest is
 * checked against it and skipped. Data lines keep input order, and every output line ends in {@code \n}.</p>
 *
 * @since 0.1.0
 */
public final class ManifestConcatenator {

  private ManifestConcatenator() {}

  /**
   * Concatenates manifests.
   *
   * @param manifests serialized manifests in the order their rows should appear
   * @return combined CSV text; empty when every input is empty
   * @throws HeaderMismatchException when a manifest header differs from the first one
   */
  public static String concatenate(List<String> manifests) {
    Objects.requireNonNull(manifests, "manifests");
    String header = null;
    StringBuilder body = new StringBuilder();
    for (String manifest : manifests) {
      List<String> lines = Objects.requireNonNull(manifest, "manifest").lines().toList();
      if (lines.isEmpty()) {
        continue;
      }
      String currentHeader = lines.get(0);
      if (header == null) {
        header = currentHeader;
      } else if (!header.equals(currentHeader)) {
        throw new HeaderMismatchException(header, currentHeader);
      }
      for (String line : lines.subList(1, lines.size())) {
        if (!line.isEmpty()) {
          body.append(line).append(Manifest.LINE_END);
        }
      }
    }
    if (header == null) {
      return "";
    }
    return header + Manifest.LINE_END + body;
  }
}
