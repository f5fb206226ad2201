package org.cellpainting.loaddata.infrastructure.persistence;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import org.cellpainting.loaddata.application.port.ManifestWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes manifests to {@code <destinationDir>/<groupId>.csv}.
 *
 * <p>Group identifiers are sanitized to {@code [A-Za-z0-9._-]} before use as file names. Writes go through a
 * temporary file and a rename, so a failed write leaves no partial manifest. Sanitizing is not one-to-one
 * ({@code P 1} and {@code P_1} share {@code P_1.csv}); callers detect such clashes through
 * {@link #targetName(String)} before writing.</p>
 *
 * @since 0.1.0
 */
public final class FileManifestWriter implements ManifestWriter {
  private static final Logger log = LoggerFactory.getLogger(FileManifestWriter.class);
  static final String EXTENSION = ".csv";

  @Override
  public Path write(String groupId, String csv, Path destinationDir) throws IOException {
    Objects.requireNonNull(groupId, "groupId");
    Objects.requireNonNull(csv, "csv");
    Objects.requireNonNull(destinationDir, "destinationDir");
    Path target = destinationDir.resolve(fileName(groupId)).toAbsolutePath().normalize();
    AtomicFiles.writeString(target, csv);
    log.debug("Wrote manifest {} ({} chars)", target, csv.length());
    return target;
  }

  @Override
  public String targetName(String groupId) {
    return fileName(groupId);
  }

  /**
   * Maps a group identifier to its manifest file name.
   *
   * @param groupId group identifier
   * @return sanitized file name ending in {@code .csv}
   */
  public static String fileName(String groupId) {
    return sanitize(groupId) + EXTENSION;
  }

  static String sanitize(String id) {
    StringBuilder sb = new StringBuilder(Math.max(16, id.length()));
    for (int i = 0; i < id.length(); i++) {
      char c = id.charAt(i);
      if (Character.isLetterOrDigit(c) || c == '-' || c == '_' || c == '.') {
        sb.append(c);
      } else {
        sb.append('_');
      }
    }
    if (sb.length() == 0) {
      sb.append('x');
    }
    return sb.toString();
  }
}
