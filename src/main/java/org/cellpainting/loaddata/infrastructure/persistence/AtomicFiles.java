package org.cellpainting.loaddata.infrastructure.persistence;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Write-then-rename helper: content lands in a temporary sibling file and is moved over the target, so readers
 * see either the previous file or the complete new one.
 */
final class AtomicFiles {
  private static final Logger log = LoggerFactory.getLogger(AtomicFiles.class);
  private static final String TEMP_SUFFIX = ".tmp";

  private AtomicFiles() {}

  /**
   * Atomically replaces {@code target} with {@code content} encoded as UTF-8.
   *
   * @param target destination file; its parent directory is created when missing
   * @param content text to write
   * @return {@code target}
   * @throws IOException when writing or moving fails; the temporary file is removed first
   */
  static Path writeString(Path target, String content) throws IOException {
    Path dir = target.toAbsolutePath().getParent();
    if (dir == null) {
      throw new IOException("target has no parent directory: " + target);
    }
    Files.createDirectories(dir);
    Path temp = Files.createTempFile(dir, "." + target.getFileName(), TEMP_SUFFIX);
    try {
      Files.writeString(temp, content, StandardCharsets.UTF_8);
      move(temp, target);
      return target;
    } catch (IOException | RuntimeException ex) {
      try {
        Files.deleteIfExists(temp);
      } catch (IOException cleanup) {
        ex.addSuppressed(cleanup);
      }
      throw ex;
    }
  }

  private static void move(Path source, Path target) throws IOException {
    try {
      Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException ex) {
      log.debug("Atomic move unsupported for {}; falling back to replacing move", target);
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }
}
