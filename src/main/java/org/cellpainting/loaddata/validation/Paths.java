package org.cellpainting.loaddata.validation;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation utilities for CLI and configuration flows.
 * <p><strong>Why:</strong> Bind and combine runs read NDJSON inputs and write manifests; checking both ends
 * before any work starts turns a late I/O failure into an immediate usage error.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Confirm input files exist and are readable.</li>
 *   <li>Create output directories on demand and guard against reusing ones that hold foreign files.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless methods; concurrency limited by underlying filesystem semantics.</p>
 *
 * @implNote Directory checks use {@link LinkOption#NOFOLLOW_LINKS}.
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates that {@code path} names an existing, readable regular file.
   *
   * @param name logical parameter name for diagnostics
   * @param path candidate file
   * @return absolute normalized path
   * @throws IllegalArgumentException if the file is missing, not a regular file, or unreadable
   */
  public static Path requireReadableFile(String name, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(name + " must not be null");
    }
    Path normalized = path.toAbsolutePath().normalize();
    if (!Files.exists(normalized)) {
      throw new IllegalArgumentException(name + " does not exist: " + normalized);
    }
    if (!Files.isRegularFile(normalized)) {
      throw new IllegalArgumentException(name + " is not a regular file: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException(name + " is not readable: " + normalized);
    }
    return normalized;
  }

  /**
   * Validates a writable directory, optionally creating it if missing.
   *
   * @param path candidate output directory; must not be {@code null}
   * @param createIfMissing whether to create the directory (and parents) when absent
   * @param allowReuse when {@code false}, directories holding anything besides manifests ({@code *.csv}) and
   *     handoff files ({@code *.ndjson}) from an earlier run are rejected
   * @return canonical directory path when available, otherwise the absolute normalized path
   * @throws IllegalArgumentException if the path is non-writable, populated without {@code allowReuse},
   *         or creation fails
   */
  public static Path validateWritableDir(Path path, boolean createIfMissing, boolean allowReuse) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    String raw = path.toString();
    if (raw.indexOf('\0') >= 0) {
      throw new IllegalArgumentException("path must not contain null bytes");
    }
    if (Strings.containsControl(raw)) {
      throw new IllegalArgumentException("path must not contain control characters");
    }

    Path normalized = path.toAbsolutePath().normalize();
    try {
      if (Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
        Path real = normalized.toRealPath(LinkOption.NOFOLLOW_LINKS);
        ensureDirectory(real, allowReuse);
        return real;
      }

      Path parent = normalized.getParent();
      if (parent == null) {
        throw new IllegalArgumentException("path has no parent to validate: " + normalized);
      }
      Path parentReal = nearestExistingAncestor(parent);
      if (!Files.isDirectory(parentReal, LinkOption.NOFOLLOW_LINKS)) {
        throw new IllegalArgumentException("parent is not a directory: " + parentReal);
      }
      if (!Files.isWritable(parentReal)) {
        throw new IllegalArgumentException("parent directory is not writable: " + parentReal);
      }
      if (createIfMissing) {
        Files.createDirectories(normalized);
        Path real = normalized.toRealPath(LinkOption.NOFOLLOW_LINKS);
        ensureDirectory(real, allowReuse);
        return real;
      }
      return normalized;
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to validate directory " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  private static void ensureDirectory(Path dir, boolean allowReuse) throws IOException {
    if (!Files.isDirectory(dir, LinkOption.NOFOLLOW_LINKS)) {
      throw new IllegalArgumentException("path is not a directory: " + dir);
    }
    if (!Files.isWritable(dir)) {
      throw new IllegalArgumentException("directory is not writable: " + dir);
    }
    if (!allowReuse) {
      try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
        for (Path entry : entries) {
          if (!isPriorRunOutput(entry)) {
            throw new IllegalArgumentException("directory " + dir + " holds " + entry.getFileName()
                + ", which no earlier run wrote; re-run with --allow-overwrite to reuse");
          }
        }
      }
    }
  }

  /** Manifests and NDJSON handoff files from an earlier run; a rerun replaces them. */
  static boolean isPriorRunOutput(Path entry) {
    if (!Files.isRegularFile(entry, LinkOption.NOFOLLOW_LINKS)) {
      return false;
    }
    String name = entry.getFileName().toString();
    return name.endsWith(".csv") || name.endsWith(".ndjson");
  }

  private static Path nearestExistingAncestor(Path start) throws IOException {
    Path current = start;
    while (current != null && !Files.exists(current, LinkOption.NOFOLLOW_LINKS)) {
      current = current.getParent();
    }
    if (current == null) {
      throw new IllegalArgumentException("no existing ancestor for " + start);
    }
    return current.toRealPath(LinkOption.NOFOLLOW_LINKS);
  }
}
