package org.cellpainting.loaddata.infrastructure.persistence;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.cellpainting.loaddata.application.port.ManifestReader;

/** Reads UTF-8 manifests from the local filesystem. */
public final class FileManifestReader implements ManifestReader {

  @Override
  public String read(Path manifest) throws IOException {
    return Files.readString(Objects.requireNonNull(manifest, "manifest"), StandardCharsets.UTF_8);
  }
}
