package org.cellpainting.loaddata.application.port;

import java.io.IOException;
import java.util.List;
import org.cellpainting.loaddata.domain.image.CorrectionArtifact;
import org.cellpainting.loaddata.domain.image.ImageRecord;

/**
 * <strong>What:</strong> Input port delivering the image and correction streams.
 * <p><strong>Role:</strong> Both streams are read to completion before grouping starts, so the port returns
 * materialized lists in arrival order.</p>
 *
 * @since 0.1.0
 */
public interface RecordSource {
  /**
   * Reads every image record.
   *
   * @return image records in arrival order
   * @throws IOException when the stream cannot be read or a record is malformed
   */
  List<ImageRecord> images() throws IOException;

  /**
   * Reads every correction artifact.
   *
   * @return correction artifacts in arrival order
   * @throws IOException when the stream cannot be read or a record is malformed
   */
  List<CorrectionArtifact> corrections() throws IOException;
}
