package org.cellpainting.loaddata.application.port;

import java.io.IOException;
import java.util.List;

/**
 * Emits handoff units for the next pipeline stage once every group has completed.
 *
 * @since 0.1.0
 */
public interface HandoffSink {
  /**
   * Publishes the units in the given order.
   *
   * @param units handoff units in image-group order
   * @throws IOException when the units cannot be published
   */
  void publish(List<HandoffUnit> units) throws IOException;

  /** Sink that discards every unit. */
  HandoffSink NONE = units -> {};
}
