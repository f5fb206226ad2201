package org.cellpainting.loaddata.application.port;

import java.io.IOException;
import java.util.List;

/**
 * Reads handoff units previously published by a bind run.
 *
 * @since 0.1.0
 */
public interface HandoffSource {
  /**
   * Reads every unit in publication order.
   *
   * @return handoff units
   * @throws IOException when the source cannot be read or a unit is malformed
   */
  List<HandoffUnit> units() throws IOException;
}
