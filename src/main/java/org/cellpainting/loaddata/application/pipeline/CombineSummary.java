package org.cellpainting.loaddata.application.pipeline;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a combine run.
 *
 * @param unitsRead handoff units read
 * @param written combined manifests written, in first-seen group order
 * @param failures combined groups that could not be written
 * @since 0.1.0
 */
public record CombineSummary(int unitsRead, List<CombinedGroup> written, List<GroupFailure> failures) {
  public CombineSummary {
    written = List.copyOf(Objects.requireNonNull(written, "written"));
    failures = List.copyOf(Objects.requireNonNull(failures, "failures"));
  }

  public boolean hasFailures() {
    return !failures.isEmpty();
  }
}
