package org.cellpainting.loaddata.application.pipeline;

import java.util.List;
import java.util.Objects;
import org.cellpainting.loaddata.application.port.HandoffUnit;
import org.cellpainting.loaddata.domain.group.UnmatchedGroup;

/**
 * Outcome of one bind run.
 *
 * @param imagesRead image records consumed
 * @param correctionsRead correction artifacts consumed
 * @param imageGroups number of image groups formed
 * @param written handoff units of successfully written groups, in image-group order
 * @param unmatched image groups without a correction match
 * @param failures groups that failed during join, synthesis or write
 * @since 0.1.0
 */
public record BindSummary(
    int imagesRead,
    int correctionsRead,
    int imageGroups,
    List<HandoffUnit> written,
    List<UnmatchedGroup> unmatched,
    List<GroupFailure> failures) {

  public BindSummary {
    written = List.copyOf(Objects.requireNonNull(written, "written"));
    unmatched = List.copyOf(Objects.requireNonNull(unmatched, "unmatched"));
    failures = List.copyOf(Objects.requireNonNull(failures, "failures"));
  }

  public boolean hasFailures() {
    return !failures.isEmpty();
  }

  /**
   * Returns whether the run should be reported as fully successful.
   *
   * @param failOnUnmatched whether unmatched groups count against success
   * @return {@code true} when no group failed (and, if requested, none went unmatched)
   */
  public boolean succeeded(boolean failOnUnmatched) {
    return failures.isEmpty() && (!failOnUnmatched || unmatched.isEmpty());
  }
}
