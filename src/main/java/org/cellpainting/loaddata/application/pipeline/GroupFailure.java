package org.cellpainting.loaddata.application.pipeline;

import java.util.Objects;

/**
 * A group whose processing failed while the rest of the run continued.
 *
 * @param groupId identifier of the failed group
 * @param error failure cause
 * @since 0.1.0
 */
public record GroupFailure(String groupId, Exception error) {

  public GroupFailure {
    Objects.requireNonNull(groupId, "groupId");
    Objects.requireNonNull(error, "error");
  }

  public String reason() {
    String message = error.getMessage();
    return error.getClass().getSimpleName() + (message == null ? "" : ": " + message);
  }
}
