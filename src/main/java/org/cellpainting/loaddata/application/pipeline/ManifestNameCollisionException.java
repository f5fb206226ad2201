package org.cellpainting.loaddata.application.pipeline;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Raised for groups whose manifests would be stored under the same name. Every group sharing the name fails;
 * none is written.
 *
 * @since 0.1.0
 */
public final class ManifestNameCollisionException extends RuntimeException {
  private final String targetName;
  private final List<String> groupIds;

  public ManifestNameCollisionException(String targetName, List<String> groupIds) {
    super("groups " + groupIds + " would all be written to " + targetName);
    this.targetName = targetName;
    this.groupIds = List.copyOf(groupIds);
  }

  public String targetName() {
    return targetName;
  }

  public List<String> groupIds() {
    return groupIds;
  }

  /** Groups ids by target name, keeping only names shared by more than one id. */
  static Map<String, List<String>> clashes(List<String> groupIds, UnaryOperator<String> naming) {
    Map<String, List<String>> byName = new LinkedHashMap<>();
    for (String groupId : groupIds) {
      byName.computeIfAbsent(naming.apply(groupId), k -> new ArrayList<>()).add(groupId);
    }
    byName.values().removeIf(ids -> ids.size() < 2);
    return byName;
  }
}
