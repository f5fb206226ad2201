package org.cellpainting.loaddata.domain.meta;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Ordered tuple of {@code (key-name, value)} pairs plus its derived identifier.
 * <p><strong>Why:</strong> Groups, join keys, and manifest file names all hang off one canonical string.</p>
 * <p><strong>Role:</strong> Domain value object produced by {@link KeyDeriver}.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @implNote Equality and hashing use {@link #id()} only: two keys are the same group iff their
 *     underscore-joined identifiers are equal, whatever key names produced them.
 * @since 0.1.0
 */
public final class GroupKey {
  static final String SEPARATOR = "_";

  private final List<String> names;
  private final List<String> values;
  private final String id;

  GroupKey(List<String> names, List<String> values) {
    if (names.size() != values.size()) {
      throw new IllegalArgumentException("names and values must have the same length");
    }
    this.names = List.copyOf(names);
    this.values = List.copyOf(values);
    this.id = String.join(SEPARATOR, this.values);
  }

  /**
   * Builds a key directly from ordered name/value pairs.
   *
   * @param pairs ordered pairs; iteration order defines the identifier
   * @return group key
   */
  public static GroupKey of(Map<String, String> pairs) {
    Objects.requireNonNull(pairs, "pairs");
    List<String> names = new ArrayList<>(pairs.size());
    List<String> values = new ArrayList<>(pairs.size());
    for (Map.Entry<String, String> entry : pairs.entrySet()) {
      names.add(Objects.requireNonNull(entry.getKey(), "name"));
      values.add(Objects.requireNonNull(entry.getValue(), "value for " + entry.getKey()));
    }
    return new GroupKey(names, values);
  }

  public List<String> names() {
    return names;
  }

  public List<String> values() {
    return values;
  }

  /**
   * Returns the underscore-joined identifier, e.g. {@code B1_P1}.
   *
   * @return group identifier
   */
  public String id() {
    return id;
  }

  /**
   * Returns the key as an ordered name/value map, suitable for handoff metadata.
   *
   * @return unmodifiable ordered map
   */
  public Map<String, String> asMap() {
    Map<String, String> map = new LinkedHashMap<>();
    for (int i = 0; i < names.size(); i++) {
      map.put(names.get(i), values.get(i));
    }
    return Collections.unmodifiableMap(map);
  }

  public boolean isEmpty() {
    return names.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof GroupKey other && id.equals(other.id);
  }

  @Override
  public int hashCode() {
    return id.hashCode();
  }

  @Override
  public String toString() {
    return id;
  }
}
