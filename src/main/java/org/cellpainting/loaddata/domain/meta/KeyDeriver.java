package org.cellpainting.loaddata.domain.meta;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Computes composite {@link GroupKey}s from metadata records.
 *
 * <p>Pure functions: the same record and key list always yield the same key, which keeps joins
 * independent of arrival order. Key order is caller-supplied and defines grouping granularity.</p>
 *
 * @since 0.1.0
 */
public final class KeyDeriver {

  private KeyDeriver() {}

  /**
   * Derives a key using every name in {@code keyNames}.
   *
   * @param record metadata record
   * @param keyNames ordered key names
   * @return derived key
   * @throws MissingKeyException when any name is absent from {@code record}
   */
  public static GroupKey derive(MetadataRecord record, List<String> keyNames) {
    Objects.requireNonNull(record, "record");
    Objects.requireNonNull(keyNames, "keyNames");
    List<String> values = new ArrayList<>(keyNames.size());
    for (String name : keyNames) {
      values.add(record.require(name));
    }
    return new GroupKey(keyNames, values);
  }

  /**
   * Derives a key from the subset of {@code keyNames} the record actually carries.
   *
   * @param record metadata record
   * @param keyNames ordered candidate names
   * @return key over the present names, in {@code keyNames} order; possibly empty
   */
  public static GroupKey deriveAvailable(MetadataRecord record, List<String> keyNames) {
    return derive(record, available(record, keyNames));
  }

  /**
   * Filters {@code keyNames} to those present on {@code record}, keeping order.
   *
   * @param record metadata record
   * @param keyNames ordered candidate names
   * @return present names
   */
  public static List<String> available(MetadataRecord record, List<String> keyNames) {
    Objects.requireNonNull(record, "record");
    Objects.requireNonNull(keyNames, "keyNames");
    List<String> present = new ArrayList<>(keyNames.size());
    for (String name : keyNames) {
      if (record.has(name)) {
        present.add(name);
      }
    }
    return present;
  }
}
