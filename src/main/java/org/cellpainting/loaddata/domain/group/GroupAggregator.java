package org.cellpainting.loaddata.domain.group;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.cellpainting.loaddata.domain.meta.GroupKey;
import org.cellpainting.loaddata.domain.meta.KeyDeriver;
import org.cellpainting.loaddata.domain.meta.MetadataRecord;
import org.cellpainting.loaddata.domain.meta.TaggedFile;

/**
 * <strong>What:</strong> Groups a stream of tagged files by a derived {@link GroupKey}.
 * <p><strong>Role:</strong> Blocking, fully materializing aggregation; group membership closes only once
 * the input is exhausted.</p>
 * <p><strong>Ordering:</strong> Groups appear in first-seen order; members keep arrival order.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class GroupAggregator {

  private GroupAggregator() {}

  /**
   * Groups records by every name in {@code keyNames}.
   *
   * @param records input records; fully consumed
   * @param keyNames ordered grouping keys
   * @param <T> record type
   * @return groups keyed by group key; empty when {@code records} is empty
   * @throws org.cellpainting.loaddata.domain.meta.MissingKeyException when a record lacks a grouping key
   */
  public static <T extends TaggedFile> Map<GroupKey, RecordGroup<T>> aggregate(
      Iterable<? extends T> records, List<String> keyNames) {
    Objects.requireNonNull(keyNames, "keyNames");
    return collect(records, metadata -> KeyDeriver.derive(metadata, keyNames));
  }

  /**
   * Groups records by the subset of {@code keyNames} each record carries.
   *
   * <p>Used for correction artifacts, whose metadata holds only part of the image grouping keys.</p>
   *
   * @param records input records; fully consumed
   * @param keyNames ordered candidate keys
   * @param <T> record type
   * @return groups keyed by the present-key subset
   */
  public static <T extends TaggedFile> Map<GroupKey, RecordGroup<T>> aggregateAvailable(
      Iterable<? extends T> records, List<String> keyNames) {
    Objects.requireNonNull(keyNames, "keyNames");
    return collect(records, metadata -> KeyDeriver.deriveAvailable(metadata, keyNames));
  }

  private static <T extends TaggedFile> Map<GroupKey, RecordGroup<T>> collect(
      Iterable<? extends T> records, KeyFunction keyFunction) {
    Objects.requireNonNull(records, "records");
    Map<GroupKey, List<T>> buckets = new LinkedHashMap<>();
    for (T record : records) {
      GroupKey key = keyFunction.apply(record.metadata());
      buckets.computeIfAbsent(key, k -> new ArrayList<>()).add(record);
    }
    Map<GroupKey, RecordGroup<T>> groups = new LinkedHashMap<>();
    for (Map.Entry<GroupKey, List<T>> entry : buckets.entrySet()) {
      groups.put(entry.getKey(), new RecordGroup<>(entry.getKey(), entry.getValue()));
    }
    return groups;
  }

  @FunctionalInterface
  private interface KeyFunction {
    GroupKey apply(MetadataRecord metadata);
  }
}
