package org.cellpainting.loaddata.domain.meta;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Immutable metadata attached to an image or correction artifact.
 * <p><strong>Why:</strong> Upstream producers tag files with an open-ended set of keys (batch, plate, well,
 * site, cycle, channels, ...); grouping and joining must read them without ad hoc presence checks.</p>
 * <p><strong>Role:</strong> Domain value object validated at the {@link KeyDeriver} boundary.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share across group workers.</p>
 *
 * @implNote Values are restricted to scalars ({@link String}, {@link Number}, {@link Boolean}). {@code null}
 *     values are dropped at construction so that "null" and "absent" are the same condition.
 * @since 0.1.0
 */
public final class MetadataRecord {
  /** Key holding a single channel name or a comma-joined list of channels sharing one file. */
  public static final String CHANNELS = "channels";
  /** Marker carried by single-channel records split out of a multi-channel acquisition. */
  public static final String ORIGINAL_CHANNELS = "original_channels";
  public static final String BATCH = "batch";
  public static final String PLATE = "plate";
  public static final String WELL = "well";
  public static final String SITE = "site";
  public static final String CYCLE = "cycle";

  private static final MetadataRecord EMPTY = new MetadataRecord(Map.of());

  private final Map<String, Object> values;

  private MetadataRecord(Map<String, Object> values) {
    this.values = values;
  }

  /**
   * Creates a record from a key/value map, preserving key order.
   *
   * @param source metadata values; {@code null} values are ignored
   * @return immutable record
   * @throws IllegalArgumentException when a key is blank or a value is not a scalar
   */
  public static MetadataRecord of(Map<String, ?> source) {
    Objects.requireNonNull(source, "source");
    if (source.isEmpty()) {
      return EMPTY;
    }
    Map<String, Object> copy = new LinkedHashMap<>();
    for (Map.Entry<String, ?> entry : source.entrySet()) {
      String key = entry.getKey();
      if (key == null || key.isBlank()) {
        throw new IllegalArgumentException("metadata keys must not be blank");
      }
      Object value = entry.getValue();
      if (value == null) {
        continue;
      }
      if (!(value instanceof String || value instanceof Number || value instanceof Boolean)) {
        throw new IllegalArgumentException(
            "metadata value for '" + key + "' must be a scalar but was " + value.getClass().getSimpleName());
      }
      copy.put(key, value);
    }
    return new MetadataRecord(Collections.unmodifiableMap(copy));
  }

  /**
   * Returns an empty record.
   *
   * @return shared empty instance
   */
  public static MetadataRecord empty() {
    return EMPTY;
  }

  public boolean has(String key) {
    return values.containsKey(key);
  }

  public Optional<Object> get(String key) {
    return Optional.ofNullable(values.get(key));
  }

  /**
   * Returns the string form of a value, if present.
   *
   * @param key metadata key
   * @return {@link String#valueOf(Object)} of the value, or empty when absent
   */
  public Optional<String> text(String key) {
    Object value = values.get(key);
    return value == null ? Optional.empty() : Optional.of(String.valueOf(value));
  }

  /**
   * Returns the string form of a required value.
   *
   * @param key metadata key
   * @return string form of the value
   * @throws MissingKeyException when the key is absent
   */
  public String require(String key) {
    Object value = values.get(key);
    if (value == null) {
      throw new MissingKeyException(key, this);
    }
    return String.valueOf(value);
  }

  public Set<String> keys() {
    return values.keySet();
  }

  public Map<String, Object> asMap() {
    return values;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof MetadataRecord other)) {
      return false;
    }
    return values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return values.toString();
  }
}
