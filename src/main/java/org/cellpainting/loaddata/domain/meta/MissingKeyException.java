package org.cellpainting.loaddata.domain.meta;

/**
 * Raised when a record lacks a key required for grouping, joining, or manifest synthesis.
 *
 * <p>Never recovered by substituting a default: a record that cannot produce its key cannot be
 * placed in a group without corrupting the join.</p>
 *
 * @since 0.1.0
 */
public final class MissingKeyException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final String key;

  /**
   * Creates the exception for a missing key.
   *
   * @param key name of the missing key
   * @param record offending record, included in the message
   */
  public MissingKeyException(String key, MetadataRecord record) {
    super("metadata key '" + key + "' is missing from record " + record);
    this.key = key;
  }

  /**
   * Returns the name of the missing key.
   *
   * @return key name
   */
  public String key() {
    return key;
  }
}
