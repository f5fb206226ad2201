package org.cellpainting.loaddata.domain.manifest;

/**
 * Raised when manifests being concatenated do not share the same header line.
 *
 * @since 0.1.0
 */
public final class HeaderMismatchException extends RuntimeException {
  private final String expected;
  private final String actual;

  public HeaderMismatchException(String expected, String actual) {
    super("manifest header mismatch: expected [" + expected + "] but found [" + actual + "]");
    this.expected = expected;
    this.actual = actual;
  }

  public String expected() {
    return expected;
  }

  public String actual() {
    return actual;
  }
}
