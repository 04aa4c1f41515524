package io.github.panghy.asynctest.error;

/**
 * Thrown when a done item is not resolved the way the test expects. Raising it marks the
 * event loop as failed and stops it.
 */
public class ResolutionException extends EventLoopException {

  /**
   * What went wrong with the resolution.
   */
  public enum Kind {
    /**
     * The done item was resolved a second time.
     */
    ALREADY_RESOLVED,

    /**
     * An ordered done item was resolved before its predecessors.
     */
    OUT_OF_ORDER,

    /**
     * The deadline of the done item elapsed before it was resolved.
     */
    TIMEOUT,

    /**
     * The test reported an error through {@code error()}.
     */
    USER_ERROR,

    /**
     * The loop found its own state inconsistent.
     */
    INTERNAL
  }

  private final Kind kind;
  private final String tag;

  /**
   * Creates a new resolution exception.
   *
   * @param kind    What went wrong
   * @param tag     The tag of the failing done item, or null for a loop-level error
   * @param message The composed error message
   */
  public ResolutionException(Kind kind, String tag, String message) {
    super(message);
    this.kind = kind;
    this.tag = tag;
  }

  /**
   * Creates a new resolution exception caused by another exception.
   *
   * @param kind    What went wrong
   * @param tag     The tag of the failing done item, or null for a loop-level error
   * @param message The composed error message
   * @param cause   The underlying cause
   */
  public ResolutionException(Kind kind, String tag, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.tag = tag;
  }

  public Kind getKind() {
    return kind;
  }

  /**
   * Gets the tag of the done item that failed.
   *
   * @return The tag, or null if the error was not tied to a done item
   */
  public String getTag() {
    return tag;
  }
}
