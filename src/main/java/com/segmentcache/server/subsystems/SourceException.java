package com.segmentcache.server.subsystems;

/**
 * Indicates that a segment definition could not be evaluated against its data source.
 * <p>
 * The {@link Kind} tells callers what went wrong without their needing to inspect the underlying
 * JDBC or reflection exception, which is still available from {@link #getCause()}.
 */
@SuppressWarnings("serial")
public class SourceException extends Exception {
  /**
   * The category of a {@link SourceException}.
   */
  public static enum Kind {
    /**
     * The configured connection does not exist, or a connection could not be obtained from it.
     */
    CONNECTION_FAILED,

    /**
     * The database rejected the query.
     */
    QUERY_MALFORMED,

    /**
     * The named manager or method does not exist, or the arguments do not fit the method.
     */
    METHOD_NOT_FOUND,

    /**
     * The source produced no result at all, as opposed to an empty result. A statement that is not
     * a query, or a lookup method that returned null, falls in this category.
     */
    EMPTY_RESULT_AMBIGUOUS
  }

  private final Kind kind;

  /**
   * Creates an instance.
   *
   * @param kind the error category
   * @param message a description of the error
   * @param cause the underlying exception, or null
   */
  public SourceException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  /**
   * Creates an instance with no underlying cause.
   *
   * @param kind the error category
   * @param message a description of the error
   */
  public SourceException(Kind kind, String message) {
    this(kind, message, null);
  }

  /**
   * Returns the error category.
   *
   * @return the kind of error
   */
  public Kind getKind() {
    return kind;
  }

  @Override
  public String toString() {
    return "SourceException(" + kind + "): " + getMessage();
  }
}
