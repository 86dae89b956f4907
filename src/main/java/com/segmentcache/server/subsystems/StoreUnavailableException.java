package com.segmentcache.server.subsystems;

/**
 * Thrown by a {@link MemberSetStore} when the underlying persistence layer cannot be reached or
 * rejects an operation.
 * <p>
 * Store implementations should translate their driver-specific exceptions into this type, so that
 * the rest of the library does not depend on any particular database client.
 */
@SuppressWarnings("serial")
public class StoreUnavailableException extends RuntimeException {
  /**
   * Creates an instance.
   * @param message a description of the failed operation
   * @param cause the underlying exception
   */
  public StoreUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Creates an instance with no underlying cause.
   * @param message a description of the failed operation
   */
  public StoreUnavailableException(String message) {
    super(message);
  }
}
