package io.b2mash.b2b.isolation.exception;

/**
 * Session-state reset or resource teardown failed. When raised for a pooled connection, the
 * connection has already been destroyed rather than returned to the pool.
 */
public class CleanupFailureException extends RuntimeException {

  public CleanupFailureException(String message) {
    super(message);
  }

  public CleanupFailureException(String message, Throwable cause) {
    super(message, cause);
  }
}
