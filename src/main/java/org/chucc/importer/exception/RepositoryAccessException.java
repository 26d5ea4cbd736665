package org.chucc.importer.exception;

/**
 * Thrown when fetching a resource graph from, or submitting a patch to, the repository fails.
 * Error code: repository_error
 *
 * <p>The HTTP status is recorded when the repository answered; it is {@code -1} for transport
 * failures where no response was received.
 */
public class RepositoryAccessException extends ImportException {

  private static final long serialVersionUID = 1L;

  private final int status;

  /**
   * Constructs a new RepositoryAccessException with an HTTP status.
   *
   * @param message the detail message
   * @param status the HTTP status returned by the repository
   * @param cause the cause of this exception
   */
  public RepositoryAccessException(String message, int status, Throwable cause) {
    super(message, "repository_error", cause);
    this.status = status;
  }

  /**
   * Constructs a new RepositoryAccessException for a failure without an HTTP response.
   *
   * @param message the detail message
   * @param cause the cause of this exception
   */
  public RepositoryAccessException(String message, Throwable cause) {
    this(message, -1, cause);
  }

  public int getStatus() {
    return status;
  }
}
