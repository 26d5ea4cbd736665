package org.chucc.importer.exception;

/**
 * Thrown when an index descriptor entry references an embedded object the resource does not hold.
 * Error code: embedded_object_not_found
 */
public class EmbeddedObjectLookupException extends ImportException {

  private static final long serialVersionUID = 1L;

  /**
   * Constructs a new EmbeddedObjectLookupException with the specified message.
   *
   * @param message the detail message
   */
  public EmbeddedObjectLookupException(String message) {
    super(message, "embedded_object_not_found");
  }

  /**
   * Constructs a new EmbeddedObjectLookupException with the specified message and cause.
   *
   * @param message the detail message
   * @param cause the cause of this exception
   */
  public EmbeddedObjectLookupException(String message, Throwable cause) {
    super(message, "embedded_object_not_found", cause);
  }
}
