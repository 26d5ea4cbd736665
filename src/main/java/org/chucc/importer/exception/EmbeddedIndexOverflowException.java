package org.chucc.importer.exception;

/**
 * Thrown when a row supplies more values for an embedded property than the index has positions.
 * Error code: embedded_index_overflow
 */
public class EmbeddedIndexOverflowException extends ImportException {

  private static final long serialVersionUID = 1L;

  /**
   * Constructs a new EmbeddedIndexOverflowException with the specified message.
   *
   * @param message the detail message
   */
  public EmbeddedIndexOverflowException(String message) {
    super(message, "embedded_index_overflow");
  }

  /**
   * Constructs a new EmbeddedIndexOverflowException with the specified message and cause.
   *
   * @param message the detail message
   * @param cause the cause of this exception
   */
  public EmbeddedIndexOverflowException(String message, Throwable cause) {
    super(message, "embedded_index_overflow", cause);
  }
}
