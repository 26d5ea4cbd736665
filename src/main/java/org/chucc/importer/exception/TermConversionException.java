package org.chucc.importer.exception;

/**
 * Thrown when a cell value cannot be coerced to the term shape a property demands.
 * Error code: term_conversion
 */
public class TermConversionException extends ImportException {

  private static final long serialVersionUID = 1L;

  /**
   * Constructs a new TermConversionException with the specified message.
   *
   * @param message the detail message
   */
  public TermConversionException(String message) {
    super(message, "term_conversion");
  }

  /**
   * Constructs a new TermConversionException with the specified message and cause.
   *
   * @param message the detail message
   * @param cause the cause of this exception
   */
  public TermConversionException(String message, Throwable cause) {
    super(message, "term_conversion", cause);
  }
}
