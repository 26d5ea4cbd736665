package org.chucc.importer.exception;

/**
 * Thrown when an embedded-object index descriptor entry is malformed.
 * Error code: index_parse
 */
public class IndexParseException extends ImportException {

  private static final long serialVersionUID = 1L;

  /**
   * Constructs a new IndexParseException with the specified message.
   *
   * @param message the detail message
   */
  public IndexParseException(String message) {
    super(message, "index_parse");
  }

  /**
   * Constructs a new IndexParseException with the specified message and cause.
   *
   * @param message the detail message
   * @param cause the cause of this exception
   */
  public IndexParseException(String message, Throwable cause) {
    super(message, "index_parse", cause);
  }
}
