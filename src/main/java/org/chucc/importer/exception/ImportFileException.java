package org.chucc.importer.exception;

/**
 * Thrown when the import file cannot be read or lacks the reserved columns.
 * Error code: import_file
 */
public class ImportFileException extends ImportException {

  private static final long serialVersionUID = 1L;

  /**
   * Constructs a new ImportFileException with the specified message.
   *
   * @param message the detail message
   */
  public ImportFileException(String message) {
    super(message, "import_file");
  }

  /**
   * Constructs a new ImportFileException with the specified message and cause.
   *
   * @param message the detail message
   * @param cause the cause of this exception
   */
  public ImportFileException(String message, Throwable cause) {
    super(message, "import_file", cause);
  }
}
