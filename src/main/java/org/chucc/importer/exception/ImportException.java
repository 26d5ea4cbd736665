package org.chucc.importer.exception;

/**
 * Base exception for errors raised while reconciling a tabular import with the repository.
 * Carries a canonical error code used in per-row failure reports.
 *
 * <p>Errors of this type abort the row being processed but not the import run.
 */
public class ImportException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final String code;

  /**
   * Constructor with message and code.
   *
   * @param message error message
   * @param code canonical error code
   */
  public ImportException(String message, String code) {
    super(message);
    this.code = code;
  }

  /**
   * Constructor with message, code, and cause.
   *
   * @param message error message
   * @param code canonical error code
   * @param cause the cause
   */
  public ImportException(String message, String code, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public String getCode() {
    return code;
  }
}
