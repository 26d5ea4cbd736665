package org.chucc.importer.exception;

/**
 * Thrown when a model name is not present in the model registry.
 * Error code: unknown_model
 */
public class UnknownModelException extends ImportException {

  private static final long serialVersionUID = 1L;

  /**
   * Constructs a new UnknownModelException for the given model name.
   *
   * @param modelName the model name that could not be resolved
   */
  public UnknownModelException(String modelName) {
    super("Unknown model: " + modelName, "unknown_model");
  }
}
