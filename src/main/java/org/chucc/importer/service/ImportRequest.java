package org.chucc.importer.service;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Parameters of one import run.
 *
 * @param modelName the registered model name
 * @param file the CSV file to import
 * @param limit the optional maximum number of rows to process
 */
public record ImportRequest(String modelName, Path file, Optional<Integer> limit) {

  /**
   * Creates a new ImportRequest with validation.
   *
   * @throws IllegalArgumentException if the model name is blank or the limit is not positive
   */
  public ImportRequest {
    Objects.requireNonNull(modelName, "Model name cannot be null");
    Objects.requireNonNull(file, "File cannot be null");
    Objects.requireNonNull(limit, "Limit cannot be null");

    if (modelName.isBlank()) {
      throw new IllegalArgumentException("Model name cannot be blank");
    }
    if (limit.isPresent() && limit.get() <= 0) {
      throw new IllegalArgumentException("Row limit must be positive");
    }
  }
}
