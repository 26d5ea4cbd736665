package org.chucc.importer.service;

import java.util.Objects;
import java.util.Optional;
import org.chucc.importer.diff.DeltaGraph;
import org.chucc.importer.domain.Resource;

/**
 * Result of processing one row.
 *
 * @param outcome whether an update was sent
 * @param resource the resource, with the row's values applied in memory
 * @param delta the net delta computed for the row
 * @param update the update text sent to the repository, empty when unchanged
 */
public record RowResult(
    RowOutcome outcome,
    Resource resource,
    DeltaGraph delta,
    Optional<String> update) {

  /**
   * Creates a new RowResult.
   */
  public RowResult {
    Objects.requireNonNull(outcome, "Outcome cannot be null");
    Objects.requireNonNull(resource, "Resource cannot be null");
    Objects.requireNonNull(delta, "Delta cannot be null");
    Objects.requireNonNull(update, "Update cannot be null");
  }
}
