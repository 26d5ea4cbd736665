package org.chucc.importer.service;

import java.util.List;

/**
 * Aggregate counts of an import run.
 *
 * @param rowCount the number of rows processed
 * @param updatedCount rows for which an update was sent
 * @param unchangedCount rows that already matched the repository
 * @param failedCount rows that failed
 * @param failures details of the failed rows
 */
public record ImportSummary(
    int rowCount,
    int updatedCount,
    int unchangedCount,
    int failedCount,
    List<RowFailure> failures) {

  /**
   * Creates a new ImportSummary, copying the failure list.
   */
  public ImportSummary {
    failures = List.copyOf(failures);
  }

  public boolean hasFailures() {
    return failedCount > 0;
  }
}
