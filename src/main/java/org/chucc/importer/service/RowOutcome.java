package org.chucc.importer.service;

/**
 * Final state of a successfully processed row.
 */
public enum RowOutcome {
  /** The row matched the repository; no update was sent. */
  UNCHANGED,
  /** An update was sent and accepted. */
  UPDATED
}
