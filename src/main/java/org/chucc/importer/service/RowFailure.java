package org.chucc.importer.service;

/**
 * A row that could not be reconciled.
 *
 * @param rowNumber the 1-based data row number
 * @param uri the resource URI from the row, may be blank
 * @param code the canonical error code
 * @param message the error message
 */
public record RowFailure(int rowNumber, String uri, String code, String message) {
}
