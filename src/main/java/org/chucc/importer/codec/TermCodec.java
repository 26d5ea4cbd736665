package org.chucc.importer.codec;

import org.chucc.importer.domain.Term;
import org.chucc.importer.exception.TermConversionException;

/**
 * Converts between plain-text cell values and the RDF terms a property holds.
 * Implementations are deterministic and side-effect-free.
 */
public interface TermCodec {

  /**
   * Converts a cell value to the term shape this property requires.
   *
   * @param value the plain-text value
   * @return the term
   * @throws TermConversionException if the value cannot be coerced
   */
  Term toTerm(String value);

  /**
   * Returns the canonical string form of a term, used for comparison with cell values.
   *
   * @param term the term
   * @return the canonical string
   */
  default String toString(Term term) {
    return term.asString();
  }
}
