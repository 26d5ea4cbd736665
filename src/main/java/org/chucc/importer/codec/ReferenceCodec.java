package org.chucc.importer.codec;

import java.util.Objects;
import org.apache.jena.irix.IRIException;
import org.apache.jena.irix.IRIx;
import org.chucc.importer.domain.Term;
import org.chucc.importer.exception.TermConversionException;

/**
 * Codec for properties whose values are references to other resources.
 * Accepts absolute IRIs only.
 */
public final class ReferenceCodec implements TermCodec {

  private static final ReferenceCodec INSTANCE = new ReferenceCodec();

  private ReferenceCodec() {
  }

  public static ReferenceCodec instance() {
    return INSTANCE;
  }

  @Override
  public Term toTerm(String value) {
    Objects.requireNonNull(value, "Value cannot be null");
    String trimmed = value.trim();
    try {
      IRIx iri = IRIx.create(trimmed);
      if (!iri.isAbsolute()) {
        throw new TermConversionException("Reference must be an absolute IRI: " + value);
      }
    } catch (IRIException e) {
      throw new TermConversionException("Invalid IRI: " + value, e);
    }
    return new Term.Reference(trimmed);
  }

  @Override
  public String toString() {
    return "ReferenceCodec";
  }
}
