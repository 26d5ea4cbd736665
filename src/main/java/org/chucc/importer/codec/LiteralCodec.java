package org.chucc.importer.codec;

import java.util.Objects;
import org.apache.jena.datatypes.RDFDatatype;
import org.apache.jena.datatypes.TypeMapper;
import org.apache.jena.datatypes.xsd.XSDDatatype;
import org.chucc.importer.domain.Term;
import org.chucc.importer.exception.TermConversionException;

/**
 * Codec for properties whose values are literals of a fixed datatype, optionally language
 * tagged.
 */
public final class LiteralCodec implements TermCodec {

  private final String datatypeUri;
  private final String language;

  private LiteralCodec(String datatypeUri, String language) {
    this.datatypeUri = datatypeUri;
    this.language = language;
  }

  /**
   * Creates a codec producing plain xsd:string literals.
   *
   * @return the codec
   */
  public static LiteralCodec string() {
    return new LiteralCodec(XSDDatatype.XSDstring.getURI(), "");
  }

  /**
   * Creates a codec producing literals of the given datatype.
   *
   * @param datatype the datatype
   * @return the codec
   */
  public static LiteralCodec typed(RDFDatatype datatype) {
    Objects.requireNonNull(datatype, "Datatype cannot be null");
    return new LiteralCodec(datatype.getURI(), "");
  }

  /**
   * Creates a codec producing language-tagged literals.
   *
   * @param language the language tag
   * @return the codec
   * @throws IllegalArgumentException if the language tag is blank
   */
  public static LiteralCodec language(String language) {
    Objects.requireNonNull(language, "Language cannot be null");
    if (language.isBlank()) {
      throw new IllegalArgumentException("Language cannot be blank");
    }
    return new LiteralCodec(null, language);
  }

  @Override
  public Term toTerm(String value) {
    Objects.requireNonNull(value, "Value cannot be null");
    if (!language.isEmpty()) {
      return new Term.Literal(value, null, language);
    }
    RDFDatatype datatype = TypeMapper.getInstance().getSafeTypeByName(datatypeUri);
    if (!datatype.isValid(value)) {
      throw new TermConversionException(
          "Value '" + value + "' is not a valid lexical form for " + datatypeUri);
    }
    return new Term.Literal(value, datatypeUri, null);
  }

  @Override
  public String toString() {
    return language.isEmpty()
        ? "LiteralCodec{datatype=" + datatypeUri + "}"
        : "LiteralCodec{language=" + language + "}";
  }
}
