package org.chucc.importer.model;

import java.util.List;
import org.apache.jena.datatypes.xsd.XSDDatatype;
import org.apache.jena.vocabulary.DCTerms;
import org.apache.jena.vocabulary.RDFS;
import org.chucc.importer.codec.LiteralCodec;
import org.chucc.importer.codec.ReferenceCodec;

/**
 * Model descriptors shipped with the importer.
 */
public final class BuiltInModels {

  /** PCDM namespace. */
  public static final String PCDM = "http://pcdm.org/models#";

  /** FaBiO namespace, used for page sequence numbers. */
  public static final String FABIO = "http://purl.org/spar/fabio/";

  public static final String LETTER = "letter.Letter";
  public static final String PCDM_ITEM = "pcdm.Item";

  private BuiltInModels() {
    // Utility class - prevent instantiation
  }

  /**
   * Digitized letter described with Dublin Core terms; its parts carry their own labels.
   *
   * @return the letter model
   */
  public static ModelDescriptor letter() {
    EmbeddedType part = new EmbeddedType("Part", List.of(
        new PropertyDefinition("label", RDFS.label.getURI(), LiteralCodec.string())));

    return ModelDescriptor.builder(LETTER)
        .property(new PropertyDefinition("title", DCTerms.title.getURI(),
            LiteralCodec.string()))
        .property(new PropertyDefinition("identifier", DCTerms.identifier.getURI(),
            LiteralCodec.string()))
        .property(new PropertyDefinition("date", DCTerms.date.getURI(),
            LiteralCodec.string()))
        .property(new PropertyDefinition("description", DCTerms.description.getURI(),
            LiteralCodec.language("en")))
        .property(new PropertyDefinition("creator", DCTerms.creator.getURI(),
            ReferenceCodec.instance()))
        .property(new PropertyDefinition("subject", DCTerms.subject.getURI(),
            ReferenceCodec.instance()))
        .embedded(new EmbeddedDefinition("part", DCTerms.hasPart.getURI(), part))
        .header("Title", "title")
        .header("Identifier", "identifier")
        .header("Date", "date")
        .header("Description", "description")
        .header("Author", "creator")
        .header("Subject", "subject")
        .header("Part Label", "part.label")
        .build();
  }

  /**
   * PCDM object whose member pages carry titles and sequence numbers.
   *
   * @return the item model
   */
  public static ModelDescriptor pcdmItem() {
    EmbeddedType page = new EmbeddedType("Page", List.of(
        new PropertyDefinition("title", DCTerms.title.getURI(), LiteralCodec.string()),
        new PropertyDefinition("number", FABIO + "hasSequenceIdentifier",
            LiteralCodec.typed(XSDDatatype.XSDinteger))));

    return ModelDescriptor.builder(PCDM_ITEM)
        .property(new PropertyDefinition("title", DCTerms.title.getURI(),
            LiteralCodec.string()))
        .property(new PropertyDefinition("rights", DCTerms.rights.getURI(),
            ReferenceCodec.instance()))
        .embedded(new EmbeddedDefinition("member", PCDM + "hasMember", page))
        .header("Title", "title")
        .header("Rights", "rights")
        .header("Page Title", "member.title")
        .header("Page Number", "member.number")
        .build();
  }
}
