package org.chucc.importer.domain;

import java.util.Objects;
import java.util.Optional;
import org.apache.jena.datatypes.TypeMapper;
import org.apache.jena.datatypes.xsd.XSDDatatype;
import org.apache.jena.graph.Node;
import org.apache.jena.graph.NodeFactory;

/**
 * An RDF value held by a resource property: either a literal or a reference to another
 * resource.
 *
 * <p>Two terms with the same {@link #asString()} are treated as the same value by the diff
 * engine, regardless of datatype or language.
 */
public sealed interface Term permits Term.Literal, Term.Reference {

  /**
   * Returns the canonical string form used for value comparison.
   *
   * @return the lexical form of a literal, or the URI of a reference
   */
  String asString();

  /**
   * Converts this term to a Jena node.
   *
   * @return the node
   */
  Node toNode();

  /**
   * Converts a Jena node to a term.
   *
   * @param node the node to convert
   * @return the term, or empty if the node is neither a URI nor a literal
   */
  static Optional<Term> fromNode(Node node) {
    Objects.requireNonNull(node, "Node cannot be null");
    if (node.isURI()) {
      return Optional.of(new Reference(node.getURI()));
    }
    if (node.isLiteral()) {
      return Optional.of(new Literal(
          node.getLiteralLexicalForm(),
          node.getLiteralDatatypeURI(),
          node.getLiteralLanguage()));
    }
    return Optional.empty();
  }

  /**
   * A literal value with a datatype and an optional language tag.
   *
   * @param lexicalForm the lexical form
   * @param datatypeUri the datatype IRI (xsd:string when null)
   * @param language the language tag, empty when none
   */
  record Literal(String lexicalForm, String datatypeUri, String language) implements Term {

    /**
     * Creates a literal, defaulting the datatype to xsd:string and the language to none.
     */
    public Literal {
      Objects.requireNonNull(lexicalForm, "Lexical form cannot be null");
      if (datatypeUri == null || datatypeUri.isBlank()) {
        datatypeUri = XSDDatatype.XSDstring.getURI();
      }
      if (language == null) {
        language = "";
      }
    }

    /**
     * Creates a plain xsd:string literal.
     *
     * @param lexicalForm the lexical form
     * @return the literal
     */
    public static Literal plain(String lexicalForm) {
      return new Literal(lexicalForm, null, null);
    }

    @Override
    public String asString() {
      return lexicalForm;
    }

    @Override
    public Node toNode() {
      if (!language.isEmpty()) {
        return NodeFactory.createLiteralLang(lexicalForm, language);
      }
      return NodeFactory.createLiteralDT(lexicalForm,
          TypeMapper.getInstance().getSafeTypeByName(datatypeUri));
    }
  }

  /**
   * A reference to another resource by URI.
   *
   * @param uri the absolute URI
   */
  record Reference(String uri) implements Term {

    /**
     * Creates a reference.
     */
    public Reference {
      Objects.requireNonNull(uri, "URI cannot be null");
    }

    @Override
    public String asString() {
      return uri;
    }

    @Override
    public Node toNode() {
      return NodeFactory.createURI(uri);
    }
  }
}
