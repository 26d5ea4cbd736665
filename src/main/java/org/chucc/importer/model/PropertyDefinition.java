package org.chucc.importer.model;

import java.util.Objects;
import org.apache.jena.graph.Node;
import org.apache.jena.graph.NodeFactory;
import org.chucc.importer.codec.TermCodec;

/**
 * Definition of a URI-identified property on a resource or embedded object.
 *
 * @param name the attribute name used in header mappings
 * @param predicateUri the predicate URI
 * @param codec the codec turning cell values into terms for this property
 */
public record PropertyDefinition(String name, String predicateUri, TermCodec codec) {

  /**
   * Creates a property definition with validation.
   *
   * @throws IllegalArgumentException if the name or predicate is blank
   */
  public PropertyDefinition {
    Objects.requireNonNull(name, "Name cannot be null");
    Objects.requireNonNull(predicateUri, "Predicate URI cannot be null");
    Objects.requireNonNull(codec, "Codec cannot be null");
    if (name.isBlank()) {
      throw new IllegalArgumentException("Name cannot be blank");
    }
    if (predicateUri.isBlank()) {
      throw new IllegalArgumentException("Predicate URI cannot be blank");
    }
  }

  public Node predicate() {
    return NodeFactory.createURI(predicateUri);
  }
}
