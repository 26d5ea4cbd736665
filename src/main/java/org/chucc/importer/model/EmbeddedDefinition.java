package org.chucc.importer.model;

import java.util.Objects;
import org.apache.jena.graph.Node;
import org.apache.jena.graph.NodeFactory;

/**
 * Definition of an attribute whose values are embedded objects held by the parent resource.
 *
 * @param name the attribute name used in header mappings and index descriptors
 * @param predicateUri the predicate linking the parent to each embedded object
 * @param type the shape of the embedded objects
 */
public record EmbeddedDefinition(String name, String predicateUri, EmbeddedType type) {

  /**
   * Creates an embedded definition with validation.
   *
   * @throws IllegalArgumentException if the name or predicate is blank
   */
  public EmbeddedDefinition {
    Objects.requireNonNull(name, "Name cannot be null");
    Objects.requireNonNull(predicateUri, "Predicate URI cannot be null");
    Objects.requireNonNull(type, "Type cannot be null");
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
