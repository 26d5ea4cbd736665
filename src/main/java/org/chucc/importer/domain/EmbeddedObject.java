package org.chucc.importer.domain;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.apache.jena.graph.Graph;
import org.apache.jena.graph.Node;
import org.apache.jena.graph.NodeFactory;
import org.chucc.importer.model.EmbeddedType;
import org.chucc.importer.model.PropertyDefinition;

/**
 * A sub-resource held by a parent resource, with its own URI and properties.
 */
public final class EmbeddedObject {

  private final String uri;
  private final EmbeddedType type;
  private final Map<String, Property> properties = new LinkedHashMap<>();

  private EmbeddedObject(String uri, EmbeddedType type) {
    this.uri = uri;
    this.type = type;
  }

  /**
   * Reads an embedded object's properties from a graph.
   *
   * @param graph the graph holding the embedded object's statements
   * @param uri the embedded object's URI
   * @param type the embedded object's shape
   * @return the embedded object
   */
  public static EmbeddedObject fromGraph(Graph graph, String uri, EmbeddedType type) {
    Objects.requireNonNull(graph, "Graph cannot be null");
    Objects.requireNonNull(uri, "URI cannot be null");
    Objects.requireNonNull(type, "Type cannot be null");

    EmbeddedObject object = new EmbeddedObject(uri, type);
    Node subject = NodeFactory.createURI(uri);
    for (PropertyDefinition definition : type.properties()) {
      object.properties.put(definition.name(),
          new Property(definition, Resource.objectsOf(graph, subject, definition.predicate())));
    }
    return object;
  }

  public String uri() {
    return uri;
  }

  public Node node() {
    return NodeFactory.createURI(uri);
  }

  public EmbeddedType type() {
    return type;
  }

  /**
   * Returns the named property.
   *
   * @param name the attribute name
   * @return the property
   * @throws IllegalArgumentException if the embedded type has no such property
   */
  public Property property(String name) {
    Property property = properties.get(name);
    if (property == null) {
      throw new IllegalArgumentException(
          "Embedded type " + type.name() + " has no property '" + name + "'");
    }
    return property;
  }

  @Override
  public String toString() {
    return "EmbeddedObject{uri='" + uri + "', type=" + type.name() + "}";
  }
}
