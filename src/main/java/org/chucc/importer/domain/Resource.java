package org.chucc.importer.domain;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.apache.jena.graph.Graph;
import org.apache.jena.graph.Node;
import org.apache.jena.graph.NodeFactory;
import org.chucc.importer.model.EmbeddedDefinition;
import org.chucc.importer.model.ModelDescriptor;
import org.chucc.importer.model.PropertyDefinition;

/**
 * In-memory view of a repository resource, materialized from its graph according to a model.
 *
 * <p>A resource is fetched fresh for each import row and discarded once the row completes.
 */
public final class Resource {

  private final String uri;
  private final ModelDescriptor model;
  private final Map<String, Property> properties = new LinkedHashMap<>();
  private final Map<String, EmbeddedCollection> embedded = new LinkedHashMap<>();

  private Resource(String uri, ModelDescriptor model) {
    this.uri = uri;
    this.model = model;
  }

  /**
   * Materializes a resource from its graph.
   *
   * @param graph the resource graph as fetched from the repository
   * @param uri the resource URI
   * @param model the model describing the resource
   * @return the resource
   */
  public static Resource fromGraph(Graph graph, String uri, ModelDescriptor model) {
    Objects.requireNonNull(graph, "Graph cannot be null");
    Objects.requireNonNull(uri, "URI cannot be null");
    Objects.requireNonNull(model, "Model cannot be null");

    Resource resource = new Resource(uri, model);
    Node subject = NodeFactory.createURI(uri);

    for (PropertyDefinition definition : model.properties()) {
      resource.properties.put(definition.name(),
          new Property(definition, objectsOf(graph, subject, definition.predicate())));
    }

    for (EmbeddedDefinition definition : model.embedded()) {
      EmbeddedCollection collection = new EmbeddedCollection(definition);
      graph.find(subject, definition.predicate(), Node.ANY).forEachRemaining(triple -> {
        if (triple.getObject().isURI()) {
          collection.add(EmbeddedObject.fromGraph(
              graph, triple.getObject().getURI(), definition.type()));
        }
      });
      resource.embedded.put(definition.name(), collection);
    }
    return resource;
  }

  static List<Term> objectsOf(Graph graph, Node subject, Node predicate) {
    List<Term> terms = new ArrayList<>();
    graph.find(subject, predicate, Node.ANY).forEachRemaining(triple ->
        Term.fromNode(triple.getObject()).ifPresent(terms::add));
    return terms;
  }

  public String uri() {
    return uri;
  }

  public Node node() {
    return NodeFactory.createURI(uri);
  }

  public ModelDescriptor model() {
    return model;
  }

  /**
   * Returns a direct property.
   *
   * @param name the attribute name
   * @return the property
   * @throws IllegalArgumentException if the model has no such direct property
   */
  public Property property(String name) {
    Property property = properties.get(name);
    if (property == null) {
      throw new IllegalArgumentException(
          "Model " + model.name() + " has no property '" + name + "'");
    }
    return property;
  }

  /**
   * Returns the embedded objects held through an attribute.
   *
   * @param name the embedded attribute name
   * @return the collection, or empty if the model has no such embedded attribute
   */
  public Optional<EmbeddedCollection> embedded(String name) {
    return Optional.ofNullable(embedded.get(name));
  }

  @Override
  public String toString() {
    return "Resource{uri='" + uri + "', model=" + model.name() + "}";
  }
}
