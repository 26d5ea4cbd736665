package org.chucc.importer.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.chucc.importer.domain.AttributePath;

/**
 * Statically typed description of a resource model: its direct properties, its embedded
 * attributes, and the mapping from import file headers to attribute paths.
 *
 * <p>Every header is resolved when the descriptor is built, so an invalid mapping fails at
 * startup rather than on the first row that uses it.
 */
public final class ModelDescriptor {

  private final String name;
  private final Map<String, PropertyDefinition> properties;
  private final Map<String, EmbeddedDefinition> embedded;
  private final Map<String, AttributePath> headerMap;

  private ModelDescriptor(Builder builder) {
    this.name = builder.name;
    this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(builder.properties));
    this.embedded = Collections.unmodifiableMap(new LinkedHashMap<>(builder.embedded));
    this.headerMap = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headerMap));
  }

  /**
   * Starts building a model descriptor.
   *
   * @param name the model name used for registry lookups
   * @return a new builder
   */
  public static Builder builder(String name) {
    return new Builder(name);
  }

  public String name() {
    return name;
  }

  public Collection<PropertyDefinition> properties() {
    return properties.values();
  }

  public Collection<EmbeddedDefinition> embedded() {
    return embedded.values();
  }

  public Optional<EmbeddedDefinition> embedded(String attribute) {
    return Optional.ofNullable(embedded.get(attribute));
  }

  /**
   * Returns the header to attribute path mapping, in declaration order.
   *
   * @return unmodifiable header map
   */
  public Map<String, AttributePath> headerMap() {
    return headerMap;
  }

  /**
   * Resolves the property definition an attribute path ends at.
   *
   * @param path the attribute path
   * @return the direct property for one-segment paths, or the embedded type's property
   * @throws IllegalArgumentException if the path does not resolve in this model
   */
  public PropertyDefinition resolve(AttributePath path) {
    if (!path.isEmbedded()) {
      PropertyDefinition property = properties.get(path.outer());
      if (property == null) {
        throw new IllegalArgumentException(
            "Model " + name + " has no property '" + path.outer() + "'");
      }
      return property;
    }
    EmbeddedDefinition definition = embedded.get(path.outer());
    if (definition == null) {
      throw new IllegalArgumentException(
          "Model " + name + " has no embedded attribute '" + path.outer() + "'");
    }
    String inner = path.inner().orElseThrow();
    return definition.type().property(inner)
        .orElseThrow(() -> new IllegalArgumentException(
            "Embedded type " + definition.type().name() + " has no property '" + inner + "'"));
  }

  @Override
  public String toString() {
    return "ModelDescriptor{name='" + name + "'}";
  }

  /**
   * Builder for {@link ModelDescriptor}.
   */
  public static final class Builder {
    private final String name;
    private final Map<String, PropertyDefinition> properties = new LinkedHashMap<>();
    private final Map<String, EmbeddedDefinition> embedded = new LinkedHashMap<>();
    private final Map<String, AttributePath> headerMap = new LinkedHashMap<>();

    private Builder(String name) {
      Objects.requireNonNull(name, "Model name cannot be null");
      if (name.isBlank()) {
        throw new IllegalArgumentException("Model name cannot be blank");
      }
      this.name = name;
    }

    /**
     * Adds a direct property.
     *
     * @param property the property definition
     * @return this builder
     */
    public Builder property(PropertyDefinition property) {
      putUnique(property.name());
      properties.put(property.name(), property);
      return this;
    }

    /**
     * Adds an embedded attribute.
     *
     * @param definition the embedded definition
     * @return this builder
     */
    public Builder embedded(EmbeddedDefinition definition) {
      putUnique(definition.name());
      embedded.put(definition.name(), definition);
      return this;
    }

    /**
     * Maps an import file header to a dotted attribute path.
     *
     * @param header the column header
     * @param dottedPath the attribute path, e.g. {@code title} or {@code part.label}
     * @return this builder
     */
    public Builder header(String header, String dottedPath) {
      Objects.requireNonNull(header, "Header cannot be null");
      if (headerMap.containsKey(header)) {
        throw new IllegalArgumentException("Duplicate header: " + header);
      }
      headerMap.put(header, AttributePath.parse(dottedPath));
      return this;
    }

    /**
     * Builds the descriptor, validating that every header resolves.
     *
     * @return the descriptor
     * @throws IllegalArgumentException if a header path does not resolve
     */
    public ModelDescriptor build() {
      ModelDescriptor descriptor = new ModelDescriptor(this);
      descriptor.headerMap.values().forEach(descriptor::resolve);
      return descriptor;
    }

    private void putUnique(String attribute) {
      if (properties.containsKey(attribute) || embedded.containsKey(attribute)) {
        throw new IllegalArgumentException(
            "Duplicate attribute '" + attribute + "' in model " + name);
      }
    }
  }
}
