package org.chucc.importer.model;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The shape of an embedded object: a named set of property definitions.
 */
public final class EmbeddedType {

  private final String name;
  private final Map<String, PropertyDefinition> properties;

  /**
   * Creates an embedded type.
   *
   * @param name the type name
   * @param properties the property definitions of the type
   * @throws IllegalArgumentException if two properties share a name
   */
  public EmbeddedType(String name, List<PropertyDefinition> properties) {
    this.name = Objects.requireNonNull(name, "Name cannot be null");
    this.properties = new LinkedHashMap<>();
    for (PropertyDefinition property : properties) {
      if (this.properties.put(property.name(), property) != null) {
        throw new IllegalArgumentException(
            "Duplicate property '" + property.name() + "' in embedded type " + name);
      }
    }
  }

  public String name() {
    return name;
  }

  public Optional<PropertyDefinition> property(String propertyName) {
    return Optional.ofNullable(properties.get(propertyName));
  }

  public Collection<PropertyDefinition> properties() {
    return properties.values();
  }
}
