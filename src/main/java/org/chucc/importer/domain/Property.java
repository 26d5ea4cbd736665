package org.chucc.importer.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.apache.jena.graph.Node;
import org.chucc.importer.codec.TermCodec;
import org.chucc.importer.model.PropertyDefinition;

/**
 * In-memory values of one property of a resource or embedded object.
 *
 * <p>Values keep their insertion order and are deduplicated by their canonical string form.
 */
public final class Property {

  private final PropertyDefinition definition;
  private final Map<String, Term> values = new LinkedHashMap<>();

  /**
   * Creates a property holding the given values.
   *
   * @param definition the property definition
   * @param values the initial values
   */
  public Property(PropertyDefinition definition, List<Term> values) {
    this.definition = Objects.requireNonNull(definition, "Definition cannot be null");
    replaceValues(values);
  }

  public PropertyDefinition definition() {
    return definition;
  }

  public Node predicate() {
    return definition.predicate();
  }

  public TermCodec codec() {
    return definition.codec();
  }

  public List<Term> values() {
    return Collections.unmodifiableList(new ArrayList<>(values.values()));
  }

  /**
   * Returns the values in canonical string form, in order.
   *
   * @return the string values
   */
  public List<String> stringValues() {
    List<String> result = new ArrayList<>(values.size());
    values.values().forEach(term -> result.add(codec().toString(term)));
    return result;
  }

  /**
   * Finds the stored term whose canonical string equals the given value.
   *
   * @param value the canonical string
   * @return the stored term, if present
   */
  public Optional<Term> find(String value) {
    return Optional.ofNullable(values.get(value));
  }

  /**
   * Returns the first value, for single-valued properties.
   *
   * @return the first value, or empty if the property has none
   */
  public Optional<Term> first() {
    return values.values().stream().findFirst();
  }

  /**
   * Replaces all values, keeping the given order and dropping later duplicates.
   *
   * @param newValues the new values
   */
  public void replaceValues(List<Term> newValues) {
    Objects.requireNonNull(newValues, "Values cannot be null");
    values.clear();
    for (Term term : newValues) {
      values.putIfAbsent(codec().toString(term), term);
    }
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  @Override
  public String toString() {
    return "Property{name='" + definition.name() + "', values=" + values.keySet() + "}";
  }
}
