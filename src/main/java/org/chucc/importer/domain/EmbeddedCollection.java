package org.chucc.importer.domain;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.chucc.importer.model.EmbeddedDefinition;

/**
 * The embedded objects a resource holds through one embedded attribute, keyed by reference.
 */
public final class EmbeddedCollection {

  private final EmbeddedDefinition definition;
  private final Map<Term, EmbeddedObject> objects = new LinkedHashMap<>();

  /**
   * Creates an empty collection.
   *
   * @param definition the embedded attribute definition
   */
  public EmbeddedCollection(EmbeddedDefinition definition) {
    this.definition = Objects.requireNonNull(definition, "Definition cannot be null");
  }

  public EmbeddedDefinition definition() {
    return definition;
  }

  void add(EmbeddedObject object) {
    objects.put(new Term.Reference(object.uri()), object);
  }

  /**
   * Looks up an embedded object by the term referencing it.
   *
   * @param term the reference term
   * @return the embedded object, if held
   */
  public Optional<EmbeddedObject> get(Term term) {
    return Optional.ofNullable(objects.get(term));
  }

  public List<EmbeddedObject> objects() {
    return new ArrayList<>(objects.values());
  }

  public int size() {
    return objects.size();
  }
}
