package org.chucc.importer.index;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.chucc.importer.domain.EmbeddedObject;

/**
 * Per-row mapping from (embedded attribute, position) to the embedded object at that position.
 */
public final class EmbeddedObjectIndex {

  private static final EmbeddedObjectIndex EMPTY = new EmbeddedObjectIndex();

  private final Map<String, Map<Integer, EmbeddedObject>> entries = new LinkedHashMap<>();

  EmbeddedObjectIndex() {
  }

  public static EmbeddedObjectIndex empty() {
    return EMPTY;
  }

  void put(String attribute, int position, EmbeddedObject object) {
    entries.computeIfAbsent(attribute, k -> new TreeMap<>()).put(position, object);
  }

  /**
   * Checks whether the index holds any position for an attribute.
   *
   * @param attribute the embedded attribute name
   * @return true if the attribute is indexed
   */
  public boolean contains(String attribute) {
    return entries.containsKey(attribute);
  }

  /**
   * Resolves the embedded object at a position.
   *
   * @param attribute the embedded attribute name
   * @param position the zero-based position
   * @return the embedded object, or empty if the position is not indexed
   */
  public Optional<EmbeddedObject> get(String attribute, int position) {
    Map<Integer, EmbeddedObject> positions = entries.get(attribute);
    if (positions == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(positions.get(position));
  }

  /**
   * Returns the positions indexed for an attribute.
   *
   * @param attribute the embedded attribute name
   * @return unmodifiable position map, empty if the attribute is not indexed
   */
  public Map<Integer, EmbeddedObject> positions(String attribute) {
    return Collections.unmodifiableMap(entries.getOrDefault(attribute, Map.of()));
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  @Override
  public String toString() {
    return "EmbeddedObjectIndex" + entries;
  }
}
