package org.chucc.importer.diff;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import org.apache.jena.graph.Node;
import org.apache.jena.graph.Triple;
import org.chucc.importer.codec.TermCodec;
import org.chucc.importer.domain.AttributePath;
import org.chucc.importer.domain.EmbeddedObject;
import org.chucc.importer.domain.Property;
import org.chucc.importer.domain.Resource;
import org.chucc.importer.domain.Term;
import org.chucc.importer.exception.EmbeddedIndexOverflowException;
import org.chucc.importer.index.EmbeddedObjectIndex;
import org.chucc.importer.model.PropertyDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Compares one property's current values with the values of a row cell and records the
 * triples to delete and insert.
 *
 * <p>Direct properties are diffed as sets: deletions are {@code old - new}, insertions are
 * {@code new - old}. Embedded properties are diffed position by position against the embedded
 * objects the row's index resolves.
 */
@Component
public class PropertyDiffEngine {

  private static final Logger logger = LoggerFactory.getLogger(PropertyDiffEngine.class);

  /** Separator between multiple values in one cell. */
  public static final String VALUE_SEPARATOR = "|";

  /**
   * Splits a cell into its values, dropping empty and whitespace-only entries.
   *
   * @param cell the raw cell text, may be null
   * @return the values in cell order
   */
  public static List<String> splitCell(String cell) {
    List<String> values = new ArrayList<>();
    if (cell == null) {
      return values;
    }
    for (String value : cell.split(Pattern.quote(VALUE_SEPARATOR), -1)) {
      if (!value.isBlank()) {
        values.add(value);
      }
    }
    return values;
  }

  /**
   * Diffs one mapped column of a row.
   *
   * @param resource the resource the row describes
   * @param path the attribute path the column maps to
   * @param cell the raw cell text
   * @param index the row's embedded-object index
   * @param delta the builder collecting the row's changes
   * @throws org.chucc.importer.exception.TermConversionException if a value cannot be
   *     converted to the property's term shape
   * @throws EmbeddedIndexOverflowException if the cell has more values than indexed positions
   */
  public void diff(Resource resource, AttributePath path, String cell,
      EmbeddedObjectIndex index, DeltaGraphBuilder delta) {
    List<String> newValues = splitCell(cell);
    if (path.isEmbedded()) {
      diffEmbedded(resource, path, newValues, index, delta);
    } else {
      diffDirect(resource, path, newValues, delta);
    }
  }

  private void diffDirect(Resource resource, AttributePath path, List<String> newValues,
      DeltaGraphBuilder delta) {
    Property property = resource.property(path.outer());
    TermCodec codec = property.codec();
    Node subject = resource.node();
    Node predicate = property.predicate();

    List<String> oldValues = property.stringValues();

    // converted up front so a bad value fails before anything is recorded;
    // keyed by canonical form so values differing only in surface form collapse
    Map<String, Term> newTerms = new LinkedHashMap<>();
    for (String value : newValues) {
      Optional<Term> stored = property.find(value);
      if (stored.isPresent()) {
        newTerms.putIfAbsent(value, stored.get());
      } else {
        Term converted = codec.toTerm(value);
        String key = codec.toString(converted);
        newTerms.putIfAbsent(key, property.find(key).orElse(converted));
      }
    }

    for (String value : oldValues) {
      if (!newTerms.containsKey(value)) {
        Term term = property.find(value).orElseGet(() -> codec.toTerm(value));
        delta.delete(Triple.create(subject, predicate, term.toNode()));
      }
    }
    newTerms.forEach((value, term) -> {
      if (!oldValues.contains(value)) {
        delta.insert(Triple.create(subject, predicate, term.toNode()));
      }
    });

    List<Term> replacement = new ArrayList<>(newTerms.values());
    delta.stage(() -> property.replaceValues(replacement));
  }

  private void diffEmbedded(Resource resource, AttributePath path, List<String> newValues,
      EmbeddedObjectIndex index, DeltaGraphBuilder delta) {
    String outer = path.outer();
    if (!index.contains(outer)) {
      logger.debug("No index entries for '{}' on {}, skipping column {}",
          outer, resource.uri(), path);
      return;
    }
    PropertyDefinition definition = resource.model().resolve(path);
    TermCodec codec = definition.codec();
    Node predicate = definition.predicate();
    String inner = path.inner().orElseThrow();

    for (int i = 0; i < newValues.size(); i++) {
      final int position = i;
      EmbeddedObject object = index.get(outer, position)
          .orElseThrow(() -> new EmbeddedIndexOverflowException(
              "Row has " + newValues.size() + " values for " + path + " but no "
                  + outer + "[" + position + "] in the index of " + resource.uri()));

      Property property = object.property(inner);
      List<Term> oldTerms = property.values();
      Term newTerm = codec.toTerm(newValues.get(position));
      if (oldTerms.size() == 1
          && codec.toString(newTerm).equals(codec.toString(oldTerms.get(0)))) {
        continue;
      }

      Node subject = object.node();
      for (Term oldTerm : oldTerms) {
        delta.delete(Triple.create(subject, predicate, oldTerm.toNode()));
      }
      delta.insert(Triple.create(subject, predicate, newTerm.toNode()));
      delta.stage(() -> property.replaceValues(List.of(newTerm)));
    }
  }
}
