package org.chucc.importer.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.chucc.importer.testutil.TestGraphs.LETTER_URI;
import static org.chucc.importer.testutil.TestGraphs.letter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.jena.graph.Graph;
import org.apache.jena.graph.NodeFactory;
import org.apache.jena.vocabulary.DCTerms;
import org.chucc.importer.model.BuiltInModels;
import org.chucc.importer.testutil.TestGraphs;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for Resource materialization.
 */
class ResourceTest {

  @Test
  void fromGraph_readsDirectProperties() {
    Graph graph = letter(LETTER_URI, List.of("A", "B"), Map.of());

    Resource resource = Resource.fromGraph(graph, LETTER_URI, BuiltInModels.letter());

    assertThat(resource.property("title").stringValues()).containsExactlyInAnyOrder("A", "B");
    assertThat(resource.property("identifier").isEmpty()).isTrue();
  }

  @Test
  void fromGraph_readsEmbeddedObjects() {
    Map<String, String> parts = new LinkedHashMap<>();
    parts.put("/part1", "Page 1");
    parts.put("/part2", null);
    Graph graph = letter(LETTER_URI, List.of(), parts);

    Resource resource = Resource.fromGraph(graph, LETTER_URI, BuiltInModels.letter());

    EmbeddedCollection collection = resource.embedded("part").orElseThrow();
    assertThat(collection.size()).isEqualTo(2);
    EmbeddedObject part1 = collection.get(new Term.Reference(LETTER_URI + "/part1"))
        .orElseThrow();
    assertThat(part1.property("label").stringValues()).containsExactly("Page 1");
    EmbeddedObject part2 = collection.get(new Term.Reference(LETTER_URI + "/part2"))
        .orElseThrow();
    assertThat(part2.property("label").isEmpty()).isTrue();
  }

  @Test
  void fromGraph_ignoresBlankNodeValues() {
    Graph graph = letter(LETTER_URI, List.of(), Map.of());
    graph.add(TestGraphs.triple(LETTER_URI, DCTerms.creator.getURI(),
        NodeFactory.createBlankNode()));

    Resource resource = Resource.fromGraph(graph, LETTER_URI, BuiltInModels.letter());

    assertThat(resource.property("creator").isEmpty()).isTrue();
  }

  @Test
  void property_unknownName_throws() {
    Resource resource = Resource.fromGraph(
        letter(LETTER_URI, List.of(), Map.of()), LETTER_URI, BuiltInModels.letter());

    assertThatThrownBy(() -> resource.property("publisher"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(resource.embedded("publisher")).isEmpty();
  }

  @Test
  void property_replaceValues_keepsOrderAndDropsDuplicates() {
    Resource resource = Resource.fromGraph(
        letter(LETTER_URI, List.of("A"), Map.of()), LETTER_URI, BuiltInModels.letter());
    Property title = resource.property("title");

    title.replaceValues(List.of(
        Term.Literal.plain("C"), Term.Literal.plain("B"), Term.Literal.plain("C")));

    assertThat(title.stringValues()).containsExactly("C", "B");
    assertThat(title.find("B")).contains(Term.Literal.plain("B"));
    assertThat(title.first()).contains(Term.Literal.plain("C"));
  }
}
