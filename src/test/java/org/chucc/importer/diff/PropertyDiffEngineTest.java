package org.chucc.importer.diff;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.chucc.importer.testutil.TestGraphs.LABEL;
import static org.chucc.importer.testutil.TestGraphs.LETTER_URI;
import static org.chucc.importer.testutil.TestGraphs.TITLE;
import static org.chucc.importer.testutil.TestGraphs.letter;
import static org.chucc.importer.testutil.TestGraphs.literal;
import static org.chucc.importer.testutil.TestGraphs.triple;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.jena.graph.Graph;
import org.apache.jena.graph.NodeFactory;
import org.apache.jena.vocabulary.DCTerms;
import org.chucc.importer.domain.AttributePath;
import org.chucc.importer.domain.Resource;
import org.chucc.importer.exception.EmbeddedIndexOverflowException;
import org.chucc.importer.exception.TermConversionException;
import org.chucc.importer.index.EmbeddedObjectIndex;
import org.chucc.importer.index.EmbeddedObjectIndexBuilder;
import org.chucc.importer.model.BuiltInModels;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for PropertyDiffEngine.
 */
class PropertyDiffEngineTest {

  private static final AttributePath TITLE_PATH = AttributePath.parse("title");
  private static final AttributePath PART_LABEL_PATH = AttributePath.parse("part.label");

  private final PropertyDiffEngine engine = new PropertyDiffEngine();
  private final EmbeddedObjectIndexBuilder indexBuilder = new EmbeddedObjectIndexBuilder();

  private static Resource letterWithTitles(String... titles) {
    return Resource.fromGraph(
        letter(LETTER_URI, List.of(titles), Map.of()), LETTER_URI, BuiltInModels.letter());
  }

  private static Resource letterWithParts() {
    Map<String, String> parts = new LinkedHashMap<>();
    parts.put("/part1", "Front");
    parts.put("/part2", "Back");
    return Resource.fromGraph(
        letter(LETTER_URI, List.of(), parts), LETTER_URI, BuiltInModels.letter());
  }

  private DeltaGraph diffTitle(Resource resource, String cell) {
    DeltaGraphBuilder builder = new DeltaGraphBuilder();
    engine.diff(resource, TITLE_PATH, cell, EmbeddedObjectIndex.empty(), builder);
    return builder.build();
  }

  @Test
  void splitCell_dropsBlankEntries() {
    assertThat(PropertyDiffEngine.splitCell("A||B| |")).containsExactly("A", "B");
    assertThat(PropertyDiffEngine.splitCell("")).isEmpty();
    assertThat(PropertyDiffEngine.splitCell(null)).isEmpty();
  }

  @Test
  void addedValue_isInserted() {
    DeltaGraph delta = diffTitle(letterWithTitles("A"), "A|B");

    assertThat(delta.deletions().isEmpty()).isTrue();
    assertThat(delta.insertions().size()).isEqualTo(1);
    assertThat(delta.insertions().contains(triple(LETTER_URI, TITLE, literal("B")))).isTrue();
  }

  @Test
  void removedValue_isDeleted() {
    DeltaGraph delta = diffTitle(letterWithTitles("A", "B"), "B");

    assertThat(delta.insertions().isEmpty()).isTrue();
    assertThat(delta.deletions().size()).isEqualTo(1);
    assertThat(delta.deletions().contains(triple(LETTER_URI, TITLE, literal("A")))).isTrue();
  }

  @Test
  void emptyCell_deletesAllValues() {
    DeltaGraph delta = diffTitle(letterWithTitles("A", "B"), "");

    assertThat(delta.deletions().size()).isEqualTo(2);
    assertThat(delta.insertions().isEmpty()).isTrue();
  }

  @Test
  void duplicateValues_collapseToOneMembership() {
    DeltaGraph delta = diffTitle(letterWithTitles(), "B|B|B");

    assertThat(delta.insertions().size()).isEqualTo(1);
  }

  @Test
  void unchangedValues_inAnyOrder_produceEmptyDelta() {
    assertThat(diffTitle(letterWithTitles("A", "B"), "B|A").isEmpty()).isTrue();
  }

  @Test
  void secondDiff_afterApplyingInMemory_isEmpty() {
    Resource resource = letterWithTitles("A", "C");

    DeltaGraph first = diffTitle(resource, "A|B");
    first.applyInMemory();
    DeltaGraph second = diffTitle(resource, "A|B");

    assertThat(first.isEmpty()).isFalse();
    assertThat(second.isEmpty()).isTrue();
    assertThat(resource.property("title").stringValues()).containsExactly("A", "B");
  }

  @Test
  void inMemoryValues_followRowOrder() {
    Resource resource = letterWithTitles("A");

    diffTitle(resource, "C|A|B").applyInMemory();

    assertThat(resource.property("title").stringValues()).containsExactly("C", "A", "B");
  }

  @Test
  void inMemoryValues_untouchedUntilApplied() {
    Resource resource = letterWithTitles("A");

    diffTitle(resource, "B");

    assertThat(resource.property("title").stringValues()).containsExactly("A");
  }

  @Test
  void deletion_usesStoredTerm() {
    Graph graph = letter(LETTER_URI, List.of(), Map.of());
    graph.add(triple(LETTER_URI, DCTerms.description.getURI(),
        NodeFactory.createLiteralLang("Old note", "de")));
    Resource resource = Resource.fromGraph(graph, LETTER_URI, BuiltInModels.letter());

    DeltaGraphBuilder builder = new DeltaGraphBuilder();
    engine.diff(resource, AttributePath.parse("description"), "New note",
        EmbeddedObjectIndex.empty(), builder);
    DeltaGraph delta = builder.build();

    assertThat(delta.deletions().contains(triple(LETTER_URI, DCTerms.description.getURI(),
        NodeFactory.createLiteralLang("Old note", "de")))).isTrue();
    assertThat(delta.insertions().contains(triple(LETTER_URI, DCTerms.description.getURI(),
        NodeFactory.createLiteralLang("New note", "en")))).isTrue();
  }

  @Test
  void referenceProperty_rejectsNonUriValue() {
    Resource resource = letterWithTitles();
    DeltaGraphBuilder builder = new DeltaGraphBuilder();

    assertThatThrownBy(() -> engine.diff(resource, AttributePath.parse("creator"),
        "John Smith", EmbeddedObjectIndex.empty(), builder))
        .isInstanceOf(TermConversionException.class);
    assertThat(builder.build().isEmpty()).isTrue();
  }

  @Test
  void embeddedValues_updateEachIndexedObject() {
    Resource resource = letterWithParts();
    EmbeddedObjectIndex index = indexBuilder.build(resource, "part[0]=/part1;part[1]=/part2");

    DeltaGraphBuilder builder = new DeltaGraphBuilder();
    engine.diff(resource, PART_LABEL_PATH, "Recto|Verso", index, builder);
    DeltaGraph delta = builder.build();

    assertThat(delta.deletions().size()).isEqualTo(2);
    assertThat(delta.insertions().size()).isEqualTo(2);
    assertThat(delta.deletions().contains(
        triple(LETTER_URI + "/part1", LABEL, literal("Front")))).isTrue();
    assertThat(delta.insertions().contains(
        triple(LETTER_URI + "/part1", LABEL, literal("Recto")))).isTrue();
    assertThat(delta.deletions().contains(
        triple(LETTER_URI + "/part2", LABEL, literal("Back")))).isTrue();
    assertThat(delta.insertions().contains(
        triple(LETTER_URI + "/part2", LABEL, literal("Verso")))).isTrue();
  }

  @Test
  void embeddedValues_unchangedPositionIsSkipped() {
    Resource resource = letterWithParts();
    EmbeddedObjectIndex index = indexBuilder.build(resource, "part[0]=/part1;part[1]=/part2");

    DeltaGraphBuilder builder = new DeltaGraphBuilder();
    engine.diff(resource, PART_LABEL_PATH, "Front|Verso", index, builder);
    DeltaGraph delta = builder.build();

    assertThat(delta.deletions().size()).isEqualTo(1);
    assertThat(delta.insertions().size()).isEqualTo(1);
    delta.applyInMemory();
    assertThat(index.get("part", 1).orElseThrow().property("label").stringValues())
        .containsExactly("Verso");
  }

  @Test
  void embeddedValues_withoutIndexEntries_areSkipped() {
    Resource resource = letterWithParts();

    DeltaGraphBuilder builder = new DeltaGraphBuilder();
    engine.diff(resource, PART_LABEL_PATH, "Recto", EmbeddedObjectIndex.empty(), builder);

    assertThat(builder.build().isEmpty()).isTrue();
  }

  @Test
  void embeddedValues_moreThanIndexed_throwOverflow() {
    Resource resource = letterWithParts();
    EmbeddedObjectIndex index = indexBuilder.build(resource, "part[0]=/part1");

    DeltaGraphBuilder builder = new DeltaGraphBuilder();
    assertThatThrownBy(() -> engine.diff(resource, PART_LABEL_PATH, "Recto|Verso", index,
        builder))
        .isInstanceOf(EmbeddedIndexOverflowException.class)
        .hasMessageContaining("part[1]");
  }

  @Test
  void embeddedValue_withoutCurrentValue_isOnlyInserted() {
    Map<String, String> parts = new LinkedHashMap<>();
    parts.put("/part1", null);
    Resource resource = Resource.fromGraph(
        letter(LETTER_URI, List.of(), parts), LETTER_URI, BuiltInModels.letter());
    EmbeddedObjectIndex index = indexBuilder.build(resource, "part[0]=/part1");

    DeltaGraphBuilder builder = new DeltaGraphBuilder();
    engine.diff(resource, PART_LABEL_PATH, "Recto", index, builder);
    DeltaGraph delta = builder.build();

    assertThat(delta.deletions().isEmpty()).isTrue();
    assertThat(delta.insertions().contains(
        triple(LETTER_URI + "/part1", LABEL, literal("Recto")))).isTrue();
  }

  @Test
  void referenceValues_differingOnlyInWhitespace_areTheSameValue() {
    Graph graph = letter(LETTER_URI, List.of(), Map.of());
    graph.add(triple(LETTER_URI, DCTerms.creator.getURI(),
        NodeFactory.createURI("http://example.org/person/1")));
    Resource resource = Resource.fromGraph(graph, LETTER_URI, BuiltInModels.letter());

    DeltaGraphBuilder builder = new DeltaGraphBuilder();
    engine.diff(resource, AttributePath.parse("creator"),
        "http://example.org/person/1| http://example.org/person/1 ",
        EmbeddedObjectIndex.empty(), builder);
    DeltaGraph delta = builder.build();

    assertThat(delta.isEmpty()).isTrue();
    delta.applyInMemory();
    assertThat(resource.property("creator").stringValues())
        .containsExactly("http://example.org/person/1");
  }

  @Test
  void referenceValue_isInsertedInTrimmedForm() {
    Resource resource = letterWithTitles();

    DeltaGraphBuilder builder = new DeltaGraphBuilder();
    engine.diff(resource, AttributePath.parse("creator"), " http://example.org/person/2",
        EmbeddedObjectIndex.empty(), builder);
    DeltaGraph delta = builder.build();

    assertThat(delta.insertions().size()).isEqualTo(1);
    assertThat(delta.insertions().contains(triple(LETTER_URI, DCTerms.creator.getURI(),
        NodeFactory.createURI("http://example.org/person/2")))).isTrue();
  }

  @Test
  void embeddedValue_replacesEveryStoredValue() {
    Graph graph = letter(LETTER_URI, List.of(), Map.of("/part1", "Front"));
    graph.add(triple(LETTER_URI + "/part1", LABEL, literal("Cover")));
    Resource resource = Resource.fromGraph(graph, LETTER_URI, BuiltInModels.letter());
    EmbeddedObjectIndex index = indexBuilder.build(resource, "part[0]=/part1");

    DeltaGraphBuilder builder = new DeltaGraphBuilder();
    engine.diff(resource, PART_LABEL_PATH, "Recto", index, builder);
    DeltaGraph delta = builder.build();

    assertThat(delta.deletions().contains(
        triple(LETTER_URI + "/part1", LABEL, literal("Front")))).isTrue();
    assertThat(delta.deletions().contains(
        triple(LETTER_URI + "/part1", LABEL, literal("Cover")))).isTrue();
    assertThat(delta.insertions().size()).isEqualTo(1);

    delta.applyInMemory();
    assertThat(index.get("part", 0).orElseThrow().property("label").stringValues())
        .containsExactly("Recto");
  }

  @Test
  void embeddedValue_matchingOneOfSeveralStoredValues_collapsesToIt() {
    Graph graph = letter(LETTER_URI, List.of(), Map.of("/part1", "Front"));
    graph.add(triple(LETTER_URI + "/part1", LABEL, literal("Cover")));
    Resource resource = Resource.fromGraph(graph, LETTER_URI, BuiltInModels.letter());
    EmbeddedObjectIndex index = indexBuilder.build(resource, "part[0]=/part1");

    DeltaGraphBuilder builder = new DeltaGraphBuilder();
    engine.diff(resource, PART_LABEL_PATH, "Front", index, builder);
    DeltaGraph delta = builder.build();

    assertThat(delta.deletions().size()).isEqualTo(1);
    assertThat(delta.deletions().contains(
        triple(LETTER_URI + "/part1", LABEL, literal("Cover")))).isTrue();
    assertThat(delta.insertions().isEmpty()).isTrue();
  }
}
