package org.chucc.importer.diff;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.chucc.importer.testutil.TestGraphs.LETTER_URI;
import static org.chucc.importer.testutil.TestGraphs.TITLE;
import static org.chucc.importer.testutil.TestGraphs.letter;
import static org.chucc.importer.testutil.TestGraphs.literal;
import static org.chucc.importer.testutil.TestGraphs.triple;
import static org.chucc.importer.testutil.TestGraphs.values;

import java.util.List;
import java.util.Map;
import org.apache.jena.graph.Graph;
import org.apache.jena.update.UpdateAction;
import org.apache.jena.update.UpdateFactory;
import org.chucc.importer.domain.AttributePath;
import org.chucc.importer.domain.Resource;
import org.chucc.importer.index.EmbeddedObjectIndex;
import org.chucc.importer.model.BuiltInModels;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for UpdateSerializer.
 */
class UpdateSerializerTest {

  private final UpdateSerializer serializer = new UpdateSerializer();

  @Test
  void serialize_rendersDeleteInsertWhere() {
    DeltaGraphBuilder builder = new DeltaGraphBuilder();
    builder.delete(triple(LETTER_URI, TITLE, literal("A")));
    builder.insert(triple(LETTER_URI, TITLE, literal("B")));

    String update = serializer.serialize(builder.build());

    assertThat(update).isEqualTo("DELETE { <" + LETTER_URI + "> <" + TITLE + "> \"A\" . } "
        + "INSERT { <" + LETTER_URI + "> <" + TITLE + "> \"B\" . } WHERE {}");
  }

  @Test
  void serialize_emptyBlocks_stillParse() {
    DeltaGraphBuilder builder = new DeltaGraphBuilder();
    builder.insert(triple(LETTER_URI, TITLE, literal("B")));

    String update = serializer.serialize(builder.build());

    assertThat(update).startsWith("DELETE {  } INSERT {");
    assertThat(UpdateFactory.create(update).getOperations()).hasSize(1);
  }

  @Test
  void serialize_escapesLiterals() {
    DeltaGraphBuilder builder = new DeltaGraphBuilder();
    builder.insert(triple(LETTER_URI, TITLE, literal("Say \"hi\"\nthen leave")));

    String update = serializer.serialize(builder.build());

    assertThat(update).contains("\\\"hi\\\"").contains("\\n");
    assertThat(UpdateFactory.create(update).getOperations()).hasSize(1);
  }

  @Test
  void serialize_nullDelta_throws() {
    assertThatThrownBy(() -> serializer.serialize(null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void applyingUpdate_leavesExactlyTheNewValues() {
    Graph repository = letter(LETTER_URI, List.of("A", "B", "C"), Map.of());
    Resource resource = Resource.fromGraph(repository, LETTER_URI, BuiltInModels.letter());

    DeltaGraphBuilder builder = new DeltaGraphBuilder();
    new PropertyDiffEngine().diff(resource, AttributePath.parse("title"), "B|D|E",
        EmbeddedObjectIndex.empty(), builder);
    UpdateAction.execute(UpdateFactory.create(serializer.serialize(builder.build())),
        repository);

    assertThat(values(repository, LETTER_URI, TITLE)).containsExactlyInAnyOrder("B", "D", "E");
  }
}
