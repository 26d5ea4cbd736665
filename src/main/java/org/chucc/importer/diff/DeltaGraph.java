package org.chucc.importer.diff;

import java.util.List;
import org.apache.jena.graph.Graph;

/**
 * Net change for one row: the triples to delete and the triples to insert, with no triple in
 * both, plus the in-memory mutations to apply once the change has been accepted.
 */
public final class DeltaGraph {

  private final Graph deletions;
  private final Graph insertions;
  private final List<Runnable> stagedMutations;

  DeltaGraph(Graph deletions, Graph insertions, List<Runnable> stagedMutations) {
    this.deletions = deletions;
    this.insertions = insertions;
    this.stagedMutations = List.copyOf(stagedMutations);
  }

  @edu.umd.cs.findbugs.annotations.SuppressFBWarnings(
      value = "EI_EXPOSE_REP",
      justification = "Delta graphs are row-scoped and handed to the serializer as-is")
  public Graph deletions() {
    return deletions;
  }

  @edu.umd.cs.findbugs.annotations.SuppressFBWarnings(
      value = "EI_EXPOSE_REP",
      justification = "Delta graphs are row-scoped and handed to the serializer as-is")
  public Graph insertions() {
    return insertions;
  }

  /**
   * Checks whether the row has no effective change.
   *
   * @return true if both the deletions and insertions are empty
   */
  public boolean isEmpty() {
    return deletions.isEmpty() && insertions.isEmpty();
  }

  /**
   * Applies the staged in-memory mutations to the resource and its embedded objects.
   * Called only after the row has fully resolved.
   */
  public void applyInMemory() {
    stagedMutations.forEach(Runnable::run);
  }

  @Override
  public String toString() {
    return "DeltaGraph{deletions=" + deletions.size() + ", insertions=" + insertions.size()
        + "}";
  }
}
