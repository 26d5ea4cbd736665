package org.chucc.importer.diff;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.apache.jena.graph.Graph;
import org.apache.jena.graph.Triple;
import org.apache.jena.sparql.graph.GraphFactory;

/**
 * Accumulates the per-property diffs of one row into a deletion graph and an insertion graph.
 *
 * <p>In-memory mutations are staged rather than applied, so that a failure later in the same
 * row leaves the resource untouched.
 */
public final class DeltaGraphBuilder {

  private final Graph deletions = GraphFactory.createDefaultGraph();
  private final Graph insertions = GraphFactory.createDefaultGraph();
  private final List<Runnable> stagedMutations = new ArrayList<>();
  private boolean built;

  /**
   * Records a triple to delete.
   *
   * @param triple the triple
   */
  public void delete(Triple triple) {
    checkNotBuilt();
    deletions.add(Objects.requireNonNull(triple, "Triple cannot be null"));
  }

  /**
   * Records a triple to insert.
   *
   * @param triple the triple
   */
  public void insert(Triple triple) {
    checkNotBuilt();
    insertions.add(Objects.requireNonNull(triple, "Triple cannot be null"));
  }

  /**
   * Stages an in-memory mutation to run once the row resolves.
   *
   * @param mutation the mutation
   */
  public void stage(Runnable mutation) {
    checkNotBuilt();
    stagedMutations.add(Objects.requireNonNull(mutation, "Mutation cannot be null"));
  }

  /**
   * Cancels every triple present in both graphs and returns the net change.
   * The builder cannot be used afterwards.
   *
   * @return the net delta
   */
  public DeltaGraph build() {
    checkNotBuilt();
    built = true;

    List<Triple> redundant = deletions.find().filterKeep(insertions::contains).toList();
    for (Triple triple : redundant) {
      deletions.delete(triple);
      insertions.delete(triple);
    }
    return new DeltaGraph(deletions, insertions, stagedMutations);
  }

  private void checkNotBuilt() {
    if (built) {
      throw new IllegalStateException("Delta graph has already been built");
    }
  }
}
