package org.chucc.importer.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Map;
import java.util.Optional;
import org.apache.jena.graph.Graph;
import org.chucc.importer.codec.ReferenceCodec;
import org.chucc.importer.diff.DeltaGraph;
import org.chucc.importer.diff.DeltaGraphBuilder;
import org.chucc.importer.diff.PropertyDiffEngine;
import org.chucc.importer.diff.UpdateSerializer;
import org.chucc.importer.domain.AttributePath;
import org.chucc.importer.domain.Resource;
import org.chucc.importer.index.EmbeddedObjectIndex;
import org.chucc.importer.index.EmbeddedObjectIndexBuilder;
import org.chucc.importer.model.ModelDescriptor;
import org.chucc.importer.repository.RepositoryClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reconciles a single import row with its repository resource.
 *
 * <p>The row moves through these steps:</p>
 * <ol>
 *   <li>Fetch the resource graph and materialize the resource</li>
 *   <li>Build the embedded-object index from the row's INDEX cell</li>
 *   <li>Diff every mapped column present in the row</li>
 *   <li>Cancel triples that are both deleted and inserted</li>
 *   <li>If anything remains, send it as one SPARQL Update patch</li>
 * </ol>
 *
 * <p>In-memory changes to the resource are applied only after the row resolves; any exception
 * leaves the resource as fetched.</p>
 */
@Component
@SuppressWarnings("PMD.GuardLogStatement") // SLF4J parameterized logging is efficient
public class RowProcessor {

  private static final Logger logger = LoggerFactory.getLogger(RowProcessor.class);

  /** Reserved column holding the resource URI. */
  public static final String URI_COLUMN = "URI";

  /** Reserved column holding the embedded-object index descriptor. */
  public static final String INDEX_COLUMN = "INDEX";

  private final RepositoryClient repositoryClient;
  private final EmbeddedObjectIndexBuilder indexBuilder;
  private final PropertyDiffEngine diffEngine;
  private final UpdateSerializer updateSerializer;

  /**
   * Constructs a new row processor.
   *
   * @param repositoryClient the repository client
   * @param indexBuilder the embedded-object index builder
   * @param diffEngine the property diff engine
   * @param updateSerializer the update serializer
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Collaborators are Spring-managed beans and are intentionally shared")
  public RowProcessor(
      RepositoryClient repositoryClient,
      EmbeddedObjectIndexBuilder indexBuilder,
      PropertyDiffEngine diffEngine,
      UpdateSerializer updateSerializer) {
    this.repositoryClient = repositoryClient;
    this.indexBuilder = indexBuilder;
    this.diffEngine = diffEngine;
    this.updateSerializer = updateSerializer;
  }

  /**
   * Processes one row.
   *
   * @param model the model describing the row
   * @param row the row cells keyed by header
   * @return the row result
   * @throws org.chucc.importer.exception.ImportException if the row cannot be reconciled
   */
  public RowResult process(ModelDescriptor model, Map<String, String> row) {
    String uri = row.getOrDefault(URI_COLUMN, "").trim();
    ReferenceCodec.instance().toTerm(uri);

    Graph graph = repositoryClient.fetchGraph(uri);
    Resource resource = Resource.fromGraph(graph, uri, model);

    EmbeddedObjectIndex index = indexBuilder.build(resource, row.get(INDEX_COLUMN));

    DeltaGraphBuilder builder = new DeltaGraphBuilder();
    for (Map.Entry<String, AttributePath> mapping : model.headerMap().entrySet()) {
      String header = mapping.getKey();
      if (row.containsKey(header)) {
        diffEngine.diff(resource, mapping.getValue(), row.get(header), index, builder);
      }
    }
    DeltaGraph delta = builder.build();

    if (delta.isEmpty()) {
      logger.info("No changes found for {}", resource);
      delta.applyInMemory();
      return new RowResult(RowOutcome.UNCHANGED, resource, delta, Optional.empty());
    }

    String update = updateSerializer.serialize(delta);
    logger.info("Sending update for {}", resource);
    logger.debug(update);
    repositoryClient.submitPatch(uri, update);
    delta.applyInMemory();
    return new RowResult(RowOutcome.UPDATED, resource, delta, Optional.of(update));
  }
}
