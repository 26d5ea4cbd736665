package org.chucc.importer.repository;

import org.apache.jena.graph.Graph;
import org.chucc.importer.exception.RepositoryAccessException;

/**
 * Access to the linked-data repository holding the resources being reconciled.
 */
public interface RepositoryClient {

  /**
   * Fetches the current graph of a resource.
   *
   * @param uri the resource URI
   * @return the resource graph
   * @throws RepositoryAccessException if the graph cannot be retrieved or parsed
   */
  Graph fetchGraph(String uri);

  /**
   * Applies a SPARQL Update to a resource as a single atomic patch.
   *
   * @param uri the resource URI
   * @param sparqlUpdate the update text
   * @throws RepositoryAccessException if the repository rejects or cannot receive the patch
   */
  void submitPatch(String uri, String sparqlUpdate);
}
