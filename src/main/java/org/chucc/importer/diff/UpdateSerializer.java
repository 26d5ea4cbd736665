package org.chucc.importer.diff;

import java.io.StringWriter;
import java.util.stream.Collectors;
import org.apache.jena.graph.Graph;
import org.apache.jena.riot.RDFDataMgr;
import org.apache.jena.riot.RDFFormat;
import org.springframework.stereotype.Component;

/**
 * Renders a row's delta as a single SPARQL Update of the form
 * {@code DELETE { ... } INSERT { ... } WHERE {}}.
 *
 * <p>Triples are written as N-Triples, one per line, sorted so the output is stable. An empty
 * graph renders as an empty block; callers check {@link DeltaGraph#isEmpty()} first.
 */
@Component
public class UpdateSerializer {

  /**
   * Serializes a delta.
   *
   * @param delta the net delta
   * @return the SPARQL Update text
   */
  public String serialize(DeltaGraph delta) {
    if (delta == null) {
      throw new IllegalArgumentException("Delta cannot be null");
    }
    return "DELETE { " + toNTriples(delta.deletions()) + " } "
        + "INSERT { " + toNTriples(delta.insertions()) + " } WHERE {}";
  }

  private static String toNTriples(Graph graph) {
    StringWriter writer = new StringWriter();
    RDFDataMgr.write(writer, graph, RDFFormat.NTRIPLES_UTF8);
    return writer.toString().lines()
        .map(String::strip)
        .filter(line -> !line.isEmpty())
        .sorted()
        .collect(Collectors.joining("\n"));
  }
}
