package org.chucc.importer.repository;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.URI;
import java.util.List;
import org.apache.jena.graph.Graph;
import org.apache.jena.riot.Lang;
import org.apache.jena.riot.RDFParser;
import org.apache.jena.riot.RiotException;
import org.apache.jena.sparql.graph.GraphFactory;
import org.chucc.importer.config.ImporterProperties;
import org.chucc.importer.exception.RepositoryAccessException;
import org.chucc.importer.util.RdfContentTypeUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Repository client speaking the LDP style HTTP interface of the repository:
 * resource graphs are read with GET and changed with a SPARQL Update sent as PATCH.
 */
@Component
public class HttpRepositoryClient implements RepositoryClient {

  private static final Logger logger = LoggerFactory.getLogger(HttpRepositoryClient.class);

  /** Media type of SPARQL Update request bodies. */
  public static final MediaType SPARQL_UPDATE = MediaType.parseMediaType(
      "application/sparql-update");

  private final RestTemplate restTemplate;
  private final String accept;
  private final Lang defaultLang;

  /**
   * Constructs the client.
   *
   * @param repositoryRestTemplate the REST template configured for the repository
   * @param properties the importer properties
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestTemplate is a Spring-managed bean and is intentionally shared")
  public HttpRepositoryClient(RestTemplate repositoryRestTemplate,
      ImporterProperties properties) {
    this.restTemplate = repositoryRestTemplate;
    this.accept = properties.getRepository().getAccept();
    this.defaultLang = RdfContentTypeUtil.determineLang(accept);
  }

  @Override
  public Graph fetchGraph(String uri) {
    HttpHeaders headers = new HttpHeaders();
    headers.set(HttpHeaders.ACCEPT, accept);

    ResponseEntity<String> response;
    try {
      response = restTemplate.exchange(
          URI.create(uri), HttpMethod.GET, new HttpEntity<>(headers), String.class);
    } catch (HttpStatusCodeException e) {
      throw new RepositoryAccessException(
          "Failed to fetch " + uri + ": " + e.getStatusCode(), e.getStatusCode().value(), e);
    } catch (RestClientException | IllegalArgumentException e) {
      throw new RepositoryAccessException("Failed to fetch " + uri + ": " + e.getMessage(), e);
    }

    Graph graph = GraphFactory.createDefaultGraph();
    String body = response.getBody();
    if (body == null || body.isBlank()) {
      return graph;
    }

    MediaType contentType = response.getHeaders().getContentType();
    Lang lang = contentType != null ? RdfContentTypeUtil.determineLang(contentType.toString())
        : null;
    if (lang == null) {
      lang = defaultLang;
    }

    try {
      RDFParser.create()
          .fromString(body)
          .lang(lang)
          .base(uri)
          .parse(graph);
    } catch (RiotException e) {
      throw new RepositoryAccessException(
          "Invalid RDF returned for " + uri + ": " + e.getMessage(),
          response.getStatusCode().value(), e);
    }
    logger.debug("Fetched {} triples for {}", graph.size(), uri);
    return graph;
  }

  @Override
  public void submitPatch(String uri, String sparqlUpdate) {
    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(SPARQL_UPDATE);
    headers.setAccept(List.of(MediaType.ALL));

    try {
      restTemplate.exchange(URI.create(uri), HttpMethod.PATCH,
          new HttpEntity<>(sparqlUpdate, headers), Void.class);
    } catch (HttpStatusCodeException e) {
      throw new RepositoryAccessException(
          "Patch rejected for " + uri + ": " + e.getStatusCode(), e.getStatusCode().value(), e);
    } catch (RestClientException | IllegalArgumentException e) {
      throw new RepositoryAccessException("Failed to patch " + uri + ": " + e.getMessage(), e);
    }
  }
}
