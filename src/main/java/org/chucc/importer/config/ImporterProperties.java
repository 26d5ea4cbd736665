package org.chucc.importer.config;

import java.time.Duration;
import org.chucc.importer.util.RdfContentTypeUtil;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for an import run.
 *
 * <p>Bound from {@code importer.*}, so a run is started with e.g.
 * {@code --importer.model=letter.Letter --importer.file=edits.csv --importer.limit=10}.
 */
@Component
@ConfigurationProperties(prefix = "importer")
public class ImporterProperties {

  /**
   * Name of the registered model describing the rows, e.g. {@code letter.Letter}.
   */
  private String model;

  /**
   * Path of the CSV file to import. No import runs when unset.
   */
  private String file;

  /**
   * Maximum number of rows to process. Unlimited when unset.
   */
  private Integer limit;

  /**
   * Repository connection settings.
   */
  private Repository repository = new Repository();

  public String getModel() {
    return model;
  }

  public void setModel(String model) {
    this.model = model;
  }

  public String getFile() {
    return file;
  }

  public void setFile(String file) {
    this.file = file;
  }

  public Integer getLimit() {
    return limit;
  }

  /**
   * Sets the row limit.
   *
   * @param limit the maximum number of rows (must be positive), or null for no limit
   * @throws IllegalArgumentException if limit is not positive
   */
  public void setLimit(Integer limit) {
    if (limit != null && limit <= 0) {
      throw new IllegalArgumentException("Row limit must be positive");
    }
    this.limit = limit;
  }

  /**
   * Gets the repository settings.
   * Note: This returns the actual internal object (not a copy) as required by Spring Boot
   * configuration properties binding.
   *
   * @return the repository settings
   */
  @edu.umd.cs.findbugs.annotations.SuppressFBWarnings(
      value = "EI_EXPOSE_REP",
      justification = "Spring Boot ConfigurationProperties requires direct access"
          + " to nested objects")
  public Repository getRepository() {
    return repository;
  }

  /**
   * Sets the repository settings.
   *
   * @param repository the repository settings
   */
  @edu.umd.cs.findbugs.annotations.SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Spring Boot ConfigurationProperties requires direct access"
          + " to nested objects")
  public void setRepository(Repository repository) {
    this.repository = repository;
  }

  /**
   * Repository connection settings.
   */
  public static class Repository {
    /**
     * RDF media type requested when fetching resource graphs.
     */
    private String accept = "text/turtle";

    /**
     * Timeout for establishing a connection to the repository.
     */
    private Duration connectTimeout = Duration.ofSeconds(10);

    /**
     * Timeout for reading a repository response.
     */
    private Duration readTimeout = Duration.ofSeconds(60);

    public String getAccept() {
      return accept;
    }

    /**
     * Sets the RDF media type requested when fetching graphs.
     *
     * @param accept the media type
     * @throws IllegalArgumentException if the media type is not a supported RDF syntax
     */
    public void setAccept(String accept) {
      if (!RdfContentTypeUtil.isSupported(accept)) {
        throw new IllegalArgumentException("Unsupported RDF media type: " + accept);
      }
      this.accept = accept;
    }

    public Duration getConnectTimeout() {
      return connectTimeout;
    }

    /**
     * Sets the connect timeout.
     *
     * @param connectTimeout the timeout (must be positive)
     * @throws IllegalArgumentException if the timeout is not positive
     */
    public void setConnectTimeout(Duration connectTimeout) {
      if (connectTimeout == null || connectTimeout.isNegative() || connectTimeout.isZero()) {
        throw new IllegalArgumentException("Connect timeout must be positive");
      }
      this.connectTimeout = connectTimeout;
    }

    public Duration getReadTimeout() {
      return readTimeout;
    }

    /**
     * Sets the read timeout.
     *
     * @param readTimeout the timeout (must be positive)
     * @throws IllegalArgumentException if the timeout is not positive
     */
    public void setReadTimeout(Duration readTimeout) {
      if (readTimeout == null || readTimeout.isNegative() || readTimeout.isZero()) {
        throw new IllegalArgumentException("Read timeout must be positive");
      }
      this.readTimeout = readTimeout;
    }
  }
}
