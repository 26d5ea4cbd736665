package org.chucc.importer.config;

import java.net.http.HttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP client configuration for the repository.
 * Uses the JDK HTTP client, which supports the PATCH method updates are sent with.
 */
@Configuration
public class RepositoryClientConfig {

  /**
   * REST template used by the repository client.
   *
   * @param properties the importer properties
   * @return the REST template
   */
  @Bean
  public RestTemplate repositoryRestTemplate(ImporterProperties properties) {
    ImporterProperties.Repository repository = properties.getRepository();
    HttpClient httpClient = HttpClient.newBuilder()
        .connectTimeout(repository.getConnectTimeout())
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build();
    JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
    requestFactory.setReadTimeout(repository.getReadTimeout());
    return new RestTemplate(requestFactory);
  }
}
