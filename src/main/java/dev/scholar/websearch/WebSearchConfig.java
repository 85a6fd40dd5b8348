package dev.scholar.websearch;

import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Configures the {@link RestClient} used to call the web search provider.
 *
 * <p>Connect and read timeouts both come from {@code scholar.web-search.timeout-ms}. Requests are
 * never retried; a timeout surfaces as a transport failure.
 */
@Configuration
public class WebSearchConfig {

  /**
   * Creates the REST client targeting the search provider.
   *
   * @param builder Spring-provided builder with common defaults
   * @param properties provider base URL and timeout
   * @return a named REST client bean for injection into {@link WebSearchClient}
   */
  @Bean
  public RestClient webSearchRestClient(
      RestClient.Builder builder, WebSearchProperties properties) {
    var requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(Duration.ofMillis(properties.timeoutMs()));
    requestFactory.setReadTimeout(Duration.ofMillis(properties.timeoutMs()));

    return builder
        .baseUrl(properties.baseUrl())
        .requestFactory(requestFactory)
        .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
        .build();
  }
}
