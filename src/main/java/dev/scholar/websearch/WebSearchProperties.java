package dev.scholar.websearch;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Connection settings for the Serpstack web search provider, bound from {@code
 * scholar.web-search.*}.
 *
 * @param baseUrl provider base URL (e.g. {@code https://api.serpstack.com})
 * @param accessKey API access key; blank disables web search
 * @param timeoutMs connect and read timeout for a single request
 * @param gl country code passed to the provider
 * @param hl interface language passed to the provider
 */
@ConfigurationProperties(prefix = "scholar.web-search")
public record WebSearchProperties(
    @DefaultValue("https://api.serpstack.com") String baseUrl,
    @DefaultValue("") String accessKey,
    @DefaultValue("10000") int timeoutMs,
    @DefaultValue("us") String gl,
    @DefaultValue("en") String hl) {

  public boolean hasAccessKey() {
    return accessKey != null && !accessKey.isBlank();
  }
}
