package dev.scholar.websearch;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Top-level JSON body of a Serpstack {@code /search} response. Only the fields this service reads
 * are mapped; unknown fields are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record SerpstackResponse(
    @Nullable Boolean success,
    @Nullable Error error,
    @JsonProperty("search_information") @Nullable SearchInformation searchInformation,
    @JsonProperty("organic_results") @Nullable List<OrganicResult> organicResults,
    @JsonProperty("news_results") @Nullable List<NewsResult> newsResults,
    @JsonProperty("answer_box") @Nullable AnswerBox answerBox,
    @JsonProperty("knowledge_graph") @Nullable KnowledgeGraphPanel knowledgeGraph,
    @JsonProperty("related_searches") @Nullable List<RelatedSearch> relatedSearches) {

  SerpstackResponse {
    organicResults = organicResults == null ? List.of() : List.copyOf(organicResults);
    newsResults = newsResults == null ? List.of() : List.copyOf(newsResults);
    relatedSearches = relatedSearches == null ? List.of() : List.copyOf(relatedSearches);
  }

  /** True when the provider reported a failure in-band. */
  boolean isError() {
    return error != null || Boolean.FALSE.equals(success);
  }

  long totalResults() {
    if (searchInformation == null || searchInformation.totalResults() == null) {
      return 0;
    }
    return searchInformation.totalResults();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record Error(@Nullable Integer code, @Nullable String type, @Nullable String info) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record SearchInformation(@JsonProperty("total_results") @Nullable Long totalResults) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record OrganicResult(@Nullable String title, @Nullable String url, @Nullable String snippet) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record NewsResult(
      @Nullable String title,
      @Nullable String url,
      @Nullable String snippet,
      @JsonProperty("source_name") @Nullable String sourceName,
      @JsonProperty("uploaded_utc") @Nullable String uploadedUtc) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record AnswerBox(
      @JsonProperty("featured_snippets") @Nullable List<FeaturedSnippet> featuredSnippets) {
    AnswerBox {
      featuredSnippets = featuredSnippets == null ? List.of() : List.copyOf(featuredSnippets);
    }
  }

  /** {@code value} is either an object with a {@code text} field or a bare string. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  record FeaturedSnippet(
      @Nullable String link,
      @JsonProperty("link_title") @Nullable String linkTitle,
      @Nullable JsonNode value) {

    String text() {
      if (value == null) {
        return "";
      }
      return value.isTextual() ? value.asText() : value.path("text").asText("");
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record KnowledgeGraphPanel(
      @Nullable String title,
      @Nullable String description,
      @Nullable String website,
      @Nullable String type) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record RelatedSearch(@Nullable String query, @Nullable String text) {

    @Nullable String label() {
      return query != null ? query : text;
    }
  }
}
