package com.flamingo.ai.factcheck.service.retrieval.web;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.factcheck.config.FactCheckConfig;
import com.flamingo.ai.factcheck.exception.SearchException;
import com.google.common.annotations.VisibleForTesting;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/** HTTP client for the Tavily search API. */
@Component
@Slf4j
public class TavilyWebSearchClient implements WebSearchClient {

  private final WebClient webClient;
  private final FactCheckConfig.WebSearch settings;

  @Autowired
  public TavilyWebSearchClient(FactCheckConfig config) {
    this(
        WebClient.builder()
            .baseUrl(config.getWebSearch().getBaseUrl())
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(2 * 1024 * 1024))
            .build(),
        config);
    log.info(
        "Tavily web search client initialized: baseUrl={}, configured={}",
        settings.getBaseUrl(),
        settings.isConfigured());
  }

  @VisibleForTesting
  TavilyWebSearchClient(WebClient webClient, FactCheckConfig config) {
    this.webClient = webClient;
    this.settings = config.getWebSearch();
  }

  @Override
  public boolean isConfigured() {
    return settings.isConfigured();
  }

  @Override
  @Timed(value = "websearch.tavily", description = "Time for a Tavily search call")
  @CircuitBreaker(name = "tavily", fallbackMethod = "searchFallback")
  public List<WebSearchHit> search(String query, int maxResults) {
    if (!isConfigured() || query == null || query.isBlank() || maxResults <= 0) {
      return List.of();
    }

    TavilySearchResponse response;
    try {
      response =
          webClient
              .post()
              .uri("/search")
              .header(HttpHeaders.AUTHORIZATION, "Bearer " + settings.getApiKey())
              .contentType(MediaType.APPLICATION_JSON)
              .bodyValue(new TavilySearchRequest(query, maxResults, settings.getSearchDepth()))
              .retrieve()
              .bodyToMono(TavilySearchResponse.class)
              .timeout(Duration.ofMillis(settings.getTimeoutMs()))
              .block();
    } catch (RuntimeException e) {
      throw new SearchException("tavily", "Web search failed: " + e.getMessage(), e);
    }

    if (response == null || response.results() == null) {
      return List.of();
    }
    List<WebSearchHit> hits = new ArrayList<>();
    for (TavilyResult result : response.results()) {
      if (hits.size() >= maxResults) {
        break;
      }
      if (result.url() == null || result.content() == null || result.content().isBlank()) {
        continue;
      }
      hits.add(new WebSearchHit(result.title(), result.url(), result.content()));
    }
    log.debug("Tavily returned {} usable hits for '{}'", hits.size(), query);
    return hits;
  }

  @SuppressWarnings("unused")
  private List<WebSearchHit> searchFallback(String query, int maxResults, Throwable t) {
    if (t instanceof SearchException searchException) {
      throw searchException;
    }
    throw new SearchException("tavily", "Web search unavailable: " + t.getMessage(), t);
  }

  record TavilySearchRequest(
      String query,
      @JsonProperty("max_results") int maxResults,
      @JsonProperty("search_depth") String searchDepth) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record TavilySearchResponse(String query, List<TavilyResult> results) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record TavilyResult(String title, String url, String content, Double score) {}
}
